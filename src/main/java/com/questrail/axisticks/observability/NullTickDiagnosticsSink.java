package com.questrail.axisticks.observability;

/**
 * No-op implementation of TickDiagnosticsSink.
 */
public final class NullTickDiagnosticsSink implements TickDiagnosticsSink {
    public static final NullTickDiagnosticsSink INSTANCE = new NullTickDiagnosticsSink();

    private NullTickDiagnosticsSink() {}

    @Override
    public void onSpacingCorrected(SpacingCorrectedEvent event) {}

    @Override
    public void onFormatAssigned(FormatAssignedEvent event) {}
}
