package com.questrail.axisticks.observability;

/**
 * Receives recoverable diagnostics from a formatter/locator.
 * Implementations can provide logging, metrics, or test recording.
 *
 * <p>Callbacks are invoked synchronously on the thread that mutated the
 * configuration. They must not throw.</p>
 */
public interface TickDiagnosticsSink {
    /**
     * Called when an explicit spacing is corrected to match the label format.
     * @param event the correction details
     */
    void onSpacingCorrected(SpacingCorrectedEvent event);

    /**
     * Called after a label format has been parsed and applied, or cleared.
     * @param event the assignment details
     */
    void onFormatAssigned(FormatAssignedEvent event);
}
