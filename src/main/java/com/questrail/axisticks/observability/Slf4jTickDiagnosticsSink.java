package com.questrail.axisticks.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of TickDiagnosticsSink that emits logs via SLF4J.
 */
public final class Slf4jTickDiagnosticsSink implements TickDiagnosticsSink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTickDiagnosticsSink.class);

    @Override
    public void onSpacingCorrected(SpacingCorrectedEvent event) {
        switch (event.reason()) {
            case TOO_SMALL -> log.warn("Spacing is too small for format '{}' - resetting spacing from {} to {} ({})",
                event.format(),
                event.requestedSpacing(),
                event.correctedSpacing(),
                event.unit());
            case NOT_A_MULTIPLE -> log.warn("Spacing is not a multiple of the base spacing of format '{}' - resetting spacing from {} to {} ({})",
                event.format(),
                event.requestedSpacing(),
                event.correctedSpacing(),
                event.unit());
        }
    }

    @Override
    public void onFormatAssigned(FormatAssignedEvent event) {
        if (event.isAutomatic()) {
            log.debug("Tick format cleared, labels derived from spacing");
        } else {
            log.debug("Tick format '{}' -> {}", event.format(), event.descriptor());
        }
    }
}
