package com.questrail.axisticks.observability;

import com.questrail.axisticks.format.FormatDescriptor;

import java.time.Instant;

/**
 * Record emitted whenever a label format is assigned or cleared.
 * A {@code null} format and descriptor means the formatter returned to automatic mode.
 */
public record FormatAssignedEvent(
    Instant timestamp,
    String format,
    FormatDescriptor descriptor
) {
    public boolean isAutomatic() {
        return format == null;
    }
}
