package com.questrail.axisticks.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used to timestamp diagnostic events.
 *
 * <p>
 * Tick computation never depends on the clock; it exists so that diagnostics
 * can carry a human-readable time and so that tests can pin that time.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
