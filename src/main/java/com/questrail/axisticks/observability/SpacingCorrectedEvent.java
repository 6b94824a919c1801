package com.questrail.axisticks.observability;

import com.questrail.axisticks.units.UnitKind;

import java.time.Instant;
import java.util.Objects;

/**
 * Record describing an explicit tick spacing that was adjusted to fit the
 * active label format.
 *
 * <p>Spacings are expressed in {@code unit}: degrees for the angle variant,
 * raw units ({@link UnitKind#DIMENSIONLESS}) for the scalar variant.</p>
 */
public record SpacingCorrectedEvent(
    Instant timestamp,
    Reason reason,
    String format,
    double requestedSpacing,
    double correctedSpacing,
    UnitKind unit
) {
    public SpacingCorrectedEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(unit, "unit");
    }

    public enum Reason {
        /**
         * Spacing was finer than the format can resolve; raised to the base spacing.
         */
        TOO_SMALL,

        /**
         * Spacing was not a whole multiple of the base spacing; rounded to the nearest one.
         */
        NOT_A_MULTIPLE
    }
}
