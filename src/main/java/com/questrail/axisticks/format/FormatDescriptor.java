package com.questrail.axisticks.format;

import com.questrail.axisticks.units.UnitKind;

import java.util.Objects;

/**
 * FormatDescriptor
 * -----------------------------------------------------------------------------
 * Structural description of a tick label format, derived once from a compact
 * format string such as {@code "dd:mm:ss.s"} or {@code "x.xx"}.
 *
 * <h2>Fields</h2>
 * <ul>
 *   <li><b>decimal</b>: a single decimal number ({@code 3.21}) rather than
 *       sexagesimal fields ({@code 3°12′36″})</li>
 *   <li><b>unit</b>: the unit the label is expressed in</li>
 *   <li><b>fields</b>: number of sexagesimal fields (1–3); always 1 for
 *       decimal formats</li>
 *   <li><b>precision</b>: fractional digits carried by the last field</li>
 * </ul>
 *
 * <p>The descriptor is a value: it knows nothing about spacing modes or the
 * locator that uses it.</p>
 */
public record FormatDescriptor(
        boolean decimal,
        UnitKind unit,
        int fields,
        int precision
) {
    public FormatDescriptor {
        Objects.requireNonNull(unit, "unit");
        if (fields < 1 || fields > 3) {
            throw new IllegalArgumentException("fields must be in range 1–3 (was " + fields + ")");
        }
        if (precision < 0) {
            throw new IllegalArgumentException("precision must be non-negative (was " + precision + ")");
        }
        if (decimal && fields != 1) {
            throw new IllegalArgumentException("decimal formats have exactly one field");
        }
        if (!decimal && unit != UnitKind.DEGREE && unit != UnitKind.HOUR_ANGLE) {
            throw new IllegalArgumentException("sexagesimal formats require DEGREE or HOUR_ANGLE (was " + unit + ")");
        }
    }

    public static FormatDescriptor decimal(UnitKind unit, int precision) {
        return new FormatDescriptor(true, unit, 1, precision);
    }

    public static FormatDescriptor sexagesimal(UnitKind unit, int fields, int precision) {
        return new FormatDescriptor(false, unit, fields, precision);
    }
}
