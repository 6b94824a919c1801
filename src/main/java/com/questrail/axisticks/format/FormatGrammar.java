package com.questrail.axisticks.format;

import com.questrail.axisticks.units.UnitKind;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * FormatGrammar
 * -----------------------------------------------------------------------------
 * Ordered list of {@link FormatRule}s. A format string is matched against the
 * rules in order and the first match wins.
 *
 * <h2>Angle grammar</h2>
 * <pre>
 *   dd | dd:mm | dd:mm:ss | dd:mm:ss.s…     sexagesimal degrees
 *   hh | hh:mm | hh:mm:ss | hh:mm:ss.s…     sexagesimal hour angle
 *   d  | d.d…                               decimal degrees
 *   m  | m.m…                               decimal arc-minutes
 *   s  | s.s…                               decimal arc-seconds
 * </pre>
 *
 * <h2>Scalar grammar</h2>
 * <pre>
 *   x  | x.x…                               decimal, dimensionless
 * </pre>
 *
 * <p>The number of placeholder characters after the {@code .} is the precision
 * of the last field. A sexagesimal format with a fractional part always has
 * three fields.</p>
 */
public final class FormatGrammar
{
    public static final FormatGrammar ANGLE = new FormatGrammar(List.of(
            FormatRule.of("sexagesimal-degrees", "dd(:mm(:ss(\\.s+)?)?)?",
                    f -> sexagesimal(f, UnitKind.DEGREE)),
            FormatRule.of("sexagesimal-hours", "hh(:mm(:ss(\\.s+)?)?)?",
                    f -> sexagesimal(f, UnitKind.HOUR_ANGLE)),
            FormatRule.of("decimal-degrees", "d(\\.d+)?",
                    f -> FormatDescriptor.decimal(UnitKind.DEGREE, precisionOf(f))),
            FormatRule.of("decimal-arcminutes", "m(\\.m+)?",
                    f -> FormatDescriptor.decimal(UnitKind.ARCMINUTE, precisionOf(f))),
            FormatRule.of("decimal-arcseconds", "s(\\.s+)?",
                    f -> FormatDescriptor.decimal(UnitKind.ARCSECOND, precisionOf(f)))
    ));

    public static final FormatGrammar SCALAR = new FormatGrammar(List.of(
            FormatRule.of("decimal-scalar", "x(\\.x+)?",
                    f -> FormatDescriptor.decimal(UnitKind.DIMENSIONLESS, precisionOf(f)))
    ));

    private final List<FormatRule> rules;

    public FormatGrammar(List<FormatRule> rules) {
        Objects.requireNonNull(rules, "rules");
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("At least one rule is required");
        }
        this.rules = List.copyOf(rules);
    }

    public List<FormatRule> rules() {
        return rules;
    }

    /**
     * Parses {@code format} into a descriptor.
     *
     * @param format the format string (must not be {@code null})
     * @return the descriptor built by the first matching rule
     * @throws TickFormatException if no rule matches
     */
    public FormatDescriptor parse(String format) {
        Objects.requireNonNull(format, "format");
        for (FormatRule rule : rules) {
            Optional<FormatDescriptor> descriptor = rule.apply(format);
            if (descriptor.isPresent()) {
                return descriptor.get();
            }
        }
        throw new TickFormatException(format);
    }

    private static FormatDescriptor sexagesimal(String format, UnitKind unit) {
        if (format.indexOf('.') >= 0) {
            return FormatDescriptor.sexagesimal(unit, 3, precisionOf(format));
        }
        int fields = 1;
        for (int i = 0; i < format.length(); i++) {
            if (format.charAt(i) == ':') {
                fields++;
            }
        }
        return FormatDescriptor.sexagesimal(unit, fields, 0);
    }

    private static int precisionOf(String format) {
        int dot = format.indexOf('.');
        return dot < 0 ? 0 : format.length() - dot - 1;
    }
}
