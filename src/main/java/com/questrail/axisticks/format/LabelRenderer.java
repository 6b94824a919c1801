package com.questrail.axisticks.format;

import com.questrail.axisticks.units.Angle;
import com.questrail.axisticks.units.UnitKind;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * LabelRenderer
 * -----------------------------------------------------------------------------
 * Converts single numeric values into label text.
 *
 * <p>All rounding is round-half-even applied to the exact binary value of the
 * input, and the result always carries exactly {@code precision} fractional
 * digits.</p>
 *
 * <p>Sexagesimal values are rounded once, in units of the last field, before
 * being split into fields. A value that rounds up to a whole minute therefore
 * renders as {@code 10°01′00″} and never as {@code 10°00′60″}.</p>
 */
public final class LabelRenderer
{
    private static final String[] DEGREE_SEPARATORS = { "°", "′", "″" };
    private static final String[] HOUR_SEPARATORS = { "h", "m", "s" };
    private static final BigInteger SIXTY = BigInteger.valueOf(60);

    private LabelRenderer() {}

    /**
     * Renders {@code value} as a plain signed decimal number.
     */
    public static String decimal(double value, int precision) {
        requireFinite(value);
        requirePrecision(precision);
        return new BigDecimal(value).setScale(precision, RoundingMode.HALF_EVEN).toPlainString();
    }

    /**
     * Renders a degree-valued position as a decimal number in {@code unit}.
     */
    public static String decimalAngle(double degrees, UnitKind unit, int precision) {
        return decimal(Angle.degrees(degrees).in(unit), precision);
    }

    /**
     * Renders a degree-valued position in sexagesimal notation.
     *
     * @param degrees   the position in degrees
     * @param unit      {@link UnitKind#DEGREE} or {@link UnitKind#HOUR_ANGLE}
     * @param fields    number of fields to render (1–3)
     * @param precision fractional digits on the last field
     */
    public static String sexagesimal(double degrees, UnitKind unit, int fields, int precision) {
        Objects.requireNonNull(unit, "unit");
        requireFinite(degrees);
        requirePrecision(precision);
        if (fields < 1 || fields > 3) {
            throw new IllegalArgumentException("fields must be in range 1–3 (was " + fields + ")");
        }

        String[] separators = switch (unit) {
            case DEGREE -> DEGREE_SEPARATORS;
            case HOUR_ANGLE -> HOUR_SEPARATORS;
            default -> throw new IllegalArgumentException("No sexagesimal notation for " + unit);
        };

        double value = Angle.degrees(degrees).in(unit);
        long lastFieldsPerUnit = fields == 1 ? 1L : (fields == 2 ? 60L : 3600L);

        BigDecimal total = new BigDecimal(Math.abs(value))
                .multiply(BigDecimal.valueOf(lastFieldsPerUnit))
                .setScale(precision, RoundingMode.HALF_EVEN);

        BigInteger whole = total.toBigInteger();
        BigDecimal fraction = total.subtract(new BigDecimal(whole));

        StringBuilder sb = new StringBuilder();
        if (value < 0 && total.signum() != 0) {
            sb.append('-');
        }

        if (fields == 1) {
            sb.append(total.toPlainString()).append(separators[0]);
            return sb.toString();
        }

        BigInteger first = whole.divide(BigInteger.valueOf(lastFieldsPerUnit));
        BigInteger last = whole.mod(SIXTY);
        sb.append(first).append(separators[0]);
        if (fields == 3) {
            BigInteger middle = whole.divide(SIXTY).mod(SIXTY);
            appendPadded(sb, new BigDecimal(middle));
            sb.append(separators[1]);
        }
        appendPadded(sb, new BigDecimal(last).add(fraction));
        sb.append(separators[fields - 1]);
        return sb.toString();
    }

    private static void appendPadded(StringBuilder sb, BigDecimal field) {
        // two integer digits on every field after the first
        if (field.compareTo(BigDecimal.TEN) < 0) {
            sb.append('0');
        }
        sb.append(field.toPlainString());
    }

    private static void requireFinite(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value must be finite (was " + value + ")");
        }
    }

    private static void requirePrecision(int precision) {
        if (precision < 0) {
            throw new IllegalArgumentException("precision must be non-negative (was " + precision + ")");
        }
    }
}
