package com.questrail.axisticks.step;

import com.questrail.axisticks.units.Angle;
import com.questrail.axisticks.units.UnitKind;

import java.util.Objects;

/**
 * StepSelectors
 * -----------------------------------------------------------------------------
 * Pure functions mapping a raw tick spacing to the nearest "clean" spacing in
 * a given unit system.
 *
 * <h2>Angular selectors</h2>
 * <p>Each selector holds an ascending table of limits. The first limit that is
 * greater than or equal to the raw spacing picks the step at the same
 * position; a raw spacing beyond the last limit yields the largest step.</p>
 *
 * <ul>
 *   <li>degrees: 1, 2, 3, 5, 10, 15, 20, 30 arcsec; the same in arcmin; then
 *       1, 2, 5, 10, 15, 30, 45, 90, 180, 360 degrees</li>
 *   <li>hours: 1, 2, 3, 4, 5, 6, 10, 12, 15, 20, 30 seconds of time; the same
 *       in minutes of time; then 1, 2, 3, 4, 6, 8, 12, 18, 24 hours</li>
 * </ul>
 *
 * <h2>Scalar selector</h2>
 * <p>Rounds the raw spacing to the closest of 1, 2, 5 or 10 times its power of
 * ten, measured in log space.</p>
 */
public final class StepSelectors
{
    private static final double[] MINSEC_LIMITS_DEGREE = { 1.5, 2.5, 3.5, 8, 11, 18, 25, 45 };
    private static final double[] MINSEC_STEPS_DEGREE = { 1, 2, 3, 5, 10, 15, 20, 30 };
    private static final double[] DEGREE_LIMITS = { 1.5, 3, 7, 13, 20, 40, 70, 120, 270, 520 };
    private static final double[] DEGREE_STEPS = { 1, 2, 5, 10, 15, 30, 45, 90, 180, 360 };

    private static final double[] MINSEC_LIMITS_HOUR = { 1.5, 2.5, 3.5, 4.5, 5.5, 8, 11, 14, 18, 25, 45 };
    private static final double[] MINSEC_STEPS_HOUR = { 1, 2, 3, 4, 5, 6, 10, 12, 15, 20, 30 };
    private static final double[] HOUR_LIMITS = { 1.5, 2.5, 3.5, 5, 7, 10, 15, 21, 36 };
    private static final double[] HOUR_STEPS = { 1, 2, 3, 4, 6, 8, 12, 18, 24 };

    private static final double[] SCALAR_LOG_STEPS = { 0.0, Math.log10(2), Math.log10(5), 1.0 };

    private static final StepTable DEGREE_TABLE = StepTable.build(
            UnitKind.DEGREE,
            MINSEC_LIMITS_DEGREE, MINSEC_STEPS_DEGREE, UnitKind.ARCSECOND,
            MINSEC_LIMITS_DEGREE, MINSEC_STEPS_DEGREE, UnitKind.ARCMINUTE,
            DEGREE_LIMITS, DEGREE_STEPS, UnitKind.DEGREE);

    // minutes and seconds of time are 15 arcmin / 15 arcsec
    private static final StepTable HOUR_TABLE = StepTable.build(
            UnitKind.HOUR_ANGLE,
            MINSEC_LIMITS_HOUR, times(MINSEC_STEPS_HOUR, 15), UnitKind.ARCSECOND,
            MINSEC_LIMITS_HOUR, times(MINSEC_STEPS_HOUR, 15), UnitKind.ARCMINUTE,
            HOUR_LIMITS, HOUR_STEPS, UnitKind.HOUR_ANGLE);

    private StepSelectors() {}

    /**
     * Selects a clean spacing in degrees, arc-minutes or arc-seconds.
     */
    public static Angle selectStepDegree(Angle rawSpacing) {
        return DEGREE_TABLE.select(requirePositive(rawSpacing));
    }

    /**
     * Selects a clean spacing in hours, minutes or seconds of time.
     */
    public static Angle selectStepHour(Angle rawSpacing) {
        return HOUR_TABLE.select(requirePositive(rawSpacing));
    }

    /**
     * Selects a clean dimensionless spacing of the form {1, 2, 5} × 10<sup>n</sup>.
     */
    public static double selectStepScalar(double rawSpacing) {
        requirePositive(rawSpacing);
        double log = Math.log10(rawSpacing);
        double base = Math.floor(log);
        double frac = log - base;

        int best = 0;
        for (int i = 1; i < SCALAR_LOG_STEPS.length; i++) {
            if (Math.abs(frac - SCALAR_LOG_STEPS[i]) < Math.abs(frac - SCALAR_LOG_STEPS[best])) {
                best = i;
            }
        }
        return Math.pow(10.0, base + SCALAR_LOG_STEPS[best]);
    }

    private static Angle requirePositive(Angle rawSpacing) {
        Objects.requireNonNull(rawSpacing, "rawSpacing");
        requirePositive(rawSpacing.degrees());
        return rawSpacing;
    }

    private static void requirePositive(double rawSpacing) {
        if (!Double.isFinite(rawSpacing) || rawSpacing <= 0) {
            throw new IllegalArgumentException("spacing must be positive and finite (was " + rawSpacing + ")");
        }
    }

    private static double[] times(double[] values, double factor) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] * factor;
        }
        return out;
    }

    /**
     * Concatenated seconds/minutes/major-unit lookup table. Limits are kept in
     * the major unit so that the raw spacing is converted only once.
     */
    private record StepTable(UnitKind limitUnit, double[] limits, double[] steps, UnitKind[] stepUnits)
    {
        static StepTable build(UnitKind limitUnit,
                               double[] secLimits, double[] secSteps, UnitKind secUnit,
                               double[] minLimits, double[] minSteps, UnitKind minUnit,
                               double[] majorLimits, double[] majorSteps, UnitKind majorUnit) {
            int n = secLimits.length + minLimits.length + majorLimits.length;
            double[] limits = new double[n];
            double[] steps = new double[n];
            UnitKind[] units = new UnitKind[n];

            int i = 0;
            for (int k = 0; k < secLimits.length; k++, i++) {
                limits[i] = secLimits[k] / 3600.0;
                steps[i] = secSteps[k];
                units[i] = secUnit;
            }
            for (int k = 0; k < minLimits.length; k++, i++) {
                limits[i] = minLimits[k] / 60.0;
                steps[i] = minSteps[k];
                units[i] = minUnit;
            }
            for (int k = 0; k < majorLimits.length; k++, i++) {
                limits[i] = majorLimits[k];
                steps[i] = majorSteps[k];
                units[i] = majorUnit;
            }
            return new StepTable(limitUnit, limits, steps, units);
        }

        Angle select(Angle rawSpacing) {
            double raw = rawSpacing.in(limitUnit);
            int n = limits.length - 1;
            for (int i = 0; i < limits.length; i++) {
                if (limits[i] >= raw) {
                    n = i;
                    break;
                }
            }
            return Angle.of(steps[n], stepUnits[n]);
        }
    }
}
