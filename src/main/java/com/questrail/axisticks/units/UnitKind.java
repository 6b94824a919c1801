package com.questrail.axisticks.units;

/**
 * UnitKind
 * -----------------------------------------------------------------------------
 * The closed set of units a tick format can be expressed in.
 *
 * <p>Angular kinds carry their size in degrees; conversions between them are
 * plain multiplications. {@link #DIMENSIONLESS} is used by the scalar variant
 * and has no angular meaning.</p>
 */
public enum UnitKind
{
    DEGREE(1.0),
    HOUR_ANGLE(15.0),
    ARCMINUTE(1.0 / 60.0),
    ARCSECOND(1.0 / 3600.0),
    DIMENSIONLESS(Double.NaN);

    private final double degreesPerUnit;

    UnitKind(double degreesPerUnit) {
        this.degreesPerUnit = degreesPerUnit;
    }

    /**
     * Returns {@code true} for the four angular kinds.
     */
    public boolean isAngular() {
        return this != DIMENSIONLESS;
    }

    /**
     * Size of one unit in degrees.
     *
     * @throws IllegalStateException for {@link #DIMENSIONLESS}
     */
    public double degreesPerUnit() {
        if (!isAngular()) {
            throw new IllegalStateException(this + " has no angular size");
        }
        return degreesPerUnit;
    }
}
