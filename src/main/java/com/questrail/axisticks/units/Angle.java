package com.questrail.axisticks.units;

import java.util.Objects;

/**
 * Immutable angular quantity: a magnitude tagged with an angular
 * {@link UnitKind}.
 *
 * <p>Comparison and equality work on the degree-equivalent value, so
 * {@code 60 arcmin} equals {@code 1 degree}.</p>
 */
public record Angle(double value, UnitKind unit) implements Comparable<Angle>
{
    public Angle {
        Objects.requireNonNull(unit, "unit");
        if (!unit.isAngular()) {
            throw new IllegalArgumentException(
                    "Angle requires an angular unit (was " + unit + ")");
        }
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("Angle value must not be NaN");
        }
    }

    public static Angle of(double value, UnitKind unit) {
        return new Angle(value, unit);
    }

    public static Angle degrees(double value) {
        return new Angle(value, UnitKind.DEGREE);
    }

    public static Angle arcminutes(double value) {
        return new Angle(value, UnitKind.ARCMINUTE);
    }

    public static Angle arcseconds(double value) {
        return new Angle(value, UnitKind.ARCSECOND);
    }

    public static Angle hours(double value) {
        return new Angle(value, UnitKind.HOUR_ANGLE);
    }

    /**
     * Degree-equivalent magnitude.
     */
    public double degrees() {
        return value * unit.degreesPerUnit();
    }

    /**
     * Magnitude expressed in {@code target} units.
     */
    public double in(UnitKind target) {
        Objects.requireNonNull(target, "target");
        if (target == unit) {
            return value;
        }
        return degrees() / target.degreesPerUnit();
    }

    /**
     * Converts this angle to {@code target} units.
     */
    public Angle to(UnitKind target) {
        return new Angle(in(target), target);
    }

    public Angle times(double factor) {
        return new Angle(value * factor, unit);
    }

    public boolean isLessThan(Angle other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(Angle other) {
        Objects.requireNonNull(other, "other");
        return Double.compare(degrees(), other.degrees());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Angle that)) return false;
        return Double.compare(degrees(), that.degrees()) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(degrees());
    }

    @Override
    public String toString() {
        return value + " " + unit;
    }
}
