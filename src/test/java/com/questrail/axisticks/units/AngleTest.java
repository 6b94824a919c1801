package com.questrail.axisticks.units;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AngleTest
{
    @Test
    void convertsBetweenAngularUnits() {
        assertEquals(15.0, Angle.hours(1).degrees(), 1e-12);
        assertEquals(1.5, Angle.arcminutes(90).degrees(), 1e-12);
        assertEquals(3600.0, Angle.degrees(1).in(UnitKind.ARCSECOND), 1e-9);
        assertEquals(4.0, Angle.degrees(1).in(UnitKind.ARCMINUTE) / 15.0, 1e-12);

        Angle converted = Angle.degrees(30).to(UnitKind.HOUR_ANGLE);
        assertEquals(UnitKind.HOUR_ANGLE, converted.unit());
        assertEquals(2.0, converted.value(), 1e-12);
    }

    @Test
    void conversionToOwnUnitIsExact() {
        Angle a = Angle.arcseconds(0.1);
        assertEquals(0.1, a.in(UnitKind.ARCSECOND));
    }

    @Test
    void comparesByDegreeEquivalent() {
        assertTrue(Angle.arcminutes(30).isLessThan(Angle.degrees(1)));
        assertTrue(Angle.hours(1).compareTo(Angle.degrees(14)) > 0);
        assertEquals(0, Angle.arcseconds(3600).compareTo(Angle.arcseconds(3600)));
    }

    @Test
    void timesKeepsUnit() {
        Angle a = Angle.arcminutes(1).times(15);
        assertEquals(UnitKind.ARCMINUTE, a.unit());
        assertEquals(15.0, a.value());
    }

    @Test
    void dimensionlessUnitIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Angle.of(0.5, UnitKind.DIMENSIONLESS));
    }

    @Test
    void nanAndNullAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Angle.degrees(Double.NaN));
        assertThrows(NullPointerException.class, () -> Angle.of(1.0, null));
    }

    @Test
    void dimensionlessHasNoAngularSize() {
        assertFalse(UnitKind.DIMENSIONLESS.isAngular());
        assertThrows(IllegalStateException.class, UnitKind.DIMENSIONLESS::degreesPerUnit);
        for (UnitKind kind : UnitKind.values()) {
            if (kind != UnitKind.DIMENSIONLESS) {
                assertTrue(kind.isAngular());
            }
        }
    }
}
