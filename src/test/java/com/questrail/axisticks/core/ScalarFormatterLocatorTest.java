package com.questrail.axisticks.core;

import com.questrail.axisticks.api.Ticks;
import com.questrail.axisticks.config.FormatterLocatorConfig;
import com.questrail.axisticks.format.TickFormatException;
import com.questrail.axisticks.internal.time.FixedWallClock;
import com.questrail.axisticks.observability.RecordingTickDiagnosticsSink;
import com.questrail.axisticks.observability.SpacingCorrectedEvent;
import com.questrail.axisticks.units.UnitKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScalarFormatterLocatorTest
{
    private RecordingTickDiagnosticsSink sink;

    @BeforeEach
    void setUp() {
        sink = new RecordingTickDiagnosticsSink();
    }

    private FormatterLocatorConfig.Builder<Double> config() {
        return FormatterLocatorConfig.<Double>builder()
                .withDiagnostics(sink)
                .withWallClock(new FixedWallClock());
    }

    private static void assertPositions(List<Double> expected, List<Double> actual) {
        assertEquals(expected.size(), actual.size(), "positions " + actual);
        for (int i = 0; i < expected.size(); i++) {
            assertEquals(expected.get(i), actual.get(i), 1e-12, "position " + i);
        }
    }

    @Test
    void explicitSpacingWithTwoDigitFormat() {
        ScalarFormatterLocator fl = new ScalarFormatterLocator(config().withFormat("x.xx").withSpacing(0.1).build());

        Ticks<Double> ticks = fl.locate(0.0, 0.35);
        assertPositions(List.of(0.0, 0.1, 0.2, 0.3), ticks.positions());
        assertEquals(List.of("0.00", "0.10", "0.20", "0.30"), fl.format(ticks));
        assertTrue(sink.getSpacingCorrections().isEmpty());
    }

    @Test
    void automaticPrecisionFollowsSpacing() {
        ScalarFormatterLocator fl = new ScalarFormatterLocator(config().build());

        Ticks<Double> ticks = fl.locate(0.0, 1.0);
        assertEquals(0.2, ticks.spacing(), 1e-12);
        assertEquals(List.of("0.0", "0.2", "0.4", "0.6", "0.8", "1.0"), fl.format(ticks));
    }

    @Test
    void automaticPrecisionIsZeroForSpacingsOfOneOrMore() {
        ScalarFormatterLocator fl = new ScalarFormatterLocator(config().build());

        assertEquals(List.of("12", "-3"), fl.format(List.of(12.0, -3.0), 5.0));
        assertEquals(List.of("0.004"), fl.format(List.of(0.004), 0.002));
    }

    @Test
    void countFinerThanFormatFallsBackToBaseSpacing() {
        ScalarFormatterLocator fl = new ScalarFormatterLocator(config().withFormat("x").build());

        Ticks<Double> ticks = fl.locate(0.0, 2.0);
        assertEquals(1.0, ticks.spacing());
        assertEquals(List.of(0.0, 1.0, 2.0), ticks.positions());
        assertEquals(List.of("0", "1", "2"), fl.format(ticks));
    }

    @Test
    void negativePositionsAreLocatedAndSigned() {
        ScalarFormatterLocator fl = new ScalarFormatterLocator(config().withFormat("x.x").withSpacing(0.5).build());

        Ticks<Double> ticks = fl.locate(-1.2, 0.3);
        assertPositions(List.of(-1.0, -0.5, 0.0), ticks.positions());
        assertEquals(List.of("-1.0", "-0.5", "0.0"), fl.format(ticks));
    }

    @Test
    void spacingBelowBaseIsRaised() {
        ScalarFormatterLocator fl = new ScalarFormatterLocator(config().withFormat("x.x").withSpacing(0.01).build());

        assertEquals(0.1, fl.getSpacing().orElseThrow(), 1e-12);
        List<SpacingCorrectedEvent> corrections = sink.getSpacingCorrections();
        assertEquals(1, corrections.size());
        assertEquals(SpacingCorrectedEvent.Reason.TOO_SMALL, corrections.get(0).reason());
        assertEquals(UnitKind.DIMENSIONLESS, corrections.get(0).unit());
    }

    @Test
    void spacingThatIsNotAMultipleIsRoundedAgainstBaseSpacing() {
        ScalarFormatterLocator fl = new ScalarFormatterLocator(config().withFormat("x.x").build());

        fl.setSpacing(0.37);

        assertEquals(0.4, fl.getSpacing().orElseThrow(), 1e-12);
        List<SpacingCorrectedEvent> corrections = sink.getSpacingCorrections();
        assertEquals(1, corrections.size());
        assertEquals(SpacingCorrectedEvent.Reason.NOT_A_MULTIPLE, corrections.get(0).reason());
        assertEquals(0.37, corrections.get(0).requestedSpacing(), 1e-12);
        assertEquals(0.4, corrections.get(0).correctedSpacing(), 1e-12);
    }

    @Test
    void explicitValuesUseSentinelSpacing() {
        ScalarFormatterLocator fl = new ScalarFormatterLocator(config().withValues(List.of(0.4, 1.6)).build());

        Ticks<Double> ticks = fl.locate(100.0, 200.0);
        assertTrue(ticks.explicitValues());
        assertEquals(ScalarFormatterLocator.EXPLICIT_VALUES_SPACING, ticks.spacing());
        assertEquals(List.of("0", "2"), fl.format(ticks));
    }

    @Test
    void zeroWidthRangeWithoutFormatUsesUnitSpacing() {
        ScalarFormatterLocator fl = new ScalarFormatterLocator(config().build());

        Ticks<Double> ticks = fl.locate(3.0, 3.0);
        assertEquals(1.0, ticks.spacing());
        assertEquals(List.of(3.0), ticks.positions());
    }

    @Test
    void rangeWithoutMultiplesYieldsNoTicks() {
        ScalarFormatterLocator fl = new ScalarFormatterLocator(config().withSpacing(1.0).build());

        Ticks<Double> ticks = fl.locate(5.2, 5.8);
        assertTrue(ticks.isEmpty());
        assertTrue(fl.format(ticks).isEmpty());
    }

    @Test
    void ticksStayInsideARangeFarFromZero() {
        ScalarFormatterLocator fl = new ScalarFormatterLocator(config().withSpacing(1.0).build());

        Ticks<Double> ticks = fl.locate(1_000_000.0005, 1_000_003.0);
        assertEquals(List.of(1_000_001.0, 1_000_002.0, 1_000_003.0), ticks.positions());
    }

    @Test
    void baseSpacingFollowsPrecision() {
        ScalarFormatterLocator fl = new ScalarFormatterLocator(config().build());
        assertTrue(fl.getBaseSpacing().isEmpty());

        fl.setFormat("x");
        assertEquals(1.0, fl.getBaseSpacing().orElseThrow());
        fl.setFormat("x.xxx");
        assertEquals(0.001, fl.getBaseSpacing().orElseThrow(), 1e-15);
    }

    @Test
    void angleFormatsAreRejected() {
        ScalarFormatterLocator fl = new ScalarFormatterLocator(config().build());
        assertThrows(TickFormatException.class, () -> fl.setFormat("dd:mm"));
        assertTrue(fl.getFormat().isEmpty());
    }

    @Test
    void nonPositiveSpacingIsRejected() {
        ScalarFormatterLocator fl = new ScalarFormatterLocator(config().build());

        assertThrows(IllegalArgumentException.class, () -> fl.setSpacing(0.0));
        assertThrows(IllegalArgumentException.class, () -> fl.setSpacing(Double.NaN));
        assertEquals(5, fl.getNumber().orElseThrow());
    }

    @Test
    void nonPositiveSpacingCannotDriveAutomaticLabels() {
        ScalarFormatterLocator fl = new ScalarFormatterLocator(config().build());
        assertThrows(IllegalArgumentException.class, () -> fl.format(List.of(1.0), 0.0));
    }
}
