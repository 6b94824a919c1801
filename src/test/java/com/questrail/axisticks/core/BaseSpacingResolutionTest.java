package com.questrail.axisticks.core;

import com.questrail.axisticks.api.Ticks;
import com.questrail.axisticks.config.FormatterLocatorConfig;
import com.questrail.axisticks.observability.NullTickDiagnosticsSink;
import com.questrail.axisticks.units.Angle;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Positions one base spacing apart must never share a label.
 */
class BaseSpacingResolutionTest
{
    private static final List<String> ANGLE_FORMATS = List.of(
            "dd", "dd:mm", "dd:mm:ss", "dd:mm:ss.s", "dd:mm:ss.ss",
            "hh", "hh:mm", "hh:mm:ss", "hh:mm:ss.s",
            "d", "d.d", "d.dd", "m", "m.m", "s", "s.ss");

    private static final List<String> SCALAR_FORMATS = List.of("x", "x.x", "x.xx", "x.xxxx");

    @Test
    void angleFormatsResolveTheirBaseSpacing() {
        for (String format : ANGLE_FORMATS) {
            AngleFormatterLocator fl = new AngleFormatterLocator(FormatterLocatorConfig.<Angle>builder()
                    .withFormat(format)
                    .withDiagnostics(NullTickDiagnosticsSink.INSTANCE)
                    .build());
            Angle base = fl.getBaseSpacing().orElseThrow();

            List<Double> positions = new ArrayList<>();
            for (int k = 0; k < 5; k++) {
                positions.add(10.0 + k * base.degrees());
            }
            assertDistinct(format, fl.format(positions, base));
        }
    }

    @Test
    void scalarFormatsResolveTheirBaseSpacing() {
        for (String format : SCALAR_FORMATS) {
            ScalarFormatterLocator fl = new ScalarFormatterLocator(FormatterLocatorConfig.<Double>builder()
                    .withFormat(format)
                    .withDiagnostics(NullTickDiagnosticsSink.INSTANCE)
                    .build());
            double base = fl.getBaseSpacing().orElseThrow();

            List<Double> positions = new ArrayList<>();
            for (int k = 0; k < 5; k++) {
                positions.add(10.0 + k * base);
            }
            assertDistinct(format, fl.format(positions, base));
        }
    }

    @Test
    void countModeStepsCanAlwaysBeLabelled() {
        double[][] ranges = { { 10.0, 10.05 }, { 0.0, 0.6 }, { 0.0, 1.0 }, { -3.3, 12.7 } };
        for (String format : ANGLE_FORMATS) {
            for (int number : new int[] { 5, 7 }) {
                AngleFormatterLocator fl = new AngleFormatterLocator(FormatterLocatorConfig.<Angle>builder()
                        .withFormat(format)
                        .withNumber(number)
                        .withDiagnostics(NullTickDiagnosticsSink.INSTANCE)
                        .build());
                double base = fl.getBaseSpacing().orElseThrow().degrees();

                for (double[] range : ranges) {
                    Ticks<Angle> ticks = fl.locate(range[0], range[1]);
                    double spacing = ticks.spacing().degrees();
                    String context = format + " n=" + number + " [" + range[0] + ", " + range[1] + "]";

                    assertTrue(spacing >= base - AbstractFormatterLocator.SPACING_TOLERANCE, context);
                    assertEquals(0.0, spacing - Math.rint(spacing / base) * base,
                            AbstractFormatterLocator.SPACING_TOLERANCE, context);
                    assertDistinct(context, fl.format(ticks));
                }
            }
        }
    }

    private static void assertDistinct(String format, List<String> labels) {
        assertEquals(labels.size(), new HashSet<>(labels).size(), format + " produced " + labels);
    }
}
