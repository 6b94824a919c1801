package com.questrail.axisticks.core;

import com.questrail.axisticks.config.FormatterLocatorConfig;
import com.questrail.axisticks.format.FormatDescriptor;
import com.questrail.axisticks.format.FormatGrammar;
import com.questrail.axisticks.format.LabelRenderer;
import com.questrail.axisticks.step.StepSelectors;
import com.questrail.axisticks.units.Angle;
import com.questrail.axisticks.units.UnitKind;

import java.util.Objects;

/**
 * AngleFormatterLocator
 * -----------------------------------------------------------------------------
 * Joint formatter/locator for angular axes.
 *
 * <p>Positions are plain {@code double}s in degrees; spacings are
 * {@link Angle}s in any angular unit. Formats follow
 * {@link FormatGrammar#ANGLE}: sexagesimal degrees ({@code dd:mm:ss.s}),
 * sexagesimal hours ({@code hh:mm:ss.s}) or decimal degrees, arc-minutes and
 * arc-seconds ({@code d.dd}, {@code m.m}, {@code s.sss}).</p>
 *
 * <h2>Base spacing</h2>
 * <ul>
 *   <li>decimal in unit U with p digits: U / 10<sup>p</sup></li>
 *   <li>sexagesimal with 1, 2 or 3 fields: 1°, 1′ or 1″ / 10<sup>p</sup></li>
 *   <li>hour-angle sexagesimal: fifteen times the above</li>
 * </ul>
 *
 * <h2>Automatic labels</h2>
 * <p>Without a format, labels are sexagesimal degrees whose field count and
 * precision follow the tick spacing: more than 1° gives {@code 12°}, more than
 * 1′ gives {@code 12°30′}, more than 1″ gives {@code 12°30′15″}, and finer
 * spacings add enough decimals to tell neighbouring ticks apart.</p>
 */
public class AngleFormatterLocator extends AbstractFormatterLocator<Angle>
{
    /**
     * Spacing reported with explicit values: just above one arc-second, so
     * automatic labels show whole arc-seconds.
     */
    public static final Angle EXPLICIT_VALUES_SPACING = Angle.arcseconds(1.1);

    private static final Angle ONE_DEGREE = Angle.degrees(1);
    private static final Angle ONE_ARCMINUTE = Angle.arcminutes(1);
    private static final Angle ONE_ARCSECOND = Angle.arcseconds(1);

    public AngleFormatterLocator() {
        this(FormatterLocatorConfig.defaults());
    }

    public AngleFormatterLocator(FormatterLocatorConfig<Angle> config) {
        super(FormatGrammar.ANGLE, config);
    }

    @Override
    protected double magnitude(Angle spacing) {
        return spacing.degrees();
    }

    @Override
    protected Angle fromMagnitude(double magnitude) {
        return Angle.degrees(magnitude);
    }

    @Override
    protected Angle scale(Angle spacing, double factor) {
        return spacing.times(factor);
    }

    @Override
    protected UnitKind magnitudeUnit() {
        return UnitKind.DEGREE;
    }

    @Override
    protected void requireValidSpacing(Angle spacing) {
        Objects.requireNonNull(spacing, "spacing");
        requirePositive(spacing.degrees(), "spacing");
    }

    @Override
    protected Angle baseSpacing(FormatDescriptor descriptor) {
        Angle spacing;
        if (descriptor.decimal()) {
            spacing = Angle.of(1.0, descriptor.unit());
        } else if (descriptor.fields() == 1) {
            spacing = ONE_DEGREE;
        } else if (descriptor.fields() == 2) {
            spacing = ONE_ARCMINUTE;
        } else {
            spacing = ONE_ARCSECOND;
        }
        if (descriptor.precision() > 0) {
            spacing = spacing.times(1.0 / Math.pow(10.0, descriptor.precision()));
        }

        if (!descriptor.decimal() && descriptor.unit() == UnitKind.HOUR_ANGLE) {
            spacing = spacing.times(15.0);
        }
        return spacing;
    }

    @Override
    protected Angle selectStep(double rawSpacing, FormatDescriptor descriptorOrNull) {
        Angle raw = Angle.degrees(rawSpacing);
        if (descriptorOrNull != null && descriptorOrNull.unit() == UnitKind.HOUR_ANGLE) {
            return StepSelectors.selectStepHour(raw);
        }
        return StepSelectors.selectStepDegree(raw);
    }

    @Override
    protected Angle degenerateSpacing() {
        return ONE_ARCSECOND;
    }

    @Override
    protected Angle explicitValuesSpacing() {
        return EXPLICIT_VALUES_SPACING;
    }

    @Override
    protected FormatDescriptor automaticDescriptor(Angle spacing) {
        if (spacing.compareTo(ONE_DEGREE) > 0) {
            return FormatDescriptor.sexagesimal(UnitKind.DEGREE, 1, 0);
        } else if (spacing.compareTo(ONE_ARCMINUTE) > 0) {
            return FormatDescriptor.sexagesimal(UnitKind.DEGREE, 2, 0);
        } else if (spacing.compareTo(ONE_ARCSECOND) > 0) {
            return FormatDescriptor.sexagesimal(UnitKind.DEGREE, 3, 0);
        }
        int precision = (int) -Math.floor(Math.log10(spacing.in(UnitKind.ARCSECOND)));
        return FormatDescriptor.sexagesimal(UnitKind.DEGREE, 3, Math.max(0, precision));
    }

    @Override
    protected String render(double position, FormatDescriptor descriptor) {
        if (descriptor.decimal()) {
            return LabelRenderer.decimalAngle(position, descriptor.unit(), descriptor.precision());
        }
        return LabelRenderer.sexagesimal(position, descriptor.unit(), descriptor.fields(), descriptor.precision());
    }
}
