package com.questrail.axisticks.core;

import com.questrail.axisticks.config.FormatterLocatorConfig;
import com.questrail.axisticks.format.FormatDescriptor;
import com.questrail.axisticks.format.FormatGrammar;
import com.questrail.axisticks.format.LabelRenderer;
import com.questrail.axisticks.step.StepSelectors;
import com.questrail.axisticks.units.UnitKind;

import java.util.Objects;

/**
 * Joint formatter/locator for plain numeric axes.
 *
 * <p>Formats follow {@link FormatGrammar#SCALAR} ({@code x}, {@code x.x},
 * {@code x.xx}, ...). The base spacing of a format with p fractional digits is
 * 10<sup>-p</sup>. Without a format, spacings below one get
 * {@code -floor(log10(spacing))} fractional digits.</p>
 */
public class ScalarFormatterLocator extends AbstractFormatterLocator<Double>
{
    public static final double EXPLICIT_VALUES_SPACING = 1.1;

    public ScalarFormatterLocator() {
        this(FormatterLocatorConfig.defaults());
    }

    public ScalarFormatterLocator(FormatterLocatorConfig<Double> config) {
        super(FormatGrammar.SCALAR, config);
    }

    @Override
    protected double magnitude(Double spacing) {
        return spacing;
    }

    @Override
    protected Double fromMagnitude(double magnitude) {
        return magnitude;
    }

    @Override
    protected Double scale(Double spacing, double factor) {
        return spacing * factor;
    }

    @Override
    protected UnitKind magnitudeUnit() {
        return UnitKind.DIMENSIONLESS;
    }

    @Override
    protected void requireValidSpacing(Double spacing) {
        Objects.requireNonNull(spacing, "spacing");
        requirePositive(spacing, "spacing");
    }

    @Override
    protected Double baseSpacing(FormatDescriptor descriptor) {
        return 1.0 / Math.pow(10.0, descriptor.precision());
    }

    @Override
    protected Double selectStep(double rawSpacing, FormatDescriptor descriptorOrNull) {
        return StepSelectors.selectStepScalar(rawSpacing);
    }

    @Override
    protected Double degenerateSpacing() {
        return 1.0;
    }

    @Override
    protected Double explicitValuesSpacing() {
        return EXPLICIT_VALUES_SPACING;
    }

    @Override
    protected FormatDescriptor automaticDescriptor(Double spacing) {
        int precision = spacing < 1.0 ? (int) -Math.floor(Math.log10(spacing)) : 0;
        return FormatDescriptor.decimal(UnitKind.DIMENSIONLESS, precision);
    }

    @Override
    protected String render(double position, FormatDescriptor descriptor) {
        return LabelRenderer.decimal(position, descriptor.precision());
    }
}
