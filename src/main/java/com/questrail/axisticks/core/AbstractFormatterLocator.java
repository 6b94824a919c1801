package com.questrail.axisticks.core;

import com.questrail.axisticks.api.FormatterLocator;
import com.questrail.axisticks.api.TickSpacing;
import com.questrail.axisticks.api.Ticks;
import com.questrail.axisticks.config.FormatterLocatorConfig;
import com.questrail.axisticks.format.FormatDescriptor;
import com.questrail.axisticks.format.FormatGrammar;
import com.questrail.axisticks.internal.time.WallClock;
import com.questrail.axisticks.observability.FormatAssignedEvent;
import com.questrail.axisticks.observability.SpacingCorrectedEvent;
import com.questrail.axisticks.observability.TickDiagnosticsSink;
import com.questrail.axisticks.units.UnitKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * AbstractFormatterLocator
 * -----------------------------------------------------------------------------
 * Shared implementation of {@link FormatterLocator}.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Holding the configuration: spacing mode, format string and its parsed
 *       {@link FormatDescriptor}</li>
 *   <li>Keeping an explicit spacing consistent with the format (see below)</li>
 *   <li>The spacing policy and the multiples-of-spacing locator</li>
 *   <li>Driving the per-position label rendering</li>
 * </ul>
 *
 * <h2>Spacing validation</h2>
 * <p>Whenever a format is applied while an explicit spacing is active, or an
 * explicit spacing is assigned while a format is set, the spacing is checked
 * against the base spacing of the format:</p>
 * <ul>
 *   <li>below the base spacing: raised to the base spacing</li>
 *   <li>not a multiple of it within {@value #SPACING_TOLERANCE}: rounded to the
 *       nearest multiple</li>
 * </ul>
 * <p>Each correction is reported to the {@link TickDiagnosticsSink} and
 * absorbed; neither is an error.</p>
 *
 * <h2>Subclass contract</h2>
 * <p>Subclasses provide the unit system: how a spacing maps to a plain number
 * ("magnitude", in position units), the base spacing of a descriptor, the
 * nice-step selector, and how one position is rendered.</p>
 *
 * @param <S> the spacing type
 */
public abstract class AbstractFormatterLocator<S> implements FormatterLocator<S>
{
    /**
     * Absolute tolerance, in position units, for "is a multiple of the base spacing".
     */
    public static final double SPACING_TOLERANCE = 1e-10;

    /**
     * Tolerance, in index units, used to snap range-end quotients onto whole
     * multiples. Widened to a few ulps for quotients too large to resolve it.
     */
    static final double INDEX_SNAP_TOLERANCE = 1e-9;

    private static final int INDEX_SNAP_ULPS = 4;

    /**
     * Upper bound on the number of positions a single {@link #locate} call may produce.
     */
    public static final long MAX_TICKS = 1_000_000L;

    // largest index whose product with the spacing is still computed exactly from an integer
    private static final double MAX_EXACT_INDEX = 0x1p53;

    private final FormatGrammar grammar;
    private final TickDiagnosticsSink diagnostics;
    private final WallClock wallClock;

    private TickSpacing<S> tickSpacing;
    private String format;
    private FormatDescriptor descriptor;

    protected AbstractFormatterLocator(FormatGrammar grammar, FormatterLocatorConfig<S> config) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        Objects.requireNonNull(config, "config");
        this.diagnostics = config.diagnostics();
        this.wallClock = config.wallClock();

        TickSpacing<S> initial = config.tickSpacing();
        if (initial instanceof TickSpacing.Fixed<S> fixed) {
            requireValidSpacing(fixed.spacing());
        }
        this.tickSpacing = initial;
        applyFormat(config.format());
    }

    // ---------------------------------------------------------------------
    // Subclass hooks
    // ---------------------------------------------------------------------

    /**
     * Spacing expressed as a plain number in position units.
     */
    protected abstract double magnitude(S spacing);

    /**
     * Inverse of {@link #magnitude}.
     */
    protected abstract S fromMagnitude(double magnitude);

    /**
     * {@code spacing} multiplied by {@code factor}, keeping its unit.
     */
    protected abstract S scale(S spacing, double factor);

    /**
     * Unit in which {@link #magnitude} is expressed, for diagnostics.
     */
    protected abstract UnitKind magnitudeUnit();

    /**
     * @throws IllegalArgumentException if {@code spacing} is not positive and finite
     */
    protected abstract void requireValidSpacing(S spacing);

    protected abstract S baseSpacing(FormatDescriptor descriptor);

    /**
     * Nice spacing for a raw spacing given in position units.
     */
    protected abstract S selectStep(double rawSpacing, FormatDescriptor descriptorOrNull);

    /**
     * Spacing used in count mode when the axis range has zero width and no
     * format is set.
     */
    protected abstract S degenerateSpacing();

    /**
     * Spacing reported alongside explicit values.
     */
    protected abstract S explicitValuesSpacing();

    /**
     * Descriptor used when no format is set, derived from the tick spacing.
     */
    protected abstract FormatDescriptor automaticDescriptor(S spacing);

    protected abstract String render(double position, FormatDescriptor descriptor);

    // ---------------------------------------------------------------------
    // Configuration
    // ---------------------------------------------------------------------

    @Override
    public TickSpacing<S> getTickSpacing() {
        return tickSpacing;
    }

    @Override
    public void setTickSpacing(TickSpacing<S> tickSpacing) {
        Objects.requireNonNull(tickSpacing, "tickSpacing");
        if (tickSpacing instanceof TickSpacing.Fixed<S> fixed) {
            requireValidSpacing(fixed.spacing());
            this.tickSpacing = conformToFormat(fixed);
        } else {
            this.tickSpacing = tickSpacing;
        }
    }

    @Override
    public Optional<String> getFormat() {
        return Optional.ofNullable(format);
    }

    @Override
    public void setFormat(String format) {
        applyFormat(format);
    }

    @Override
    public Optional<FormatDescriptor> getFormatDescriptor() {
        return Optional.ofNullable(descriptor);
    }

    @Override
    public Optional<S> getBaseSpacing() {
        return descriptor == null ? Optional.empty() : Optional.of(baseSpacing(descriptor));
    }

    private void applyFormat(String newFormat) {
        if (newFormat == null) {
            this.format = null;
            this.descriptor = null;
            diagnostics.onFormatAssigned(new FormatAssignedEvent(wallClock.now(), null, null));
            return;
        }

        // parse first: a rejected format leaves the previous one in place
        FormatDescriptor parsed = grammar.parse(newFormat);
        this.format = newFormat;
        this.descriptor = parsed;
        diagnostics.onFormatAssigned(new FormatAssignedEvent(wallClock.now(), newFormat, parsed));

        if (tickSpacing instanceof TickSpacing.Fixed<S> fixed) {
            this.tickSpacing = conformToFormat(fixed);
        }
    }

    private TickSpacing<S> conformToFormat(TickSpacing.Fixed<S> fixed) {
        if (descriptor == null) {
            return fixed;
        }

        S base = baseSpacing(descriptor);
        double baseMagnitude = magnitude(base);
        S spacing = fixed.spacing();

        if (magnitude(spacing) < baseMagnitude) {
            spacing = correct(SpacingCorrectedEvent.Reason.TOO_SMALL, spacing, base);
        }

        double multiple = Math.rint(magnitude(spacing) / baseMagnitude);
        if (Math.abs(magnitude(spacing) - multiple * baseMagnitude) > SPACING_TOLERANCE) {
            spacing = correct(SpacingCorrectedEvent.Reason.NOT_A_MULTIPLE, spacing,
                    scale(base, Math.max(1.0, multiple)));
        }

        return spacing == fixed.spacing() ? fixed : TickSpacing.fixed(spacing);
    }

    private S correct(SpacingCorrectedEvent.Reason reason, S requested, S corrected) {
        diagnostics.onSpacingCorrected(new SpacingCorrectedEvent(
                wallClock.now(),
                reason,
                format,
                magnitude(requested),
                magnitude(corrected),
                magnitudeUnit()));
        return corrected;
    }

    // ---------------------------------------------------------------------
    // Locator
    // ---------------------------------------------------------------------

    @Override
    public Ticks<S> locate(double valueMin, double valueMax) {
        requireFinite(valueMin, "valueMin");
        requireFinite(valueMax, "valueMax");

        if (tickSpacing instanceof TickSpacing.Values<S> values) {
            return new Ticks<>(values.values(), explicitValuesSpacing(), true);
        }

        double step = magnitude(resolveSpacing(valueMin, valueMax));
        return new Ticks<>(multiples(valueMin, valueMax, step), fromMagnitude(step), false);
    }

    /**
     * Spacing policy for the non-values modes.
     */
    S resolveSpacing(double valueMin, double valueMax) {
        if (tickSpacing instanceof TickSpacing.Fixed<S> fixed) {
            return fixed.spacing();
        }

        TickSpacing.Count<S> count = (TickSpacing.Count<S>) tickSpacing;
        double dv = Math.abs(valueMax - valueMin) / count.number();

        if (descriptor != null && dv < magnitude(baseSpacing(descriptor))) {
            // the format cannot resolve anything finer
            return baseSpacing(descriptor);
        }
        if (dv == 0.0) {
            return degenerateSpacing();
        }

        S step = selectStep(dv, descriptor);
        return descriptor == null ? step : roundUpToBase(step, baseSpacing(descriptor));
    }

    /**
     * Smallest multiple of {@code base} that is not finer than {@code step}.
     * A step already within {@value #SPACING_TOLERANCE} of a multiple is kept.
     */
    private S roundUpToBase(S step, S base) {
        double baseMagnitude = magnitude(base);
        double ratio = magnitude(step) / baseMagnitude;
        if (Math.abs(magnitude(step) - Math.rint(ratio) * baseMagnitude) <= SPACING_TOLERANCE) {
            return step;
        }
        return scale(base, Math.max(1.0, Math.ceil(ratio)));
    }

    /**
     * All integer multiples of {@code step} within {@code [valueMin, valueMax]}.
     * Positions are computed as {@code index * step} so that no error
     * accumulates from one tick to the next.
     */
    static List<Double> multiples(double valueMin, double valueMax, double step) {
        double lower = Math.ceil(snap(valueMin / step));
        double upper = Math.floor(snap(valueMax / step));
        if (lower > upper) {
            return List.of();
        }
        if (Math.abs(lower) > MAX_EXACT_INDEX || Math.abs(upper) > MAX_EXACT_INDEX) {
            throw new IllegalArgumentException("Range [" + valueMin + ", " + valueMax
                    + "] is too far from zero for spacing " + step);
        }
        if (upper - lower >= MAX_TICKS) {
            throw new IllegalArgumentException("Range [" + valueMin + ", " + valueMax
                    + "] with spacing " + step + " exceeds " + MAX_TICKS + " ticks");
        }

        long iMin = (long) lower;
        long iMax = (long) upper;
        List<Double> positions = new ArrayList<>((int) (iMax - iMin + 1));
        for (long i = iMin; i <= iMax; i++) {
            positions.add(i * step);
        }
        return positions;
    }

    private static double snap(double quotient) {
        double nearest = Math.rint(quotient);
        double tolerance = Math.max(INDEX_SNAP_TOLERANCE, INDEX_SNAP_ULPS * Math.ulp(quotient));
        if (Math.abs(quotient - nearest) <= tolerance) {
            return nearest;
        }
        return quotient;
    }

    // ---------------------------------------------------------------------
    // Formatter
    // ---------------------------------------------------------------------

    @Override
    public List<String> format(List<Double> positions, S spacing) {
        Objects.requireNonNull(positions, "positions");
        if (positions.isEmpty()) {
            return List.of();
        }

        FormatDescriptor active;
        if (descriptor != null) {
            active = descriptor;
        } else {
            Objects.requireNonNull(spacing, "spacing");
            requireValidSpacing(spacing);
            active = automaticDescriptor(spacing);
        }

        List<String> labels = new ArrayList<>(positions.size());
        for (Double position : positions) {
            labels.add(render(Objects.requireNonNull(position, "position"), active));
        }
        return labels;
    }

    protected static void requireFinite(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be finite (was " + value + ")");
        }
    }

    protected static void requirePositive(double value, String name) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new IllegalArgumentException(name + " must be positive and finite (was " + value + ")");
        }
    }
}
