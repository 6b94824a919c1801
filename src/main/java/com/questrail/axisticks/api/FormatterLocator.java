package com.questrail.axisticks.api;

import com.questrail.axisticks.format.FormatDescriptor;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * FormatterLocator
 * -----------------------------------------------------------------------------
 * A joint tick locator and tick label formatter.
 *
 * <p>Keeping the two together guarantees that the tick spacing can always be
 * represented by the label format and vice versa. For example, a format of
 * {@code dd:mm} cannot label ticks that are not whole arc-minutes apart, so an
 * explicit spacing of 30 arc-seconds is corrected to one arc-minute.</p>
 *
 * <h2>Usage</h2>
 * <p>The caller configures the object once (a label format plus one
 * {@link TickSpacing} mode) and on each redraw calls {@link #locate} with the
 * current axis range, then {@link #format} with the returned positions and
 * spacing.</p>
 *
 * <h2>State</h2>
 * <ul>
 *   <li>The only mutable state is the configuration (format and spacing mode)</li>
 *   <li>{@link #locate} and {@link #format} are pure functions of that
 *       configuration and their arguments</li>
 *   <li>Implementations are not thread-safe; callers serialize configuration
 *       changes</li>
 * </ul>
 *
 * @param <S> the spacing type
 */
public interface FormatterLocator<S>
{
    /**
     * Returns the active spacing mode.
     */
    TickSpacing<S> getTickSpacing();

    /**
     * Replaces the spacing mode. An explicit spacing is validated against the
     * current format.
     *
     * @param tickSpacing the new mode (must not be {@code null})
     */
    void setTickSpacing(TickSpacing<S> tickSpacing);

    /**
     * Switches to explicit tick positions, clearing count and spacing.
     */
    default void setValues(List<Double> values) {
        setTickSpacing(TickSpacing.values(values));
    }

    /**
     * Switches to a desired tick count, clearing values and spacing.
     */
    default void setNumber(int number) {
        setTickSpacing(TickSpacing.count(number));
    }

    /**
     * Switches to an explicit spacing, clearing values and count.
     */
    default void setSpacing(S spacing) {
        setTickSpacing(TickSpacing.fixed(spacing));
    }

    default Optional<List<Double>> getValues() {
        return getTickSpacing() instanceof TickSpacing.Values<S> v
                ? Optional.of(v.values())
                : Optional.empty();
    }

    default OptionalInt getNumber() {
        return getTickSpacing() instanceof TickSpacing.Count<S> c
                ? OptionalInt.of(c.number())
                : OptionalInt.empty();
    }

    default Optional<S> getSpacing() {
        return getTickSpacing() instanceof TickSpacing.Fixed<S> f
                ? Optional.of(f.spacing())
                : Optional.empty();
    }

    /**
     * Returns the label format string, or empty in automatic mode.
     */
    Optional<String> getFormat();

    /**
     * Parses and applies a label format. {@code null} returns to automatic
     * mode, where labels are derived from the tick spacing.
     *
     * @throws com.questrail.axisticks.format.TickFormatException if the format is not recognized
     */
    void setFormat(String format);

    Optional<FormatDescriptor> getFormatDescriptor();

    /**
     * Returns the finest spacing the current format can represent exactly, or
     * empty when no format is set.
     */
    Optional<S> getBaseSpacing();

    /**
     * Computes tick positions within {@code [valueMin, valueMax]}.
     *
     * @return the positions, in ascending order unless explicit values were
     *         configured, and the spacing to pass to {@link #format}
     */
    Ticks<S> locate(double valueMin, double valueMax);

    /**
     * Renders tick positions as labels.
     *
     * @param positions tick positions, typically from {@link #locate}
     * @param spacing   the spacing returned alongside them
     * @return one label per position, in the same order
     */
    List<String> format(List<Double> positions, S spacing);

    /**
     * Convenience for {@code format(ticks.positions(), ticks.spacing())}.
     */
    default List<String> format(Ticks<S> ticks) {
        return format(ticks.positions(), ticks.spacing());
    }
}
