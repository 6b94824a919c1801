package com.questrail.axisticks.api;

import java.util.List;
import java.util.Objects;

/**
 * TickSpacing
 * -----------------------------------------------------------------------------
 * How a formatter/locator chooses its tick positions. Exactly one of three
 * modes is active at any time:
 *
 * <ul>
 *   <li>{@link Values}: a fixed list of tick positions, used verbatim</li>
 *   <li>{@link Count}: a target number of ticks; the spacing is derived from
 *       the axis range</li>
 *   <li>{@link Fixed}: a fixed spacing between ticks</li>
 * </ul>
 *
 * <p>The modes are variants of a sealed type, so a configuration holding, say,
 * both a count and a spacing cannot be expressed.</p>
 *
 * @param <S> the spacing type ({@code Angle} for angles, {@code Double} for scalars)
 */
public sealed interface TickSpacing<S>
        permits TickSpacing.Values, TickSpacing.Count, TickSpacing.Fixed
{
    /**
     * Default mode when nothing else is configured.
     */
    int DEFAULT_COUNT = 5;

    static <S> TickSpacing<S> values(List<Double> values) {
        return new Values<>(values);
    }

    static <S> TickSpacing<S> count(int number) {
        return new Count<>(number);
    }

    static <S> TickSpacing<S> fixed(S spacing) {
        return new Fixed<>(spacing);
    }

    static <S> TickSpacing<S> defaultCount() {
        return new Count<>(DEFAULT_COUNT);
    }

    /**
     * Explicit tick positions, in the locator's position unit.
     */
    record Values<S>(List<Double> values) implements TickSpacing<S>
    {
        public Values {
            Objects.requireNonNull(values, "values");
            for (Double v : values) {
                Objects.requireNonNull(v, "values must not contain null");
            }
            values = List.copyOf(values);
        }
    }

    /**
     * Desired number of ticks across the axis range.
     */
    record Count<S>(int number) implements TickSpacing<S>
    {
        public Count {
            if (number < 1) {
                throw new IllegalArgumentException("number of ticks must be positive (was " + number + ")");
            }
        }
    }

    /**
     * Fixed distance between consecutive ticks.
     */
    record Fixed<S>(S spacing) implements TickSpacing<S>
    {
        public Fixed {
            Objects.requireNonNull(spacing, "spacing");
        }
    }
}
