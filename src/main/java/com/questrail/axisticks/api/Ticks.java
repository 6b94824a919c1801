package com.questrail.axisticks.api;

import java.util.List;
import java.util.Objects;

/**
 * Result of a locator call: the tick positions together with the spacing that
 * produced them.
 *
 * <p>When {@code explicitValues} is {@code true} the positions were configured
 * by the caller and {@code spacing} is only a hint for picking the label
 * precision.</p>
 *
 * @param <S> the spacing type
 */
public record Ticks<S>(
        List<Double> positions,
        S spacing,
        boolean explicitValues
) {
    public Ticks {
        Objects.requireNonNull(positions, "positions");
        Objects.requireNonNull(spacing, "spacing");
        positions = List.copyOf(positions);
    }

    public boolean isEmpty() {
        return positions.isEmpty();
    }

    public int size() {
        return positions.size();
    }
}
