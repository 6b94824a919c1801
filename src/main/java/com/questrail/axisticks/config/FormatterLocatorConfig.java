package com.questrail.axisticks.config;

import com.questrail.axisticks.api.TickSpacing;
import com.questrail.axisticks.internal.time.SystemWallClock;
import com.questrail.axisticks.internal.time.WallClock;
import com.questrail.axisticks.observability.Slf4jTickDiagnosticsSink;
import com.questrail.axisticks.observability.TickDiagnosticsSink;

import java.util.List;
import java.util.Objects;

/**
 * Initial configuration of a formatter/locator.
 *
 * <p>{@code format} may be {@code null} (automatic labels). The builder accepts
 * at most one of values, number and spacing and falls back to
 * {@link TickSpacing#defaultCount()} when none is given.</p>
 *
 * @param <S> the spacing type
 */
public record FormatterLocatorConfig<S>(
    TickSpacing<S> tickSpacing,
    String format,
    TickDiagnosticsSink diagnostics,
    WallClock wallClock
) {
    public FormatterLocatorConfig {
        Objects.requireNonNull(tickSpacing, "tickSpacing");
        Objects.requireNonNull(diagnostics, "diagnostics");
        Objects.requireNonNull(wallClock, "wallClock");
    }

    public static <S> FormatterLocatorConfig<S> defaults() {
        return FormatterLocatorConfig.<S>builder().build();
    }

    public static <S> Builder<S> builder() {
        return new Builder<>();
    }

    public static final class Builder<S> {
        private List<Double> values;
        private Integer number;
        private S spacing;
        private String format;
        private TickDiagnosticsSink diagnostics = new Slf4jTickDiagnosticsSink();
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder<S> withValues(List<Double> values) {
            this.values = values;
            return this;
        }

        public Builder<S> withNumber(int number) {
            this.number = number;
            return this;
        }

        public Builder<S> withSpacing(S spacing) {
            this.spacing = spacing;
            return this;
        }

        public Builder<S> withFormat(String format) {
            this.format = format;
            return this;
        }

        public Builder<S> withDiagnostics(TickDiagnosticsSink diagnostics) {
            this.diagnostics = diagnostics;
            return this;
        }

        public Builder<S> withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        /**
         * @throws TickConfigurationException if more than one of values, number
         *         and spacing was supplied
         */
        public FormatterLocatorConfig<S> build() {
            int supplied = (values != null ? 1 : 0) + (number != null ? 1 : 0) + (spacing != null ? 1 : 0);
            if (supplied > 1) {
                throw new TickConfigurationException("At most one of values/number/spacing can be specified");
            }

            TickSpacing<S> tickSpacing;
            if (values != null) {
                tickSpacing = TickSpacing.values(values);
            } else if (number != null) {
                tickSpacing = TickSpacing.count(number);
            } else if (spacing != null) {
                tickSpacing = TickSpacing.fixed(spacing);
            } else {
                tickSpacing = TickSpacing.defaultCount();
            }
            return new FormatterLocatorConfig<>(tickSpacing, format, diagnostics, wallClock);
        }
    }
}
