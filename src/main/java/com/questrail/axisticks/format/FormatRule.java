package com.questrail.axisticks.format;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * One rule of a {@link FormatGrammar}: a whole-string pattern and the builder
 * producing a descriptor for strings it accepts.
 */
public record FormatRule(
        String name,
        Pattern pattern,
        Function<String, FormatDescriptor> builder
) {
    public FormatRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(builder, "builder");
    }

    public static FormatRule of(String name, String regex, Function<String, FormatDescriptor> builder) {
        return new FormatRule(name, Pattern.compile(regex), builder);
    }

    /**
     * Applies this rule to {@code format}.
     *
     * @return the descriptor if the whole string matches, otherwise empty
     */
    public Optional<FormatDescriptor> apply(String format) {
        if (!pattern.matcher(format).matches()) {
            return Optional.empty();
        }
        return Optional.of(builder.apply(format));
    }
}
