package com.coach.linkage.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A case-insensitive regex rewrite applied to a name during normalization.
 * Rules run in ascending {@code priority}; rules of equal priority keep their list order.
 *
 * @param name        identifier used in trace logging
 * @param pattern     compiled match pattern
 * @param replacement replacement text, may reference groups
 * @param priority    lower runs first
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, int priority) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
    }

    public static NormalizationRule of(String name, String regex, String replacement, int priority) {
        return new NormalizationRule(name,
                Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
                replacement, priority);
    }

    public String apply(String input) {
        return input == null ? null : pattern.matcher(input).replaceAll(replacement);
    }
}
