package com.coach.linkage.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Runs {@link NormalizationRule}s over a trimmed name, then lowercases it and collapses
 * whitespace. Blank or null input normalizes to the empty string.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = rules.stream()
                .sorted(Comparator.comparingInt(NormalizationRule::priority))
                .toList();
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String result = name.trim();
        for (NormalizationRule rule : rules) {
            String rewritten = rule.apply(result);
            if (log.isTraceEnabled() && !rewritten.equals(result)) {
                log.trace("normalize.rule name={} '{}' -> '{}'", rule.name(), result, rewritten);
            }
            result = rewritten;
        }
        return WHITESPACE.matcher(result.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }

    public boolean areEquivalent(String name1, String name2) {
        return normalize(name1).equals(normalize(name2));
    }
}
