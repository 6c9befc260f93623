package com.coach.linkage.rules;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalization and abbreviation rules for school names.
 */
public final class SchoolNameRules {

    private SchoolNameRules() {
        // Utility class
    }

    /**
     * Drops a leading "The", a trailing "University" or "College", turns " of " and
     * punctuation into spaces. "The Ohio State University" becomes "ohio state".
     */
    public static NormalizationEngine createEngine() {
        return new NormalizationEngine(List.of(
                NormalizationRule.of("school-leading-the", "^the\\s+", "", 10),
                NormalizationRule.of("school-trailing-university", "\\s+university$", "", 20),
                NormalizationRule.of("school-trailing-college", "\\s+college$", "", 20),
                NormalizationRule.of("school-of", "\\s+of\\s+", " ", 30),
                NormalizationRule.of("school-punctuation", "[.,\\-–—]", " ", 40)
        ));
    }

    /**
     * Word pairs written both in full and abbreviated in school names.
     */
    public static final List<AbbreviationPair> ABBREVIATIONS = List.of(
            AbbreviationPair.of("Saint", "St"),
            AbbreviationPair.of("Mount", "Mt"),
            AbbreviationPair.of("University", "U"),
            AbbreviationPair.of("North", "N"),
            AbbreviationPair.of("South", "S"),
            AbbreviationPair.of("East", "E"),
            AbbreviationPair.of("West", "W")
    );

    /**
     * Returns true if the two names become identical once the first occurrence of
     * some full word or its abbreviation is replaced by the same placeholder.
     * "Saint Mary's" and "St. Mary's" match.
     */
    public static boolean areAbbreviationVariants(String name1, String name2) {
        if (name1 == null || name2 == null) {
            return false;
        }
        for (AbbreviationPair pair : ABBREVIATIONS) {
            if (pair.fold(name1).equals(pair.fold(name2))) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param full        pattern for the full word
     * @param abbreviated pattern for the abbreviation, optional trailing period included
     */
    public record AbbreviationPair(Pattern full, Pattern abbreviated) {

        private static final String PLACEHOLDER = "\u0000";

        static AbbreviationPair of(String full, String abbreviation) {
            return new AbbreviationPair(
                    Pattern.compile("\\b" + full + "\\b", Pattern.CASE_INSENSITIVE),
                    Pattern.compile("\\b" + abbreviation + "\\b\\.?", Pattern.CASE_INSENSITIVE));
        }

        String fold(String name) {
            String folded = full.matcher(name).replaceFirst(PLACEHOLDER);
            folded = abbreviated.matcher(folded).replaceFirst(PLACEHOLDER);
            return folded.toLowerCase(Locale.ROOT);
        }
    }
}
