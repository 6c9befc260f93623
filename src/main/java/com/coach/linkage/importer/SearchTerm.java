package com.coach.linkage.importer;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A free-text school name prepared for matching: trimmed, lowercased, alias-expanded,
 * plus its significant words.
 *
 * @param text  the normalized search text
 * @param words words of at least three characters once generic words are removed
 */
public record SearchTerm(String text, List<String> words) {

    private static final Pattern GENERIC_WORDS =
            Pattern.compile("\\b(university|college|of|the)\\b|[-–]", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    static final int MIN_WORD_LENGTH = 3;

    public SearchTerm {
        words = List.copyOf(words);
    }

    public static SearchTerm of(String freeText) {
        String text = SchoolAliases.expand(freeText.trim().toLowerCase(Locale.ROOT));
        List<String> words = Arrays.stream(WHITESPACE.split(GENERIC_WORDS.matcher(text).replaceAll(" ")))
                .filter(w -> w.length() >= MIN_WORD_LENGTH)
                .toList();
        return new SearchTerm(text, words);
    }
}
