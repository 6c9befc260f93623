package com.coach.linkage.similarity;

import com.coach.linkage.core.model.Coach;

import java.util.Locale;

/**
 * Additive confidence score for a pair of coach names. Larger is more confident.
 * Scores are only used to rank candidates of a single scan against each other.
 *
 * <ul>
 *   <li>+50 identical first names, +50 identical last names</li>
 *   <li>+30 first names one edit apart, +30 last names one edit apart</li>
 *   <li>+10 first names share their first character</li>
 * </ul>
 */
public class NameMatchScorer {

    static final int EXACT_NAME_POINTS = 50;
    static final int ONE_EDIT_POINTS = 30;
    static final int SAME_INITIAL_POINTS = 10;

    private final LevenshteinDistance levenshtein;

    public NameMatchScorer() {
        this(new LevenshteinDistance());
    }

    public NameMatchScorer(LevenshteinDistance levenshtein) {
        this.levenshtein = levenshtein;
    }

    public int score(Coach a, Coach b) {
        return score(a.getFirstName(), a.getLastName(), b.getFirstName(), b.getLastName());
    }

    public int score(String firstA, String lastA, String firstB, String lastB) {
        String first1 = normalize(firstA);
        String first2 = normalize(firstB);
        String last1 = normalize(lastA);
        String last2 = normalize(lastB);

        int score = 0;
        if (first1.equals(first2)) score += EXACT_NAME_POINTS;
        if (last1.equals(last2)) score += EXACT_NAME_POINTS;

        if (levenshtein.distance(first1, first2) == 1) score += ONE_EDIT_POINTS;
        if (levenshtein.distance(last1, last2) == 1) score += ONE_EDIT_POINTS;

        if (!first1.isEmpty() && !first2.isEmpty() && first1.charAt(0) == first2.charAt(0)) {
            score += SAME_INITIAL_POINTS;
        }
        return score;
    }

    private static String normalize(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }
}
