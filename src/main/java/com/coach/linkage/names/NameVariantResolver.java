package com.coach.linkage.names;

import com.coach.linkage.api.DedupOptions;
import com.coach.linkage.core.model.MatchType;
import com.coach.linkage.similarity.LevenshteinDistance;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether two coach names plausibly belong to the same person.
 *
 * <p>Last names gate the decision: they must be equal or within
 * {@link DedupOptions#getLastNameMaxDistance()} edits. First names then match on any of
 * a single-letter initial, a punctuated initial ("J." vs "John"), a small edit distance,
 * or a shared nickname group.</p>
 *
 * <p>Every check is symmetric, so swapping the two names never changes the result.</p>
 */
public class NameVariantResolver {

    private static final Pattern PUNCTUATION = Pattern.compile("\\p{Punct}");

    private final LevenshteinDistance levenshtein;
    private final NicknameTable nicknames;
    private final int lastNameMaxDistance;
    private final int firstNameMaxDistance;

    public NameVariantResolver() {
        this(new LevenshteinDistance(), NicknameTable.defaultTable(), DedupOptions.defaults());
    }

    public NameVariantResolver(LevenshteinDistance levenshtein, NicknameTable nicknames, DedupOptions options) {
        this.levenshtein = levenshtein;
        this.nicknames = nicknames;
        this.lastNameMaxDistance = options.getLastNameMaxDistance();
        this.firstNameMaxDistance = options.getFirstNameMaxDistance();
    }

    public MatchType classify(String lastA, String lastB, String firstA, String firstB) {
        String last1 = normalize(lastA);
        String last2 = normalize(lastB);
        String first1 = normalize(firstA);
        String first2 = normalize(firstB);

        if (first1.equals(first2) && last1.equals(last2)) {
            return MatchType.EXACT;
        }

        boolean lastNamesCompatible = last1.equals(last2)
                || levenshtein.distance(last1, last2) <= lastNameMaxDistance;
        if (!lastNamesCompatible) {
            return MatchType.NONE;
        }

        if (isInitialOf(first1, first2)
                || isPunctuatedInitialOf(first1, first2)
                || isPunctuatedInitialOf(first2, first1)
                || levenshtein.distance(first1, first2) <= firstNameMaxDistance
                || nicknames.areVariants(first1, first2)) {
            return MatchType.FUZZY;
        }
        return MatchType.NONE;
    }

    /**
     * One name is a single letter equal to the other's first letter.
     */
    private static boolean isInitialOf(String first1, String first2) {
        if (first1.isEmpty() || first2.isEmpty()) {
            return false;
        }
        return (first1.length() == 1 || first2.length() == 1) && first1.charAt(0) == first2.charAt(0);
    }

    /**
     * {@code candidate} with punctuation removed equals the first letter of {@code other}.
     */
    private static boolean isPunctuatedInitialOf(String candidate, String other) {
        if (other.isEmpty()) {
            return false;
        }
        String stripped = PUNCTUATION.matcher(candidate).replaceAll("");
        return stripped.length() == 1 && stripped.charAt(0) == other.charAt(0);
    }

    private static String normalize(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }
}
