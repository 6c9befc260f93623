package com.coach.linkage.similarity;

import java.util.Locale;

/**
 * Levenshtein edit distance over trimmed, lower-cased strings.
 * Insertion, deletion and substitution each cost 1.
 */
public class LevenshteinDistance {

    public static final int DEFAULT_MAX_INPUT_LENGTH = 256;

    private final int maxInputLength;

    public LevenshteinDistance() {
        this(DEFAULT_MAX_INPUT_LENGTH);
    }

    /**
     * @param maxInputLength inputs are truncated to this many characters after normalization
     */
    public LevenshteinDistance(int maxInputLength) {
        if (maxInputLength <= 0) {
            throw new IllegalArgumentException("maxInputLength must be > 0");
        }
        this.maxInputLength = maxInputLength;
    }

    /**
     * Computes the edit distance between two strings. Null is treated as empty.
     */
    public int distance(String a, String b) {
        String s1 = normalize(a);
        String s2 = normalize(b);
        if (s1.equals(s2)) {
            return 0;
        }
        if (s1.isEmpty()) {
            return s2.length();
        }
        if (s2.isEmpty()) {
            return s1.length();
        }
        return levenshteinDistance(s1, s2);
    }

    /**
     * Similarity ratio {@code 1 - distance / maxLength} in [0.0, 1.0].
     * Two empty strings are identical.
     */
    public double similarity(String a, String b) {
        String s1 = normalize(a);
        String s2 = normalize(b);
        int maxLength = Math.max(s1.length(), s2.length());
        if (maxLength == 0) {
            return 1.0;
        }
        return 1.0 - ((double) distance(s1, s2) / maxLength);
    }

    public int getMaxInputLength() {
        return maxInputLength;
    }

    private String normalize(String s) {
        if (s == null) {
            return "";
        }
        String normalized = s.trim().toLowerCase(Locale.ROOT);
        return normalized.length() > maxInputLength ? normalized.substring(0, maxInputLength) : normalized;
    }

    /**
     * Wagner-Fischer with two rolling rows sized to the shorter string.
     */
    private int levenshteinDistance(String s1, String s2) {
        if (s1.length() > s2.length()) {
            String temp = s1;
            s1 = s2;
            s2 = temp;
        }

        int m = s1.length();
        int n = s2.length();

        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];

        for (int i = 0; i <= m; i++) {
            previousRow[i] = i;
        }

        for (int j = 1; j <= n; j++) {
            currentRow[0] = j;

            for (int i = 1; i <= m; i++) {
                int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
                currentRow[i] = Math.min(
                        Math.min(currentRow[i - 1] + 1, previousRow[i] + 1),
                        previousRow[i - 1] + cost
                );
            }

            int[] temp = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }

        return previousRow[m];
    }
}
