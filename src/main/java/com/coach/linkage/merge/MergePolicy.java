package com.coach.linkage.merge;

import com.coach.linkage.api.DedupOptions;

/**
 * Field preferences applied when a keeper absorbs a loser.
 *
 * @param initialNameMaxLength a keeper first name this short or shorter counts as an initial
 *                             and gives way to a longer first name on the loser
 */
public record MergePolicy(int initialNameMaxLength) {

    public static final int DEFAULT_INITIAL_NAME_MAX_LENGTH = 2;

    public MergePolicy {
        if (initialNameMaxLength < 0) {
            throw new IllegalArgumentException("initialNameMaxLength must be >= 0");
        }
    }

    public static MergePolicy defaults() {
        return new MergePolicy(DEFAULT_INITIAL_NAME_MAX_LENGTH);
    }

    public static MergePolicy from(DedupOptions options) {
        return new MergePolicy(options.getInitialNameMaxLength());
    }

    /**
     * Returns true if {@code loserFirst} should replace {@code keeperFirst}.
     */
    public boolean prefersLoserFirstName(String keeperFirst, String loserFirst) {
        String keeper = keeperFirst == null ? "" : keeperFirst.trim();
        String loser = loserFirst == null ? "" : loserFirst.trim();
        return keeper.length() <= initialNameMaxLength && loser.length() > keeper.length();
    }
}
