package com.coach.linkage.core.model;

/**
 * Classification of a pair of records during duplicate detection.
 */
public enum MatchType {
    /**
     * Names are identical after case folding and trimming.
     */
    EXACT,

    /**
     * Names differ but are plausibly the same record (typos, initials, nicknames).
     */
    FUZZY,

    /**
     * Not a duplicate candidate.
     */
    NONE
}
