package com.coach.linkage.core.model;

import java.util.Objects;

/**
 * Two records flagged as possibly representing the same real-world coach or school.
 * Produced fresh by every scan and never mutated.
 *
 * @param first     the record that came first in scan order
 * @param second    the other record
 * @param matchType EXACT or FUZZY
 * @param score     additive confidence, only meaningful relative to other pairs of the same scan
 */
public record CandidatePair<T extends LinkableRecord>(T first, T second, MatchType matchType, int score) {
    public CandidatePair {
        Objects.requireNonNull(first, "first is required");
        Objects.requireNonNull(second, "second is required");
        if (matchType == null || matchType == MatchType.NONE) {
            throw new IllegalArgumentException("Candidate pairs must be EXACT or FUZZY");
        }
    }

    /**
     * Returns true if this pair is made of the two given ids, in either order.
     */
    public boolean involves(String idA, String idB) {
        return (first.getId().equals(idA) && second.getId().equals(idB))
                || (first.getId().equals(idB) && second.getId().equals(idA));
    }
}
