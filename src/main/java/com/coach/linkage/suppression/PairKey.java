package com.coach.linkage.suppression;

import java.util.Objects;

/**
 * Order-independent identifier for an unordered pair of record ids.
 * The smaller id (string order) always comes first.
 */
public record PairKey(String lowId, String highId) {

    public static final String SEPARATOR = "|";

    public PairKey {
        Objects.requireNonNull(lowId, "lowId is required");
        Objects.requireNonNull(highId, "highId is required");
        if (lowId.compareTo(highId) > 0) {
            throw new IllegalArgumentException("lowId must sort before highId; use PairKey.of");
        }
    }

    public static PairKey of(String idA, String idB) {
        return idA.compareTo(idB) <= 0 ? new PairKey(idA, idB) : new PairKey(idB, idA);
    }

    /**
     * Serialized form stored by suppression lists.
     */
    public String value() {
        return lowId + SEPARATOR + highId;
    }

    @Override
    public String toString() {
        return value();
    }
}
