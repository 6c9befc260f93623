package com.coach.linkage.suppression;

import java.util.Set;

/**
 * Persisted set of record pairs an operator has marked "not a duplicate".
 * Entries never expire; they are removed only by {@link #clearAll()}.
 */
public interface SuppressionStore {

    /**
     * Records that the two records are not duplicates. Argument order does not matter.
     */
    void dismiss(String idA, String idB);

    boolean isDismissed(String idA, String idB);

    /**
     * Forgets every dismissal. Callers should rescan for candidates afterwards.
     */
    void clearAll();

    /**
     * Serialized keys of all dismissed pairs, in dismissal order.
     */
    Set<String> dismissedKeys();

    default int size() {
        return dismissedKeys().size();
    }
}
