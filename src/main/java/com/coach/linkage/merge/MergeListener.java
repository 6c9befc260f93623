package com.coach.linkage.merge;

/**
 * Listener for completed merges, e.g. to refresh a candidate list.
 */
public interface MergeListener {

    /**
     * Called after a successful merge.
     *
     * @param recordKind "coach" or "school"
     * @param keeperId   the surviving record
     * @param loserId    the deleted record
     */
    void onMerge(String recordKind, String keeperId, String loserId);
}
