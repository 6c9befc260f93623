package com.coach.linkage.merge;

/**
 * Outcome of a merge request.
 */
public enum MergeStatus {
    /**
     * Keeper updated, dependents moved, loser deleted.
     */
    MERGED,

    /**
     * The loser (or keeper) no longer exists, typically because another operator merged
     * the pair first. Informational, nothing was changed.
     */
    ALREADY_RESOLVED,

    /**
     * A step failed; see the failed step to judge whether manual cleanup is needed.
     */
    FAILED
}
