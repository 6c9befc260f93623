package com.coach.linkage.merge;

/**
 * Steps of a merge, in the order they run.
 */
public enum MergeStep {
    LOAD_RECORDS("load records"),
    RECONCILE_FIELDS("reconcile fields"),
    REPOINT_ATTENDANCE("repoint attendance"),
    REPOINT_COACHES("repoint coaches"),
    DELETE_LOSER("delete duplicate");

    private final String description;

    MergeStep(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
