package com.coach.linkage.merge;

/**
 * Dependent rows handled while repointing a loser's dependents to the keeper.
 *
 * @param moved   rows now referencing the keeper
 * @param dropped loser rows deleted because the keeper already had an equivalent row
 */
public record DependentMove(int moved, int dropped) {

    public static final DependentMove NONE = new DependentMove(0, 0);
}
