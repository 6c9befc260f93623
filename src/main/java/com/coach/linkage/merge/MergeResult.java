package com.coach.linkage.merge;

import com.coach.linkage.core.model.LinkableRecord;

import java.util.List;

/**
 * Result of a merge operation.
 *
 * @param status       overall outcome
 * @param keeperId     surviving record id
 * @param loserId      absorbed record id
 * @param keeper       keeper after field reconciliation; null unless MERGED
 * @param mergedFields fields copied from the loser
 * @param dependents   dependent rows moved and dropped
 * @param failedStep   step that failed; null unless FAILED
 * @param message      operator-facing summary or error text
 */
public record MergeResult<T extends LinkableRecord>(
        MergeStatus status,
        String keeperId,
        String loserId,
        T keeper,
        List<String> mergedFields,
        DependentMove dependents,
        MergeStep failedStep,
        String message
) {
    public MergeResult {
        mergedFields = mergedFields != null ? List.copyOf(mergedFields) : List.of();
        dependents = dependents != null ? dependents : DependentMove.NONE;
    }

    public static <T extends LinkableRecord> MergeResult<T> merged(T keeper, String loserId, List<String> mergedFields,
                                                                   DependentMove dependents, String message) {
        return new MergeResult<>(MergeStatus.MERGED, keeper.getId(), loserId, keeper, mergedFields,
                dependents, null, message);
    }

    public static <T extends LinkableRecord> MergeResult<T> alreadyResolved(String keeperId, String loserId,
                                                                            String message) {
        return new MergeResult<>(MergeStatus.ALREADY_RESOLVED, keeperId, loserId, null, List.of(),
                DependentMove.NONE, null, message);
    }

    public static <T extends LinkableRecord> MergeResult<T> failed(String keeperId, String loserId,
                                                                   MergeStep failedStep, String message) {
        return new MergeResult<>(MergeStatus.FAILED, keeperId, loserId, null, List.of(),
                DependentMove.NONE, failedStep, message);
    }

    public boolean isSuccess() {
        return status == MergeStatus.MERGED;
    }

    public boolean isAlreadyResolved() {
        return status == MergeStatus.ALREADY_RESOLVED;
    }

    public boolean isFailure() {
        return status == MergeStatus.FAILED;
    }
}
