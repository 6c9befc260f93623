package com.coach.linkage.candidate;

import com.coach.linkage.core.model.CandidatePair;
import com.coach.linkage.core.model.LinkableRecord;
import com.coach.linkage.core.model.MatchType;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one duplicate scan: candidate pairs ranked by score plus the figures an
 * operator needs to pick a keeper.
 *
 * @param candidates      candidate pairs, highest score first
 * @param dependentCounts per record id, how many dependent rows would move on merge
 *                        (attendance rows for coaches, coaches for schools)
 * @param totalRecords    number of records scanned
 * @param skippedIds      ids of records left out because they failed validation
 */
public record DuplicateScan<T extends LinkableRecord>(
        List<CandidatePair<T>> candidates,
        Map<String, Integer> dependentCounts,
        int totalRecords,
        List<String> skippedIds
) {
    public DuplicateScan {
        candidates = List.copyOf(candidates);
        dependentCounts = Map.copyOf(dependentCounts);
        skippedIds = List.copyOf(skippedIds);
    }

    public long exactCount() {
        return candidates.stream().filter(c -> c.matchType() == MatchType.EXACT).count();
    }

    public long fuzzyCount() {
        return candidates.stream().filter(c -> c.matchType() == MatchType.FUZZY).count();
    }

    /**
     * Candidates of one match type, or all of them for {@code null}.
     */
    public List<CandidatePair<T>> filter(MatchType matchType) {
        if (matchType == null) {
            return candidates;
        }
        return candidates.stream().filter(c -> c.matchType() == matchType).toList();
    }

    public int dependentCount(String recordId) {
        return dependentCounts.getOrDefault(recordId, 0);
    }

    /**
     * Copy of this scan without the given pair, used right after a dismissal.
     */
    public DuplicateScan<T> without(String idA, String idB) {
        List<CandidatePair<T>> remaining = candidates.stream()
                .filter(c -> !c.involves(idA, idB))
                .toList();
        return new DuplicateScan<>(remaining, dependentCounts, totalRecords, skippedIds);
    }
}
