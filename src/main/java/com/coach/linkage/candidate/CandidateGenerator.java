package com.coach.linkage.candidate;

import com.coach.linkage.core.model.CandidatePair;
import com.coach.linkage.core.model.LinkableRecord;
import com.coach.linkage.core.model.MatchType;
import com.coach.linkage.suppression.SuppressionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pairwise duplicate scan shared by coaches and schools.
 *
 * <p>Records are grouped by {@link #partitionKey}; only records of the same group are
 * compared. Every unordered pair of a group is skipped if dismissed, classified, and
 * scored when classified EXACT or FUZZY. The result is sorted by score, highest first;
 * ties keep the order in which the pairs appear in the input.</p>
 */
public abstract class CandidateGenerator<T extends LinkableRecord> {
    private static final Logger log = LoggerFactory.getLogger(CandidateGenerator.class);

    private final SuppressionStore suppressionStore;

    protected CandidateGenerator(SuppressionStore suppressionStore) {
        this.suppressionStore = Objects.requireNonNull(suppressionStore, "suppressionStore is required");
    }

    /**
     * Records with equal keys are compared with each other. A {@code null} key
     * excludes the record from comparison.
     */
    protected abstract Object partitionKey(T record);

    protected abstract boolean isValid(T record);

    protected abstract MatchType classify(T a, T b);

    protected abstract int score(T a, T b);

    public DuplicateScan<T> generate(List<T> records, Map<String, Integer> dependentCounts) {
        List<String> skipped = new ArrayList<>();
        Map<Object, List<Indexed<T>>> partitions = new LinkedHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            T record = records.get(i);
            if (!isValid(record)) {
                skipped.add(record.getId());
                continue;
            }
            Object key = partitionKey(record);
            if (key == null) {
                continue;
            }
            partitions.computeIfAbsent(key, k -> new ArrayList<>()).add(new Indexed<>(i, record));
        }
        if (!skipped.isEmpty()) {
            log.warn("scan.skipped count={} reason=missing-required-name ids={}", skipped.size(), skipped);
        }

        List<Ranked<T>> ranked = new ArrayList<>();
        int suppressed = 0;
        for (List<Indexed<T>> partition : partitions.values()) {
            for (int i = 0; i < partition.size(); i++) {
                for (int j = i + 1; j < partition.size(); j++) {
                    Indexed<T> a = partition.get(i);
                    Indexed<T> b = partition.get(j);
                    if (suppressionStore.isDismissed(a.record().getId(), b.record().getId())) {
                        suppressed++;
                        continue;
                    }
                    MatchType matchType = classify(a.record(), b.record());
                    if (matchType == MatchType.NONE) {
                        continue;
                    }
                    int score = score(a.record(), b.record());
                    ranked.add(new Ranked<>(a.position(), b.position(),
                            new CandidatePair<>(a.record(), b.record(), matchType, score)));
                }
            }
        }

        ranked.sort(Comparator.<Ranked<T>>comparingInt(r -> r.pair().score()).reversed()
                .thenComparingInt(Ranked::firstPosition)
                .thenComparingInt(Ranked::secondPosition));

        List<CandidatePair<T>> candidates = ranked.stream().map(Ranked::pair).toList();
        log.debug("scan.pairs partitions={} candidates={} suppressed={}",
                partitions.size(), candidates.size(), suppressed);
        return new DuplicateScan<>(candidates, dependentCounts, records.size(), skipped);
    }

    private record Indexed<T>(int position, T record) {}

    private record Ranked<T extends LinkableRecord>(int firstPosition, int secondPosition, CandidatePair<T> pair) {}
}
