package com.coach.linkage.api;

import com.coach.linkage.candidate.CandidateGenerator;
import com.coach.linkage.candidate.DuplicateScan;
import com.coach.linkage.core.model.LinkableRecord;
import com.coach.linkage.logging.LogContext;
import com.coach.linkage.merge.MergeEngine;
import com.coach.linkage.merge.MergeResult;
import com.coach.linkage.metrics.MetricsService;
import com.coach.linkage.metrics.NoOpMetricsService;
import com.coach.linkage.suppression.SuppressionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Operator workflow over one record kind: scan for candidate pairs, dismiss pairs that
 * are not duplicates, and merge the ones that are.
 */
public abstract class DedupService<T extends LinkableRecord> {
    private static final Logger log = LoggerFactory.getLogger(DedupService.class);

    private final String recordKind;
    private final CandidateGenerator<T> candidateGenerator;
    private final MergeEngine<T> mergeEngine;
    private final SuppressionStore suppressionStore;
    private final MetricsService metricsService;

    protected DedupService(String recordKind, CandidateGenerator<T> candidateGenerator, MergeEngine<T> mergeEngine,
                           SuppressionStore suppressionStore, MetricsService metricsService) {
        this.recordKind = recordKind;
        this.candidateGenerator = candidateGenerator;
        this.mergeEngine = mergeEngine;
        this.suppressionStore = suppressionStore;
        this.metricsService = metricsService != null ? metricsService : NoOpMetricsService.INSTANCE;
    }

    protected abstract List<T> loadRecords();

    /**
     * Dependent rows per record id, read in one batch.
     */
    protected abstract Map<String, Integer> loadDependentCounts();

    /**
     * Reads all records and returns the current candidate pairs, best first.
     */
    public DuplicateScan<T> scan() {
        try (LogContext logCtx = LogContext.forScan(LogContext.generateCorrelationId(), recordKind)) {
            long start = System.nanoTime();
            List<T> records = loadRecords();
            Map<String, Integer> dependentCounts = loadDependentCounts();
            DuplicateScan<T> scan = candidateGenerator.generate(records, dependentCounts);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            metricsService.recordScan(recordKind, elapsed, scan.candidates().size());
            log.info("scan.completed recordKind={} records={} candidates={} exact={} fuzzy={} durationMs={}",
                    recordKind, scan.totalRecords(), scan.candidates().size(),
                    scan.exactCount(), scan.fuzzyCount(), elapsed.toMillis());
            return scan;
        }
    }

    /**
     * Marks a pair as not duplicates and returns {@code current} without it, so the
     * operator does not wait for a rescan.
     */
    public DuplicateScan<T> dismiss(DuplicateScan<T> current, String idA, String idB) {
        suppressionStore.dismiss(idA, idB);
        metricsService.incrementDismissed(recordKind);
        log.info("scan.dismissed recordKind={} idA={} idB={}", recordKind, idA, idB);
        return current.without(idA, idB);
    }

    /**
     * Forgets all dismissals of this record kind and rescans.
     */
    public DuplicateScan<T> clearDismissed() {
        int cleared = suppressionStore.size();
        suppressionStore.clearAll();
        log.info("scan.dismissals-cleared recordKind={} cleared={}", recordKind, cleared);
        return scan();
    }

    public int dismissedCount() {
        return suppressionStore.size();
    }

    /**
     * Merges {@code loserId} into {@code keeperId}.
     *
     * @throws com.coach.linkage.error.ValidationException if the two records cannot be merged
     */
    public MergeResult<T> merge(String keeperId, String loserId) {
        return mergeEngine.merge(keeperId, loserId);
    }

    public String getRecordKind() {
        return recordKind;
    }

    protected MergeEngine<T> getMergeEngine() {
        return mergeEngine;
    }
}
