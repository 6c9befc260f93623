package com.coach.linkage.metrics;

import com.coach.linkage.core.model.ConfidenceTier;
import com.coach.linkage.merge.MergeStatus;

import java.time.Duration;

/**
 * Interface for recording linkage metrics.
 * The default {@link NoOpMetricsService} does nothing.
 */
public interface MetricsService {

    void recordScan(String recordKind, Duration duration, int candidates);

    void incrementMerge(String recordKind, MergeStatus status);

    void incrementDismissed(String recordKind);

    void incrementImportMatch(ConfidenceTier tier);

    void recordImportCommit(int imported, int duplicates, int rejected);
}
