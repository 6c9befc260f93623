package com.coach.linkage.metrics;

import com.coach.linkage.core.model.ConfidenceTier;
import com.coach.linkage.merge.MergeStatus;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    public static final NoOpMetricsService INSTANCE = new NoOpMetricsService();

    @Override
    public void recordScan(String recordKind, Duration duration, int candidates) {
    }

    @Override
    public void incrementMerge(String recordKind, MergeStatus status) {
    }

    @Override
    public void incrementDismissed(String recordKind) {
    }

    @Override
    public void incrementImportMatch(ConfidenceTier tier) {
    }

    @Override
    public void recordImportCommit(int imported, int duplicates, int rejected) {
    }
}
