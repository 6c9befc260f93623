package com.coach.linkage.metrics;

import com.coach.linkage.core.model.ConfidenceTier;
import com.coach.linkage.merge.MergeStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code linkage.scan.duration} Timer (tag: recordKind)</li>
 *   <li>{@code linkage.scan.candidates} DistributionSummary (tag: recordKind)</li>
 *   <li>{@code linkage.merge} Counter (tags: recordKind, status)</li>
 *   <li>{@code linkage.dismissed} Counter (tag: recordKind)</li>
 *   <li>{@code linkage.import.match} Counter (tag: tier)</li>
 *   <li>{@code linkage.import.rows} Counter (tag: outcome)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordScan(String recordKind, Duration duration, int candidates) {
        timerCache.computeIfAbsent(recordKind, k ->
                Timer.builder("linkage.scan.duration")
                        .description("Duration of full duplicate scans")
                        .tag("recordKind", recordKind)
                        .register(registry))
                .record(duration);
        summaryCache.computeIfAbsent(recordKind, k ->
                DistributionSummary.builder("linkage.scan.candidates")
                        .description("Candidate pairs found per scan")
                        .tag("recordKind", recordKind)
                        .register(registry))
                .record(candidates);
    }

    @Override
    public void incrementMerge(String recordKind, MergeStatus status) {
        String key = "merge:" + recordKind + ":" + status.name();
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("linkage.merge")
                        .description("Merge requests by outcome")
                        .tag("recordKind", recordKind)
                        .tag("status", status.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementDismissed(String recordKind) {
        String key = "dismissed:" + recordKind;
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("linkage.dismissed")
                        .description("Candidate pairs dismissed as not duplicates")
                        .tag("recordKind", recordKind)
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementImportMatch(ConfidenceTier tier) {
        String key = "import.match:" + tier.name();
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("linkage.import.match")
                        .description("Import rows by school match confidence")
                        .tag("tier", tier.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void recordImportCommit(int imported, int duplicates, int rejected) {
        importRows("imported").increment(imported);
        importRows("duplicate").increment(duplicates);
        importRows("rejected").increment(rejected);
    }

    private Counter importRows(String outcome) {
        return counterCache.computeIfAbsent("import.rows:" + outcome, k ->
                Counter.builder("linkage.import.rows")
                        .description("Committed import rows by outcome")
                        .tag("outcome", outcome)
                        .register(registry));
    }
}
