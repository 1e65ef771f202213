package com.contact.resolution.metrics;

import com.contact.resolution.core.model.MatchType;
import com.contact.resolution.sync.SyncOutcome;
import io.micrometer.core.instrument.Counter;
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
 *   <li>{@code contacts.sync.records}: Counter (tag: outcome)</li>
 *   <li>{@code contacts.sync.page.failures}: Counter</li>
 *   <li>{@code contacts.dedup.signals}: Counter (tag: matchType)</li>
 *   <li>{@code contacts.dedup.clusters}: Counter</li>
 *   <li>{@code contacts.dedup.merged}: Counter</li>
 *   <li>{@code contacts.merge.duration}: Timer</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter pageFailureCounter;
    private final Counter clusterCounter;
    private final Counter mergedCounter;
    private final Timer mergeTimer;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.pageFailureCounter = Counter.builder("contacts.sync.page.failures")
                .description("Number of upstream page fetches that failed")
                .register(registry);
        this.clusterCounter = Counter.builder("contacts.dedup.clusters")
                .description("Number of duplicate clusters found")
                .register(registry);
        this.mergedCounter = Counter.builder("contacts.dedup.merged")
                .description("Number of contacts merged into a primary and removed")
                .register(registry);
        this.mergeTimer = Timer.builder("contacts.merge.duration")
                .description("Duration of cluster merges")
                .register(registry);
    }

    @Override
    public void incrementSyncRecord(SyncOutcome outcome) {
        String key = "sync:" + outcome.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("contacts.sync.records")
                        .description("Number of synced records by outcome")
                        .tag("outcome", outcome.tagValue())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementPageFailure() {
        pageFailureCounter.increment();
    }

    @Override
    public void recordSignals(MatchType type, int count) {
        String key = "signals:" + type.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("contacts.dedup.signals")
                        .description("Number of match signals by detector")
                        .tag("matchType", type.code())
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void recordClusters(int count) {
        clusterCounter.increment(count);
    }

    @Override
    public void incrementContactsMerged(int count) {
        mergedCounter.increment(count);
    }

    @Override
    public void recordMergeDuration(Duration duration) {
        mergeTimer.record(duration);
    }
}
