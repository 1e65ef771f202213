package com.contact.resolution.metrics;

import com.contact.resolution.core.model.MatchType;
import com.contact.resolution.sync.SyncOutcome;

import java.time.Duration;

/**
 * Records sync and dedup metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without a metrics registry.
 */
public interface MetricsService {

    void incrementSyncRecord(SyncOutcome outcome);

    void incrementPageFailure();

    void recordSignals(MatchType type, int count);

    void recordClusters(int count);

    void incrementContactsMerged(int count);

    void recordMergeDuration(Duration duration);
}
