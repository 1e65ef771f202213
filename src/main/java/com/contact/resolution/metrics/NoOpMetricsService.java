package com.contact.resolution.metrics;

import com.contact.resolution.core.model.MatchType;
import com.contact.resolution.sync.SyncOutcome;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void incrementSyncRecord(SyncOutcome outcome) {
    }

    @Override
    public void incrementPageFailure() {
    }

    @Override
    public void recordSignals(MatchType type, int count) {
    }

    @Override
    public void recordClusters(int count) {
    }

    @Override
    public void incrementContactsMerged(int count) {
    }

    @Override
    public void recordMergeDuration(Duration duration) {
    }
}
