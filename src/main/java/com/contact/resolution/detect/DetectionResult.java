package com.contact.resolution.detect;

import com.contact.resolution.core.model.DuplicateCluster;
import com.contact.resolution.core.model.MatchSignal;
import com.contact.resolution.core.model.MatchType;

import java.util.List;

/**
 * Signals of one detection run and the clusters computed from them.
 */
public record DetectionResult(List<MatchSignal> signals, List<DuplicateCluster> clusters) {
    public DetectionResult {
        signals = signals != null ? List.copyOf(signals) : List.of();
        clusters = clusters != null ? List.copyOf(clusters) : List.of();
    }

    public long signalCount(MatchType type) {
        return signals.stream().filter(s -> s.matchType() == type).count();
    }

    /**
     * Number of contacts that belong to some cluster.
     */
    public int contactsInClusters() {
        return clusters.stream().mapToInt(DuplicateCluster::size).sum();
    }

    public boolean hasDuplicates() {
        return !clusters.isEmpty();
    }

    @Override
    public String toString() {
        return "DetectionResult{signals=" + signals.size() +
                ", clusters=" + clusters.size() +
                ", contacts=" + contactsInClusters() + '}';
    }
}
