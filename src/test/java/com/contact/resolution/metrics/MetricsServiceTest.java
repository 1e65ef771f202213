package com.contact.resolution.metrics;

import com.contact.resolution.core.model.MatchType;
import com.contact.resolution.sync.SyncOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.incrementSyncRecord(SyncOutcome.ADDED);
                noOp.incrementPageFailure();
                noOp.recordSignals(MatchType.EMAIL, 3);
                noOp.recordClusters(2);
                noOp.incrementContactsMerged(4);
                noOp.recordMergeDuration(Duration.ofMillis(10));
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should count synced records by outcome")
        void countsSyncRecords() {
            metrics.incrementSyncRecord(SyncOutcome.ADDED);
            metrics.incrementSyncRecord(SyncOutcome.ADDED);
            metrics.incrementSyncRecord(SyncOutcome.UNCHANGED);

            Counter added = registry.find("contacts.sync.records").tag("outcome", "added").counter();
            Counter unchanged = registry.find("contacts.sync.records").tag("outcome", "unchanged").counter();

            assertNotNull(added);
            assertEquals(2.0, added.count());
            assertNotNull(unchanged);
            assertEquals(1.0, unchanged.count());
            assertNull(registry.find("contacts.sync.records").tag("outcome", "updated").counter());
        }

        @Test
        @DisplayName("Should count page failures")
        void countsPageFailures() {
            metrics.incrementPageFailure();
            metrics.incrementPageFailure();

            assertEquals(2.0, registry.find("contacts.sync.page.failures").counter().count());
        }

        @Test
        @DisplayName("Should add signal counts per match type")
        void countsSignals() {
            metrics.recordSignals(MatchType.EMAIL, 3);
            metrics.recordSignals(MatchType.EMAIL, 2);
            metrics.recordSignals(MatchType.FUZZY_NAME, 1);

            assertEquals(5.0, registry.find("contacts.dedup.signals").tag("matchType", "email").counter().count());
            assertEquals(1.0, registry.find("contacts.dedup.signals").tag("matchType", "fuzzy_name").counter().count());
        }

        @Test
        @DisplayName("Should record clusters, merged contacts and merge duration")
        void recordsMergeMetrics() {
            metrics.recordClusters(4);
            metrics.incrementContactsMerged(3);
            metrics.recordMergeDuration(Duration.ofMillis(120));

            assertEquals(4.0, registry.find("contacts.dedup.clusters").counter().count());
            assertEquals(3.0, registry.find("contacts.dedup.merged").counter().count());
            Timer timer = registry.find("contacts.merge.duration").timer();
            assertNotNull(timer);
            assertEquals(1, timer.count());
        }
    }
}
