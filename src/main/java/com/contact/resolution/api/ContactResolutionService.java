package com.contact.resolution.api;

import com.contact.resolution.cluster.DuplicateClusterer;
import com.contact.resolution.config.DetectionOptions;
import com.contact.resolution.config.StoreConfig;
import com.contact.resolution.config.SyncOptions;
import com.contact.resolution.core.model.DuplicateCluster;
import com.contact.resolution.core.model.MatchSignal;
import com.contact.resolution.detect.DetectionResult;
import com.contact.resolution.detect.DuplicateDetectionService;
import com.contact.resolution.fingerprint.FingerprintEngine;
import com.contact.resolution.merge.ContactMerger;
import com.contact.resolution.merge.DuplicateResolver;
import com.contact.resolution.merge.MergeResult;
import com.contact.resolution.merge.ResolutionReport;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.metrics.NoOpMetricsService;
import com.contact.resolution.review.DuplicateFlagger;
import com.contact.resolution.review.DuplicateReviewService;
import com.contact.resolution.review.FlagResult;
import com.contact.resolution.store.ContactRepository;
import com.contact.resolution.store.EmailRepository;
import com.contact.resolution.store.PhoneRepository;
import com.contact.resolution.store.SqliteStoreConnection;
import com.contact.resolution.store.StoreConnection;
import com.contact.resolution.sync.ContactPageSource;
import com.contact.resolution.sync.ContactSyncEngine;
import com.contact.resolution.sync.ProgressCallback;
import com.contact.resolution.sync.SyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.List;

/**
 * Main entry point: wires the store, detectors, clusterer, merger, flagger,
 * reviewer and sync engine together.
 *
 * <pre>
 * try (ContactResolutionService service = ContactResolutionService.builder()
 *         .storeConfig(StoreConfig.fromEnvironment())
 *         .build()) {
 *     service.sync(source);
 *     service.flag();
 *     for (String groupId : service.review().pendingGroups()) { ... }
 *     service.resolveConfirmed();
 * }
 * </pre>
 */
public class ContactResolutionService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ContactResolutionService.class);

    private final StoreConnection connection;
    private final boolean ownsConnection;
    private final ContactRepository contactRepository;
    private final FingerprintEngine fingerprintEngine;
    private final DuplicateClusterer clusterer;
    private final DuplicateDetectionService detectionService;
    private final ContactMerger merger;
    private final DuplicateFlagger flagger;
    private final DuplicateReviewService reviewService;
    private final DuplicateResolver resolver;
    private final SyncOptions syncOptions;
    private final MetricsService metricsService;
    private final Clock clock;

    private ContactResolutionService(Builder builder) {
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;
        this.syncOptions = builder.syncOptions;
        this.metricsService = builder.metricsService;
        this.clock = builder.clock;

        DetectionOptions options = builder.detectionOptions;
        this.contactRepository = new ContactRepository(connection);
        this.fingerprintEngine = new FingerprintEngine(options.getDefaultPhoneRegion(), options.getSimilarityWeights());
        this.clusterer = new DuplicateClusterer();
        this.detectionService = new DuplicateDetectionService(fingerprintEngine, options, clusterer, metricsService);
        this.merger = new ContactMerger(connection, contactRepository, new EmailRepository(connection),
                new PhoneRepository(connection), metricsService);
        this.flagger = new DuplicateFlagger(connection, contactRepository, detectionService, options);
        this.reviewService = new DuplicateReviewService(contactRepository);
        this.resolver = new DuplicateResolver(contactRepository, detectionService, merger, options);
    }

    // ========== Sync ==========

    public SyncResult sync(ContactPageSource source) {
        return sync(source, ProgressCallback.NOOP);
    }

    /**
     * Runs one incremental sync from the source into the store.
     */
    public SyncResult sync(ContactPageSource source, ProgressCallback progress) {
        try (ContactSyncEngine engine = new ContactSyncEngine(source, connection, syncOptions, metricsService, clock)) {
            return engine.sync(progress);
        }
    }

    // ========== Detection ==========

    /**
     * Email, phone, name plus title and fuzzy name at the given threshold, clustered.
     */
    public DetectionResult detect(double fuzzyThreshold) {
        return detectionService.detect(contactRepository.findAll(), fuzzyThreshold);
    }

    /**
     * All seven detectors, clustered.
     */
    public DetectionResult detectAll() {
        return detectionService.detectAll(contactRepository.findAll());
    }

    public List<DuplicateCluster> cluster(Collection<MatchSignal> signals) {
        return clusterer.cluster(signals);
    }

    // ========== Merge and review ==========

    public MergeResult merge(Collection<String> contactIds, String primaryContactId) {
        return merger.merge(contactIds, primaryContactId);
    }

    public FlagResult flag() {
        return flagger.flag();
    }

    public DuplicateReviewService review() {
        return reviewService;
    }

    public ResolutionReport resolveAll() {
        return resolver.resolveAll();
    }

    public ResolutionReport resolveConfirmed() {
        return resolver.resolveConfirmed();
    }

    public long contactCount() {
        return contactRepository.count();
    }

    public FingerprintEngine fingerprintEngine() {
        return fingerprintEngine;
    }

    public ContactRepository contacts() {
        return contactRepository;
    }

    @Override
    public void close() {
        if (ownsConnection) {
            try {
                connection.close();
            } catch (RuntimeException e) {
                log.warn("Error closing contact store", e);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private StoreConnection connection;
        private boolean ownsConnection = false;
        private DetectionOptions detectionOptions = DetectionOptions.defaults();
        private SyncOptions syncOptions = SyncOptions.defaults();
        private MetricsService metricsService = new NoOpMetricsService();
        private Clock clock = Clock.systemUTC();

        /**
         * Uses an existing store connection. The caller keeps ownership.
         */
        public Builder storeConnection(StoreConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Opens a SQLite store, applying the schema. The store is closed with the service.
         */
        public Builder storeConfig(StoreConfig config) {
            this.connection = SqliteStoreConnection.open(config);
            this.ownsConnection = true;
            return this;
        }

        public Builder detectionOptions(DetectionOptions detectionOptions) {
            this.detectionOptions = detectionOptions;
            return this;
        }

        public Builder syncOptions(SyncOptions syncOptions) {
            this.syncOptions = syncOptions;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Clock used for {@code last_synced_at} timestamps.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ContactResolutionService build() {
            if (connection == null) {
                throw new IllegalStateException("A store connection or store config is required");
            }
            if (detectionOptions == null || syncOptions == null || metricsService == null || clock == null) {
                throw new IllegalStateException("Options, metrics service and clock must not be null");
            }
            return new ContactResolutionService(this);
        }
    }
}
