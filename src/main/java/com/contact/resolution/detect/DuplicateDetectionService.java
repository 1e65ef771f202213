package com.contact.resolution.detect;

import com.contact.resolution.cluster.DuplicateClusterer;
import com.contact.resolution.config.DetectionOptions;
import com.contact.resolution.core.model.ContactRecord;
import com.contact.resolution.core.model.DuplicateCluster;
import com.contact.resolution.core.model.MatchSignal;
import com.contact.resolution.fingerprint.FingerprintEngine;
import com.contact.resolution.logging.LogContext;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the detectors over a contact snapshot and clusters their signals.
 *
 * <p>{@link #detect(List, double)} runs the detector set the flag and resolve passes use:
 * exact email, exact phone, name plus title and blocked fuzzy name.
 * {@link #detectAll(List)} runs all seven detectors for analysis.</p>
 */
public class DuplicateDetectionService {
    private static final Logger log = LoggerFactory.getLogger(DuplicateDetectionService.class);

    private final FingerprintEngine fingerprintEngine;
    private final DetectionOptions options;
    private final DuplicateClusterer clusterer;
    private final MetricsService metricsService;

    public DuplicateDetectionService(FingerprintEngine fingerprintEngine, DetectionOptions options) {
        this(fingerprintEngine, options, new DuplicateClusterer(), new NoOpMetricsService());
    }

    public DuplicateDetectionService(FingerprintEngine fingerprintEngine, DetectionOptions options,
                                     DuplicateClusterer clusterer, MetricsService metricsService) {
        this.fingerprintEngine = fingerprintEngine;
        this.options = options;
        this.clusterer = clusterer;
        this.metricsService = metricsService;
    }

    /**
     * Exact email, exact phone, name plus title and fuzzy name at the given threshold.
     */
    public List<MatchDetector> standardDetectors(double fuzzyThreshold) {
        return List.of(
                new ExactEmailDetector(),
                new ExactPhoneDetector(fingerprintEngine),
                new NameTitleDetector(),
                new FuzzyNameDetector(fuzzyThreshold));
    }

    /**
     * All seven detectors, fuzzy name at the configured fuzzy threshold.
     */
    public List<MatchDetector> allDetectors() {
        return List.of(
                new ExactEmailDetector(),
                new ExactPhoneDetector(fingerprintEngine),
                new BirthdayNameDetector(options.getPlaceholderBirthday()),
                new FingerprintNameDetector(fingerprintEngine),
                new NameTitleDetector(),
                new FuzzyNameDetector(options.getFuzzyThreshold()),
                new LinkedInDetector(fingerprintEngine));
    }

    public DetectionResult detect(List<ContactRecord> contacts, double fuzzyThreshold) {
        return run(contacts, standardDetectors(fuzzyThreshold), fuzzyThreshold);
    }

    public DetectionResult detectAll(List<ContactRecord> contacts) {
        return run(contacts, allDetectors(), options.getFuzzyThreshold());
    }

    /**
     * Runs the given detectors and clusters the union of their signals.
     */
    public DetectionResult run(List<ContactRecord> contacts, List<MatchDetector> detectors, double threshold) {
        try (LogContext ctx = LogContext.forDetection(LogContext.generateCorrelationId(), threshold)) {
            log.info("detect.starting contacts={} detectors={}", contacts.size(), detectors.size());

            List<MatchSignal> signals = new ArrayList<>();
            for (MatchDetector detector : detectors) {
                List<MatchSignal> found = detector.detect(contacts);
                metricsService.recordSignals(detector.matchType(), found.size());
                log.info("detect.pass matchType={} signals={}", detector.matchType().code(), found.size());
                signals.addAll(found);
            }

            List<DuplicateCluster> clusters = clusterer.cluster(signals);
            metricsService.recordClusters(clusters.size());

            DetectionResult result = new DetectionResult(signals, clusters);
            log.info("detect.completed signals={} clusters={} contacts={}",
                    signals.size(), clusters.size(), result.contactsInClusters());
            return result;
        }
    }
}
