package com.contact.resolution.detect;

import com.contact.resolution.core.model.ContactRecord;
import com.contact.resolution.core.model.MatchSignal;
import com.contact.resolution.core.model.MatchType;
import com.contact.resolution.similarity.BlockingKeyStrategy;
import com.contact.resolution.similarity.JaroWinklerSimilarity;
import com.contact.resolution.similarity.PhoneticBlockingKeyStrategy;
import com.contact.resolution.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pairs of contacts with similar full names.
 *
 * <p>Contacts are first partitioned into blocks by a phonetic code of the surname, and
 * only pairs within one block are scored, which keeps the pass near-linear at the cost
 * of missing duplicates whose surnames encode differently. Every pair scoring at or
 * above the threshold yields one signal.</p>
 */
public class FuzzyNameDetector implements MatchDetector {
    private static final Logger log = LoggerFactory.getLogger(FuzzyNameDetector.class);

    private final double threshold;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final SimilarityAlgorithm similarity;

    public FuzzyNameDetector(double threshold) {
        this(threshold, new PhoneticBlockingKeyStrategy(), new JaroWinklerSimilarity());
    }

    public FuzzyNameDetector(double threshold, BlockingKeyStrategy blockingKeyStrategy,
                             SimilarityAlgorithm similarity) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        this.threshold = threshold;
        this.blockingKeyStrategy = blockingKeyStrategy;
        this.similarity = similarity;
    }

    @Override
    public MatchType matchType() {
        return MatchType.FUZZY_NAME;
    }

    public double getThreshold() {
        return threshold;
    }

    @Override
    public List<MatchSignal> detect(List<ContactRecord> contacts) {
        Map<String, List<NamedContact>> blocks = new LinkedHashMap<>();
        for (ContactRecord contact : contacts) {
            if (contact.getFirstName() == null || contact.getLastName() == null) {
                continue;
            }
            String first = contact.getFirstName().strip();
            String last = contact.getLastName().strip();
            if (first.isEmpty() || last.isEmpty()) {
                continue;
            }
            String key = blockingKeyStrategy.blockingKey(last);
            blocks.computeIfAbsent(key, k -> new ArrayList<>())
                    .add(new NamedContact(contact.getId(), first + " " + last));
        }

        List<MatchSignal> signals = new ArrayList<>();
        long comparisons = 0;
        for (List<NamedContact> block : blocks.values()) {
            for (int i = 0; i < block.size(); i++) {
                for (int j = i + 1; j < block.size(); j++) {
                    NamedContact a = block.get(i);
                    NamedContact b = block.get(j);
                    if (a.id().equals(b.id())) {
                        continue;
                    }
                    comparisons++;
                    double score = similarity.compute(a.fullName(), b.fullName());
                    if (score >= threshold) {
                        signals.add(MatchSignal.of(MatchType.FUZZY_NAME,
                                String.format(Locale.ROOT, "%s <-> %s (%.2f)", a.fullName(), b.fullName(), score),
                                a.id(), b.id()));
                    }
                }
            }
        }
        log.debug("detect.completed matchType={} blocks={} comparisons={} signals={}",
                matchType().code(), blocks.size(), comparisons, signals.size());
        return signals;
    }

    private record NamedContact(String id, String fullName) {}
}
