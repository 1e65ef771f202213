package com.contact.resolution.config;

import com.contact.resolution.similarity.SimilarityWeights;

/**
 * Options for duplicate detection, flagging and batch resolution.
 * Configures thresholds, the placeholder birthday and similarity weights.
 */
public class DetectionOptions {

    private static final double DEFAULT_FUZZY_THRESHOLD = 0.9;
    private static final double DEFAULT_BATCH_THRESHOLD = 0.98;
    private static final String DEFAULT_PLACEHOLDER_BIRTHDAY = "2001-01-01";
    private static final String DEFAULT_PHONE_REGION = "US";

    private final double fuzzyThreshold;
    private final double batchThreshold;
    private final String placeholderBirthday;
    private final SimilarityWeights similarityWeights;
    private final String defaultPhoneRegion;

    private DetectionOptions(Builder builder) {
        this.fuzzyThreshold = builder.fuzzyThreshold;
        this.batchThreshold = builder.batchThreshold;
        this.placeholderBirthday = builder.placeholderBirthday;
        this.similarityWeights = builder.similarityWeights;
        this.defaultPhoneRegion = builder.defaultPhoneRegion;
    }

    /**
     * Jaro-Winkler threshold used by the fuzzy-name detector when run on its own.
     */
    public double getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    /**
     * Fuzzy threshold used by the flag and resolve passes.
     */
    public double getBatchThreshold() {
        return batchThreshold;
    }

    /**
     * Birthday some CRMs fill in when the real one is unknown; never used as match evidence.
     */
    public String getPlaceholderBirthday() {
        return placeholderBirthday;
    }

    public SimilarityWeights getSimilarityWeights() {
        return similarityWeights;
    }

    public String getDefaultPhoneRegion() {
        return defaultPhoneRegion;
    }

    public static DetectionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double fuzzyThreshold = DEFAULT_FUZZY_THRESHOLD;
        private double batchThreshold = DEFAULT_BATCH_THRESHOLD;
        private String placeholderBirthday = DEFAULT_PLACEHOLDER_BIRTHDAY;
        private SimilarityWeights similarityWeights = SimilarityWeights.defaultWeights();
        private String defaultPhoneRegion = DEFAULT_PHONE_REGION;

        public Builder fuzzyThreshold(double fuzzyThreshold) {
            validateThreshold(fuzzyThreshold, "fuzzyThreshold");
            this.fuzzyThreshold = fuzzyThreshold;
            return this;
        }

        public Builder batchThreshold(double batchThreshold) {
            validateThreshold(batchThreshold, "batchThreshold");
            this.batchThreshold = batchThreshold;
            return this;
        }

        public Builder placeholderBirthday(String placeholderBirthday) {
            this.placeholderBirthday = placeholderBirthday;
            return this;
        }

        public Builder similarityWeights(SimilarityWeights similarityWeights) {
            if (similarityWeights == null) {
                throw new IllegalArgumentException("similarityWeights must not be null");
            }
            this.similarityWeights = similarityWeights;
            return this;
        }

        public Builder defaultPhoneRegion(String defaultPhoneRegion) {
            if (defaultPhoneRegion == null || defaultPhoneRegion.length() != 2) {
                throw new IllegalArgumentException("defaultPhoneRegion must be a two-letter region code");
            }
            this.defaultPhoneRegion = defaultPhoneRegion;
            return this;
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }

        public DetectionOptions build() {
            return new DetectionOptions(this);
        }
    }
}
