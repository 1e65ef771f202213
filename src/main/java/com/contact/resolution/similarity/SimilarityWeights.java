package com.contact.resolution.similarity;

/**
 * Weights for the ensemble name score.
 */
public record SimilarityWeights(double jaroWinklerWeight, double levenshteinWeight) {
    public SimilarityWeights {
        if (jaroWinklerWeight < 0 || levenshteinWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = jaroWinklerWeight + levenshteinWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * 0.6 Jaro-Winkler, 0.4 Levenshtein.
     */
    public static SimilarityWeights defaultWeights() {
        return new SimilarityWeights(0.6, 0.4);
    }

    public static SimilarityWeights jaroWinklerOnly() {
        return new SimilarityWeights(1.0, 0.0);
    }

    public static SimilarityWeights levenshteinOnly() {
        return new SimilarityWeights(0.0, 1.0);
    }
}
