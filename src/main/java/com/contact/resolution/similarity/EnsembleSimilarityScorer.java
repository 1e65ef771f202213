package com.contact.resolution.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Weighted blend of Jaro-Winkler and Levenshtein similarity:
 * {@code jw * jaroWinkler(a, b) + lev * (1 - normalizedLevenshtein(a, b))}.
 *
 * <p>The fuzzy-name detector scores with plain Jaro-Winkler; this scorer is
 * available for callers that want the blended score.</p>
 */
public class EnsembleSimilarityScorer implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(EnsembleSimilarityScorer.class);

    private final JaroWinklerSimilarity jaroWinkler;
    private final LevenshteinSimilarity levenshtein;
    private final SimilarityWeights weights;

    public EnsembleSimilarityScorer() {
        this(SimilarityWeights.defaultWeights());
    }

    public EnsembleSimilarityScorer(SimilarityWeights weights) {
        this.jaroWinkler = new JaroWinklerSimilarity();
        this.levenshtein = new LevenshteinSimilarity();
        this.weights = weights;
    }

    @Override
    public double compute(String s1, String s2) {
        return compute(s1, s2, weights);
    }

    /**
     * Scores with configured-style weights instead of the scorer's own.
     */
    public double compute(String s1, String s2, SimilarityWeights customWeights) {
        return compute(s1, s2, customWeights.jaroWinklerWeight(), customWeights.levenshteinWeight());
    }

    /**
     * Scores with arbitrary caller weights. The weights need not sum to 1, so the score is
     * only bounded by {@code jaroWinklerWeight + levenshteinWeight}.
     *
     * @throws IllegalArgumentException if a weight is negative
     */
    public double compute(String s1, String s2, double jaroWinklerWeight, double levenshteinWeight) {
        if (jaroWinklerWeight < 0 || levenshteinWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        String a = s1 != null ? s1 : "";
        String b = s2 != null ? s2 : "";

        double jwScore = a.equals(b) ? 1.0 : jaroWinkler.compute(a, b);
        double levScore = 1.0 - levenshtein.normalizedDistance(a, b);
        double score = jaroWinklerWeight * jwScore + levenshteinWeight * levScore;

        log.debug("Ensemble score for '{}' vs '{}': jaroWinkler={}, levenshtein={}, ensemble={}",
                a, b, jwScore, levScore, score);
        return score;
    }

    @Override
    public String getName() {
        return "Ensemble";
    }

    public SimilarityWeights getWeights() {
        return weights;
    }
}
