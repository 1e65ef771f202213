package com.contact.resolution.similarity;

/**
 * Jaro-Winkler similarity. Rewards a shared prefix of up to four characters,
 * which suits personal names where typos tend to sit towards the end.
 */
public class JaroWinklerSimilarity implements SimilarityAlgorithm {

    private static final double DEFAULT_SCALING_FACTOR = 0.1;
    private static final double BOOST_THRESHOLD = 0.7;
    private static final int MAX_PREFIX_LENGTH = 4;

    private final double scalingFactor;

    public JaroWinklerSimilarity() {
        this(DEFAULT_SCALING_FACTOR);
    }

    public JaroWinklerSimilarity(double scalingFactor) {
        if (scalingFactor < 0 || scalingFactor > 0.25) {
            throw new IllegalArgumentException("Scaling factor must be between 0 and 0.25");
        }
        this.scalingFactor = scalingFactor;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        double jaro = computeJaro(s1, s2);
        if (jaro <= BOOST_THRESHOLD) {
            return jaro;
        }

        int prefixLength = 0;
        int maxPrefixLength = Math.min(MAX_PREFIX_LENGTH, Math.min(s1.length(), s2.length()));
        while (prefixLength < maxPrefixLength && s1.charAt(prefixLength) == s2.charAt(prefixLength)) {
            prefixLength++;
        }

        return jaro + (prefixLength * scalingFactor * (1.0 - jaro));
    }

    @Override
    public String getName() {
        return "Jaro-Winkler";
    }

    private double computeJaro(String s1, String s2) {
        int window = Math.max(0, Math.max(s1.length(), s2.length()) / 2 - 1);
        boolean[] taken = new boolean[s2.length()];
        StringBuilder fromFirst = new StringBuilder();

        for (int i = 0; i < s1.length(); i++) {
            int hi = Math.min(i + window + 1, s2.length());
            for (int j = Math.max(0, i - window); j < hi; j++) {
                if (!taken[j] && s1.charAt(i) == s2.charAt(j)) {
                    taken[j] = true;
                    fromFirst.append(s1.charAt(i));
                    break;
                }
            }
        }

        int m = fromFirst.length();
        if (m == 0) {
            return 0.0;
        }

        // matched characters of s2 in their own order; mismatched positions are half-transpositions
        int outOfOrder = 0;
        int k = 0;
        for (int j = 0; j < s2.length(); j++) {
            if (taken[j] && s2.charAt(j) != fromFirst.charAt(k++)) {
                outOfOrder++;
            }
        }

        double matches = m;
        return (matches / s1.length() + matches / s2.length() + (matches - outOfOrder / 2.0) / matches) / 3.0;
    }
}
