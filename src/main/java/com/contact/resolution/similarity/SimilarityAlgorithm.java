package com.contact.resolution.similarity;

/**
 * A string similarity measure over contact names.
 * Scores range from 0.0 (nothing in common) to 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    /**
     * Scores how alike two strings are.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity between 0.0 and 1.0; 0.0 when either side is null
     */
    double compute(String s1, String s2);

    /**
     * Short name used in logs and signal descriptions.
     */
    String getName();
}
