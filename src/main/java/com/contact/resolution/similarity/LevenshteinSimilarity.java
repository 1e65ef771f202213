package com.contact.resolution.similarity;

/**
 * Edit-distance similarity: {@code 1 - distance / max(len1, len2)}.
 * Also exposes the raw and normalized distances, which the fingerprint engine reports directly.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        return 1.0 - normalizedDistance(s1, s2);
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    /**
     * Edit distance divided by the longer length.
     * 0.0 when both strings are empty, 1.0 when exactly one of them is.
     */
    public double normalizedDistance(String s1, String s2) {
        String a = s1 != null ? s1 : "";
        String b = s2 != null ? s2 : "";
        int maxLength = Math.max(a.length(), b.length());
        if (maxLength == 0) {
            return 0.0;
        }
        return (double) distance(a, b) / maxLength;
    }

    /**
     * Levenshtein edit distance (Wagner-Fischer, two rows).
     */
    public int distance(String s1, String s2) {
        if (s1.length() > s2.length()) {
            String temp = s1;
            s1 = s2;
            s2 = temp;
        }

        int m = s1.length();
        int n = s2.length();

        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];
        for (int i = 0; i <= m; i++) {
            previousRow[i] = i;
        }

        for (int j = 1; j <= n; j++) {
            currentRow[0] = j;
            for (int i = 1; i <= m; i++) {
                int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
                currentRow[i] = Math.min(
                        Math.min(currentRow[i - 1] + 1, previousRow[i] + 1),
                        previousRow[i - 1] + cost
                );
            }
            int[] temp = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }

        return previousRow[m];
    }
}
