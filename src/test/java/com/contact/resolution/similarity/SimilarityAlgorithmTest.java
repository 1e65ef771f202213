package com.contact.resolution.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Similarity Algorithm Tests")
class SimilarityAlgorithmTest {

    @Nested
    @DisplayName("Jaro-Winkler")
    class JaroWinklerTests {
        private final JaroWinklerSimilarity jaroWinkler = new JaroWinklerSimilarity();

        @ParameterizedTest
        @DisplayName("Reference pairs")
        @CsvSource({
                "MARTHA,MARHTA,0.9611",
                "DWAYNE,DUANE,0.84",
                "DIXON,DICKSONX,0.8133",
                "Jonathan Smith,Jonathon Smith,0.9714"
        })
        void referencePairs(String a, String b, double expected) {
            assertEquals(expected, jaroWinkler.compute(a, b), 0.0001);
        }

        @Test
        void identicalStringsScoreOne() {
            assertEquals(1.0, jaroWinkler.compute("Jane", "Jane"));
            assertEquals(1.0, jaroWinkler.compute("", ""));
        }

        @Test
        void emptyOrNullSideScoresZero() {
            assertEquals(0.0, jaroWinkler.compute("", "Jane"));
            assertEquals(0.0, jaroWinkler.compute(null, "Jane"));
        }

        @Test
        void noCommonCharactersScoresZero() {
            assertEquals(0.0, jaroWinkler.compute("abc", "xyz"));
        }

        @Test
        void isSymmetric() {
            assertEquals(jaroWinkler.compute("Katherine", "Catherine"),
                    jaroWinkler.compute("Catherine", "Katherine"), 1e-12);
        }

        @Test
        void rejectsOutOfRangeScalingFactor() {
            assertThrows(IllegalArgumentException.class, () -> new JaroWinklerSimilarity(0.3));
        }
    }

    @Nested
    @DisplayName("Levenshtein")
    class LevenshteinTests {
        private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();

        @ParameterizedTest
        @CsvSource({
                "kitten,sitting,3",
                "flaw,lawn,2",
                "abc,abc,0",
                "'',abc,3"
        })
        void distance(String a, String b, int expected) {
            assertEquals(expected, levenshtein.distance(a, b));
            assertEquals(expected, levenshtein.distance(b, a));
        }

        @Test
        void similarityIsOneMinusNormalizedDistance() {
            assertEquals(1.0 - 3.0 / 7.0, levenshtein.compute("kitten", "sitting"), 1e-9);
            assertEquals(0.0, levenshtein.compute(null, "x"));
        }
    }

    @Nested
    @DisplayName("Ensemble")
    class EnsembleTests {

        @Test
        void defaultWeightsBlendBothScores() {
            EnsembleSimilarityScorer scorer = new EnsembleSimilarityScorer();
            double jw = new JaroWinklerSimilarity().compute("Jon", "John");
            double lev = new LevenshteinSimilarity().compute("Jon", "John");
            assertEquals(0.6 * jw + 0.4 * lev, scorer.compute("Jon", "John"), 1e-9);
        }

        @Test
        void customWeightsOverrideConfigured() {
            EnsembleSimilarityScorer scorer = new EnsembleSimilarityScorer();
            double lev = new LevenshteinSimilarity().compute("Jon", "John");
            assertEquals(lev, scorer.compute("Jon", "John", SimilarityWeights.levenshteinOnly()), 1e-9);
        }

        @Test
        void nullsAreTreatedAsEmpty() {
            EnsembleSimilarityScorer scorer = new EnsembleSimilarityScorer(SimilarityWeights.jaroWinklerOnly());
            assertEquals(1.0, scorer.compute(null, ""), 1e-9);
        }

        @Test
        void weightsMustSumToOne() {
            assertThrows(IllegalArgumentException.class, () -> new SimilarityWeights(0.7, 0.4));
            assertThrows(IllegalArgumentException.class, () -> new SimilarityWeights(-0.2, 1.2));
        }
    }
}
