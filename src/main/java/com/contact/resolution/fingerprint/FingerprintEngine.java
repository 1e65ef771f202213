package com.contact.resolution.fingerprint;

import com.contact.resolution.similarity.EnsembleSimilarityScorer;
import com.contact.resolution.similarity.JaroWinklerSimilarity;
import com.contact.resolution.similarity.LevenshteinSimilarity;
import com.contact.resolution.similarity.SimilarityWeights;

import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Keying and similarity primitives shared by the duplicate detectors.
 *
 * <p>The name keys follow OpenRefine's clustering keys:</p>
 * <ul>
 *   <li>{@link #fingerprint(String)}: the sorted, de-duplicated token set, so
 *       "Tom Cruise", "Cruise, Tom" and "TOM CRUISE" all key to {@code cruise tom}</li>
 *   <li>{@link #ngramFingerprint(String, int)}: the sorted set of character n-grams,
 *       which also survives small spelling differences</li>
 * </ul>
 */
public class FingerprintEngine {

    private static final Pattern ASCII_PUNCTUATION = Pattern.compile("[!-/:-@\\[-`{-~]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final PhoneNormalizer phoneNormalizer;
    private final LinkedInNormalizer linkedInNormalizer;
    private final JaroWinklerSimilarity jaroWinkler;
    private final LevenshteinSimilarity levenshtein;
    private final EnsembleSimilarityScorer ensembleScorer;

    public FingerprintEngine() {
        this(PhoneNormalizer.DEFAULT_REGION, SimilarityWeights.defaultWeights());
    }

    public FingerprintEngine(String defaultPhoneRegion, SimilarityWeights ensembleWeights) {
        this.phoneNormalizer = new PhoneNormalizer(defaultPhoneRegion);
        this.linkedInNormalizer = new LinkedInNormalizer();
        this.jaroWinkler = new JaroWinklerSimilarity();
        this.levenshtein = new LevenshteinSimilarity();
        this.ensembleScorer = new EnsembleSimilarityScorer(ensembleWeights);
    }

    /**
     * Order-, case-, accent- and punctuation-insensitive key for a name.
     * Returns an empty string for null or blank input.
     */
    public String fingerprint(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = value.strip().toLowerCase(Locale.ROOT);
        if (cleaned.isEmpty()) {
            return "";
        }
        cleaned = AsciiFolder.fold(cleaned);
        cleaned = ASCII_PUNCTUATION.matcher(cleaned).replaceAll("");

        TreeSet<String> tokens = new TreeSet<>();
        for (String token : WHITESPACE.split(cleaned)) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return String.join(" ", tokens);
    }

    /**
     * Sorted, de-duplicated character n-grams of the squashed value, concatenated.
     * Values shorter than {@code n} after cleaning are returned as they are.
     */
    public String ngramFingerprint(String value, int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be positive");
        }
        if (value == null) {
            return "";
        }
        String cleaned = WHITESPACE.matcher(value.toLowerCase(Locale.ROOT)).replaceAll("");
        if (cleaned.isEmpty()) {
            return "";
        }
        cleaned = AsciiFolder.fold(cleaned);
        cleaned = ASCII_PUNCTUATION.matcher(cleaned).replaceAll("");
        if (cleaned.length() < n) {
            return cleaned;
        }

        TreeSet<String> grams = new TreeSet<>();
        for (int i = 0; i + n <= cleaned.length(); i++) {
            grams.add(cleaned.substring(i, i + n));
        }
        return String.join("", grams);
    }

    /**
     * Digits-only phone key with a leading +1 removed.
     */
    public String normalizePhone(String phone) {
        return phoneNormalizer.normalize(phone);
    }

    /**
     * E.164 form of a phone number using the configured default region, non-strict.
     */
    public String normalizePhoneE164(String phone) {
        return phoneNormalizer.normalizeE164(phone);
    }

    public String normalizePhoneE164(String phone, String defaultRegion, boolean strict) {
        return phoneNormalizer.normalizeE164(phone, defaultRegion, strict);
    }

    /**
     * Case-insensitive key of an email address. Unicode letters are case-folded too, so
     * "JOSÉ@x.com" and "josé@x.com" share a key.
     */
    public static String emailKey(String email) {
        return email.strip().toLowerCase(Locale.ROOT);
    }

    /**
     * Canonical {@code linkedin.com/in/<user>} or {@code linkedin.com/company/<slug>}, or empty.
     */
    public String normalizeLinkedin(String url) {
        return linkedInNormalizer.normalize(url);
    }

    public double jaroWinkler(String s1, String s2) {
        return jaroWinkler.compute(s1, s2);
    }

    /**
     * Edit distance divided by the longer length: 0.0 for two empty strings, 1.0 when only one is empty.
     */
    public double normalizedLevenshtein(String s1, String s2) {
        return levenshtein.normalizedDistance(s1, s2);
    }

    /**
     * Ensemble score using the configured weights.
     */
    public double ensembleSimilarity(String s1, String s2) {
        return ensembleScorer.compute(s1, s2);
    }

    /**
     * {@code jaroWinklerWeight * jw + levenshteinWeight * (1 - lev)} for any non-negative weights.
     */
    public double ensembleSimilarity(String s1, String s2, double jaroWinklerWeight, double levenshteinWeight) {
        return ensembleScorer.compute(s1, s2, jaroWinklerWeight, levenshteinWeight);
    }
}
