package com.contact.resolution.fingerprint;

import com.ibm.icu.text.Transliterator;

/**
 * Folds Unicode text to plain ASCII with ICU: other scripts are romanized ("Петров" to
 * "Petrov", "Νίκος" to "Nikos"), accents are stripped ("José" to "Jose") and Latin letters
 * without a decomposition are spelled out ("ð" to "d", "ß" to "ss"). Whatever has no
 * ASCII rendering (emoji, symbols) is dropped.
 */
final class AsciiFolder {

    private static final String TRANSFORM = "Any-Latin; Latin-ASCII; NFD; [:Nonspacing Mark:] Remove; NFC";

    // Transliterator instances are not safe for concurrent use
    private static final ThreadLocal<Transliterator> TO_ASCII =
            ThreadLocal.withInitial(() -> Transliterator.getInstance(TRANSFORM));

    private AsciiFolder() {
    }

    static String fold(String value) {
        if (isAscii(value)) {
            return value;
        }
        String romanized = TO_ASCII.get().transliterate(value);

        StringBuilder folded = new StringBuilder(romanized.length());
        for (int i = 0; i < romanized.length(); i++) {
            char c = romanized.charAt(i);
            if (c < 128) {
                folded.append(c);
            } else if (Character.isWhitespace(c) || Character.isSpaceChar(c)) {
                folded.append(' ');
            }
        }
        return folded.toString();
    }

    private static boolean isAscii(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) >= 128) {
                return false;
            }
        }
        return true;
    }
}
