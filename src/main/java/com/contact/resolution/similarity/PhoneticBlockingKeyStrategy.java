package com.contact.resolution.similarity;

import org.apache.commons.codec.language.Metaphone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Blocks contacts by the Metaphone code of their surname, so "Smith" and "Smyth" share a block.
 * When the encoder fails or yields nothing (digits, symbols), the first two lowercase letters
 * of the surname are used instead.
 */
public class PhoneticBlockingKeyStrategy implements BlockingKeyStrategy {
    private static final Logger log = LoggerFactory.getLogger(PhoneticBlockingKeyStrategy.class);

    private static final int MAX_CODE_LENGTH = 32;

    private final Metaphone metaphone;

    public PhoneticBlockingKeyStrategy() {
        this.metaphone = new Metaphone();
        this.metaphone.setMaxCodeLen(MAX_CODE_LENGTH);
    }

    @Override
    public String blockingKey(String surname) {
        try {
            String code = metaphone.metaphone(surname);
            if (code != null && !code.isEmpty()) {
                return code;
            }
        } catch (RuntimeException e) {
            log.debug("Metaphone failed for surname '{}': {}", surname, e.getMessage());
        }
        return fallbackKey(surname);
    }

    static String fallbackKey(String surname) {
        String lower = surname.toLowerCase(Locale.ROOT);
        return lower.length() > 2 ? lower.substring(0, 2) : lower;
    }
}
