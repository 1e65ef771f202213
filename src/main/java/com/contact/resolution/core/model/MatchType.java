package com.contact.resolution.core.model;

/**
 * The kind of evidence a duplicate signal is based on, ordered roughly from
 * most to least certain.
 */
public enum MatchType {
    /**
     * Same email address, compared case-insensitively.
     */
    EMAIL("email"),

    /**
     * Same phone number after stripping formatting and the +1 prefix.
     */
    PHONE("phone"),

    /**
     * Same first and last name and the same birthday month-day.
     */
    BIRTHDAY_NAME("birthday_name"),

    /**
     * Same name token set, ignoring order, case, accents and punctuation.
     */
    FINGERPRINT_NAME("fingerprint_name"),

    /**
     * Same full name and job title.
     */
    NAME_TITLE("name_title"),

    /**
     * Jaro-Winkler similar full names within the same phonetic surname block.
     */
    FUZZY_NAME("fuzzy_name"),

    /**
     * Same LinkedIn profile after URL normalization.
     */
    LINKEDIN("linkedin");

    private final String code;

    MatchType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
