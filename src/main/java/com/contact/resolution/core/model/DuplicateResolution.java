package com.contact.resolution.core.model;

/**
 * Review outcome recorded for a flagged duplicate group.
 */
public enum DuplicateResolution {
    /**
     * Flagged (or never flagged) and not reviewed yet.
     */
    UNSET(null),

    /**
     * A reviewer confirmed the group and chose a primary contact.
     */
    CONFIRMED("confirmed"),

    /**
     * A reviewer decided the contacts are different people.
     */
    FALSE_POSITIVE("false_positive");

    private final String storedValue;

    DuplicateResolution(String storedValue) {
        this.storedValue = storedValue;
    }

    /**
     * Column value for the {@code duplicate_resolution} column, {@code null} for {@link #UNSET}.
     */
    public String storedValue() {
        return storedValue;
    }

    public static DuplicateResolution fromStoredValue(String value) {
        if (value == null || value.isBlank()) {
            return UNSET;
        }
        for (DuplicateResolution resolution : values()) {
            if (value.equals(resolution.storedValue)) {
                return resolution;
            }
        }
        throw new IllegalArgumentException("Unknown duplicate resolution: " + value);
    }
}
