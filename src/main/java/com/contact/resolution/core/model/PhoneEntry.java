package com.contact.resolution.core.model;

import java.util.Objects;

/**
 * A phone child row: the number exactly as stored plus its optional label.
 */
public record PhoneEntry(String number, String label) {
    public PhoneEntry {
        Objects.requireNonNull(number, "number is required");
    }
}
