package com.contact.resolution.sync;

import java.util.Locale;

/**
 * What an incremental sync did with one upstream record.
 */
public enum SyncOutcome {
    ADDED,
    UPDATED,
    /**
     * Stored hash equals the incoming hash; nothing was written.
     */
    UNCHANGED;

    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
