package com.contact.resolution.core.model;

import java.util.Objects;

/**
 * Dedup metadata persisted on a contact row. Set by flagging and by human review,
 * and carried forward unchanged when the contact is re-synced.
 *
 * @param groupId          short random id shared by all contacts of a flagged group, or null
 * @param resolution       review outcome
 * @param primaryContactId surviving contact chosen by the reviewer, or null
 */
public record DuplicateGroup(String groupId, DuplicateResolution resolution, String primaryContactId) {
    public DuplicateGroup {
        Objects.requireNonNull(resolution, "resolution is required");
    }

    public static DuplicateGroup none() {
        return new DuplicateGroup(null, DuplicateResolution.UNSET, null);
    }

    public boolean isFlagged() {
        return groupId != null;
    }

    public boolean isReviewed() {
        return resolution != DuplicateResolution.UNSET;
    }
}
