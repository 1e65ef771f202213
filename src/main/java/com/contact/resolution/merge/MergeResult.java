package com.contact.resolution.merge;

import java.util.List;

/**
 * Result of merging one cluster.
 *
 * @param primaryContactId  the surviving contact
 * @param mergedContactIds  contacts folded into the primary and deleted
 * @param emailRowsRemoved  duplicate email rows removed after repointing
 * @param phoneRowsRemoved  duplicate phone rows removed after repointing
 */
public record MergeResult(
        String primaryContactId,
        List<String> mergedContactIds,
        int emailRowsRemoved,
        int phoneRowsRemoved
) {
    public MergeResult {
        mergedContactIds = mergedContactIds != null ? List.copyOf(mergedContactIds) : List.of();
    }

    public int contactsRemoved() {
        return mergedContactIds.size();
    }
}
