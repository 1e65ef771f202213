package com.contact.resolution.core.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A set of contact ids transitively connected through shared match signals.
 * Clusters are recomputed on every detection run.
 */
public record DuplicateCluster(Set<String> contactIds) {
    public DuplicateCluster {
        contactIds = Set.copyOf(contactIds);
        if (contactIds.size() < 2) {
            throw new IllegalArgumentException("A duplicate cluster needs at least two contacts");
        }
    }

    public static DuplicateCluster of(String... contactIds) {
        return new DuplicateCluster(new LinkedHashSet<>(List.of(contactIds)));
    }

    public int size() {
        return contactIds.size();
    }

    public boolean contains(String contactId) {
        return contactIds.contains(contactId);
    }
}
