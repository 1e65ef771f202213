package com.contact.resolution.core.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Evidence that two or more contacts describe the same person.
 * Signals are transient: produced by a detection pass and consumed by clustering.
 *
 * @param matchType   the detector that produced the signal
 * @param matchValue  diagnostic description of the shared value
 * @param contactIds  the distinct contact ids sharing that value (at least two)
 */
public record MatchSignal(MatchType matchType, String matchValue, List<String> contactIds) {
    public MatchSignal {
        Objects.requireNonNull(matchType, "matchType is required");
        Objects.requireNonNull(contactIds, "contactIds is required");
        contactIds = List.copyOf(new LinkedHashSet<>(contactIds));
        if (contactIds.size() < 2) {
            throw new IllegalArgumentException("A match signal needs at least two distinct contact ids");
        }
        matchValue = matchValue != null ? matchValue : "";
    }

    public static MatchSignal of(MatchType matchType, String matchValue, String... contactIds) {
        return new MatchSignal(matchType, matchValue, new ArrayList<>(List.of(contactIds)));
    }
}
