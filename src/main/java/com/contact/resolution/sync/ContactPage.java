package com.contact.resolution.sync;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One page of upstream contact records.
 *
 * @param contacts raw contact objects as delivered by the source
 * @param total    total number of contacts the source reports
 */
public record ContactPage(List<JsonNode> contacts, long total) {
    public ContactPage {
        contacts = contacts != null ? List.copyOf(contacts) : List.of();
    }
}
