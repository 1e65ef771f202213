package com.contact.resolution.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Serves pages from a contact export already on disk or in memory.
 *
 * <p>Accepts either a bare JSON array of contacts or an object with a {@code contacts}
 * array, as returned by the CRM's paginated endpoint.</p>
 */
public class JsonContactPageSource implements ContactPageSource {

    private final List<JsonNode> contacts;

    public JsonContactPageSource(List<JsonNode> contacts) {
        this.contacts = List.copyOf(contacts);
    }

    public static JsonContactPageSource fromJson(String json) {
        try {
            return fromTree(new ObjectMapper().readTree(json));
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid contact export", e);
        }
    }

    public static JsonContactPageSource fromFile(Path file) {
        try {
            return fromTree(new ObjectMapper().readTree(file.toFile()));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read contact export " + file, e);
        }
    }

    private static JsonContactPageSource fromTree(JsonNode root) {
        JsonNode array = root.isArray() ? root : root.path("contacts");
        if (!array.isArray()) {
            throw new IllegalArgumentException("Contact export must be an array or contain a 'contacts' array");
        }
        List<JsonNode> contacts = new ArrayList<>();
        array.forEach(contacts::add);
        return new JsonContactPageSource(contacts);
    }

    @Override
    public ContactPage fetchPage(long offset, int limit) {
        if (offset < 0 || limit < 1) {
            throw new ContactSourceException("Invalid page request offset=" + offset + " limit=" + limit, offset);
        }
        int from = (int) Math.min(offset, contacts.size());
        int to = (int) Math.min(offset + limit, contacts.size());
        return new ContactPage(contacts.subList(from, to), contacts.size());
    }
}
