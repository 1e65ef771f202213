package com.contact.resolution.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Canonical JSON snapshots and their SHA-256 digests.
 *
 * <p>Object keys are sorted at every level, so two payloads that differ only in key
 * order produce the same snapshot and the same hash.</p>
 */
public class RecordHasher {

    private final ObjectMapper canonicalMapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    public String canonicalJson(JsonNode record) {
        try {
            Object plain = canonicalMapper.treeToValue(record, Object.class);
            return canonicalMapper.writeValueAsString(plain);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Record cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Lowercase hex SHA-256 of the UTF-8 bytes.
     */
    public String hash(String canonicalJson) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonicalJson.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String hash(JsonNode record) {
        return hash(canonicalJson(record));
    }
}
