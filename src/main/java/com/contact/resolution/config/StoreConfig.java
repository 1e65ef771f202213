package com.contact.resolution.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Location of the local contact store.
 *
 * @param jdbcUrl SQLite JDBC URL, e.g. {@code jdbc:sqlite:output/contacts.db}
 */
public record StoreConfig(String jdbcUrl) {

    public static final String DATA_DIR_VARIABLE = "CONTACTS_DATA_DIR";
    public static final String DEFAULT_DATA_DIR = "output";
    public static final String DATABASE_FILE = "contacts.db";

    public StoreConfig {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl is required");
        if (!jdbcUrl.startsWith("jdbc:sqlite:")) {
            throw new IllegalArgumentException("Only SQLite stores are supported: " + jdbcUrl);
        }
    }

    public static StoreConfig forFile(Path databaseFile) {
        return new StoreConfig("jdbc:sqlite:" + databaseFile);
    }

    public static StoreConfig inMemory() {
        return new StoreConfig("jdbc:sqlite::memory:");
    }

    public static StoreConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Resolves {@code contacts.db} inside {@code CONTACTS_DATA_DIR}, or inside {@code output} when unset.
     */
    public static StoreConfig fromEnvironment(Map<String, String> environment) {
        String dataDir = environment.get(DATA_DIR_VARIABLE);
        if (dataDir == null || dataDir.isBlank()) {
            dataDir = DEFAULT_DATA_DIR;
        }
        return forFile(Path.of(dataDir).resolve(DATABASE_FILE));
    }

    /**
     * Database file path, or null for an in-memory store.
     */
    public Path databaseFile() {
        String location = jdbcUrl.substring("jdbc:sqlite:".length());
        if (location.isEmpty() || location.startsWith(":memory:")) {
            return null;
        }
        return Path.of(location);
    }
}
