package com.contact.resolution.config;

import com.contact.resolution.similarity.SimilarityWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Options Tests")
class OptionsTest {

    @Nested
    @DisplayName("DetectionOptions")
    class DetectionOptionsTests {

        @Test
        @DisplayName("Defaults match the documented thresholds")
        void defaults() {
            DetectionOptions options = DetectionOptions.defaults();
            assertEquals(0.9, options.getFuzzyThreshold());
            assertEquals(0.98, options.getBatchThreshold());
            assertEquals("2001-01-01", options.getPlaceholderBirthday());
            assertEquals(SimilarityWeights.defaultWeights(), options.getSimilarityWeights());
            assertEquals("US", options.getDefaultPhoneRegion());
        }

        @Test
        @DisplayName("Builder overrides values")
        void builderOverrides() {
            DetectionOptions options = DetectionOptions.builder()
                    .fuzzyThreshold(0.85)
                    .batchThreshold(0.95)
                    .placeholderBirthday("1900-01-01")
                    .defaultPhoneRegion("GB")
                    .build();
            assertEquals(0.85, options.getFuzzyThreshold());
            assertEquals(0.95, options.getBatchThreshold());
            assertEquals("1900-01-01", options.getPlaceholderBirthday());
            assertEquals("GB", options.getDefaultPhoneRegion());
        }

        @Test
        @DisplayName("Invalid values are rejected")
        void rejectsInvalid() {
            assertThrows(IllegalArgumentException.class, () -> DetectionOptions.builder().fuzzyThreshold(1.1));
            assertThrows(IllegalArgumentException.class, () -> DetectionOptions.builder().batchThreshold(-0.1));
            assertThrows(IllegalArgumentException.class, () -> DetectionOptions.builder().similarityWeights(null));
            assertThrows(IllegalArgumentException.class, () -> DetectionOptions.builder().defaultPhoneRegion("USA"));
        }
    }

    @Nested
    @DisplayName("SyncOptions")
    class SyncOptionsTests {

        @Test
        void defaultsDeriveChunkSize() {
            SyncOptions options = SyncOptions.defaults();
            assertEquals(100, options.pageSize());
            assertEquals(5, options.maxConcurrency());
            assertEquals(10, options.chunkSize());
        }

        @Test
        void rejectsNonPositiveValues() {
            assertThrows(IllegalArgumentException.class, () -> new SyncOptions(0, 1, 1));
            assertThrows(IllegalArgumentException.class, () -> new SyncOptions(1, 0, 1));
            assertThrows(IllegalArgumentException.class, () -> new SyncOptions(1, 1, 0));
        }
    }

    @Nested
    @DisplayName("StoreConfig")
    class StoreConfigTests {

        @Test
        void environmentVariableChoosesDataDirectory() {
            StoreConfig config = StoreConfig.fromEnvironment(Map.of("CONTACTS_DATA_DIR", "/tmp/contacts"));
            assertEquals(Path.of("/tmp/contacts", "contacts.db"), config.databaseFile());
        }

        @Test
        void missingVariableFallsBackToOutput() {
            StoreConfig config = StoreConfig.fromEnvironment(Map.of());
            assertEquals("jdbc:sqlite:" + Path.of("output", "contacts.db"), config.jdbcUrl());
            assertEquals(Path.of("output", "contacts.db"), StoreConfig.fromEnvironment(Map.of("CONTACTS_DATA_DIR", " ")).databaseFile());
        }

        @Test
        void inMemoryHasNoFile() {
            assertNull(StoreConfig.inMemory().databaseFile());
        }

        @Test
        void rejectsOtherDatabases() {
            assertThrows(IllegalArgumentException.class, () -> new StoreConfig("jdbc:postgresql://localhost/db"));
        }
    }
}
