package com.contact.resolution.store;

import com.contact.resolution.config.StoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * SQLite implementation of {@link StoreConnection} holding a single JDBC connection.
 * SQLite allows one writer at a time, so all writes go through this connection.
 */
public class SqliteStoreConnection implements StoreConnection {
    private static final Logger log = LoggerFactory.getLogger(SqliteStoreConnection.class);

    private static final String SCHEMA_RESOURCE = "/schema.sql";

    private final Connection connection;
    private final String jdbcUrl;
    private boolean inTransaction = false;

    public SqliteStoreConnection(StoreConfig config) {
        this.jdbcUrl = config.jdbcUrl();
        Path databaseFile = config.databaseFile();
        try {
            if (databaseFile != null && databaseFile.getParent() != null) {
                Files.createDirectories(databaseFile.getParent());
            }
            this.connection = DriverManager.getConnection(jdbcUrl);
        } catch (IOException e) {
            throw new StoreException("Could not create data directory for " + databaseFile, e);
        } catch (SQLException e) {
            throw new StoreException("Could not open contact store at " + jdbcUrl, e);
        }
        log.info("Opened contact store at {}", jdbcUrl);
    }

    /**
     * Opens the store and applies the schema.
     */
    public static SqliteStoreConnection open(StoreConfig config) {
        SqliteStoreConnection store = new SqliteStoreConnection(config);
        store.createSchema();
        return store;
    }

    @Override
    public Connection jdbc() {
        return connection;
    }

    @Override
    public <T> T inTransaction(SqlWork<T> work) {
        try (StoreTransaction tx = beginTransaction()) {
            T result;
            try {
                result = work.execute();
            } catch (SQLException e) {
                throw new StoreException("Transaction failed: " + e.getMessage(), e);
            }
            tx.markSuccess();
            return result;
        }
    }

    @Override
    public StoreTransaction beginTransaction() {
        if (inTransaction) {
            throw new IllegalStateException("A transaction is already active on this connection");
        }
        inTransaction = true;
        return new StoreTransaction(connection, () -> inTransaction = false);
    }

    @Override
    public void createSchema() {
        String script = loadSchemaScript();
        try (Statement statement = connection.createStatement()) {
            for (String sql : script.split(";")) {
                if (!sql.isBlank()) {
                    statement.execute(sql.strip());
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Could not apply schema", e);
        }
        log.debug("Applied contact store schema");
    }

    private String loadSchemaScript() {
        try (InputStream in = SqliteStoreConnection.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new StoreException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreException("Could not read schema resource", e);
        }
    }

    @Override
    public boolean isConnected() {
        try {
            return !connection.isClosed();
        } catch (SQLException e) {
            return false;
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
            log.info("Closed contact store at {}", jdbcUrl);
        } catch (SQLException e) {
            throw new StoreException("Could not close contact store", e);
        }
    }
}
