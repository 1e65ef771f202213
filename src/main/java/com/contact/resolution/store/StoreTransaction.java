package com.contact.resolution.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A JDBC transaction scoped by try-with-resources.
 *
 * <pre>
 * try (StoreTransaction tx = connection.beginTransaction()) {
 *     tx.execute("repoint emails", () -> emails.repoint(ids, primaryId));
 *     tx.execute("delete merged contacts", () -> contacts.deleteByIds(ids));
 *     tx.markSuccess();
 * }
 * // If markSuccess() was not called, every step is rolled back
 * </pre>
 */
public class StoreTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StoreTransaction.class);

    private final Connection connection;
    private final Runnable onClose;
    private boolean success = false;
    private boolean closed = false;

    StoreTransaction(Connection connection, Runnable onClose) {
        this.connection = connection;
        this.onClose = onClose;
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            onClose.run();
            throw new StoreException("Could not start transaction", e);
        }
    }

    /**
     * Runs one step of the transaction. If the step fails the transaction is rolled back
     * immediately and the exception is rethrown.
     */
    public void execute(String description, Runnable operation) {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }
        try {
            log.debug("Executing transaction step: {}", description);
            operation.run();
        } catch (RuntimeException e) {
            log.warn("Transaction step '{}' failed: {}. Rolling back.", description, e.getMessage());
            rollback();
            throw e;
        }
    }

    /**
     * Marks the transaction as successful; close() will commit.
     */
    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (success) {
                connection.commit();
            } else {
                log.warn("StoreTransaction closed without success - rolling back");
                connection.rollback();
            }
        } catch (SQLException e) {
            throw new StoreException("Could not finish transaction", e);
        } finally {
            restoreAutoCommit();
            onClose.run();
        }
    }

    private void rollback() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.error("Rollback failed: {}", e.getMessage());
        }
        success = false;
    }

    private void restoreAutoCommit() {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            log.error("Could not restore auto-commit: {}", e.getMessage());
        }
    }
}
