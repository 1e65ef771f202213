package com.contact.resolution.store;

import java.sql.Connection;

/**
 * Connection to the local contact store.
 * Abstracts the JDBC plumbing from the repositories.
 */
public interface StoreConnection extends AutoCloseable {

    /**
     * The underlying JDBC connection. Callers must not close it.
     */
    Connection jdbc();

    /**
     * Runs the work in a transaction: committed on success, rolled back on any exception.
     * A {@link java.sql.SQLException} thrown by the work is rethrown as a {@link StoreException}.
     */
    <T> T inTransaction(SqlWork<T> work);

    /**
     * Starts a transaction that rolls back on close unless marked successful.
     */
    StoreTransaction beginTransaction();

    /**
     * Creates the contacts, emails and phones tables and their indexes if they don't exist.
     */
    void createSchema();

    boolean isConnected();

    @Override
    void close();
}
