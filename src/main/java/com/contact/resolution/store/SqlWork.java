package com.contact.resolution.store;

import java.sql.SQLException;

/**
 * A unit of store work run inside a transaction.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface SqlWork<T> {

    T execute() throws SQLException;
}
