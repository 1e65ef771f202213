package com.contact.resolution.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Runs parameterized SQL against the store. All SQL text is static; values are
 * always bound as parameters.
 */
public class SqlExecutor {

    private final StoreConnection connection;

    public SqlExecutor(StoreConnection connection) {
        this.connection = connection;
    }

    public int update(String sql, Object... params) {
        try (PreparedStatement statement = prepare(sql, params)) {
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Update failed: " + e.getMessage(), e);
        }
    }

    public <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) {
        try (PreparedStatement statement = prepare(sql, params);
             ResultSet rs = statement.executeQuery()) {
            List<T> results = new ArrayList<>();
            while (rs.next()) {
                results.add(mapper.map(rs));
            }
            return results;
        } catch (SQLException e) {
            throw new StoreException("Query failed: " + e.getMessage(), e);
        }
    }

    public long queryForLong(String sql, Object... params) {
        List<Long> values = query(sql, rs -> rs.getLong(1), params);
        return values.isEmpty() ? 0L : values.get(0);
    }

    /**
     * A {@code ?, ?, ?} list for an IN clause with one placeholder per value.
     */
    public static String placeholders(Collection<?> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("IN clause needs at least one value");
        }
        return String.join(", ", Collections.nCopies(values.size(), "?"));
    }

    private PreparedStatement prepare(String sql, Object... params) throws SQLException {
        Connection jdbc = connection.jdbc();
        PreparedStatement statement = jdbc.prepareStatement(sql);
        try {
            for (int i = 0; i < params.length; i++) {
                statement.setObject(i + 1, params[i]);
            }
        } catch (SQLException e) {
            statement.close();
            throw e;
        }
        return statement;
    }
}
