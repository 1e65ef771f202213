package com.contact.resolution.store;

import com.contact.resolution.fingerprint.FingerprintEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Repository for the {@code emails} child rows of contacts.
 */
public class EmailRepository {
    private static final Logger log = LoggerFactory.getLogger(EmailRepository.class);

    private final SqlExecutor executor;

    public EmailRepository(SqlExecutor executor) {
        this.executor = executor;
    }

    public EmailRepository(StoreConnection connection) {
        this(new SqlExecutor(connection));
    }

    /**
     * Replaces every email row of a contact with the given addresses, in order.
     */
    public void replaceForContact(String contactId, List<String> emails) {
        executor.update("DELETE FROM emails WHERE contact_id = ?", contactId);
        for (String email : emails) {
            executor.update("INSERT INTO emails (contact_id, email) VALUES (?, ?)", contactId, email);
        }
    }

    public List<String> findByContact(String contactId) {
        return executor.query("SELECT email FROM emails WHERE contact_id = ? AND email IS NOT NULL ORDER BY id",
                rs -> rs.getString("email"), contactId);
    }

    /**
     * All non-null email rows in row-id order, grouped by owning contact.
     */
    public Map<String, List<String>> findAllGroupedByContact() {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        executor.query("SELECT contact_id, email FROM emails WHERE email IS NOT NULL ORDER BY id", rs -> {
            grouped.computeIfAbsent(rs.getString("contact_id"), k -> new ArrayList<>())
                    .add(rs.getString("email"));
            return null;
        });
        return grouped;
    }

    /**
     * Moves every email row owned by one of the contacts to the primary.
     *
     * @return rows moved
     */
    public int repointToPrimary(Collection<String> contactIds, String primaryContactId) {
        List<Object> params = new ArrayList<>();
        params.add(primaryContactId);
        params.addAll(contactIds);
        return executor.update("UPDATE emails SET contact_id = ? WHERE contact_id IN ("
                + SqlExecutor.placeholders(contactIds) + ")", params.toArray());
    }

    /**
     * Removes duplicate addresses of a contact, keeping the earliest row. Addresses are compared
     * by {@link FingerprintEngine#emailKey(String)}, the key duplicate detection matches on.
     *
     * @return rows removed
     */
    public int deduplicateForContact(String contactId) {
        List<Long> duplicateRowIds = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        executor.query("SELECT id, email FROM emails WHERE contact_id = ? AND email IS NOT NULL ORDER BY id", rs -> {
            if (!seen.add(FingerprintEngine.emailKey(rs.getString("email")))) {
                duplicateRowIds.add(rs.getLong("id"));
            }
            return null;
        }, contactId);
        if (duplicateRowIds.isEmpty()) {
            return 0;
        }

        int removed = executor.update("DELETE FROM emails WHERE id IN ("
                + SqlExecutor.placeholders(duplicateRowIds) + ")", duplicateRowIds.toArray());
        log.debug("Removed {} duplicate email rows for contact {}", removed, contactId);
        return removed;
    }

    public long count() {
        return executor.queryForLong("SELECT COUNT(*) FROM emails");
    }
}
