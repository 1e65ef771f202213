package com.contact.resolution.store;

import com.contact.resolution.core.model.PhoneEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Repository for the {@code phones} child rows of contacts.
 */
public class PhoneRepository {
    private static final Logger log = LoggerFactory.getLogger(PhoneRepository.class);

    private final SqlExecutor executor;

    public PhoneRepository(SqlExecutor executor) {
        this.executor = executor;
    }

    public PhoneRepository(StoreConnection connection) {
        this(new SqlExecutor(connection));
    }

    /**
     * Replaces every phone row of a contact with the given entries, in order.
     */
    public void replaceForContact(String contactId, List<PhoneEntry> phones) {
        executor.update("DELETE FROM phones WHERE contact_id = ?", contactId);
        for (PhoneEntry phone : phones) {
            executor.update("INSERT INTO phones (contact_id, phone_number, label) VALUES (?, ?, ?)",
                    contactId, phone.number(), phone.label());
        }
    }

    public List<PhoneEntry> findByContact(String contactId) {
        return executor.query("SELECT phone_number, label FROM phones WHERE contact_id = ? AND phone_number IS NOT NULL ORDER BY id",
                rs -> new PhoneEntry(rs.getString("phone_number"), rs.getString("label")), contactId);
    }

    /**
     * All phone rows in row-id order, grouped by owning contact. Rows without a number are skipped.
     */
    public Map<String, List<PhoneEntry>> findAllGroupedByContact() {
        Map<String, List<PhoneEntry>> grouped = new LinkedHashMap<>();
        executor.query("""
                SELECT contact_id, phone_number, label FROM phones
                WHERE phone_number IS NOT NULL
                ORDER BY id
                """, rs -> {
            grouped.computeIfAbsent(rs.getString("contact_id"), k -> new ArrayList<>())
                    .add(new PhoneEntry(rs.getString("phone_number"), rs.getString("label")));
            return null;
        });
        return grouped;
    }

    /**
     * Moves every phone row owned by one of the contacts to the primary.
     *
     * @return rows moved
     */
    public int repointToPrimary(Collection<String> contactIds, String primaryContactId) {
        List<Object> params = new ArrayList<>();
        params.add(primaryContactId);
        params.addAll(contactIds);
        return executor.update("UPDATE phones SET contact_id = ? WHERE contact_id IN ("
                + SqlExecutor.placeholders(contactIds) + ")", params.toArray());
    }

    /**
     * Removes rows of a contact whose stored number is an exact duplicate, keeping the earliest row.
     * Differently formatted spellings of one number are not collapsed.
     *
     * @return rows removed
     */
    public int deduplicateForContact(String contactId) {
        int removed = executor.update("""
                DELETE FROM phones
                WHERE contact_id = ?
                  AND id NOT IN (
                      SELECT MIN(id) FROM phones WHERE contact_id = ? GROUP BY phone_number
                  )
                """, contactId, contactId);
        if (removed > 0) {
            log.debug("Removed {} duplicate phone rows for contact {}", removed, contactId);
        }
        return removed;
    }

    public long count() {
        return executor.queryForLong("SELECT COUNT(*) FROM phones");
    }
}
