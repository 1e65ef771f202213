package com.contact.resolution.store;

import com.contact.resolution.core.model.ContactRecord;
import com.contact.resolution.core.model.DuplicateGroup;
import com.contact.resolution.core.model.DuplicateResolution;
import com.contact.resolution.core.model.PhoneEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for contact rows and their dedup metadata.
 */
public class ContactRepository {
    private static final Logger log = LoggerFactory.getLogger(ContactRepository.class);

    private static final String CONTACT_COLUMNS = """
            id, first_name, last_name, job_title, linkedin, website, birthday, full_data,
            record_hash, last_synced_at, duplicate_group_id, duplicate_resolution, primary_contact_id
            """;

    private final SqlExecutor executor;
    private final EmailRepository emailRepository;
    private final PhoneRepository phoneRepository;

    public ContactRepository(SqlExecutor executor) {
        this.executor = executor;
        this.emailRepository = new EmailRepository(executor);
        this.phoneRepository = new PhoneRepository(executor);
    }

    public ContactRepository(StoreConnection connection) {
        this(new SqlExecutor(connection));
    }

    /**
     * Loads every contact with its email and phone rows, ordered by contact id.
     */
    public List<ContactRecord> findAll() {
        Map<String, List<String>> emails = emailRepository.findAllGroupedByContact();
        Map<String, List<PhoneEntry>> phones = phoneRepository.findAllGroupedByContact();
        return executor.query("SELECT " + CONTACT_COLUMNS + " FROM contacts ORDER BY id",
                rs -> mapToContact(rs,
                        emails.getOrDefault(rs.getString("id"), List.of()),
                        phones.getOrDefault(rs.getString("id"), List.of())));
    }

    /**
     * Loads the stored contacts among the given ids, ordered by id. Unknown ids are ignored.
     */
    public List<ContactRecord> findByIds(Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        List<ContactRecord> bare = executor.query("SELECT " + CONTACT_COLUMNS + " FROM contacts WHERE id IN ("
                        + SqlExecutor.placeholders(ids) + ") ORDER BY id",
                rs -> mapToContact(rs, List.of(), List.of()), ids.toArray());
        List<ContactRecord> contacts = new ArrayList<>(bare.size());
        for (ContactRecord contact : bare) {
            contacts.add(contact.toBuilder()
                    .emails(emailRepository.findByContact(contact.getId()))
                    .phones(phoneRepository.findByContact(contact.getId()))
                    .build());
        }
        return contacts;
    }

    public Optional<ContactRecord> findById(String id) {
        List<ContactRecord> found = findByIds(List.of(id));
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    /**
     * Stored hash and dedup metadata of a contact, or empty if the contact is new.
     */
    public Optional<SyncState> findSyncState(String id) {
        List<SyncState> states = executor.query("""
                SELECT record_hash, duplicate_group_id, duplicate_resolution, primary_contact_id
                FROM contacts WHERE id = ?
                """, rs -> new SyncState(rs.getString("record_hash"), mapToGroup(rs)), id);
        return states.isEmpty() ? Optional.empty() : Optional.of(states.get(0));
    }

    /**
     * Inserts the contact row or replaces every column of the existing one, dedup metadata included.
     * Callers carry the stored {@link DuplicateGroup} forward before calling this.
     */
    public void upsert(ContactRecord contact) {
        DuplicateGroup group = contact.getDuplicateGroup();
        executor.update("""
                INSERT INTO contacts (
                    id, first_name, last_name, job_title, linkedin, website, birthday, full_data,
                    record_hash, last_synced_at, duplicate_group_id, duplicate_resolution, primary_contact_id
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(id) DO UPDATE SET
                    first_name = excluded.first_name,
                    last_name = excluded.last_name,
                    job_title = excluded.job_title,
                    linkedin = excluded.linkedin,
                    website = excluded.website,
                    birthday = excluded.birthday,
                    full_data = excluded.full_data,
                    record_hash = excluded.record_hash,
                    last_synced_at = excluded.last_synced_at,
                    duplicate_group_id = excluded.duplicate_group_id,
                    duplicate_resolution = excluded.duplicate_resolution,
                    primary_contact_id = excluded.primary_contact_id
                """,
                contact.getId(), contact.getFirstName(), contact.getLastName(), contact.getJobTitle(),
                contact.getLinkedin(), contact.getWebsite(), contact.getBirthday(), contact.getFullData(),
                contact.getRecordHash(), contact.getLastSyncedAt(),
                group.groupId(), group.resolution().storedValue(), group.primaryContactId());
    }

    /**
     * Overwrites the scalar profile fields of an existing contact. Dedup metadata and sync
     * bookkeeping other than the hash are left alone.
     */
    public int updateScalarFields(ContactRecord contact) {
        return executor.update("""
                UPDATE contacts
                SET first_name = ?, last_name = ?, job_title = ?, linkedin = ?, website = ?,
                    birthday = ?, full_data = ?, record_hash = ?
                WHERE id = ?
                """,
                contact.getFirstName(), contact.getLastName(), contact.getJobTitle(), contact.getLinkedin(),
                contact.getWebsite(), contact.getBirthday(), contact.getFullData(), contact.getRecordHash(),
                contact.getId());
    }

    public int deleteByIds(Collection<String> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        return executor.update("DELETE FROM contacts WHERE id IN (" + SqlExecutor.placeholders(ids) + ")",
                ids.toArray());
    }

    public long count() {
        return executor.queryForLong("SELECT COUNT(*) FROM contacts");
    }

    // ========== Duplicate groups ==========

    /**
     * Clears the group id of every contact whose group has not been reviewed yet.
     *
     * @return contacts cleared
     */
    public int clearUnresolvedGroups() {
        int cleared = executor.update("""
                UPDATE contacts SET duplicate_group_id = NULL
                WHERE duplicate_group_id IS NOT NULL
                  AND (duplicate_resolution IS NULL OR duplicate_resolution = '')
                """);
        log.debug("Cleared unresolved duplicate group ids from {} contacts", cleared);
        return cleared;
    }

    /**
     * Puts the unreviewed contacts among the given ids into a group. Contacts that already
     * carry a review outcome keep the group they were reviewed in.
     *
     * @return contacts updated
     */
    public int assignGroup(String groupId, Collection<String> contactIds) {
        if (contactIds.isEmpty()) {
            return 0;
        }
        List<Object> params = new ArrayList<>();
        params.add(groupId);
        params.addAll(contactIds);
        return executor.update("UPDATE contacts SET duplicate_group_id = ? WHERE id IN ("
                + SqlExecutor.placeholders(contactIds) + ")"
                + " AND (duplicate_resolution IS NULL OR duplicate_resolution = '')", params.toArray());
    }

    public List<String> findGroupMembers(String groupId) {
        return executor.query("SELECT id FROM contacts WHERE duplicate_group_id = ? ORDER BY id",
                rs -> rs.getString("id"), groupId);
    }

    /**
     * Records a review outcome on every member of a group.
     *
     * @return contacts updated
     */
    public int setResolution(String groupId, DuplicateResolution resolution, String primaryContactId) {
        return executor.update("""
                UPDATE contacts SET duplicate_resolution = ?, primary_contact_id = ?
                WHERE duplicate_group_id = ?
                """, resolution.storedValue(), primaryContactId, groupId);
    }

    /**
     * Distinct flagged groups with the given review outcome, ordered by group id.
     */
    public List<DuplicateGroup> findGroupsByResolution(DuplicateResolution resolution) {
        String sql = """
                SELECT duplicate_group_id, MAX(duplicate_resolution) AS duplicate_resolution, MAX(primary_contact_id) AS primary_contact_id
                FROM contacts
                WHERE duplicate_group_id IS NOT NULL AND %s
                GROUP BY duplicate_group_id
                ORDER BY duplicate_group_id
                """;
        if (resolution == DuplicateResolution.UNSET) {
            return executor.query(String.format(sql, "(duplicate_resolution IS NULL OR duplicate_resolution = '')"), this::mapToGroup);
        }
        return executor.query(String.format(sql, "duplicate_resolution = ?"), this::mapToGroup,
                resolution.storedValue());
    }

    private ContactRecord mapToContact(ResultSet rs, List<String> emails, List<PhoneEntry> phones)
            throws SQLException {
        return ContactRecord.builder()
                .id(rs.getString("id"))
                .firstName(rs.getString("first_name"))
                .lastName(rs.getString("last_name"))
                .jobTitle(rs.getString("job_title"))
                .linkedin(rs.getString("linkedin"))
                .website(rs.getString("website"))
                .birthday(rs.getString("birthday"))
                .fullData(rs.getString("full_data"))
                .recordHash(rs.getString("record_hash"))
                .lastSyncedAt(rs.getString("last_synced_at"))
                .duplicateGroup(mapToGroup(rs))
                .emails(emails)
                .phones(phones)
                .build();
    }

    private DuplicateGroup mapToGroup(ResultSet rs) throws SQLException {
        return new DuplicateGroup(
                rs.getString("duplicate_group_id"),
                DuplicateResolution.fromStoredValue(rs.getString("duplicate_resolution")),
                rs.getString("primary_contact_id"));
    }
}
