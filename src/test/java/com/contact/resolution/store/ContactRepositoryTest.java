package com.contact.resolution.store;

import com.contact.resolution.core.model.ContactRecord;
import com.contact.resolution.core.model.DuplicateGroup;
import com.contact.resolution.core.model.DuplicateResolution;
import com.contact.resolution.core.model.PhoneEntry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.contact.resolution.store.StoreFixtures.contact;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Contact Store Tests")
class ContactRepositoryTest {

    private SqliteStoreConnection store;
    private ContactRepository contacts;
    private EmailRepository emails;
    private PhoneRepository phones;

    @BeforeEach
    void setUp() {
        store = StoreFixtures.inMemoryStore();
        contacts = new ContactRepository(store);
        emails = new EmailRepository(store);
        phones = new PhoneRepository(store);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Nested
    @DisplayName("Contacts")
    class ContactTests {

        @Test
        @DisplayName("Stored contacts load back with their child rows in order")
        void roundTripsChildren() {
            StoreFixtures.save(store,
                    contact("b", "Bob", "Roe").email("bob@x.com").phone("555-0001", "work").build(),
                    contact("a", "Ann", "Doe").jobTitle("CTO").birthday("1980-02-03")
                            .email("ann@x.com").email("ann@y.com")
                            .phone("555-0002", "mobile").phone("555-0003", null).build());

            List<ContactRecord> all = contacts.findAll();

            assertEquals(List.of("a", "b"), all.stream().map(ContactRecord::getId).toList());
            ContactRecord ann = all.get(0);
            assertEquals("CTO", ann.getJobTitle());
            assertEquals("1980-02-03", ann.getBirthday());
            assertEquals(List.of("ann@x.com", "ann@y.com"), ann.getEmails());
            assertEquals(List.of(new PhoneEntry("555-0002", "mobile"), new PhoneEntry("555-0003", null)),
                    ann.getPhones());
            assertEquals(ann.getEmails(), contacts.findById("a").orElseThrow().getEmails());
        }

        @Test
        @DisplayName("Upsert replaces every column of an existing row")
        void upsertReplaces() {
            StoreFixtures.save(store, contact("a", "Ann", "Doe").jobTitle("CTO").build());
            contacts.upsert(contact("a", "Anne", "Doe").recordHash("h2")
                    .duplicateGroup(new DuplicateGroup("g1", DuplicateResolution.CONFIRMED, "a")).build());

            ContactRecord stored = contacts.findById("a").orElseThrow();
            assertEquals("Anne", stored.getFirstName());
            assertNull(stored.getJobTitle());
            assertEquals("g1", stored.getDuplicateGroup().groupId());
            assertEquals(DuplicateResolution.CONFIRMED, stored.getDuplicateGroup().resolution());
            assertEquals(1, contacts.count());
        }

        @Test
        @DisplayName("Sync state is empty for unknown contacts")
        void syncState() {
            assertEquals(Optional.empty(), contacts.findSyncState("missing"));
            StoreFixtures.save(store, contact("a", "Ann", "Doe").recordHash("abc").build());
            SyncState state = contacts.findSyncState("a").orElseThrow();
            assertEquals("abc", state.recordHash());
            assertFalse(state.duplicateGroup().isFlagged());
        }

        @Test
        @DisplayName("Scalar update leaves dedup metadata alone")
        void scalarUpdateKeepsGroup() {
            StoreFixtures.save(store, contact("a", "Ann", null)
                    .duplicateGroup(new DuplicateGroup("g1", DuplicateResolution.UNSET, null)).build());

            int updated = contacts.updateScalarFields(contact("a", "Ann", "Doe").website("x.com").build());

            assertEquals(1, updated);
            ContactRecord stored = contacts.findById("a").orElseThrow();
            assertEquals("Doe", stored.getLastName());
            assertEquals("x.com", stored.getWebsite());
            assertEquals("g1", stored.getDuplicateGroup().groupId());
        }

        @Test
        @DisplayName("findByIds ignores unknown ids")
        void findByIdsIgnoresUnknown() {
            StoreFixtures.save(store, contact("a", "Ann", "Doe").build(), contact("b", "Bob", "Roe").build());
            assertEquals(1, contacts.findByIds(List.of("b", "zzz")).size());
            assertTrue(contacts.findByIds(List.of()).isEmpty());
        }

        @Test
        @DisplayName("Contacts are deleted by id")
        void deleteByIds() {
            StoreFixtures.save(store, contact("a", "Ann", "Doe").build(), contact("b", "Bob", "Roe").build(),
                    contact("c", "Cy", "Loe").build());
            assertEquals(2, contacts.deleteByIds(List.of("a", "c")));
            assertEquals(1, contacts.count());
            assertEquals(0, contacts.deleteByIds(List.of()));
        }
    }

    @Nested
    @DisplayName("Duplicate groups")
    class GroupTests {

        @BeforeEach
        void seed() {
            StoreFixtures.save(store,
                    contact("a", "Ann", "Doe").build(),
                    contact("b", "Ann", "Doe").build(),
                    contact("c", "Bob", "Roe").build(),
                    contact("d", "Bob", "Roe").build());
        }

        @Test
        @DisplayName("Assigned groups list their members in id order")
        void assignAndFind() {
            assertEquals(2, contacts.assignGroup("g1", List.of("b", "a")));
            assertEquals(List.of("a", "b"), contacts.findGroupMembers("g1"));
            List<DuplicateGroup> pending = contacts.findGroupsByResolution(DuplicateResolution.UNSET);
            assertEquals(1, pending.size());
            assertEquals("g1", pending.get(0).groupId());
        }

        @Test
        @DisplayName("Resolution is recorded on every member")
        void setResolution() {
            contacts.assignGroup("g1", List.of("a", "b"));
            contacts.assignGroup("g2", List.of("c", "d"));
            contacts.setResolution("g1", DuplicateResolution.CONFIRMED, "b");

            List<DuplicateGroup> confirmed = contacts.findGroupsByResolution(DuplicateResolution.CONFIRMED);
            assertEquals(List.of(new DuplicateGroup("g1", DuplicateResolution.CONFIRMED, "b")), confirmed);
            assertEquals("g2", contacts.findGroupsByResolution(DuplicateResolution.UNSET).get(0).groupId());
            assertEquals("b", contacts.findById("a").orElseThrow().getDuplicateGroup().primaryContactId());
        }

        @Test
        @DisplayName("Assigning a group leaves reviewed contacts in their own group")
        void assignSkipsReviewed() {
            contacts.assignGroup("g1", List.of("a", "b"));
            contacts.setResolution("g1", DuplicateResolution.CONFIRMED, "a");

            assertEquals(2, contacts.assignGroup("g2", List.of("a", "b", "c", "d")));

            assertEquals(List.of("a", "b"), contacts.findGroupMembers("g1"));
            assertEquals(List.of("c", "d"), contacts.findGroupMembers("g2"));
        }

        @Test
        @DisplayName("Clearing only touches unreviewed groups")
        void clearUnresolved() {
            contacts.assignGroup("g1", List.of("a", "b"));
            contacts.assignGroup("g2", List.of("c", "d"));
            contacts.setResolution("g2", DuplicateResolution.FALSE_POSITIVE, null);

            assertEquals(2, contacts.clearUnresolvedGroups());
            assertTrue(contacts.findGroupMembers("g1").isEmpty());
            assertEquals(List.of("c", "d"), contacts.findGroupMembers("g2"));
        }

        @Test
        @DisplayName("An empty stored resolution counts as unreviewed")
        void emptyResolutionIsUnset() throws Exception {
            contacts.assignGroup("g1", List.of("a", "b"));
            new SqlExecutor(store).update("UPDATE contacts SET duplicate_resolution = '' WHERE id = 'a'");

            assertEquals(1, contacts.findGroupsByResolution(DuplicateResolution.UNSET).size());
            assertEquals(2, contacts.clearUnresolvedGroups());
        }
    }

    @Nested
    @DisplayName("Child rows")
    class ChildRowTests {

        @Test
        @DisplayName("Repointing moves rows and deduplication keeps the earliest")
        void repointAndDedupe() {
            StoreFixtures.save(store,
                    contact("a", "Ann", "Doe").email("ann@x.com").phone("555-1234", "work").build(),
                    contact("b", "Ann", "Doe").email("ANN@x.com").phone("555-1234", "home").build());

            assertEquals(1, emails.repointToPrimary(List.of("b"), "a"));
            assertEquals(1, phones.repointToPrimary(List.of("b"), "a"));
            assertEquals(1, emails.deduplicateForContact("a"));
            assertEquals(1, phones.deduplicateForContact("a"));

            assertEquals(List.of("ann@x.com"), emails.findByContact("a"));
            assertEquals(List.of(new PhoneEntry("555-1234", "work")), phones.findByContact("a"));
            assertTrue(emails.findByContact("b").isEmpty());
        }

        @Test
        @DisplayName("Replacing a contact's rows drops the old ones")
        void replace() {
            StoreFixtures.save(store, contact("a", "Ann", "Doe").email("old@x.com").build());
            emails.replaceForContact("a", List.of("new@x.com"));
            phones.replaceForContact("a", List.of());
            assertEquals(List.of("new@x.com"), emails.findByContact("a"));
            assertEquals(1, emails.count());
            assertEquals(0, phones.count());
        }
    }
}
