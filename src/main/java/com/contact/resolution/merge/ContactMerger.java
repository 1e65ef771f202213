package com.contact.resolution.merge;

import com.contact.resolution.core.model.ContactRecord;
import com.contact.resolution.core.model.DuplicateCluster;
import com.contact.resolution.logging.LogContext;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.metrics.NoOpMetricsService;
import com.contact.resolution.store.ContactRepository;
import com.contact.resolution.store.EmailRepository;
import com.contact.resolution.store.PhoneRepository;
import com.contact.resolution.store.StoreConnection;
import com.contact.resolution.store.StoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Consolidates a cluster of duplicate contacts into one surviving primary.
 *
 * Merge process:
 * 1. Primary selection: the explicit primary, or the most complete member
 * 2. Fill-forward: empty primary fields take the first non-empty value of the other members
 * 3. Child consolidation: email and phone rows move to the primary and are de-duplicated
 * 4. Deletion of the non-primary contact rows
 *
 * All steps run in one store transaction.
 */
public class ContactMerger {
    private static final Logger log = LoggerFactory.getLogger(ContactMerger.class);

    private static final Comparator<ContactRecord> MOST_COMPLETE_FIRST =
            Comparator.comparingInt(ContactRecord::completeness).reversed()
                    .thenComparing(ContactRecord::getId);

    private final StoreConnection connection;
    private final ContactRepository contactRepository;
    private final EmailRepository emailRepository;
    private final PhoneRepository phoneRepository;
    private final MetricsService metricsService;

    public ContactMerger(StoreConnection connection) {
        this(connection, new ContactRepository(connection), new EmailRepository(connection),
                new PhoneRepository(connection), new NoOpMetricsService());
    }

    public ContactMerger(StoreConnection connection,
                         ContactRepository contactRepository,
                         EmailRepository emailRepository,
                         PhoneRepository phoneRepository,
                         MetricsService metricsService) {
        this.connection = connection;
        this.contactRepository = contactRepository;
        this.emailRepository = emailRepository;
        this.phoneRepository = phoneRepository;
        this.metricsService = metricsService;
    }

    public MergeResult merge(DuplicateCluster cluster) {
        return merge(cluster.contactIds(), null);
    }

    /**
     * Merges the contacts into one.
     *
     * @param contactIds       ids of the cluster
     * @param explicitPrimaryId surviving contact chosen by a reviewer, or null to pick the most complete one
     * @return the merge result
     * @throws IllegalArgumentException if no ids are given, none of them is stored, or the
     *                                  explicit primary is not a stored member of the cluster
     */
    public MergeResult merge(Collection<String> contactIds, String explicitPrimaryId) {
        if (contactIds == null || contactIds.isEmpty()) {
            throw new IllegalArgumentException("No contact IDs provided");
        }
        Set<String> ids = new LinkedHashSet<>(contactIds);
        if (explicitPrimaryId != null && !ids.contains(explicitPrimaryId)) {
            throw new IllegalArgumentException("Primary ID " + explicitPrimaryId + " is not in the contact cluster");
        }

        try (LogContext logCtx = LogContext.forMerge(LogContext.generateCorrelationId(), explicitPrimaryId)) {
            long started = System.nanoTime();
            log.info("merge.starting contacts={} explicitPrimary={}", ids.size(), explicitPrimaryId != null);

            List<ContactRecord> stored = contactRepository.findByIds(ids);
            if (stored.isEmpty()) {
                throw new IllegalArgumentException("Contacts not found in store: " + ids);
            }

            ContactRecord primary = selectPrimary(stored, explicitPrimaryId);
            List<ContactRecord> others = stored.stream()
                    .filter(c -> !c.getId().equals(primary.getId()))
                    .sorted(MOST_COMPLETE_FIRST)
                    .toList();
            ContactRecord merged = fillForward(primary, others);
            List<String> mergedIds = others.stream().map(ContactRecord::getId).toList();
            List<String> removableIds = ids.stream().filter(id -> !id.equals(primary.getId())).toList();

            Map<ChildRelation, Integer> removedRows = new EnumMap<>(ChildRelation.class);
            try (StoreTransaction tx = connection.beginTransaction()) {
                tx.execute("fill forward primary fields", () -> contactRepository.updateScalarFields(merged));
                for (ChildRelation relation : ChildRelation.values()) {
                    tx.execute("consolidate " + relation.name().toLowerCase(Locale.ROOT),
                            () -> removedRows.put(relation, consolidate(relation, ids, primary.getId())));
                }
                tx.execute("delete merged contacts", () -> contactRepository.deleteByIds(removableIds));
                tx.markSuccess();
            } catch (RuntimeException e) {
                log.error("merge.failed primaryId={} error={}", primary.getId(), e.getMessage());
                throw e;
            }

            metricsService.incrementContactsMerged(mergedIds.size());
            metricsService.recordMergeDuration(Duration.ofNanos(System.nanoTime() - started));
            log.info("merge.completed primaryId={} removed={} emailRowsRemoved={} phoneRowsRemoved={}",
                    primary.getId(), mergedIds.size(),
                    removedRows.get(ChildRelation.EMAILS), removedRows.get(ChildRelation.PHONES));

            return new MergeResult(primary.getId(), mergedIds,
                    removedRows.get(ChildRelation.EMAILS), removedRows.get(ChildRelation.PHONES));
        }
    }

    /**
     * The explicit primary if given, else the member with the most non-empty fields,
     * ties going to the lexicographically smallest id.
     */
    ContactRecord selectPrimary(List<ContactRecord> stored, String explicitPrimaryId) {
        if (explicitPrimaryId != null) {
            Optional<ContactRecord> primary = stored.stream()
                    .filter(c -> c.getId().equals(explicitPrimaryId))
                    .findFirst();
            return primary.orElseThrow(() -> new IllegalArgumentException(
                    "Primary ID " + explicitPrimaryId + " not found in store"));
        }
        return stored.stream().sorted(MOST_COMPLETE_FIRST).findFirst().orElseThrow();
    }

    /**
     * Keeps every non-empty primary field and fills each empty one from the first
     * other member that has it. The source snapshot and its hash travel together.
     */
    ContactRecord fillForward(ContactRecord primary, List<ContactRecord> others) {
        ContactRecord.Builder merged = primary.toBuilder()
                .firstName(coalesce(primary, others, ContactRecord::getFirstName))
                .lastName(coalesce(primary, others, ContactRecord::getLastName))
                .jobTitle(coalesce(primary, others, ContactRecord::getJobTitle))
                .linkedin(coalesce(primary, others, ContactRecord::getLinkedin))
                .website(coalesce(primary, others, ContactRecord::getWebsite))
                .birthday(coalesce(primary, others, ContactRecord::getBirthday));

        if (isEmpty(primary.getFullData())) {
            for (ContactRecord other : others) {
                if (!isEmpty(other.getFullData())) {
                    merged.fullData(other.getFullData()).recordHash(other.getRecordHash());
                    break;
                }
            }
        }
        return merged.build();
    }

    private int consolidate(ChildRelation relation, Collection<String> clusterIds, String primaryId) {
        return switch (relation) {
            case EMAILS -> consolidateEmails(clusterIds, primaryId);
            case PHONES -> consolidatePhones(clusterIds, primaryId);
        };
    }

    private int consolidateEmails(Collection<String> clusterIds, String primaryId) {
        int moved = emailRepository.repointToPrimary(new ArrayList<>(clusterIds), primaryId);
        int removed = emailRepository.deduplicateForContact(primaryId);
        log.debug("Consolidated emails onto {}: moved={} removed={}", primaryId, moved, removed);
        return removed;
    }

    private int consolidatePhones(Collection<String> clusterIds, String primaryId) {
        int moved = phoneRepository.repointToPrimary(new ArrayList<>(clusterIds), primaryId);
        int removed = phoneRepository.deduplicateForContact(primaryId);
        log.debug("Consolidated phones onto {}: moved={} removed={}", primaryId, moved, removed);
        return removed;
    }

    private static String coalesce(ContactRecord primary, List<ContactRecord> others,
                                   Function<ContactRecord, String> field) {
        String value = field.apply(primary);
        if (!isEmpty(value)) {
            return value;
        }
        for (ContactRecord other : others) {
            String candidate = field.apply(other);
            if (!isEmpty(candidate)) {
                return candidate;
            }
        }
        return value;
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
