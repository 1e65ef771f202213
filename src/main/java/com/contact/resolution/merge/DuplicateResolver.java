package com.contact.resolution.merge;

import com.contact.resolution.config.DetectionOptions;
import com.contact.resolution.core.model.ContactRecord;
import com.contact.resolution.core.model.DuplicateCluster;
import com.contact.resolution.core.model.DuplicateGroup;
import com.contact.resolution.core.model.DuplicateResolution;
import com.contact.resolution.detect.DetectionResult;
import com.contact.resolution.detect.DuplicateDetectionService;
import com.contact.resolution.store.ContactRepository;
import com.contact.resolution.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Batch resolution: merges duplicate clusters into single contacts.
 *
 * <p>{@link #resolveAll()} merges whatever detection finds at the batch threshold without
 * review. {@link #resolveConfirmed()} merges only groups a reviewer confirmed, into the
 * primary the reviewer chose. A cluster whose merge fails is rolled back, logged and skipped.</p>
 */
public class DuplicateResolver {
    private static final Logger log = LoggerFactory.getLogger(DuplicateResolver.class);

    private final ContactRepository contactRepository;
    private final DuplicateDetectionService detectionService;
    private final ContactMerger merger;
    private final DetectionOptions options;

    public DuplicateResolver(ContactRepository contactRepository, DuplicateDetectionService detectionService,
                             ContactMerger merger, DetectionOptions options) {
        this.contactRepository = contactRepository;
        this.detectionService = detectionService;
        this.merger = merger;
        this.options = options;
    }

    public ResolutionReport resolveAll() {
        long before = contactRepository.count();
        log.info("resolve.starting contacts={} threshold={}", before, options.getBatchThreshold());

        DetectionResult detection = detectionService.detect(contactRepository.findAll(), options.getBatchThreshold());
        int merged = 0;
        int failed = 0;
        for (DuplicateCluster cluster : detection.clusters()) {
            if (tryMerge(cluster.contactIds().stream().sorted().toList(), null)) {
                merged++;
            } else {
                failed++;
            }
        }
        return report(before, merged, failed);
    }

    public ResolutionReport resolveConfirmed() {
        long before = contactRepository.count();
        List<DuplicateGroup> confirmed = contactRepository.findGroupsByResolution(DuplicateResolution.CONFIRMED);
        log.info("resolve.starting contacts={} confirmedGroups={}", before, confirmed.size());

        int merged = 0;
        int failed = 0;
        for (DuplicateGroup group : confirmed) {
            List<String> members = confirmedMembers(group.groupId());
            if (members.size() < 2) {
                log.debug("resolve.skipped groupId={} reason=already merged", group.groupId());
                continue;
            }
            if (tryMerge(members, group.primaryContactId())) {
                merged++;
            } else {
                failed++;
            }
        }
        return report(before, merged, failed);
    }

    /**
     * Members of the group that carry the confirmed outcome themselves. A contact added to the
     * group after the review waits for its own.
     */
    private List<String> confirmedMembers(String groupId) {
        return contactRepository.findByIds(contactRepository.findGroupMembers(groupId)).stream()
                .filter(c -> c.getDuplicateGroup().resolution() == DuplicateResolution.CONFIRMED)
                .map(ContactRecord::getId)
                .toList();
    }

    private boolean tryMerge(List<String> contactIds, String primaryContactId) {
        try {
            merger.merge(contactIds, primaryContactId);
            return true;
        } catch (IllegalArgumentException | StoreException e) {
            log.error("resolve.cluster_failed contacts={} error={}", contactIds, e.getMessage());
            return false;
        }
    }

    private ResolutionReport report(long before, int merged, int failed) {
        ResolutionReport report = new ResolutionReport(before, contactRepository.count(), merged, failed);
        log.info("resolve.completed before={} after={} merged={} failed={}",
                report.contactsBefore(), report.contactsAfter(), merged, failed);
        return report;
    }
}
