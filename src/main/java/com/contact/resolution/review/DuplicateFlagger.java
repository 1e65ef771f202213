package com.contact.resolution.review;

import com.contact.resolution.config.DetectionOptions;
import com.contact.resolution.core.model.ContactRecord;
import com.contact.resolution.core.model.DuplicateCluster;
import com.contact.resolution.detect.DetectionResult;
import com.contact.resolution.detect.DuplicateDetectionService;
import com.contact.resolution.logging.LogContext;
import com.contact.resolution.store.ContactRepository;
import com.contact.resolution.store.StoreConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Marks duplicate clusters for human review by giving their contacts a shared group id.
 *
 * <p>Each pass first clears the group id of every contact that has not been reviewed, then
 * re-runs detection at the batch threshold and assigns a fresh short id to the unreviewed
 * members of every cluster. Reviewed contacts keep their group, outcome and primary; a cluster
 * with fewer than two unreviewed members gets no group.</p>
 */
public class DuplicateFlagger {
    private static final Logger log = LoggerFactory.getLogger(DuplicateFlagger.class);

    private static final int GROUP_ID_LENGTH = 8;

    private final StoreConnection connection;
    private final ContactRepository contactRepository;
    private final DuplicateDetectionService detectionService;
    private final DetectionOptions options;
    private final Supplier<String> groupIdGenerator;

    public DuplicateFlagger(StoreConnection connection, ContactRepository contactRepository,
                            DuplicateDetectionService detectionService, DetectionOptions options) {
        this(connection, contactRepository, detectionService, options, DuplicateFlagger::randomGroupId);
    }

    public DuplicateFlagger(StoreConnection connection, ContactRepository contactRepository,
                            DuplicateDetectionService detectionService, DetectionOptions options,
                            Supplier<String> groupIdGenerator) {
        this.connection = connection;
        this.contactRepository = contactRepository;
        this.detectionService = detectionService;
        this.options = options;
        this.groupIdGenerator = groupIdGenerator;
    }

    public FlagResult flag() {
        try (LogContext logCtx = LogContext.forFlag(LogContext.generateCorrelationId())) {
            log.info("flag.starting threshold={}", options.getBatchThreshold());

            FlagResult result = connection.inTransaction(() -> {
                int cleared = contactRepository.clearUnresolvedGroups();
                List<ContactRecord> all = contactRepository.findAll();
                Set<String> reviewed = all.stream()
                        .filter(c -> c.getDuplicateGroup().isReviewed())
                        .map(ContactRecord::getId)
                        .collect(Collectors.toSet());
                DetectionResult detection = detectionService.detect(all, options.getBatchThreshold());

                int groups = 0;
                int flagged = 0;
                for (DuplicateCluster cluster : detection.clusters()) {
                    List<String> members = cluster.contactIds().stream()
                            .filter(id -> !reviewed.contains(id))
                            .sorted()
                            .toList();
                    if (members.size() < 2) {
                        log.debug("flag.skipped contacts={} reason=members already reviewed", cluster.contactIds());
                        continue;
                    }
                    String groupId = groupIdGenerator.get();
                    flagged += contactRepository.assignGroup(groupId, members);
                    groups++;
                    log.debug("flag.group groupId={} members={}", groupId, members);
                }
                return new FlagResult(cleared, detection.signals().size(), groups, flagged);
            });

            log.info("flag.completed cleared={} signals={} groups={} flagged={}",
                    result.groupsCleared(), result.signals(), result.clusters(), result.contactsFlagged());
            return result;
        }
    }

    static String randomGroupId() {
        return UUID.randomUUID().toString().substring(0, GROUP_ID_LENGTH);
    }
}
