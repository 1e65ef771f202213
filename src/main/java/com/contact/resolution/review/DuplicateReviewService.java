package com.contact.resolution.review;

import com.contact.resolution.core.model.ContactRecord;
import com.contact.resolution.core.model.DuplicateGroup;
import com.contact.resolution.core.model.DuplicateResolution;
import com.contact.resolution.store.ContactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Records reviewer decisions on flagged duplicate groups.
 * Decisions apply to every member of the group and survive later syncs.
 */
public class DuplicateReviewService {
    private static final Logger log = LoggerFactory.getLogger(DuplicateReviewService.class);

    private final ContactRepository contactRepository;

    public DuplicateReviewService(ContactRepository contactRepository) {
        this.contactRepository = contactRepository;
    }

    /**
     * Group ids flagged and not reviewed yet.
     */
    public List<String> pendingGroups() {
        return contactRepository.findGroupsByResolution(DuplicateResolution.UNSET).stream()
                .map(DuplicateGroup::groupId)
                .toList();
    }

    /**
     * The contacts of a group, for display to the reviewer.
     */
    public List<ContactRecord> groupMembers(String groupId) {
        return contactRepository.findByIds(requireMembers(groupId));
    }

    /**
     * Confirms the group as duplicates of one person, to be merged into {@code primaryContactId}.
     *
     * @return contacts updated
     * @throws IllegalArgumentException if the group is unknown or the primary is not a member
     */
    public int confirm(String groupId, String primaryContactId) {
        List<String> members = requireMembers(groupId);
        if (!members.contains(primaryContactId)) {
            throw new IllegalArgumentException(
                    "Primary contact " + primaryContactId + " is not a member of group " + groupId);
        }
        int updated = contactRepository.setResolution(groupId, DuplicateResolution.CONFIRMED, primaryContactId);
        log.info("review.confirmed groupId={} primaryContactId={} members={}", groupId, primaryContactId, updated);
        return updated;
    }

    /**
     * Marks the group as different people; it will never be merged.
     *
     * @return contacts updated
     * @throws IllegalArgumentException if the group is unknown
     */
    public int markFalsePositive(String groupId) {
        requireMembers(groupId);
        int updated = contactRepository.setResolution(groupId, DuplicateResolution.FALSE_POSITIVE, null);
        log.info("review.false_positive groupId={} members={}", groupId, updated);
        return updated;
    }

    private List<String> requireMembers(String groupId) {
        List<String> members = contactRepository.findGroupMembers(groupId);
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Unknown duplicate group: " + groupId);
        }
        return members;
    }
}
