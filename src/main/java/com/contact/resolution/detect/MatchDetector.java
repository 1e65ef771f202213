package com.contact.resolution.detect;

import com.contact.resolution.core.model.ContactRecord;
import com.contact.resolution.core.model.MatchSignal;
import com.contact.resolution.core.model.MatchType;

import java.util.List;

/**
 * One read-only duplicate detection pass over a snapshot of the contact store.
 * Implementations are stateless and skip malformed records instead of failing the pass.
 */
public interface MatchDetector {

    MatchType matchType();

    /**
     * Finds groups of contacts sharing this detector's kind of evidence.
     *
     * @param contacts snapshot of the stored contacts
     * @return one signal per group of two or more distinct contacts
     */
    List<MatchSignal> detect(List<ContactRecord> contacts);
}
