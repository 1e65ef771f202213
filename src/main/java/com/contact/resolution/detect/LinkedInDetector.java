package com.contact.resolution.detect;

import com.contact.resolution.core.model.ContactRecord;
import com.contact.resolution.core.model.MatchType;
import com.contact.resolution.fingerprint.FingerprintEngine;

import java.util.Collection;
import java.util.List;

/**
 * Contacts pointing at the same LinkedIn profile once the URL is normalized.
 */
public class LinkedInDetector extends KeyGroupingDetector {

    private final FingerprintEngine fingerprintEngine;

    public LinkedInDetector(FingerprintEngine fingerprintEngine) {
        this.fingerprintEngine = fingerprintEngine;
    }

    @Override
    public MatchType matchType() {
        return MatchType.LINKEDIN;
    }

    @Override
    protected Collection<String> keysFor(ContactRecord contact) {
        String normalized = fingerprintEngine.normalizeLinkedin(contact.getLinkedin());
        return normalized.isEmpty() ? List.of() : List.of(normalized);
    }
}
