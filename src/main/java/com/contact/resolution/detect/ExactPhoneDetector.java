package com.contact.resolution.detect;

import com.contact.resolution.core.model.ContactRecord;
import com.contact.resolution.core.model.MatchType;
import com.contact.resolution.core.model.PhoneEntry;
import com.contact.resolution.fingerprint.FingerprintEngine;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Contacts sharing a phone number once formatting and a leading +1 are stripped.
 */
public class ExactPhoneDetector extends KeyGroupingDetector {

    private final FingerprintEngine fingerprintEngine;

    public ExactPhoneDetector(FingerprintEngine fingerprintEngine) {
        this.fingerprintEngine = fingerprintEngine;
    }

    @Override
    public MatchType matchType() {
        return MatchType.PHONE;
    }

    @Override
    protected Collection<String> keysFor(ContactRecord contact) {
        Set<String> keys = new LinkedHashSet<>();
        for (PhoneEntry phone : contact.getPhones()) {
            String normalized = fingerprintEngine.normalizePhone(phone.number());
            if (!normalized.isEmpty()) {
                keys.add(normalized);
            }
        }
        return keys;
    }
}
