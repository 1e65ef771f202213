package com.contact.resolution.detect;

import com.contact.resolution.core.model.ContactRecord;
import com.contact.resolution.core.model.MatchType;
import com.contact.resolution.fingerprint.FingerprintEngine;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Contacts whose full names have the same fingerprint: reordered ("Cruise, Tom"),
 * accented ("José García") and punctuated ("O'Brien") variants all match.
 */
public class FingerprintNameDetector extends KeyGroupingDetector {

    private final FingerprintEngine fingerprintEngine;

    public FingerprintNameDetector(FingerprintEngine fingerprintEngine) {
        this.fingerprintEngine = fingerprintEngine;
    }

    @Override
    public MatchType matchType() {
        return MatchType.FINGERPRINT_NAME;
    }

    @Override
    protected Collection<String> keysFor(ContactRecord contact) {
        if (isBlank(contact.getFirstName()) || isBlank(contact.getLastName())) {
            return List.of();
        }
        String key = fingerprintEngine.fingerprint(contact.getFullName());
        return key.isEmpty() ? List.of() : List.of(key);
    }

    @Override
    protected String describe(String key, List<ContactRecord> members) {
        return key + " (" + members.stream()
                .map(ContactRecord::getFullName)
                .collect(Collectors.joining(", ")) + ")";
    }
}
