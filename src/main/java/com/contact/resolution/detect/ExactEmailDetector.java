package com.contact.resolution.detect;

import com.contact.resolution.core.model.ContactRecord;
import com.contact.resolution.core.model.MatchType;
import com.contact.resolution.fingerprint.FingerprintEngine;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Contacts sharing an email address, compared case-insensitively.
 */
public class ExactEmailDetector extends KeyGroupingDetector {

    @Override
    public MatchType matchType() {
        return MatchType.EMAIL;
    }

    @Override
    protected Collection<String> keysFor(ContactRecord contact) {
        Set<String> keys = new LinkedHashSet<>();
        for (String email : contact.getEmails()) {
            if (!isBlank(email)) {
                keys.add(FingerprintEngine.emailKey(email));
            }
        }
        return keys;
    }
}
