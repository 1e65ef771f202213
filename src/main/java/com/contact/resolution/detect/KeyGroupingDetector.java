package com.contact.resolution.detect;

import com.contact.resolution.core.model.ContactRecord;
import com.contact.resolution.core.model.MatchSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Base for detectors that group contacts by an exact key. A contact may yield several
 * keys (one per email address, say); every key shared by two or more distinct contacts
 * becomes a signal.
 */
abstract class KeyGroupingDetector implements MatchDetector {
    private static final Logger log = LoggerFactory.getLogger(KeyGroupingDetector.class);

    /**
     * Grouping keys of a contact; empty when the contact has nothing to match on.
     */
    protected abstract Collection<String> keysFor(ContactRecord contact);

    /**
     * Diagnostic match value of a group.
     */
    protected String describe(String key, List<ContactRecord> members) {
        return key;
    }

    @Override
    public List<MatchSignal> detect(List<ContactRecord> contacts) {
        Map<String, Map<String, ContactRecord>> groups = new LinkedHashMap<>();
        for (ContactRecord contact : contacts) {
            Collection<String> keys;
            try {
                keys = keysFor(contact);
            } catch (RuntimeException e) {
                log.debug("detect.skipped matchType={} contactId={} reason={}",
                        matchType().code(), contact.getId(), e.getMessage());
                continue;
            }
            for (String key : keys) {
                groups.computeIfAbsent(key, k -> new LinkedHashMap<>()).putIfAbsent(contact.getId(), contact);
            }
        }

        List<MatchSignal> signals = new ArrayList<>();
        for (Map.Entry<String, Map<String, ContactRecord>> group : groups.entrySet()) {
            Map<String, ContactRecord> members = group.getValue();
            if (members.size() > 1) {
                signals.add(new MatchSignal(matchType(),
                        describe(group.getKey(), new ArrayList<>(members.values())),
                        new ArrayList<>(members.keySet())));
            }
        }
        log.debug("detect.completed matchType={} signals={}", matchType().code(), signals.size());
        return signals;
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static String fold(String value) {
        return value.strip().toLowerCase(Locale.ROOT);
    }
}
