package com.contact.resolution.detect;

import com.contact.resolution.core.model.ContactRecord;
import com.contact.resolution.core.model.MatchType;

import java.util.Collection;
import java.util.List;

/**
 * Contacts with the same full name and the same job title, case-insensitive and trimmed.
 */
public class NameTitleDetector extends KeyGroupingDetector {

    @Override
    public MatchType matchType() {
        return MatchType.NAME_TITLE;
    }

    @Override
    protected Collection<String> keysFor(ContactRecord contact) {
        if (isBlank(contact.getFirstName()) || isBlank(contact.getLastName()) || isBlank(contact.getJobTitle())) {
            return List.of();
        }
        return List.of(fold(contact.getFirstName()) + " " + fold(contact.getLastName())
                + " | " + fold(contact.getJobTitle()));
    }
}
