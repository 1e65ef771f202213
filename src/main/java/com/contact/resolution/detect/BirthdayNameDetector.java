package com.contact.resolution.detect;

import com.contact.resolution.core.model.ContactRecord;
import com.contact.resolution.core.model.MatchType;

import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Contacts with the same first and last name born on the same month and day.
 *
 * <p>The year is ignored because many CRMs store the entry date's year there.
 * Birthdays starting with the placeholder date are never evidence. The month and day are
 * compared as written, without calendar validation, so "02-30" groups with "02-30".</p>
 */
public class BirthdayNameDetector extends KeyGroupingDetector {

    private static final Pattern YEAR_MONTH_DAY = Pattern.compile("\\d{4}-(\\d{2}-\\d{2})");

    private final String placeholderBirthday;

    public BirthdayNameDetector(String placeholderBirthday) {
        this.placeholderBirthday = placeholderBirthday;
    }

    @Override
    public MatchType matchType() {
        return MatchType.BIRTHDAY_NAME;
    }

    @Override
    protected Collection<String> keysFor(ContactRecord contact) {
        String birthday = contact.getBirthday();
        if (isBlank(birthday) || isBlank(contact.getFirstName()) || isBlank(contact.getLastName())) {
            return List.of();
        }
        if (placeholderBirthday != null && birthday.startsWith(placeholderBirthday)) {
            return List.of();
        }
        Matcher matcher = YEAR_MONTH_DAY.matcher(birthday);
        if (!matcher.lookingAt()) {
            return List.of();
        }
        String monthDay = matcher.group(1);
        return List.of(fold(contact.getFirstName()) + " " + fold(contact.getLastName())
                + " (birthday: " + monthDay + ")");
    }
}
