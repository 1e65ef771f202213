package com.contact.resolution.fingerprint;

import com.google.i18n.phonenumbers.NumberParseException;
import com.google.i18n.phonenumbers.PhoneNumberUtil;
import com.google.i18n.phonenumbers.Phonenumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Phone number keys. {@link #normalize(String)} is the cheap digits-only key used for
 * exact phone matching; {@link #normalizeE164(String, String, boolean)} parses against the
 * numbering plan via libphonenumber.
 */
public class PhoneNormalizer {
    private static final Logger log = LoggerFactory.getLogger(PhoneNormalizer.class);

    public static final String DEFAULT_REGION = "US";

    private static final Pattern US_COUNTRY_PREFIX = Pattern.compile("^\\+1\\s*");
    private static final Pattern NON_DIGITS = Pattern.compile("\\D");

    private final PhoneNumberUtil phoneNumberUtil = PhoneNumberUtil.getInstance();
    private final String defaultRegion;

    public PhoneNormalizer() {
        this(DEFAULT_REGION);
    }

    public PhoneNormalizer(String defaultRegion) {
        this.defaultRegion = defaultRegion;
    }

    /**
     * Strips a leading "+1" and then every non-digit: "(555) 123-4567" and "+1 555-123-4567"
     * both become "5551234567".
     */
    public String normalize(String phone) {
        if (phone == null) {
            return "";
        }
        String withoutPrefix = US_COUNTRY_PREFIX.matcher(phone).replaceFirst("");
        return NON_DIGITS.matcher(withoutPrefix).replaceAll("");
    }

    public String normalizeE164(String phone) {
        return normalizeE164(phone, defaultRegion, false);
    }

    /**
     * Formats a number as E.164 ({@code +442079460958}).
     *
     * @param phone         raw number
     * @param defaultRegion ISO region used for numbers without a country code
     * @param strict        when true, numbers that do not parse or are not valid in the
     *                      numbering plan yield an empty string; when false, parse failures
     *                      fall back to {@link #normalize(String)}
     */
    public String normalizeE164(String phone, String defaultRegion, boolean strict) {
        if (phone == null || phone.isBlank()) {
            return "";
        }
        try {
            Phonenumber.PhoneNumber parsed = phoneNumberUtil.parse(phone.strip(), defaultRegion);
            if (strict && !phoneNumberUtil.isValidNumber(parsed)) {
                return "";
            }
            return phoneNumberUtil.format(parsed, PhoneNumberUtil.PhoneNumberFormat.E164);
        } catch (NumberParseException e) {
            log.debug("Could not parse phone '{}' for region {}: {}", phone, defaultRegion, e.getMessage());
            return strict ? "" : normalize(phone);
        }
    }
}
