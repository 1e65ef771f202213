package com.contact.resolution.fingerprint;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reduces the many ways a LinkedIn profile gets written down to one key.
 *
 * <p>Accepted inputs:</p>
 * <ul>
 *   <li>full URLs with any scheme and {@code www.}, {@code m.} or locale subdomains</li>
 *   <li>paths such as {@code in/johndoe} or {@code company/acme}</li>
 *   <li>bare usernames such as {@code johndoe}</li>
 * </ul>
 * Query strings, fragments and trailing slashes are dropped and the result is lowercased,
 * e.g. {@code linkedin.com/in/johndoe}. Anything else, including the bare LinkedIn homepage
 * and other sites, yields an empty string.
 */
public class LinkedInNormalizer {

    private static final String HOST = "linkedin.com";
    private static final Pattern SCHEME = Pattern.compile("^[a-z][a-z0-9+.-]*://");
    private static final Pattern BARE_USERNAME = Pattern.compile("^[a-z0-9_%-]+$");

    public String normalize(String url) {
        if (url == null) {
            return "";
        }
        String value = url.strip().toLowerCase(Locale.ROOT);
        value = cutAt(value, '?');
        value = cutAt(value, '#');
        value = SCHEME.matcher(value).replaceFirst("");
        if (value.isEmpty()) {
            return "";
        }

        String path;
        int slash = value.indexOf('/');
        String host = slash >= 0 ? value.substring(0, slash) : value;
        if (host.equals(HOST) || host.endsWith("." + HOST)) {
            path = slash >= 0 ? value.substring(slash) : "";
        } else if (value.startsWith("in/") || value.startsWith("company/")
                || value.startsWith("/in/") || value.startsWith("/company/")) {
            path = value;
        } else {
            String username = trimSlashes(value);
            return BARE_USERNAME.matcher(username).matches() ? HOST + "/in/" + username : "";
        }

        String[] segments = trimSlashes(path).split("/+");
        if (segments.length < 2) {
            return "";
        }
        String kind = segments[0];
        String slug = segments[1];
        if (!(kind.equals("in") || kind.equals("company")) || slug.isEmpty()) {
            return "";
        }
        return HOST + "/" + kind + "/" + slug;
    }

    private static String cutAt(String value, char delimiter) {
        int index = value.indexOf(delimiter);
        return index >= 0 ? value.substring(0, index) : value;
    }

    private static String trimSlashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end);
    }
}
