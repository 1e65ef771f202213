package com.contact.resolution.sync;

/**
 * Upstream source of contact records, read with offset pagination.
 * Implementations may be called from several threads at once.
 */
public interface ContactPageSource {

    /**
     * Fetches contacts {@code [offset, offset + limit)}.
     *
     * @throws ContactSourceException if the page cannot be fetched
     */
    ContactPage fetchPage(long offset, int limit);
}
