package com.contact.resolution.config;

/**
 * Paging and concurrency settings for an incremental sync.
 *
 * @param pageSize       contacts requested per upstream page
 * @param maxConcurrency upper bound on page fetches in flight at once
 * @param chunkSize      pages fetched together before their results are applied
 */
public record SyncOptions(int pageSize, int maxConcurrency, int chunkSize) {

    public static final int DEFAULT_PAGE_SIZE = 100;
    public static final int DEFAULT_MAX_CONCURRENCY = 5;

    public SyncOptions {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be at least 1");
        }
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be at least 1");
        }
    }

    public static SyncOptions defaults() {
        return of(DEFAULT_PAGE_SIZE, DEFAULT_MAX_CONCURRENCY);
    }

    /**
     * Options with the chunk size derived as twice the concurrency.
     */
    public static SyncOptions of(int pageSize, int maxConcurrency) {
        return new SyncOptions(pageSize, maxConcurrency, maxConcurrency * 2);
    }
}
