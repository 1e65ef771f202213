package com.contact.resolution.sync;

/**
 * Callback for tracking progress of a sync run.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called after each page has been applied or counted as failed.
     *
     * @param processed pages handled so far
     * @param total     pages planned for the run
     * @param message   running totals
     */
    void onProgress(long processed, long total, String message);

    /**
     * A no-op progress callback.
     */
    ProgressCallback NOOP = (processed, total, message) -> {};
}
