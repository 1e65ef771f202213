package com.contact.resolution.sync;

/**
 * Result of an incremental sync run.
 *
 * @param added       records inserted
 * @param updated     records whose content hash changed
 * @param unchanged   records skipped because their hash matched
 * @param failedPages page fetches that failed
 * @param interrupted whether the run was stopped before all pages were fetched
 */
public record SyncResult(long added, long updated, long unchanged, long failedPages, boolean interrupted) {

    public static SyncResult empty() {
        return new SyncResult(0, 0, 0, 0, false);
    }

    public long recordsProcessed() {
        return added + updated + unchanged;
    }

    public boolean hasFailures() {
        return failedPages > 0;
    }

    @Override
    public String toString() {
        return "SyncResult{added=" + added +
                ", updated=" + updated +
                ", unchanged=" + unchanged +
                ", failedPages=" + failedPages +
                ", interrupted=" + interrupted + '}';
    }
}
