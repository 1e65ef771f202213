package com.contact.resolution.merge;

/**
 * Result of a batch resolution pass.
 *
 * @param contactsBefore  stored contacts before the pass
 * @param contactsAfter   stored contacts after the pass
 * @param clustersMerged  clusters merged successfully
 * @param clustersFailed  clusters whose merge failed and was rolled back
 */
public record ResolutionReport(long contactsBefore, long contactsAfter, int clustersMerged, int clustersFailed) {

    public long contactsRemoved() {
        return contactsBefore - contactsAfter;
    }

    @Override
    public String toString() {
        return "ResolutionReport{before=" + contactsBefore +
                ", after=" + contactsAfter +
                ", merged=" + clustersMerged +
                ", failed=" + clustersFailed + '}';
    }
}
