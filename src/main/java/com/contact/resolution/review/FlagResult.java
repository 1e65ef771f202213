package com.contact.resolution.review;

/**
 * Result of a flagging pass.
 *
 * @param groupsCleared    contacts whose unreviewed group id was cleared first
 * @param signals          match signals found
 * @param clusters         duplicate groups created
 * @param contactsFlagged  contacts assigned to a group
 */
public record FlagResult(int groupsCleared, int signals, int clusters, int contactsFlagged) {

    @Override
    public String toString() {
        return "FlagResult{cleared=" + groupsCleared +
                ", signals=" + signals +
                ", clusters=" + clusters +
                ", flagged=" + contactsFlagged + '}';
    }
}
