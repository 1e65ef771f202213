package com.contact.resolution.similarity;

/**
 * Strategy for assigning contacts to comparison blocks.
 * Only contacts sharing a block key are compared pairwise, so a coarser key trades
 * comparison cost for recall.
 */
public interface BlockingKeyStrategy {

    /**
     * Computes the block key for a surname.
     *
     * @param surname trimmed, non-empty surname
     * @return block key (never null)
     */
    String blockingKey(String surname);
}
