package com.shareledger.chain;

/**
 * Source of the current block height.
 *
 * In production, this would be backed by the consensus layer that sequences calls.
 */
public interface BlockHeightProvider {

    /**
     * Get the height at which the next call executes.
     */
    long currentHeight();

    /**
     * Advance the chain by the given number of blocks.
     *
     * @param blocks number of blocks to advance, must be positive
     * @return the new current height
     */
    long advance(long blocks);
}
