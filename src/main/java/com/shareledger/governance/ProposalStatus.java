package com.shareledger.governance;

/**
 * Lifecycle states for a proposal. No transition skips a state.
 */
public enum ProposalStatus {
    /**
     * Accepting votes: current height is below the end height.
     */
    OPEN,

    /**
     * Voting window elapsed, waiting for finalization.
     */
    CLOSED,

    /**
     * Outcome evaluated and recorded. Terminal.
     */
    FINALIZED
}
