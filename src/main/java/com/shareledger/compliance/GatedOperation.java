package com.shareledger.compliance;

/**
 * Operations that require the acting (or receiving) address to hold a current attestation.
 *
 * Tokenization is not listed: it is restricted to the registrar instead.
 */
public enum GatedOperation {
    /**
     * Caller of initiateProposal.
     */
    PROPOSE,

    /**
     * Caller of castVote.
     */
    VOTE,

    /**
     * Caller of harvestDividends.
     */
    HARVEST,

    /**
     * Recipient of transferShares.
     */
    RECEIVE_SHARES
}
