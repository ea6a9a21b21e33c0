package com.shareledger.common;

/**
 * Protocol constants. Changing any of these changes the meaning of recorded state.
 */
public final class LedgerConstants {

    /**
     * Shares minted for every tokenized asset. Never burned or re-minted.
     */
    public static final long SUPPLY_PER_ASSET = 100_000L;

    public static final long MIN_VALUE = 1_000L;
    public static final long MAX_VALUE = 1_000_000_000_000L;

    /**
     * Voting window bounds, in blocks.
     */
    public static final long MIN_DURATION = 12L;
    public static final long MAX_DURATION = 144L;

    public static final int MAX_KYC_LEVEL = 5;
    public static final long MAX_EXPIRY_BLOCKS = 52_560L;

    public static final int MAX_TEXT_LENGTH = 256;

    /**
     * A proposer must hold at least SUPPLY_PER_ASSET / PROPOSAL_OWNERSHIP_DIVISOR shares.
     */
    public static final long PROPOSAL_OWNERSHIP_DIVISOR = 10L;

    public static final int MAX_PRICE_DECIMALS = 18;

    private LedgerConstants() {
    }

    public static long proposalOwnershipMinimum() {
        return SUPPLY_PER_ASSET / PROPOSAL_OWNERSHIP_DIVISOR;
    }
}
