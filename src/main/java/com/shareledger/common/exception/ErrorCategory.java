package com.shareledger.common.exception;

/**
 * Failure taxonomy shared by every ledger operation.
 */
public enum ErrorCategory {
    /**
     * Caller is not allowed to perform the operation.
     */
    AUTHORIZATION,

    /**
     * Referenced asset, proposal or record does not exist.
     */
    NOT_FOUND,

    /**
     * Numeric or text argument out of range.
     */
    INVALID_INPUT,

    /**
     * Operation conflicts with recorded state (double vote, closed poll, re-finalization).
     */
    STATE_CONFLICT,

    /**
     * Price or compliance record is no longer fresh.
     */
    STALE_DATA
}
