package com.shareledger.common.exception;

/**
 * Thrown when an operation conflicts with recorded state, such as a second vote
 * from the same voter or a vote after the poll closed.
 */
public class StateConflictException extends ShareLedgerException {

    public StateConflictException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
