package com.shareledger.common.exception;

/**
 * Thrown when a numeric or text argument is out of range.
 */
public class InvalidInputException extends ShareLedgerException {

    public InvalidInputException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
