package com.shareledger.common.exception;

/**
 * Base exception for all share ledger exceptions.
 *
 * Every rejected call surfaces exactly one {@link ErrorCode}. Throwing from inside a
 * transactional service method rolls the whole call back.
 */
public class ShareLedgerException extends RuntimeException {

    private final ErrorCode errorCode;

    public ShareLedgerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public ErrorCategory getCategory() {
        return errorCode.getCategory();
    }
}
