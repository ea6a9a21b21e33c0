package com.shareledger.common.exception;

/**
 * Thrown when the caller is not allowed to perform an operation.
 */
public class NotAuthorizedException extends ShareLedgerException {

    public NotAuthorizedException(ErrorCode errorCode, String caller, String operation) {
        super(errorCode, String.format("Caller %s is not allowed to %s", caller, operation));
    }

    public static NotAuthorizedException ownerOnly(String caller, String operation) {
        return new NotAuthorizedException(ErrorCode.OWNER_ONLY, caller, operation);
    }

    public static NotAuthorizedException notAuthorized(String caller, String operation) {
        return new NotAuthorizedException(ErrorCode.NOT_AUTHORIZED, caller, operation);
    }

    public static NotAuthorizedException kycRequired(String caller, String operation) {
        return new NotAuthorizedException(ErrorCode.KYC_REQUIRED, caller, operation);
    }
}
