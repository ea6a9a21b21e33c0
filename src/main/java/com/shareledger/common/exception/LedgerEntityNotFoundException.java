package com.shareledger.common.exception;

/**
 * Thrown when an asset, proposal or other keyed record is not found.
 */
public class LedgerEntityNotFoundException extends ShareLedgerException {

    public LedgerEntityNotFoundException(String entity, Object id) {
        super(ErrorCode.NOT_FOUND, entity + " not found: " + id);
    }
}
