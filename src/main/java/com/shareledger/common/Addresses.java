package com.shareledger.common;

import com.shareledger.common.exception.ErrorCode;
import com.shareledger.common.exception.InvalidInputException;

/**
 * Utility class for validating principal addresses.
 * Addresses are opaque identifiers; the ledger only requires them to be present and bounded.
 */
public final class Addresses {

    public static final int MAX_LENGTH = 128;

    private Addresses() {
    }

    public static boolean isValid(String address) {
        if (address == null || address.trim().isEmpty()) {
            return false;
        }
        return address.length() <= MAX_LENGTH && address.equals(address.trim());
    }

    public static void validate(String address) {
        if (!isValid(address)) {
            throw new InvalidInputException(ErrorCode.INVALID_ADDRESS, "Invalid address: " + address);
        }
    }
}
