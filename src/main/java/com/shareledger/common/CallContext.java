package com.shareledger.common;

import lombok.Value;

/**
 * Identity and clock of a single ledger call.
 *
 * Supplied by the execution environment for every mutating operation; the core
 * never looks up the current caller or block height on its own.
 */
@Value
public class CallContext {
    String caller;
    long blockHeight;

    public static CallContext of(String caller, long blockHeight) {
        Addresses.validate(caller);
        if (blockHeight < 0) {
            throw new IllegalArgumentException("Block height cannot be negative: " + blockHeight);
        }
        return new CallContext(caller, blockHeight);
    }
}
