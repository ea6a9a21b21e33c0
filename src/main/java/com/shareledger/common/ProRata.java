package com.shareledger.common;

import java.math.BigInteger;

/**
 * Integer pro-rata arithmetic over the fixed share supply.
 *
 * Products are taken in {@link BigInteger} so that {@code shares * amount} cannot overflow;
 * division truncates toward zero. The truncated remainder is bounded dust that stays
 * in the asset's revenue pool.
 */
public final class ProRata {

    private ProRata() {
    }

    /**
     * Compute {@code floor(shares * amount / SUPPLY_PER_ASSET)}.
     *
     * @throws IllegalArgumentException if either operand is negative
     * @throws ArithmeticException if the result does not fit in a long
     */
    public static long share(long shares, long amount) {
        if (shares < 0 || amount < 0) {
            throw new IllegalArgumentException(
                String.format("Pro-rata operands must be non-negative: shares=%d, amount=%d", shares, amount));
        }
        return BigInteger.valueOf(shares)
            .multiply(BigInteger.valueOf(amount))
            .divide(BigInteger.valueOf(LedgerConstants.SUPPLY_PER_ASSET))
            .longValueExact();
    }
}
