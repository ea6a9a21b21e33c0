package com.shareledger.accounts;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Settled revenue owed to one holder across all assets.
 *
 * Credited by dividend harvests. Withdrawal to the outside world is handled by the
 * settlement layer and is not modelled here.
 */
@Entity
@Table(name = "payout_accounts")
@Data
@NoArgsConstructor
public class PayoutAccount {

    @Id
    private String holder;

    @Column(nullable = false)
    private long balance;

    @Column(name = "updated_at", nullable = false)
    private long updatedAt;

    public PayoutAccount(String holder) {
        this.holder = holder;
        this.balance = 0L;
        this.updatedAt = 0L;
    }

    public void credit(long amount, long height) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Credit must be positive: " + amount);
        }
        this.balance = Math.addExact(balance, amount);
        this.updatedAt = height;
    }
}
