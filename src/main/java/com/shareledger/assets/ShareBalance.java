package com.shareledger.assets;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Number of shares of one asset held by one holder.
 *
 * For every asset the amounts of all its balances sum to SUPPLY_PER_ASSET.
 */
@Entity
@Table(name = "share_balances", indexes = {
    @Index(name = "idx_share_balance_asset_id", columnList = "asset_id")
})
@Data
@NoArgsConstructor
public class ShareBalance {

    @EmbeddedId
    private ShareBalanceId id;

    @Column(nullable = false)
    private long amount;

    public ShareBalance(String holder, long assetId) {
        this.id = new ShareBalanceId(holder, assetId);
        this.amount = 0L;
    }

    public void credit(long shares) {
        if (shares <= 0) {
            throw new IllegalArgumentException("Credit must be positive: " + shares);
        }
        this.amount = Math.addExact(amount, shares);
    }

    public void debit(long shares) {
        if (shares <= 0) {
            throw new IllegalArgumentException("Debit must be positive: " + shares);
        }
        if (shares > amount) {
            throw new IllegalStateException(String.format(
                "Holder %s has %d shares of asset %d, cannot debit %d",
                id.getHolder(), amount, id.getAssetId(), shares));
        }
        this.amount -= shares;
    }
}
