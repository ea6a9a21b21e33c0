package com.shareledger.market;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Latest oracle price for an asset.
 *
 * {@code price} is the value of the whole asset (all shares) in minor units, scaled by
 * {@code 10^decimals}. Readers must check freshness before trusting it.
 */
@Entity
@Table(name = "market_prices")
@Data
@NoArgsConstructor
public class MarketPrice {

    @Id
    @Column(name = "asset_id")
    private Long assetId;

    @Column(nullable = false)
    private long price;

    @Column(nullable = false)
    private int decimals;

    @Column(name = "last_updated_at", nullable = false)
    private long lastUpdatedAt;

    @Column(name = "oracle_address", nullable = false)
    private String oracleAddress;

    public MarketPrice(long assetId, long price, int decimals, long lastUpdatedAt, String oracleAddress) {
        this.assetId = assetId;
        this.price = price;
        this.decimals = decimals;
        this.lastUpdatedAt = lastUpdatedAt;
        this.oracleAddress = oracleAddress;
    }

    public boolean isFreshAt(long height, long maxStalenessBlocks) {
        return height - lastUpdatedAt <= maxStalenessBlocks;
    }

    public BigDecimal toDecimal() {
        return BigDecimal.valueOf(price, decimals);
    }
}
