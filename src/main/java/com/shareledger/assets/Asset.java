package com.shareledger.assets;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A registered asset whose ownership is split into {@code SUPPLY_PER_ASSET} shares.
 *
 * Assets are never deleted. Heights are block heights supplied by the execution
 * environment, not wall-clock time.
 */
@Entity
@Table(name = "assets")
@Data
@NoArgsConstructor
public class Asset {

    @Id
    @Column(name = "asset_id")
    private Long assetId;

    /**
     * Registrar that tokenized the asset.
     */
    @Column(nullable = false, updatable = false)
    private String owner;

    @Column(name = "metadata_uri", nullable = false, length = 256)
    private String metadataUri;

    /**
     * Declared valuation of the underlying asset, within [MIN_VALUE, MAX_VALUE].
     */
    @Column(name = "asset_value", nullable = false)
    private long value;

    /**
     * A locked asset rejects share transfers.
     */
    @Column(nullable = false)
    private boolean locked;

    @Column(name = "created_at", nullable = false, updatable = false)
    private long createdAt;

    /**
     * Height of the last oracle price update; 0 until a price is published.
     */
    @Column(name = "last_price_update_at", nullable = false)
    private long lastPriceUpdateAt;

    /**
     * Total lifetime revenue credited to this asset. Never decreases.
     */
    @Column(name = "accrued_revenue", nullable = false)
    private long accruedRevenue;

    /**
     * Total revenue paid out through dividend harvests. Never exceeds accruedRevenue.
     */
    @Column(name = "distributed_revenue", nullable = false)
    private long distributedRevenue;

    public Asset(long assetId, String owner, String metadataUri, long value, long createdAt) {
        this.assetId = assetId;
        this.owner = owner;
        this.metadataUri = metadataUri;
        this.value = value;
        this.locked = false;
        this.createdAt = createdAt;
        this.lastPriceUpdateAt = 0L;
        this.accruedRevenue = 0L;
        this.distributedRevenue = 0L;
    }

    public void accrueRevenue(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Revenue amount must be positive: " + amount);
        }
        this.accruedRevenue = Math.addExact(accruedRevenue, amount);
    }

    public void recordDistribution(long amount) {
        long distributed = Math.addExact(distributedRevenue, amount);
        if (distributed > accruedRevenue) {
            throw new IllegalStateException(String.format(
                "Asset %d cannot distribute %d: only %d of %d accrued remains undistributed",
                assetId, amount, accruedRevenue - distributedRevenue, accruedRevenue));
        }
        this.distributedRevenue = distributed;
    }

    public long getUndistributedRevenue() {
        return accruedRevenue - distributedRevenue;
    }
}
