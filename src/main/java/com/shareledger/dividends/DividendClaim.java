package com.shareledger.dividends;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Harvest marker for one beneficiary in one asset.
 *
 * {@code lastClaimedAccrual} is the asset's accrued revenue at the last harvest; only
 * revenue accrued after it is harvestable. {@code carriedEntitlement} holds amounts
 * settled ahead of a share movement while the beneficiary could not be paid; it is
 * paid out by the next successful harvest.
 */
@Entity
@Table(name = "dividend_claims")
@Data
@NoArgsConstructor
public class DividendClaim {

    @EmbeddedId
    private DividendClaimId id;

    @Column(name = "last_claimed_accrual", nullable = false)
    private long lastClaimedAccrual;

    @Column(name = "total_claimed", nullable = false)
    private long totalClaimed;

    @Column(name = "last_claimed_at", nullable = false)
    private long lastClaimedAt;

    @Column(name = "carried_entitlement", nullable = false)
    private long carriedEntitlement;

    public DividendClaim(long assetId, String beneficiary) {
        this.id = new DividendClaimId(assetId, beneficiary);
        this.lastClaimedAccrual = 0L;
        this.totalClaimed = 0L;
        this.lastClaimedAt = 0L;
        this.carriedEntitlement = 0L;
    }

    /**
     * Record a payout of {@code amount}, which includes any carried entitlement.
     */
    public void markHarvested(long accrued, long amount, long height) {
        advanceMarker(accrued);
        this.totalClaimed = Math.addExact(totalClaimed, amount);
        this.carriedEntitlement = 0L;
        this.lastClaimedAt = height;
    }

    /**
     * Move the marker to {@code accrued} without paying, keeping {@code owed} for a later harvest.
     */
    public void carryForward(long accrued, long owed) {
        advanceMarker(accrued);
        this.carriedEntitlement = Math.addExact(carriedEntitlement, owed);
    }

    private void advanceMarker(long accrued) {
        if (accrued < lastClaimedAccrual) {
            throw new IllegalStateException(String.format(
                "Accrued revenue moved backwards for %s: %d < %d", id, accrued, lastClaimedAccrual));
        }
        this.lastClaimedAccrual = accrued;
    }
}
