package com.shareledger.dividends;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite key of a claim marker: one beneficiary in one asset.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DividendClaimId implements Serializable {

    @Column(name = "asset_id", nullable = false)
    private long assetId;

    @Column(nullable = false)
    private String beneficiary;
}
