package com.shareledger.assets;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite key of a share balance: one holder's position in one asset.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ShareBalanceId implements Serializable {

    @Column(nullable = false)
    private String holder;

    @Column(name = "asset_id", nullable = false)
    private long assetId;
}
