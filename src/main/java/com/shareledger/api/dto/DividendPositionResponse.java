package com.shareledger.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A holder's dividend position in one asset.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DividendPositionResponse {

    private long assetId;
    private String holder;
    private long lastClaimedAccrual;
    private long totalClaimed;
    private long carriedEntitlement;
    private long pending;
    private long payoutBalance;
}
