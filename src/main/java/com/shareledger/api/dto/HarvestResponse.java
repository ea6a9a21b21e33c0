package com.shareledger.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HarvestResponse {

    private long assetId;
    private String beneficiary;
    private long amount;
    private long lastClaimedAccrual;
    private long payoutBalance;
}
