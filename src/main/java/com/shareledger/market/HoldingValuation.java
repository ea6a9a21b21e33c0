package com.shareledger.market;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Value of one holder's shares, priced from a fresh oracle record.
 */
@Value
@Builder
public class HoldingValuation {
    String holder;
    long assetId;
    long shares;
    BigDecimal assetPrice;
    BigDecimal holdingValue;
    long pricedAt;
    long valuedAt;
}
