package com.shareledger.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for crediting revenue to an asset.
 */
@Data
public class DepositRevenueRequest {

    @NotNull(message = "Amount is required")
    private Long amount;
}
