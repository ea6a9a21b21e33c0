package com.shareledger.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for an oracle price update.
 */
@Data
public class SetPriceRequest {

    @NotNull(message = "Price is required")
    private Long price;

    @NotNull(message = "Decimals are required")
    private Integer decimals;
}
