package com.shareledger.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class AdvanceChainRequest {

    @NotNull(message = "Blocks is required")
    @Positive(message = "Blocks must be positive")
    private Long blocks;
}
