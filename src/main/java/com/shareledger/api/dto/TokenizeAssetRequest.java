package com.shareledger.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for tokenizing a new asset. Range checks are left to the ledger so that
 * callers receive its numbered error codes.
 */
@Data
public class TokenizeAssetRequest {

    @NotNull(message = "Metadata URI is required")
    private String metadataUri;

    @NotNull(message = "Value is required")
    private Long value;
}
