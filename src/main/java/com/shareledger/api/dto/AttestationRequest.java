package com.shareledger.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO carrying the outcome of an external compliance attestation.
 */
@Data
public class AttestationRequest {

    @NotNull(message = "Approved flag is required")
    private Boolean approved;

    @NotNull(message = "Level is required")
    private Integer level;

    @NotNull(message = "Validity in blocks is required")
    private Long validForBlocks;
}
