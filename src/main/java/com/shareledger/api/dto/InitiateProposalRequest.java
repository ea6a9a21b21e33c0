package com.shareledger.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for opening a governance proposal.
 */
@Data
public class InitiateProposalRequest {

    @NotNull(message = "Asset ID is required")
    private Long assetId;

    @NotNull(message = "Title is required")
    private String title;

    @NotNull(message = "Duration in blocks is required")
    private Long durationBlocks;

    @NotNull(message = "Minimum threshold is required")
    private Long minimumThreshold;
}
