package com.shareledger.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for casting a vote.
 */
@Data
public class CastVoteRequest {

    @NotNull(message = "Support is required")
    private Boolean support;

    @NotNull(message = "Weight is required")
    private Long weight;
}
