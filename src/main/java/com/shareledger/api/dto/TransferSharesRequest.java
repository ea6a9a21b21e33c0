package com.shareledger.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for moving shares to another holder.
 */
@Data
public class TransferSharesRequest {

    @NotNull(message = "Recipient is required")
    private String recipient;

    @NotNull(message = "Amount is required")
    private Long amount;
}
