package com.shareledger.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class LockAssetRequest {

    @NotNull(message = "Locked flag is required")
    private Boolean locked;
}
