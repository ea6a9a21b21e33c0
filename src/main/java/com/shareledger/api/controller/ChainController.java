package com.shareledger.api.controller;

import com.shareledger.api.dto.AdvanceChainRequest;
import com.shareledger.api.dto.ChainHeightResponse;
import com.shareledger.chain.BlockHeightProvider;
import com.shareledger.chain.CallSequencer;
import com.shareledger.common.exception.NotAuthorizedException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for the block clock.
 */
@RestController
@RequestMapping("/api/v1/chain")
@Tag(name = "Chain", description = "Block height API")
public class ChainController {

    private final BlockHeightProvider blockHeightProvider;
    private final CallSequencer callSequencer;
    private final String registrar;

    public ChainController(BlockHeightProvider blockHeightProvider,
                           CallSequencer callSequencer,
                           @Value("${share-ledger.registrar}") String registrar) {
        this.blockHeightProvider = blockHeightProvider;
        this.callSequencer = callSequencer;
        this.registrar = registrar;
    }

    @GetMapping("/height")
    @Operation(summary = "Get the current block height")
    public ResponseEntity<ChainHeightResponse> getHeight() {
        return ResponseEntity.ok(new ChainHeightResponse(blockHeightProvider.currentHeight()));
    }

    @PostMapping("/advance")
    @Operation(summary = "Advance the block height")
    public ResponseEntity<ChainHeightResponse> advance(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @Valid @RequestBody AdvanceChainRequest request) {
        if (!registrar.equals(caller)) {
            throw NotAuthorizedException.ownerOnly(caller, "advance the chain");
        }
        return ResponseEntity.ok(new ChainHeightResponse(callSequencer.advance(request.getBlocks())));
    }
}
