package com.shareledger.api.controller;

import com.shareledger.api.dto.SetPriceRequest;
import com.shareledger.chain.BlockHeightProvider;
import com.shareledger.chain.CallSequencer;
import com.shareledger.market.HoldingValuation;
import com.shareledger.market.MarketDataService;
import com.shareledger.market.MarketPrice;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for oracle prices and valuations.
 */
@RestController
@RequestMapping("/api/v1/assets/{assetId}")
@RequiredArgsConstructor
@Tag(name = "Market data", description = "Oracle price and valuation API")
public class MarketDataController {

    private final MarketDataService marketDataService;
    private final CallSequencer callSequencer;
    private final BlockHeightProvider blockHeightProvider;

    @PutMapping("/price")
    @Operation(summary = "Publish an oracle price")
    public ResponseEntity<MarketPrice> setPrice(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable long assetId,
            @Valid @RequestBody SetPriceRequest request) {
        MarketPrice price = callSequencer.submit(caller, context ->
            marketDataService.setPrice(context, assetId, request.getPrice(), request.getDecimals()));
        return ResponseEntity.ok(price);
    }

    @GetMapping("/price")
    @Operation(summary = "Get the cached price, optionally rejecting stale prices")
    public ResponseEntity<MarketPrice> getPrice(
            @PathVariable long assetId,
            @RequestParam(required = false) Long maxStalenessBlocks) {
        if (maxStalenessBlocks == null) {
            return ResponseEntity.ok(marketDataService.getMarketPrice(assetId));
        }
        return ResponseEntity.ok(marketDataService.getValidatedPrice(
            assetId, maxStalenessBlocks, blockHeightProvider.currentHeight()));
    }

    @GetMapping("/valuation/{holder}")
    @Operation(summary = "Value a holder's shares from a fresh price")
    public ResponseEntity<HoldingValuation> getHoldingValuation(@PathVariable long assetId,
                                                                @PathVariable String holder) {
        return ResponseEntity.ok(marketDataService.getHoldingValuation(
            holder, assetId, blockHeightProvider.currentHeight()));
    }
}
