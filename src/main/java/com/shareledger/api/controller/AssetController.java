package com.shareledger.api.controller;

import com.shareledger.api.dto.DepositRevenueRequest;
import com.shareledger.api.dto.LockAssetRequest;
import com.shareledger.api.dto.ShareBalanceResponse;
import com.shareledger.api.dto.TokenizeAssetRequest;
import com.shareledger.api.dto.TransferSharesRequest;
import com.shareledger.assets.Asset;
import com.shareledger.assets.AssetService;
import com.shareledger.assets.ShareBalance;
import com.shareledger.chain.CallSequencer;
import com.shareledger.ledger.LedgerEntry;
import com.shareledger.ledger.LedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for the asset registry and share ledger.
 */
@RestController
@RequestMapping("/api/v1/assets")
@RequiredArgsConstructor
@Tag(name = "Assets", description = "Asset tokenization and share ledger API")
public class AssetController {

    private final AssetService assetService;
    private final LedgerService ledgerService;
    private final CallSequencer callSequencer;

    @PostMapping
    @Operation(summary = "Tokenize an asset and mint its shares to the registrar")
    public ResponseEntity<Asset> tokenizeAsset(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @Valid @RequestBody TokenizeAssetRequest request) {
        Asset asset = callSequencer.submit(caller, context ->
            assetService.tokenizeAsset(context, request.getMetadataUri(), request.getValue()));
        return ResponseEntity.status(HttpStatus.CREATED).body(asset);
    }

    @GetMapping("/{assetId}")
    @Operation(summary = "Get asset details")
    public ResponseEntity<Asset> getAssetDetails(@PathVariable long assetId) {
        return ResponseEntity.ok(assetService.getAssetDetails(assetId));
    }

    @GetMapping("/{assetId}/balances/{holder}")
    @Operation(summary = "Get a holder's share balance")
    public ResponseEntity<ShareBalanceResponse> getShareBalance(@PathVariable long assetId,
                                                                @PathVariable String holder) {
        return ResponseEntity.ok(ShareBalanceResponse.builder()
            .holder(holder)
            .assetId(assetId)
            .amount(assetService.getShareBalance(holder, assetId))
            .build());
    }

    @GetMapping("/{assetId}/holders")
    @Operation(summary = "List holders with a non-zero balance")
    public ResponseEntity<List<ShareBalanceResponse>> getHolders(@PathVariable long assetId) {
        List<ShareBalanceResponse> holders = assetService.getHolders(assetId).stream()
            .map(AssetController::toResponse)
            .toList();
        return ResponseEntity.ok(holders);
    }

    @PostMapping("/{assetId}/transfers")
    @Operation(summary = "Transfer shares to another holder")
    public ResponseEntity<Void> transferShares(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable long assetId,
            @Valid @RequestBody TransferSharesRequest request) {
        callSequencer.submit(caller, context -> {
            assetService.transferShares(context, assetId, request.getRecipient(), request.getAmount());
            return null;
        });
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{assetId}/revenue")
    @Operation(summary = "Credit revenue to an asset")
    public ResponseEntity<Asset> depositRevenue(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable long assetId,
            @Valid @RequestBody DepositRevenueRequest request) {
        Asset asset = callSequencer.submit(caller, context ->
            assetService.depositRevenue(context, assetId, request.getAmount()));
        return ResponseEntity.ok(asset);
    }

    @PutMapping("/{assetId}/lock")
    @Operation(summary = "Lock or unlock share transfers for an asset")
    public ResponseEntity<Asset> setLocked(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable long assetId,
            @Valid @RequestBody LockAssetRequest request) {
        Asset asset = callSequencer.submit(caller, context ->
            assetService.setAssetLocked(context, assetId, request.getLocked()));
        return ResponseEntity.ok(asset);
    }

    @GetMapping("/{assetId}/ledger")
    @Operation(summary = "Get journal entries for an asset")
    public ResponseEntity<List<LedgerEntry>> getAssetJournal(@PathVariable long assetId) {
        assetService.getAssetDetails(assetId);
        return ResponseEntity.ok(ledgerService.getAssetJournal(assetId));
    }

    private static ShareBalanceResponse toResponse(ShareBalance balance) {
        return ShareBalanceResponse.builder()
            .holder(balance.getId().getHolder())
            .assetId(balance.getId().getAssetId())
            .amount(balance.getAmount())
            .build();
    }
}
