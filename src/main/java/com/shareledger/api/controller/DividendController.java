package com.shareledger.api.controller;

import com.shareledger.accounts.PayoutAccountService;
import com.shareledger.api.dto.DividendPositionResponse;
import com.shareledger.api.dto.HarvestResponse;
import com.shareledger.chain.CallSequencer;
import com.shareledger.dividends.DividendClaim;
import com.shareledger.dividends.DividendService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for dividend harvesting.
 */
@RestController
@RequestMapping("/api/v1/assets/{assetId}/dividends")
@RequiredArgsConstructor
@Tag(name = "Dividends", description = "Dividend distribution API")
public class DividendController {

    private final DividendService dividendService;
    private final PayoutAccountService payoutAccountService;
    private final CallSequencer callSequencer;

    @PostMapping("/harvest")
    @Operation(summary = "Harvest the caller's share of revenue accrued since the last claim")
    public ResponseEntity<HarvestResponse> harvestDividends(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable long assetId) {
        HarvestResponse response = callSequencer.submit(caller, context -> {
            long amount = dividendService.harvestDividends(context, assetId);
            return HarvestResponse.builder()
                .assetId(assetId)
                .beneficiary(context.getCaller())
                .amount(amount)
                .lastClaimedAccrual(dividendService.getLastClaim(assetId, context.getCaller()))
                .payoutBalance(payoutAccountService.getBalance(context.getCaller()))
                .build();
        });
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{holder}")
    @Operation(summary = "Get a holder's dividend position")
    public ResponseEntity<DividendPositionResponse> getDividendPosition(@PathVariable long assetId,
                                                                        @PathVariable String holder) {
        DividendClaim claim = dividendService.getClaim(assetId, holder);
        return ResponseEntity.ok(DividendPositionResponse.builder()
            .assetId(assetId)
            .holder(holder)
            .lastClaimedAccrual(claim.getLastClaimedAccrual())
            .totalClaimed(claim.getTotalClaimed())
            .carriedEntitlement(claim.getCarriedEntitlement())
            .pending(dividendService.getPendingDividends(holder, assetId))
            .payoutBalance(payoutAccountService.getBalance(holder))
            .build());
    }
}
