package com.shareledger.api.controller;

import com.shareledger.accounts.PayoutAccountService;
import com.shareledger.api.dto.PayoutBalanceResponse;
import com.shareledger.ledger.LedgerEntry;
import com.shareledger.ledger.LedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for holder payout accounts.
 */
@RestController
@RequestMapping("/api/v1/payouts")
@RequiredArgsConstructor
@Tag(name = "Payouts", description = "Dividend payout account API")
public class PayoutAccountController {

    private final PayoutAccountService payoutAccountService;
    private final LedgerService ledgerService;

    @GetMapping("/{holder}")
    @Operation(summary = "Get a holder's settled payout balance")
    public ResponseEntity<PayoutBalanceResponse> getPayoutBalance(@PathVariable String holder) {
        return ResponseEntity.ok(new PayoutBalanceResponse(holder, payoutAccountService.getBalance(holder)));
    }

    @GetMapping("/{holder}/ledger")
    @Operation(summary = "Get journal entries posted to a holder's payout account")
    public ResponseEntity<List<LedgerEntry>> getPayoutJournal(@PathVariable String holder) {
        return ResponseEntity.ok(ledgerService.getAccountJournal(LedgerService.payoutRef(holder)));
    }
}
