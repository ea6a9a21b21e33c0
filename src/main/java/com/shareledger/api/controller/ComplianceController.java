package com.shareledger.api.controller;

import com.shareledger.api.dto.AttestationRequest;
import com.shareledger.chain.CallSequencer;
import com.shareledger.compliance.ComplianceRecord;
import com.shareledger.compliance.ComplianceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for compliance attestations.
 */
@RestController
@RequestMapping("/api/v1/compliance")
@RequiredArgsConstructor
@Tag(name = "Compliance", description = "Compliance attestation API")
public class ComplianceController {

    private final ComplianceService complianceService;
    private final CallSequencer callSequencer;

    @PutMapping("/{address}")
    @Operation(summary = "Record the outcome of an attestation")
    public ResponseEntity<ComplianceRecord> recordAttestation(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable String address,
            @Valid @RequestBody AttestationRequest request) {
        ComplianceRecord record = callSequencer.submit(caller, context ->
            complianceService.recordAttestation(context, address, request.getApproved(),
                request.getLevel(), request.getValidForBlocks()));
        return ResponseEntity.ok(record);
    }

    @GetMapping("/{address}")
    @Operation(summary = "Get the compliance record of an address")
    public ResponseEntity<ComplianceRecord> getComplianceRecord(@PathVariable String address) {
        return ResponseEntity.ok(complianceService.getComplianceRecord(address));
    }
}
