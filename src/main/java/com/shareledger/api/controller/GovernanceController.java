package com.shareledger.api.controller;

import com.shareledger.api.dto.CastVoteRequest;
import com.shareledger.api.dto.FinalizeProposalResponse;
import com.shareledger.api.dto.InitiateProposalRequest;
import com.shareledger.api.dto.ProposalDetailsResponse;
import com.shareledger.chain.BlockHeightProvider;
import com.shareledger.chain.CallSequencer;
import com.shareledger.governance.GovernanceService;
import com.shareledger.governance.Proposal;
import com.shareledger.governance.VoteRecord;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for proposals and voting.
 */
@RestController
@RequestMapping("/api/v1/proposals")
@RequiredArgsConstructor
@Tag(name = "Governance", description = "Proposal and voting API")
public class GovernanceController {

    private final GovernanceService governanceService;
    private final CallSequencer callSequencer;
    private final BlockHeightProvider blockHeightProvider;

    @PostMapping
    @Operation(summary = "Open a proposal on an asset")
    public ResponseEntity<Proposal> initiateProposal(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @Valid @RequestBody InitiateProposalRequest request) {
        Proposal proposal = callSequencer.submit(caller, context ->
            governanceService.initiateProposal(context, request.getAssetId(), request.getTitle(),
                request.getDurationBlocks(), request.getMinimumThreshold()));
        return ResponseEntity.status(HttpStatus.CREATED).body(proposal);
    }

    @GetMapping("/{proposalId}")
    @Operation(summary = "Get proposal details and current status")
    public ResponseEntity<ProposalDetailsResponse> getProposalDetails(@PathVariable long proposalId) {
        long height = blockHeightProvider.currentHeight();
        Proposal proposal = governanceService.getProposalDetails(proposalId);
        return ResponseEntity.ok(ProposalDetailsResponse.builder()
            .proposal(proposal)
            .status(proposal.statusAt(height))
            .observedAt(height)
            .build());
    }

    @GetMapping("/asset/{assetId}")
    @Operation(summary = "List proposals for an asset")
    public ResponseEntity<List<Proposal>> getProposalsForAsset(@PathVariable long assetId) {
        return ResponseEntity.ok(governanceService.getProposalsForAsset(assetId));
    }

    @PostMapping("/{proposalId}/votes")
    @Operation(summary = "Cast a weighted vote")
    public ResponseEntity<VoteRecord> castVote(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable long proposalId,
            @Valid @RequestBody CastVoteRequest request) {
        VoteRecord vote = callSequencer.submit(caller, context ->
            governanceService.castVote(context, proposalId, request.getSupport(), request.getWeight()));
        return ResponseEntity.status(HttpStatus.CREATED).body(vote);
    }

    @GetMapping("/{proposalId}/votes")
    @Operation(summary = "List votes cast on a proposal")
    public ResponseEntity<List<VoteRecord>> getVotes(@PathVariable long proposalId) {
        return ResponseEntity.ok(governanceService.getVotes(proposalId));
    }

    @GetMapping("/{proposalId}/votes/{voter}")
    @Operation(summary = "Get a recorded vote")
    public ResponseEntity<VoteRecord> getVoteRecord(@PathVariable long proposalId, @PathVariable String voter) {
        return ResponseEntity.ok(governanceService.getVoteRecord(proposalId, voter));
    }

    @PostMapping("/{proposalId}/finalize")
    @Operation(summary = "Finalize a closed proposal")
    public ResponseEntity<FinalizeProposalResponse> finalizeProposal(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable long proposalId) {
        FinalizeProposalResponse response = callSequencer.submit(caller, context -> {
            boolean passed = governanceService.finalizeProposal(context, proposalId);
            return FinalizeProposalResponse.from(governanceService.getProposalDetails(proposalId), passed);
        });
        return ResponseEntity.ok(response);
    }
}
