package com.shareledger.api.dto;

import com.shareledger.governance.Proposal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of finalizing a proposal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinalizeProposalResponse {

    private long proposalId;
    private boolean passed;
    private long votesFor;
    private long votesAgainst;
    private long minimumThreshold;
    private long finalizedAt;

    public static FinalizeProposalResponse from(Proposal proposal, boolean passed) {
        return FinalizeProposalResponse.builder()
            .proposalId(proposal.getProposalId())
            .passed(passed)
            .votesFor(proposal.getVotesFor())
            .votesAgainst(proposal.getVotesAgainst())
            .minimumThreshold(proposal.getMinimumThreshold())
            .finalizedAt(proposal.getFinalizedAt())
            .build();
    }
}
