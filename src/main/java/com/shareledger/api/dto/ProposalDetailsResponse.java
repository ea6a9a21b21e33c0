package com.shareledger.api.dto;

import com.shareledger.governance.Proposal;
import com.shareledger.governance.ProposalStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Proposal with its status at the height of the request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProposalDetailsResponse {

    private Proposal proposal;
    private ProposalStatus status;
    private long observedAt;
}
