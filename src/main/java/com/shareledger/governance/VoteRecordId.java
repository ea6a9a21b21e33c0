package com.shareledger.governance;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite key of a vote: at most one per voter per proposal.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VoteRecordId implements Serializable {

    @Column(name = "proposal_id", nullable = false)
    private long proposalId;

    @Column(nullable = false)
    private String voter;
}
