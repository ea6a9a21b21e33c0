package com.shareledger.governance;

import com.shareledger.common.exception.ErrorCode;
import com.shareledger.common.exception.StateConflictException;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Governance proposal over one asset.
 *
 * Title, heights and threshold are fixed at creation. Tallies change only through
 * {@link #recordVote} while the proposal is open; the outcome is written once by
 * {@link #finalizeAt}.
 */
@Entity
@Table(name = "proposals", indexes = {
    @Index(name = "idx_proposal_asset_id", columnList = "asset_id")
})
@Data
@NoArgsConstructor
public class Proposal {

    @Id
    @Column(name = "proposal_id")
    private Long proposalId;

    @Column(name = "asset_id", nullable = false, updatable = false)
    private long assetId;

    @Column(nullable = false, updatable = false)
    private String proposer;

    @Column(nullable = false, updatable = false, length = 256)
    private String title;

    @Column(name = "start_height", nullable = false, updatable = false)
    private long startHeight;

    @Column(name = "end_height", nullable = false, updatable = false)
    private long endHeight;

    @Column(name = "minimum_threshold", nullable = false, updatable = false)
    private long minimumThreshold;

    @Column(name = "votes_for", nullable = false)
    private long votesFor;

    @Column(name = "votes_against", nullable = false)
    private long votesAgainst;

    @Column(nullable = false)
    private boolean executed;

    /**
     * Outcome; null until finalized.
     */
    private Boolean passed;

    @Column(name = "finalized_at")
    private Long finalizedAt;

    public Proposal(long proposalId, long assetId, String proposer, String title,
                    long startHeight, long duration, long minimumThreshold) {
        this.proposalId = proposalId;
        this.assetId = assetId;
        this.proposer = proposer;
        this.title = title;
        this.startHeight = startHeight;
        this.endHeight = Math.addExact(startHeight, duration);
        this.minimumThreshold = minimumThreshold;
        this.votesFor = 0L;
        this.votesAgainst = 0L;
        this.executed = false;
    }

    public ProposalStatus statusAt(long height) {
        if (executed) {
            return ProposalStatus.FINALIZED;
        }
        return height < endHeight ? ProposalStatus.OPEN : ProposalStatus.CLOSED;
    }

    public boolean isOpenAt(long height) {
        return statusAt(height) == ProposalStatus.OPEN;
    }

    public void recordVote(boolean support, long weight, long height) {
        if (!isOpenAt(height)) {
            throw new StateConflictException(ErrorCode.VOTE_ENDED, String.format(
                "Voting on proposal %d ended at height %d", proposalId, endHeight));
        }
        if (support) {
            votesFor = Math.addExact(votesFor, weight);
        } else {
            votesAgainst = Math.addExact(votesAgainst, weight);
        }
    }

    /**
     * Close the proposal and evaluate it.
     *
     * Passes iff {@code votesFor >= minimumThreshold}: a tally exactly at the threshold
     * passes, and votes against are recorded but do not veto.
     *
     * @return whether the proposal passed
     */
    public boolean finalizeAt(long height) {
        if (executed) {
            throw new StateConflictException(ErrorCode.ALREADY_EXECUTED,
                "Proposal " + proposalId + " is already finalized");
        }
        if (height < endHeight) {
            throw new StateConflictException(ErrorCode.PROPOSAL_OPEN, String.format(
                "Proposal %d is open until height %d", proposalId, endHeight));
        }
        this.executed = true;
        this.passed = votesFor >= minimumThreshold;
        this.finalizedAt = height;
        return passed;
    }
}
