package com.shareledger.governance;

import com.shareledger.assets.AssetService;
import com.shareledger.common.CallContext;
import com.shareledger.common.LedgerConstants;
import com.shareledger.common.exception.ErrorCode;
import com.shareledger.common.exception.InvalidInputException;
import com.shareledger.common.exception.LedgerEntityNotFoundException;
import com.shareledger.common.exception.NotAuthorizedException;
import com.shareledger.common.exception.StateConflictException;
import com.shareledger.compliance.ComplianceService;
import com.shareledger.compliance.GatedOperation;
import com.shareledger.ledger.IdAllocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Governance engine: proposal lifecycle and share-weighted voting.
 *
 * Proposal flow:
 * 1. A holder of at least 10% of an asset's shares opens a proposal
 * 2. Holders cast one vote each, weighted by up to their current balance
 * 3. Once the end height is reached, anyone finalizes it exactly once
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GovernanceService {

    private final ProposalRepository proposalRepository;
    private final VoteRecordRepository voteRecordRepository;
    private final AssetService assetService;
    private final ComplianceService complianceService;
    private final IdAllocator idAllocator;

    @Transactional
    public Proposal initiateProposal(CallContext context, long assetId, String title,
                                     long duration, long minimumThreshold) {
        assetService.getAssetDetails(assetId);

        if (duration < LedgerConstants.MIN_DURATION || duration > LedgerConstants.MAX_DURATION) {
            throw new InvalidInputException(ErrorCode.INVALID_DURATION, String.format(
                "Duration must be within [%d, %d] blocks: %d",
                LedgerConstants.MIN_DURATION, LedgerConstants.MAX_DURATION, duration));
        }
        if (minimumThreshold <= 0 || minimumThreshold > LedgerConstants.SUPPLY_PER_ASSET) {
            throw new InvalidInputException(ErrorCode.INVALID_VOTES, String.format(
                "Minimum threshold must be within [1, %d]: %d",
                LedgerConstants.SUPPLY_PER_ASSET, minimumThreshold));
        }
        if (title == null || title.isEmpty() || title.length() > LedgerConstants.MAX_TEXT_LENGTH) {
            throw new InvalidInputException(ErrorCode.INVALID_TITLE, String.format(
                "Title must be 1..%d characters", LedgerConstants.MAX_TEXT_LENGTH));
        }

        long balance = assetService.getShareBalance(context.getCaller(), assetId);
        if (balance < LedgerConstants.proposalOwnershipMinimum()) {
            log.debug("Rejected proposal from {} holding {} shares of asset {}",
                context.getCaller(), balance, assetId);
            throw NotAuthorizedException.notAuthorized(context.getCaller(),
                "open proposals on asset " + assetId + " with " + balance + " shares");
        }
        complianceService.requireCompliant(context.getCaller(), GatedOperation.PROPOSE, context.getBlockHeight());

        long proposalId = idAllocator.next(IdAllocator.PROPOSALS);
        Proposal proposal = new Proposal(proposalId, assetId, context.getCaller(), title,
            context.getBlockHeight(), duration, minimumThreshold);
        proposalRepository.save(proposal);

        log.info("Opened proposal {} on asset {} by {}: '{}' until height {}, threshold {}",
            proposalId, assetId, context.getCaller(), title, proposal.getEndHeight(), minimumThreshold);
        return proposal;
    }

    @Transactional
    public VoteRecord castVote(CallContext context, long proposalId, boolean support, long weight) {
        String voter = context.getCaller();
        Proposal proposal = proposalRepository.findForUpdate(proposalId)
            .orElseThrow(() -> new LedgerEntityNotFoundException("Proposal", proposalId));

        if (!proposal.isOpenAt(context.getBlockHeight())) {
            throw new StateConflictException(ErrorCode.VOTE_ENDED, String.format(
                "Voting on proposal %d ended at height %d", proposalId, proposal.getEndHeight()));
        }
        if (voteRecordRepository.existsById(new VoteRecordId(proposalId, voter))) {
            throw new StateConflictException(ErrorCode.VOTE_EXISTS,
                String.format("%s already voted on proposal %d", voter, proposalId));
        }
        long balance = assetService.getShareBalance(voter, proposal.getAssetId());
        if (weight <= 0 || weight > balance) {
            throw new InvalidInputException(ErrorCode.INVALID_AMOUNT, String.format(
                "Vote weight must be within [1, %d]: %d", balance, weight));
        }
        complianceService.requireCompliant(voter, GatedOperation.VOTE, context.getBlockHeight());

        VoteRecord vote = new VoteRecord(proposalId, voter, support, weight, context.getBlockHeight());
        voteRecordRepository.save(vote);
        proposal.recordVote(support, weight, context.getBlockHeight());
        proposalRepository.save(proposal);

        log.info("Recorded vote on proposal {} by {}: {} with weight {} (for={}, against={})",
            proposalId, voter, support ? "for" : "against", weight,
            proposal.getVotesFor(), proposal.getVotesAgainst());
        return vote;
    }

    /**
     * Evaluate a closed proposal. Succeeds once per proposal.
     *
     * @return true if votes for reached the minimum threshold
     */
    @Transactional
    public boolean finalizeProposal(CallContext context, long proposalId) {
        Proposal proposal = proposalRepository.findForUpdate(proposalId)
            .orElseThrow(() -> new LedgerEntityNotFoundException("Proposal", proposalId));

        boolean passed = proposal.finalizeAt(context.getBlockHeight());
        proposalRepository.save(proposal);

        log.info("Finalized proposal {} at height {}: {} (for={}, against={}, threshold={})",
            proposalId, context.getBlockHeight(), passed ? "passed" : "rejected",
            proposal.getVotesFor(), proposal.getVotesAgainst(), proposal.getMinimumThreshold());
        return passed;
    }

    @Transactional(readOnly = true)
    public Proposal getProposalDetails(long proposalId) {
        return proposalRepository.findById(proposalId)
            .orElseThrow(() -> new LedgerEntityNotFoundException("Proposal", proposalId));
    }

    @Transactional(readOnly = true)
    public ProposalStatus getProposalStatus(long proposalId, long height) {
        return getProposalDetails(proposalId).statusAt(height);
    }

    @Transactional(readOnly = true)
    public VoteRecord getVoteRecord(long proposalId, String voter) {
        return voteRecordRepository.findById(new VoteRecordId(proposalId, voter))
            .orElseThrow(() -> new LedgerEntityNotFoundException("Vote",
                "proposal " + proposalId + " voter " + voter));
    }

    @Transactional(readOnly = true)
    public List<VoteRecord> getVotes(long proposalId) {
        getProposalDetails(proposalId);
        return voteRecordRepository.findByIdProposalId(proposalId);
    }

    @Transactional(readOnly = true)
    public List<Proposal> getProposalsForAsset(long assetId) {
        return proposalRepository.findByAssetIdOrderByProposalIdAsc(assetId);
    }
}
