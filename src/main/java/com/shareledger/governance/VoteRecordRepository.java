package com.shareledger.governance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for vote records.
 */
@Repository
public interface VoteRecordRepository extends JpaRepository<VoteRecord, VoteRecordId> {

    List<VoteRecord> findByIdProposalId(long proposalId);

    /**
     * True if the voter has a vote on a proposal of the asset that is still open at the height.
     */
    @Query("select count(v) > 0 from VoteRecord v, Proposal p " +
           "where v.id.proposalId = p.proposalId and p.assetId = :assetId and v.id.voter = :voter " +
           "and p.executed = false and p.endHeight > :height")
    boolean existsOpenVote(@Param("assetId") long assetId,
                           @Param("voter") String voter,
                           @Param("height") long height);
}
