package com.shareledger.governance;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for proposals.
 */
@Repository
public interface ProposalRepository extends JpaRepository<Proposal, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from Proposal p where p.proposalId = :proposalId")
    Optional<Proposal> findForUpdate(@Param("proposalId") long proposalId);

    List<Proposal> findByAssetIdOrderByProposalIdAsc(long assetId);
}
