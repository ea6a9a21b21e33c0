package com.shareledger.dividends;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for dividend claim markers.
 */
@Repository
public interface DividendClaimRepository extends JpaRepository<DividendClaim, DividendClaimId> {
}
