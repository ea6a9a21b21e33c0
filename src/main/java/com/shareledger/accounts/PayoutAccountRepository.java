package com.shareledger.accounts;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for payout accounts.
 */
@Repository
public interface PayoutAccountRepository extends JpaRepository<PayoutAccount, String> {
}
