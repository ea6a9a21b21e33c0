package com.shareledger.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for id counters.
 */
@Repository
public interface LedgerCounterRepository extends JpaRepository<LedgerCounter, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from LedgerCounter c where c.counterName = :counterName")
    Optional<LedgerCounter> findForUpdate(@Param("counterName") String counterName);
}
