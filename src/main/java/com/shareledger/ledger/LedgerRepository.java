package com.shareledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for journal entries.
 */
@Repository
public interface LedgerRepository extends JpaRepository<LedgerEntry, String> {

    List<LedgerEntry> findByAssetIdOrderByJournalSequenceAscEntryTypeDesc(long assetId);

    List<LedgerEntry> findByAccountRefOrderByJournalSequenceAscEntryTypeDesc(String accountRef);
}
