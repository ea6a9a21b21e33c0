package com.shareledger.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Service for the double-entry journal.
 *
 * Balances and counters live on their own tables; the journal is the audit trail of
 * how they moved. Posting always joins the caller's transaction so a rolled-back call
 * leaves no entries behind.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final LedgerRepository ledgerRepository;
    private final IdAllocator idAllocator;

    public static String issuanceRef(long assetId) {
        return "asset:" + assetId + ":issuance";
    }

    public static String revenuePoolRef(long assetId) {
        return "asset:" + assetId + ":revenue";
    }

    public static String payoutRef(String holder) {
        return "payout:" + holder;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public String recordIssuance(long assetId, String holder, long shares, long blockHeight) {
        return post(TransactionType.SHARE_ISSUANCE, assetId, issuanceRef(assetId), holder,
            shares, blockHeight, "Share issuance");
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public String recordShareTransfer(long assetId, String from, String to, long shares, long blockHeight) {
        return post(TransactionType.SHARE_TRANSFER, assetId, from, to,
            shares, blockHeight, "Share transfer");
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public String recordRevenueDeposit(long assetId, String depositor, long amount, long blockHeight) {
        return post(TransactionType.REVENUE_DEPOSIT, assetId, depositor, revenuePoolRef(assetId),
            amount, blockHeight, "Revenue deposit");
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public String recordDividendPayout(long assetId, String beneficiary, long amount, long blockHeight) {
        return post(TransactionType.DIVIDEND_PAYOUT, assetId, revenuePoolRef(assetId), payoutRef(beneficiary),
            amount, blockHeight, "Dividend payout");
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getAssetJournal(long assetId) {
        return ledgerRepository.findByAssetIdOrderByJournalSequenceAscEntryTypeDesc(assetId);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getAccountJournal(String accountRef) {
        return ledgerRepository.findByAccountRefOrderByJournalSequenceAscEntryTypeDesc(accountRef);
    }

    private String post(TransactionType type, long assetId, String debitRef, String creditRef,
                        long amount, long blockHeight, String description) {
        long sequence = idAllocator.next(IdAllocator.JOURNAL);
        String transactionId = LedgerEntry.transactionId(sequence);

        LedgerEntry debit = new LedgerEntry(sequence, debitRef, LedgerEntry.EntryType.DEBIT,
            amount, type, assetId, blockHeight, description);
        LedgerEntry credit = new LedgerEntry(sequence, creditRef, LedgerEntry.EntryType.CREDIT,
            amount, type, assetId, blockHeight, description);

        ledgerRepository.save(debit);
        ledgerRepository.save(credit);

        log.info("Recorded {}: txn={}, asset={}, {} -> {}, amount={}",
            type, transactionId, assetId, debitRef, creditRef, amount);

        return transactionId;
    }
}
