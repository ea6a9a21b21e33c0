package com.shareledger.assets;

import com.shareledger.common.CallContext;
import com.shareledger.common.LedgerConstants;
import com.shareledger.common.exception.ErrorCode;
import com.shareledger.common.exception.ShareLedgerException;
import com.shareledger.compliance.ComplianceService;
import com.shareledger.ledger.IdAllocator;
import com.shareledger.ledger.LedgerEntry;
import com.shareledger.ledger.LedgerService;
import com.shareledger.ledger.TransactionType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the asset registry and share ledger.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class AssetServiceTest {

    private static final String REGISTRAR = "registrar";
    private static final long HEIGHT = 100L;

    @Autowired
    private AssetService assetService;

    @Autowired
    private ComplianceService complianceService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private IdAllocator idAllocator;

    private CallContext as(String caller) {
        return CallContext.of(caller, HEIGHT);
    }

    private void attest(String address) {
        complianceService.recordAttestation(as(REGISTRAR), address, true, 1, 1000);
    }

    private ErrorCode rejectionOf(Runnable call) {
        return assertThrows(ShareLedgerException.class, call::run).getErrorCode();
    }

    @Test
    void testTokenizeMintsFullSupplyToRegistrar() {
        Asset asset = assetService.tokenizeAsset(as(REGISTRAR), "ipfs://x", 5000);

        assertEquals(1L, asset.getAssetId());
        assertEquals(REGISTRAR, asset.getOwner());
        assertEquals(0L, asset.getAccruedRevenue());
        assertEquals(HEIGHT, asset.getCreatedAt());
        assertEquals(100_000L, assetService.getShareBalance(REGISTRAR, 1L));
        assertEquals(LedgerConstants.SUPPLY_PER_ASSET, assetService.getTotalSupply(1L));

        List<LedgerEntry> journal = ledgerService.getAssetJournal(1L);
        assertEquals(2, journal.size());
        assertTrue(journal.stream().allMatch(e -> e.getTransactionType() == TransactionType.SHARE_ISSUANCE));
    }

    @Test
    void testTokenizeAllocatesSequentialIds() {
        Asset first = assetService.tokenizeAsset(as(REGISTRAR), "ipfs://a", 1000);
        Asset second = assetService.tokenizeAsset(as(REGISTRAR), "ipfs://b", LedgerConstants.MAX_VALUE);

        assertEquals(first.getAssetId() + 1, second.getAssetId());
        assertEquals(3L, idAllocator.peek(IdAllocator.ASSETS));
    }

    @Test
    void testTokenizeRejectedForNonRegistrar() {
        assertEquals(ErrorCode.NOT_AUTHORIZED,
            rejectionOf(() -> assetService.tokenizeAsset(as("alice"), "ipfs://x", 5000)));
        assertEquals(1L, idAllocator.peek(IdAllocator.ASSETS));
    }

    @Test
    void testTokenizeRejectsInvalidInput() {
        assertEquals(ErrorCode.INVALID_URI,
            rejectionOf(() -> assetService.tokenizeAsset(as(REGISTRAR), "", 5000)));
        assertEquals(ErrorCode.INVALID_URI,
            rejectionOf(() -> assetService.tokenizeAsset(as(REGISTRAR), "u".repeat(257), 5000)));
        assertEquals(ErrorCode.INVALID_VALUE,
            rejectionOf(() -> assetService.tokenizeAsset(as(REGISTRAR), "ipfs://x", 999)));
        assertEquals(ErrorCode.INVALID_VALUE,
            rejectionOf(() -> assetService.tokenizeAsset(as(REGISTRAR), "ipfs://x", LedgerConstants.MAX_VALUE + 1)));

        assertEquals(1L, idAllocator.peek(IdAllocator.ASSETS));
        assertEquals(ErrorCode.NOT_FOUND, rejectionOf(() -> assetService.getAssetDetails(1L)));
    }

    @Test
    void testUnknownBalanceIsZero() {
        assertEquals(0L, assetService.getShareBalance("nobody", 42L));
        assertEquals(0L, assetService.getTotalSupply(42L));
    }

    @Test
    void testTransferConservesSupply() {
        long assetId = assetService.tokenizeAsset(as(REGISTRAR), "ipfs://x", 5000).getAssetId();
        attest("alice");
        attest("bob");

        assetService.transferShares(as(REGISTRAR), assetId, "alice", 30_000);
        assetService.transferShares(as("alice"), assetId, "bob", 12_500);

        assertEquals(70_000L, assetService.getShareBalance(REGISTRAR, assetId));
        assertEquals(17_500L, assetService.getShareBalance("alice", assetId));
        assertEquals(12_500L, assetService.getShareBalance("bob", assetId));
        assertEquals(LedgerConstants.SUPPLY_PER_ASSET, assetService.getTotalSupply(assetId));
        assertEquals(3, assetService.getHolders(assetId).size());
    }

    @Test
    void testTransferRejectionsLeaveBalancesUnchanged() {
        long assetId = assetService.tokenizeAsset(as(REGISTRAR), "ipfs://x", 5000).getAssetId();
        attest("alice");

        assertEquals(ErrorCode.INVALID_ADDRESS,
            rejectionOf(() -> assetService.transferShares(as(REGISTRAR), assetId, REGISTRAR, 10)));
        assertEquals(ErrorCode.INVALID_ADDRESS,
            rejectionOf(() -> assetService.transferShares(as(REGISTRAR), assetId, " ", 10)));
        assertEquals(ErrorCode.INVALID_AMOUNT,
            rejectionOf(() -> assetService.transferShares(as(REGISTRAR), assetId, "alice", 0)));
        assertEquals(ErrorCode.INVALID_AMOUNT,
            rejectionOf(() -> assetService.transferShares(as(REGISTRAR), assetId, "alice", 100_001)));
        assertEquals(ErrorCode.KYC_REQUIRED,
            rejectionOf(() -> assetService.transferShares(as(REGISTRAR), assetId, "mallory", 10)));
        assertEquals(ErrorCode.NOT_FOUND,
            rejectionOf(() -> assetService.transferShares(as(REGISTRAR), 99L, "alice", 10)));

        assertEquals(100_000L, assetService.getShareBalance(REGISTRAR, assetId));
        assertEquals(0L, assetService.getShareBalance("alice", assetId));
    }

    @Test
    void testLockedAssetRejectsTransfers() {
        long assetId = assetService.tokenizeAsset(as(REGISTRAR), "ipfs://x", 5000).getAssetId();
        attest("alice");

        assertEquals(ErrorCode.OWNER_ONLY,
            rejectionOf(() -> assetService.setAssetLocked(as("alice"), assetId, true)));

        assetService.setAssetLocked(as(REGISTRAR), assetId, true);
        assertEquals(ErrorCode.NOT_AUTHORIZED,
            rejectionOf(() -> assetService.transferShares(as(REGISTRAR), assetId, "alice", 10)));

        assetService.setAssetLocked(as(REGISTRAR), assetId, false);
        assetService.transferShares(as(REGISTRAR), assetId, "alice", 10);
        assertEquals(10L, assetService.getShareBalance("alice", assetId));
    }

    @Test
    void testDepositRevenue() {
        long assetId = assetService.tokenizeAsset(as(REGISTRAR), "ipfs://x", 5000).getAssetId();

        assetService.depositRevenue(as(REGISTRAR), assetId, 10_000);
        Asset asset = assetService.depositRevenue(as(REGISTRAR), assetId, 2_500);

        assertEquals(12_500L, asset.getAccruedRevenue());
        assertEquals(ErrorCode.OWNER_ONLY,
            rejectionOf(() -> assetService.depositRevenue(as("alice"), assetId, 100)));
        assertEquals(ErrorCode.INVALID_AMOUNT,
            rejectionOf(() -> assetService.depositRevenue(as(REGISTRAR), assetId, 0)));
        assertEquals(12_500L, assetService.getAssetDetails(assetId).getAccruedRevenue());

        long deposits = ledgerService.getAssetJournal(assetId).stream()
            .filter(e -> e.getTransactionType() == TransactionType.REVENUE_DEPOSIT)
            .count();
        assertEquals(4L, deposits);
    }

    @Test
    void testJournalIdsFollowCallOrder() {
        long assetId = assetService.tokenizeAsset(as(REGISTRAR), "ipfs://x", 5000).getAssetId();
        attest("alice");
        assetService.transferShares(as(REGISTRAR), assetId, "alice", 100);
        assetService.depositRevenue(as(REGISTRAR), assetId, 500);

        List<LedgerEntry> journal = ledgerService.getAssetJournal(assetId);
        assertEquals(6, journal.size());
        assertEquals("txn-1:debit", journal.get(0).getEntryId());
        assertEquals("txn-1:credit", journal.get(1).getEntryId());
        assertEquals(TransactionType.SHARE_TRANSFER, journal.get(2).getTransactionType());
        assertEquals("txn-2", journal.get(2).getTransactionId());
        assertEquals(LedgerEntry.EntryType.DEBIT, journal.get(2).getEntryType());
        assertEquals(REGISTRAR, journal.get(2).getAccountRef());
        assertEquals("alice", journal.get(3).getAccountRef());
        assertEquals(3L, journal.get(5).getJournalSequence());
        assertEquals(4L, idAllocator.peek(IdAllocator.JOURNAL));
    }
}
