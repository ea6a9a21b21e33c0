package com.shareledger.dividends;

import com.shareledger.accounts.PayoutAccountService;
import com.shareledger.assets.Asset;
import com.shareledger.assets.AssetService;
import com.shareledger.common.CallContext;
import com.shareledger.common.exception.ErrorCode;
import com.shareledger.common.exception.ShareLedgerException;
import com.shareledger.compliance.ComplianceService;
import com.shareledger.ledger.LedgerService;
import com.shareledger.ledger.TransactionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for dividend harvesting.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class DividendServiceTest {

    private static final String REGISTRAR = "registrar";
    private static final long HEIGHT = 100L;

    @Autowired
    private DividendService dividendService;

    @Autowired
    private AssetService assetService;

    @Autowired
    private ComplianceService complianceService;

    @Autowired
    private PayoutAccountService payoutAccountService;

    @Autowired
    private LedgerService ledgerService;

    private long assetId;

    @BeforeEach
    void setUp() {
        attest(REGISTRAR);
        attest("alice");
        assetId = assetService.tokenizeAsset(as(REGISTRAR), "ipfs://x", 5000).getAssetId();
        // Half the supply moves out before any revenue accrues
        assetService.transferShares(as(REGISTRAR), assetId, "alice", 50_000);
    }

    private static CallContext as(String caller) {
        return CallContext.of(caller, HEIGHT);
    }

    private void attest(String address) {
        complianceService.recordAttestation(as(REGISTRAR), address, true, 1, 1000);
    }

    @Test
    void testHarvestProRataShare() {
        assetService.depositRevenue(as(REGISTRAR), assetId, 10_000);

        assertEquals(5_000L, dividendService.getPendingDividends("alice", assetId));
        assertEquals(5_000L, dividendService.harvestDividends(as("alice"), assetId));

        assertEquals(10_000L, dividendService.getLastClaim(assetId, "alice"));
        assertEquals(5_000L, payoutAccountService.getBalance("alice"));
        assertEquals(0L, dividendService.getPendingDividends("alice", assetId));

        Asset asset = assetService.getAssetDetails(assetId);
        assertEquals(5_000L, asset.getDistributedRevenue());
        assertEquals(5_000L, asset.getUndistributedRevenue());

        long payoutEntries = ledgerService.getAssetJournal(assetId).stream()
            .filter(e -> e.getTransactionType() == TransactionType.DIVIDEND_PAYOUT)
            .count();
        assertEquals(2L, payoutEntries);
    }

    @Test
    void testSecondHarvestWithoutNewRevenueYieldsNothing() {
        assetService.depositRevenue(as(REGISTRAR), assetId, 10_000);
        dividendService.harvestDividends(as("alice"), assetId);

        ShareLedgerException e = assertThrows(ShareLedgerException.class,
            () -> dividendService.harvestDividends(as("alice"), assetId));
        assertEquals(ErrorCode.INVALID_AMOUNT, e.getErrorCode());
        assertEquals(5_000L, payoutAccountService.getBalance("alice"));
        assertEquals(10_000L, dividendService.getLastClaim(assetId, "alice"));
    }

    @Test
    void testZeroHarvestKeepsMarkerForDust() {
        attest("bob");
        assetService.transferShares(as(REGISTRAR), assetId, "bob", 3);
        assetService.depositRevenue(as(REGISTRAR), assetId, 10_000);

        ShareLedgerException e = assertThrows(ShareLedgerException.class,
            () -> dividendService.harvestDividends(as("bob"), assetId));
        assertEquals(ErrorCode.INVALID_AMOUNT, e.getErrorCode());
        assertEquals(0L, dividendService.getLastClaim(assetId, "bob"));

        assetService.depositRevenue(as(REGISTRAR), assetId, 30_000);
        assertEquals(1L, dividendService.harvestDividends(as("bob"), assetId));
        assertEquals(40_000L, dividendService.getLastClaim(assetId, "bob"));
    }

    @Test
    void testHarvestRequiresCompliance() {
        complianceService.recordAttestation(as(REGISTRAR), "alice", false, 1, 1000);
        assetService.depositRevenue(as(REGISTRAR), assetId, 10_000);

        ShareLedgerException e = assertThrows(ShareLedgerException.class,
            () -> dividendService.harvestDividends(as("alice"), assetId));
        assertEquals(ErrorCode.KYC_REQUIRED, e.getErrorCode());
        assertEquals(0L, payoutAccountService.getBalance("alice"));
    }

    @Test
    void testHarvestUnknownAsset() {
        ShareLedgerException e = assertThrows(ShareLedgerException.class,
            () -> dividendService.harvestDividends(as("alice"), 99L));
        assertEquals(ErrorCode.NOT_FOUND, e.getErrorCode());
    }

    @Test
    void testTransferSettlesAccruedDividendsFirst() {
        attest("bob");
        assetService.depositRevenue(as(REGISTRAR), assetId, 10_000);

        // Alice is paid for the revenue accrued while she held the shares
        assetService.transferShares(as("alice"), assetId, "bob", 50_000);
        assertEquals(5_000L, payoutAccountService.getBalance("alice"));
        assertEquals(0L, dividendService.getPendingDividends("bob", assetId));
        assertEquals(10_000L, dividendService.getLastClaim(assetId, "bob"));

        assertThrows(ShareLedgerException.class, () -> dividendService.harvestDividends(as("bob"), assetId));

        assetService.depositRevenue(as(REGISTRAR), assetId, 2_000);
        assertEquals(1_000L, dividendService.harvestDividends(as("bob"), assetId));
        assertEquals(6_000L, dividendService.harvestDividends(as(REGISTRAR), assetId));

        Asset asset = assetService.getAssetDetails(assetId);
        assertEquals(12_000L, asset.getDistributedRevenue());
        assertEquals(asset.getAccruedRevenue(), asset.getDistributedRevenue());
    }

    @Test
    void testTransferDoesNotPayHolderWhoFailsCompliance() {
        attest("bob");
        complianceService.recordAttestation(as(REGISTRAR), "alice", false, 1, 1000);
        assetService.depositRevenue(as(REGISTRAR), assetId, 10_000);

        ShareLedgerException e = assertThrows(ShareLedgerException.class,
            () -> dividendService.harvestDividends(as("alice"), assetId));
        assertEquals(ErrorCode.KYC_REQUIRED, e.getErrorCode());

        assetService.transferShares(as("alice"), assetId, "bob", 1);

        assertEquals(0L, payoutAccountService.getBalance("alice"));
        assertEquals(5_000L, dividendService.getClaim(assetId, "alice").getCarriedEntitlement());
        assertEquals(5_000L, dividendService.getPendingDividends("alice", assetId));
        assertEquals(0L, assetService.getAssetDetails(assetId).getDistributedRevenue());

        // The entitlement is paid once the holder passes the gate again
        attest("alice");
        assertEquals(5_000L, dividendService.harvestDividends(as("alice"), assetId));
        assertEquals(5_000L, payoutAccountService.getBalance("alice"));
        assertEquals(0L, dividendService.getClaim(assetId, "alice").getCarriedEntitlement());
    }
}
