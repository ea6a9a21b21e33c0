package com.shareledger.dividends;

import com.shareledger.accounts.PayoutAccountService;
import com.shareledger.assets.Asset;
import com.shareledger.assets.AssetRepository;
import com.shareledger.assets.ShareBalance;
import com.shareledger.assets.ShareBalanceId;
import com.shareledger.assets.ShareBalanceRepository;
import com.shareledger.common.CallContext;
import com.shareledger.common.ProRata;
import com.shareledger.common.exception.ErrorCode;
import com.shareledger.common.exception.InvalidInputException;
import com.shareledger.common.exception.LedgerEntityNotFoundException;
import com.shareledger.compliance.ComplianceService;
import com.shareledger.compliance.GatedOperation;
import com.shareledger.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Dividend distribution engine.
 *
 * A holder's harvestable amount is {@code floor(balance * (accrued - lastClaimed) / SUPPLY_PER_ASSET)}
 * plus any entitlement carried forward from an earlier share movement.
 * Truncation leaves less than one unit per harvest in the asset's pool; that dust is
 * never paid out.
 *
 * Harvest flow:
 * 1. Check the caller passes the compliance gate
 * 2. Compute the pro-rata amount since the caller's last claim
 * 3. Advance the claim marker, credit the payout account, journal the movement
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DividendService {

    private final AssetRepository assetRepository;
    private final ShareBalanceRepository shareBalanceRepository;
    private final DividendClaimRepository dividendClaimRepository;
    private final PayoutAccountService payoutAccountService;
    private final LedgerService ledgerService;
    private final ComplianceService complianceService;

    /**
     * Pay the caller's share of revenue accrued since their last claim, plus any carried entitlement.
     *
     * A zero amount is rejected with {@code InvalidAmount} and leaves the claim marker
     * untouched, so sub-unit remainders keep accumulating for the next harvest.
     *
     * @return the amount credited to the caller's payout account
     */
    @Transactional
    public long harvestDividends(CallContext context, long assetId) {
        String beneficiary = context.getCaller();
        Asset asset = assetRepository.findForUpdate(assetId)
            .orElseThrow(() -> new LedgerEntityNotFoundException("Asset", assetId));
        complianceService.requireCompliant(beneficiary, GatedOperation.HARVEST, context.getBlockHeight());

        DividendClaim claim = findClaim(assetId, beneficiary);
        long amount = pendingAmount(asset, claim, beneficiary);
        if (amount <= 0) {
            throw new InvalidInputException(ErrorCode.INVALID_AMOUNT, String.format(
                "Nothing to harvest for %s on asset %d", beneficiary, assetId));
        }

        settle(asset, claim, amount, context.getBlockHeight());

        log.info("Harvested {} from asset {} for {} (accrued {}, claimed through {})",
            amount, assetId, beneficiary, asset.getAccruedRevenue(), claim.getLastClaimedAccrual());
        return amount;
    }

    /**
     * Settle whatever the holder is owed and move their marker to the current accrual.
     *
     * Runs before any share movement so that revenue accrued under the old balances stays
     * with the holders who held the shares while it accrued. A holder who passes the
     * harvest gate is paid; anyone else keeps the amount as a carried entitlement that
     * only a later, gated harvest pays out. Sub-unit dust is forfeited either way.
     *
     * @return the amount paid out, possibly zero
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public long settlePending(long assetId, String holder, long height) {
        Asset asset = assetRepository.findForUpdate(assetId)
            .orElseThrow(() -> new LedgerEntityNotFoundException("Asset", assetId));
        DividendClaim claim = findClaim(assetId, holder);
        long accrued = accruedShare(asset, claim, holder);
        boolean markerBehind = claim.getLastClaimedAccrual() != asset.getAccruedRevenue();

        if (complianceService.passes(holder, GatedOperation.HARVEST, height)) {
            long amount = accrued + claim.getCarriedEntitlement();
            if (amount > 0) {
                settle(asset, claim, amount, height);
                log.info("Settled {} from asset {} for {} ahead of a share movement", amount, assetId, holder);
                return amount;
            }
            if (markerBehind) {
                claim.markHarvested(asset.getAccruedRevenue(), 0L, height);
                dividendClaimRepository.save(claim);
            }
            return 0L;
        }

        if (markerBehind) {
            claim.carryForward(asset.getAccruedRevenue(), accrued);
            dividendClaimRepository.save(claim);
            if (accrued > 0) {
                log.info("Carried {} from asset {} forward for {} pending compliance, entitlement now {}",
                    accrued, assetId, holder, claim.getCarriedEntitlement());
            }
        }
        return 0L;
    }

    /**
     * Amount the holder would receive from a harvest right now.
     */
    @Transactional(readOnly = true)
    public long getPendingDividends(String holder, long assetId) {
        Asset asset = assetRepository.findById(assetId)
            .orElseThrow(() -> new LedgerEntityNotFoundException("Asset", assetId));
        return pendingAmount(asset, findClaim(assetId, holder), holder);
    }

    /**
     * Accrued revenue at the beneficiary's last harvest; zero if they never harvested.
     */
    @Transactional(readOnly = true)
    public long getLastClaim(long assetId, String beneficiary) {
        return dividendClaimRepository.findById(new DividendClaimId(assetId, beneficiary))
            .map(DividendClaim::getLastClaimedAccrual)
            .orElse(0L);
    }

    @Transactional(readOnly = true)
    public DividendClaim getClaim(long assetId, String beneficiary) {
        return findClaim(assetId, beneficiary);
    }

    private DividendClaim findClaim(long assetId, String beneficiary) {
        return dividendClaimRepository.findById(new DividendClaimId(assetId, beneficiary))
            .orElseGet(() -> new DividendClaim(assetId, beneficiary));
    }

    private long pendingAmount(Asset asset, DividendClaim claim, String holder) {
        return Math.addExact(accruedShare(asset, claim, holder), claim.getCarriedEntitlement());
    }

    private long accruedShare(Asset asset, DividendClaim claim, String holder) {
        long balance = shareBalanceRepository.findById(new ShareBalanceId(holder, asset.getAssetId()))
            .map(ShareBalance::getAmount)
            .orElse(0L);
        long unclaimed = asset.getAccruedRevenue() - claim.getLastClaimedAccrual();
        return ProRata.share(balance, unclaimed);
    }

    private void settle(Asset asset, DividendClaim claim, long amount, long height) {
        String beneficiary = claim.getId().getBeneficiary();
        claim.markHarvested(asset.getAccruedRevenue(), amount, height);
        dividendClaimRepository.save(claim);

        asset.recordDistribution(amount);
        assetRepository.save(asset);

        payoutAccountService.credit(beneficiary, amount, height);
        ledgerService.recordDividendPayout(asset.getAssetId(), beneficiary, amount, height);
    }
}
