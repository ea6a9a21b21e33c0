package com.shareledger.assets;

import com.shareledger.common.Addresses;
import com.shareledger.common.CallContext;
import com.shareledger.common.LedgerConstants;
import com.shareledger.common.exception.ErrorCode;
import com.shareledger.common.exception.InvalidInputException;
import com.shareledger.common.exception.LedgerEntityNotFoundException;
import com.shareledger.common.exception.NotAuthorizedException;
import com.shareledger.common.exception.StateConflictException;
import com.shareledger.compliance.ComplianceService;
import com.shareledger.compliance.GatedOperation;
import com.shareledger.dividends.DividendService;
import com.shareledger.governance.VoteRecordRepository;
import com.shareledger.ledger.IdAllocator;
import com.shareledger.ledger.LedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Token ledger and asset registry.
 *
 * Owns asset metadata and share balances. The full supply of an asset is minted once,
 * at tokenization, and afterwards only moves between holders.
 */
@Service
@Slf4j
public class AssetService {

    private final AssetRepository assetRepository;
    private final ShareBalanceRepository shareBalanceRepository;
    private final IdAllocator idAllocator;
    private final LedgerService ledgerService;
    private final ComplianceService complianceService;
    private final DividendService dividendService;
    private final VoteRecordRepository voteRecordRepository;
    private final String registrar;

    public AssetService(AssetRepository assetRepository,
                        ShareBalanceRepository shareBalanceRepository,
                        IdAllocator idAllocator,
                        LedgerService ledgerService,
                        ComplianceService complianceService,
                        DividendService dividendService,
                        VoteRecordRepository voteRecordRepository,
                        @Value("${share-ledger.registrar}") String registrar) {
        this.assetRepository = assetRepository;
        this.shareBalanceRepository = shareBalanceRepository;
        this.idAllocator = idAllocator;
        this.ledgerService = ledgerService;
        this.complianceService = complianceService;
        this.dividendService = dividendService;
        this.voteRecordRepository = voteRecordRepository;
        this.registrar = registrar;
    }

    /**
     * Register an asset and mint its full share supply to the registrar.
     *
     * @return the new asset, carrying its freshly allocated id
     */
    @Transactional
    public Asset tokenizeAsset(CallContext context, String metadataUri, long value) {
        if (!registrar.equals(context.getCaller())) {
            throw NotAuthorizedException.notAuthorized(context.getCaller(), "tokenize assets");
        }
        if (metadataUri == null || metadataUri.isEmpty()
                || metadataUri.length() > LedgerConstants.MAX_TEXT_LENGTH) {
            throw new InvalidInputException(ErrorCode.INVALID_URI, String.format(
                "Metadata URI must be 1..%d characters", LedgerConstants.MAX_TEXT_LENGTH));
        }
        if (value < LedgerConstants.MIN_VALUE || value > LedgerConstants.MAX_VALUE) {
            throw new InvalidInputException(ErrorCode.INVALID_VALUE, String.format(
                "Asset value must be within [%d, %d]: %d",
                LedgerConstants.MIN_VALUE, LedgerConstants.MAX_VALUE, value));
        }

        long assetId = idAllocator.next(IdAllocator.ASSETS);
        Asset asset = new Asset(assetId, context.getCaller(), metadataUri, value, context.getBlockHeight());
        assetRepository.save(asset);

        ShareBalance balance = new ShareBalance(context.getCaller(), assetId);
        balance.credit(LedgerConstants.SUPPLY_PER_ASSET);
        shareBalanceRepository.save(balance);

        ledgerService.recordIssuance(assetId, context.getCaller(), LedgerConstants.SUPPLY_PER_ASSET,
            context.getBlockHeight());

        log.info("Tokenized asset {} ({}) valued {} with {} shares to {}",
            assetId, metadataUri, value, LedgerConstants.SUPPLY_PER_ASSET, context.getCaller());
        return asset;
    }

    @Transactional(readOnly = true)
    public Asset getAssetDetails(long assetId) {
        return assetRepository.findById(assetId)
            .orElseThrow(() -> new LedgerEntityNotFoundException("Asset", assetId));
    }

    /**
     * Shares of the asset held by the holder; zero for any unknown pair.
     */
    @Transactional(readOnly = true)
    public long getShareBalance(String holder, long assetId) {
        if (holder == null) {
            return 0L;
        }
        return shareBalanceRepository.findById(new ShareBalanceId(holder, assetId))
            .map(ShareBalance::getAmount)
            .orElse(0L);
    }

    @Transactional(readOnly = true)
    public long getTotalSupply(long assetId) {
        Long total = shareBalanceRepository.sumByAssetId(assetId);
        return total == null ? 0L : total;
    }

    @Transactional(readOnly = true)
    public List<ShareBalance> getHolders(long assetId) {
        getAssetDetails(assetId);
        return shareBalanceRepository.findByIdAssetId(assetId).stream()
            .filter(balance -> balance.getAmount() > 0)
            .toList();
    }

    /**
     * Move shares from the caller to a recipient. Total supply is unchanged.
     *
     * Both parties' pending dividends are settled first, so revenue accrued before the
     * transfer stays with the balances it accrued under. Shares of a holder who voted on a
     * proposal of the asset stay put until that proposal closes, so one balance is counted
     * at most once per proposal.
     */
    @Transactional
    public void transferShares(CallContext context, long assetId, String recipient, long amount) {
        Asset asset = getAssetDetails(assetId);
        if (asset.isLocked()) {
            throw NotAuthorizedException.notAuthorized(context.getCaller(),
                "transfer shares of locked asset " + assetId);
        }
        if (!Addresses.isValid(recipient) || recipient.equals(context.getCaller())) {
            throw new InvalidInputException(ErrorCode.INVALID_ADDRESS, "Invalid recipient: " + recipient);
        }
        long available = getShareBalance(context.getCaller(), assetId);
        if (amount <= 0 || amount > available) {
            throw new InvalidInputException(ErrorCode.INVALID_AMOUNT, String.format(
                "Transfer amount must be within [1, %d]: %d", available, amount));
        }
        if (voteRecordRepository.existsOpenVote(assetId, context.getCaller(), context.getBlockHeight())) {
            throw new StateConflictException(ErrorCode.PROPOSAL_OPEN, String.format(
                "%s voted on an open proposal of asset %d; shares are held until it closes",
                context.getCaller(), assetId));
        }
        complianceService.requireCompliant(recipient, GatedOperation.RECEIVE_SHARES, context.getBlockHeight());

        dividendService.settlePending(assetId, context.getCaller(), context.getBlockHeight());
        dividendService.settlePending(assetId, recipient, context.getBlockHeight());

        ShareBalance from = shareBalanceRepository.findById(new ShareBalanceId(context.getCaller(), assetId))
            .orElseThrow(() -> new IllegalStateException("Balance vanished for " + context.getCaller()));
        ShareBalance to = shareBalanceRepository.findById(new ShareBalanceId(recipient, assetId))
            .orElseGet(() -> new ShareBalance(recipient, assetId));

        from.debit(amount);
        to.credit(amount);
        shareBalanceRepository.save(from);
        shareBalanceRepository.save(to);

        ledgerService.recordShareTransfer(assetId, context.getCaller(), recipient, amount,
            context.getBlockHeight());

        log.info("Transferred {} shares of asset {} from {} to {}",
            amount, assetId, context.getCaller(), recipient);
    }

    @Transactional
    public Asset setAssetLocked(CallContext context, long assetId, boolean locked) {
        Asset asset = getAssetDetails(assetId);
        if (!asset.getOwner().equals(context.getCaller())) {
            throw NotAuthorizedException.ownerOnly(context.getCaller(), "lock asset " + assetId);
        }
        asset.setLocked(locked);
        assetRepository.save(asset);
        log.info("Asset {} {}", assetId, locked ? "locked" : "unlocked");
        return asset;
    }

    /**
     * Credit revenue to an asset. This is the only path that moves accruedRevenue, and
     * it only ever increases it.
     */
    @Transactional
    public Asset depositRevenue(CallContext context, long assetId, long amount) {
        Asset asset = assetRepository.findForUpdate(assetId)
            .orElseThrow(() -> new LedgerEntityNotFoundException("Asset", assetId));
        String caller = context.getCaller();
        if (!registrar.equals(caller) && !asset.getOwner().equals(caller)) {
            throw NotAuthorizedException.ownerOnly(caller, "deposit revenue to asset " + assetId);
        }
        if (amount <= 0) {
            throw new InvalidInputException(ErrorCode.INVALID_AMOUNT,
                "Revenue amount must be positive: " + amount);
        }

        asset.accrueRevenue(amount);
        assetRepository.save(asset);
        ledgerService.recordRevenueDeposit(assetId, caller, amount, context.getBlockHeight());

        log.info("Deposited {} revenue to asset {}, accrued now {}", amount, assetId, asset.getAccruedRevenue());
        return asset;
    }
}
