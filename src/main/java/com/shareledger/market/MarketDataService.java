package com.shareledger.market;

import com.shareledger.assets.Asset;
import com.shareledger.assets.AssetRepository;
import com.shareledger.assets.AssetService;
import com.shareledger.common.CallContext;
import com.shareledger.common.LedgerConstants;
import com.shareledger.common.exception.ErrorCode;
import com.shareledger.common.exception.InvalidInputException;
import com.shareledger.common.exception.LedgerEntityNotFoundException;
import com.shareledger.common.exception.NotAuthorizedException;
import com.shareledger.common.exception.StaleDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Market data cache.
 *
 * Stores the latest oracle price per asset. Every read that values something goes
 * through {@link #getValidatedPrice}, which refuses prices older than the caller's
 * staleness window.
 */
@Service
@Slf4j
public class MarketDataService {

    private final MarketPriceRepository marketPriceRepository;
    private final AssetRepository assetRepository;
    private final AssetService assetService;
    private final Set<String> oracles;
    private final long maxPriceStalenessBlocks;

    public MarketDataService(MarketPriceRepository marketPriceRepository,
                             AssetRepository assetRepository,
                             AssetService assetService,
                             @Value("${share-ledger.oracles:}") String oracles,
                             @Value("${share-ledger.market.max-price-staleness-blocks:144}") long maxPriceStalenessBlocks) {
        this.marketPriceRepository = marketPriceRepository;
        this.assetRepository = assetRepository;
        this.assetService = assetService;
        this.oracles = Arrays.stream(oracles.split(","))
            .map(String::trim)
            .filter(oracle -> !oracle.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
        this.maxPriceStalenessBlocks = maxPriceStalenessBlocks;
        log.info("Market data accepts prices from {} oracle(s), max staleness {} blocks",
            this.oracles.size(), maxPriceStalenessBlocks);
    }

    /**
     * Publish a price for an asset. Only configured oracle addresses may call this.
     */
    @Transactional
    public MarketPrice setPrice(CallContext context, long assetId, long price, int decimals) {
        if (!oracles.contains(context.getCaller())) {
            throw NotAuthorizedException.notAuthorized(context.getCaller(), "publish prices");
        }
        Asset asset = assetRepository.findForUpdate(assetId)
            .orElseThrow(() -> new LedgerEntityNotFoundException("Asset", assetId));
        if (price <= 0) {
            throw new InvalidInputException(ErrorCode.INVALID_AMOUNT, "Price must be positive: " + price);
        }
        if (decimals < 0 || decimals > LedgerConstants.MAX_PRICE_DECIMALS) {
            throw new InvalidInputException(ErrorCode.INVALID_VALUE, String.format(
                "Price decimals must be within [0, %d]: %d", LedgerConstants.MAX_PRICE_DECIMALS, decimals));
        }

        MarketPrice marketPrice = new MarketPrice(assetId, price, decimals, context.getBlockHeight(),
            context.getCaller());
        marketPriceRepository.save(marketPrice);

        asset.setLastPriceUpdateAt(context.getBlockHeight());
        assetRepository.save(asset);

        log.info("Price for asset {} set to {} at height {} by {}",
            assetId, marketPrice.toDecimal(), context.getBlockHeight(), context.getCaller());
        return marketPrice;
    }

    /**
     * Raw cached record, without any freshness check.
     */
    @Transactional(readOnly = true)
    public MarketPrice getMarketPrice(long assetId) {
        return marketPriceRepository.findById(assetId)
            .orElseThrow(() -> new LedgerEntityNotFoundException("Market price for asset", assetId));
    }

    /**
     * Cached record, only if it was updated no more than {@code maxStalenessBlocks} ago.
     *
     * @throws StaleDataException with {@code PriceExpired} otherwise
     */
    @Transactional(readOnly = true)
    public MarketPrice getValidatedPrice(long assetId, long maxStalenessBlocks, long currentHeight) {
        MarketPrice marketPrice = getMarketPrice(assetId);
        if (!marketPrice.isFreshAt(currentHeight, maxStalenessBlocks)) {
            throw new StaleDataException(assetId, marketPrice.getLastUpdatedAt(), currentHeight, maxStalenessBlocks);
        }
        return marketPrice;
    }

    /**
     * Value a holder's position from a price no older than the configured staleness window.
     */
    @Transactional(readOnly = true)
    public HoldingValuation getHoldingValuation(String holder, long assetId, long currentHeight) {
        assetService.getAssetDetails(assetId);
        MarketPrice marketPrice = getValidatedPrice(assetId, maxPriceStalenessBlocks, currentHeight);
        long shares = assetService.getShareBalance(holder, assetId);

        BigDecimal assetPrice = marketPrice.toDecimal();
        BigDecimal holdingValue = assetPrice
            .multiply(BigDecimal.valueOf(shares))
            .divide(BigDecimal.valueOf(LedgerConstants.SUPPLY_PER_ASSET), marketPrice.getDecimals(), RoundingMode.DOWN);

        return HoldingValuation.builder()
            .holder(holder)
            .assetId(assetId)
            .shares(shares)
            .assetPrice(assetPrice)
            .holdingValue(holdingValue)
            .pricedAt(marketPrice.getLastUpdatedAt())
            .valuedAt(currentHeight)
            .build();
    }
}
