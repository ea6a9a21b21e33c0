package com.shareledger.common.exception;

/**
 * Thrown when a cached price is older than the caller's freshness window.
 */
public class StaleDataException extends ShareLedgerException {

    public StaleDataException(long assetId, long lastUpdatedAt, long currentHeight, long maxStalenessBlocks) {
        super(ErrorCode.PRICE_EXPIRED, String.format(
            "Price for asset %d last updated at height %d is stale at height %d (max staleness %d blocks)",
            assetId, lastUpdatedAt, currentHeight, maxStalenessBlocks));
    }
}
