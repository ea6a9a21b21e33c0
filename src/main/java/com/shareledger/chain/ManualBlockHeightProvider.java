package com.shareledger.chain;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Block height provider driven by explicit advances.
 *
 * Starts at the configured genesis height and only moves forward.
 */
@Component
@Slf4j
public class ManualBlockHeightProvider implements BlockHeightProvider {

    private final AtomicLong height;

    public ManualBlockHeightProvider(@Value("${share-ledger.chain.genesis-height:0}") long genesisHeight) {
        if (genesisHeight < 0) {
            throw new IllegalArgumentException("Genesis height cannot be negative: " + genesisHeight);
        }
        this.height = new AtomicLong(genesisHeight);
    }

    @Override
    public long currentHeight() {
        return height.get();
    }

    @Override
    public long advance(long blocks) {
        if (blocks <= 0) {
            throw new IllegalArgumentException("Blocks to advance must be positive: " + blocks);
        }
        long newHeight = height.addAndGet(blocks);
        log.info("Advanced chain by {} blocks to height {}", blocks, newHeight);
        return newHeight;
    }
}
