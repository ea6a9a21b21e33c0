package com.shareledger.chain;

import com.shareledger.common.CallContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Totally orders ledger calls.
 *
 * Each submitted call runs to completion, including its transaction commit, while
 * holding a single fair lock. The caller's context is stamped with the block height
 * observed under that lock, so no two calls interleave and heights never go backwards
 * between consecutive calls.
 */
@Component
@Slf4j
public class CallSequencer {

    private final BlockHeightProvider blockHeightProvider;
    private final ReentrantLock lock = new ReentrantLock(true);

    public CallSequencer(BlockHeightProvider blockHeightProvider) {
        this.blockHeightProvider = blockHeightProvider;
    }

    /**
     * Run a call for the given caller at the current block height.
     *
     * @param caller address of the principal submitting the call
     * @param call the ledger operation; must commit or roll back before returning
     * @return the call's result
     */
    public <T> T submit(String caller, Function<CallContext, T> call) {
        lock.lock();
        try {
            CallContext context = CallContext.of(caller, blockHeightProvider.currentHeight());
            log.debug("Executing call for {} at height {}", caller, context.getBlockHeight());
            return call.apply(context);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Advance the chain while no call is in flight.
     */
    public long advance(long blocks) {
        lock.lock();
        try {
            return blockHeightProvider.advance(blocks);
        } finally {
            lock.unlock();
        }
    }
}
