package com.shareledger.chain;

import com.shareledger.common.CallContext;
import com.shareledger.common.exception.ErrorCode;
import com.shareledger.common.exception.InvalidInputException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for call ordering and the manual block clock.
 */
class CallSequencerTest {

    @Test
    void testContextCarriesCallerAndHeight() {
        ManualBlockHeightProvider provider = new ManualBlockHeightProvider(10L);
        CallSequencer sequencer = new CallSequencer(provider);

        CallContext context = sequencer.submit("alice", c -> c);
        assertEquals("alice", context.getCaller());
        assertEquals(10L, context.getBlockHeight());

        assertEquals(15L, sequencer.advance(5L));
        assertEquals(15L, sequencer.submit("alice", CallContext::getBlockHeight));
    }

    @Test
    void testRejectsInvalidInput() {
        ManualBlockHeightProvider provider = new ManualBlockHeightProvider(0L);
        CallSequencer sequencer = new CallSequencer(provider);

        InvalidInputException blank = assertThrows(InvalidInputException.class, () -> sequencer.submit(" ", c -> c));
        assertEquals(ErrorCode.INVALID_ADDRESS, blank.getErrorCode());
        InvalidInputException overlong = assertThrows(InvalidInputException.class,
            () -> sequencer.submit("a".repeat(129), c -> c));
        assertEquals(ErrorCode.INVALID_ADDRESS, overlong.getErrorCode());
        assertThrows(IllegalArgumentException.class, () -> sequencer.advance(0L));
        assertThrows(IllegalArgumentException.class, () -> new ManualBlockHeightProvider(-1L));
        assertEquals(0L, provider.currentHeight());
    }

    @Test
    void testCallsNeverInterleave() throws InterruptedException {
        CallSequencer sequencer = new CallSequencer(new ManualBlockHeightProvider(0L));
        AtomicInteger inFlight = new AtomicInteger();
        List<Integer> overlaps = Collections.synchronizedList(new ArrayList<>());
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(200);

        for (int i = 0; i < 200; i++) {
            executor.submit(() -> {
                sequencer.submit("alice", context -> {
                    int concurrent = inFlight.incrementAndGet();
                    if (concurrent > 1) {
                        overlaps.add(concurrent);
                    }
                    inFlight.decrementAndGet();
                    return null;
                });
                done.countDown();
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdown();
        assertTrue(overlaps.isEmpty());
    }
}
