package com.shareledger.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Allocates asset, proposal and journal ids from persisted counters.
 *
 * Ids start at 1 and are never reused. Allocation must join the caller's transaction.
 */
@Service
@RequiredArgsConstructor
public class IdAllocator {

    public static final String ASSETS = "assets";
    public static final String PROPOSALS = "proposals";
    public static final String JOURNAL = "journal";

    private final LedgerCounterRepository counterRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public long next(String counterName) {
        LedgerCounter counter = counterRepository.findForUpdate(counterName)
            .orElseGet(() -> new LedgerCounter(counterName));
        long id = counter.allocate();
        counterRepository.save(counter);
        return id;
    }

    @Transactional(readOnly = true)
    public long peek(String counterName) {
        return counterRepository.findById(counterName)
            .map(LedgerCounter::getNextValue)
            .orElse(1L);
    }
}
