package com.shareledger.accounts;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Service for holder payout accounts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutAccountService {

    private final PayoutAccountRepository payoutAccountRepository;

    /**
     * Credit a holder. Must run inside the transaction that produced the payout.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public PayoutAccount credit(String holder, long amount, long height) {
        PayoutAccount account = payoutAccountRepository.findById(holder)
            .orElseGet(() -> new PayoutAccount(holder));
        account.credit(amount, height);
        PayoutAccount saved = payoutAccountRepository.save(account);
        log.debug("Credited {} to payout account {}, balance {}", amount, holder, saved.getBalance());
        return saved;
    }

    /**
     * Settled balance of the holder; zero when nothing was ever paid out.
     */
    @Transactional(readOnly = true)
    public long getBalance(String holder) {
        return payoutAccountRepository.findById(holder)
            .map(PayoutAccount::getBalance)
            .orElse(0L);
    }
}
