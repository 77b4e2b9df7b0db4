package com.flagship.finance_ledger.ledger;

import com.flagship.finance_ledger.account.AccountRepository;
import com.flagship.finance_ledger.pouch.PouchRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;

/**
 * The only component that writes account and pouch balances.
 *
 * Must be called inside a ledger unit of work: a missing balance row throws,
 * which rolls back every write of that unit.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BalanceWriter {

    private final AccountRepository accountRepository;
    private final PouchRepository pouchRepository;

    public void apply(BalanceEffects effects) {
        for (Map.Entry<String, BigDecimal> entry : effects.accountDeltas().entrySet()) {
            if (accountRepository.applyBalanceDelta(entry.getKey(), entry.getValue()) == 0) {
                throw new IllegalStateException("Account disappeared while applying balance effect: " + entry.getKey());
            }
            log.debug("Account {} balance {}", entry.getKey(), entry.getValue().toPlainString());
        }
        for (Map.Entry<String, BigDecimal> entry : effects.pouchDeltas().entrySet()) {
            if (pouchRepository.applyBalanceDelta(entry.getKey(), entry.getValue()) == 0) {
                throw new IllegalStateException("Pouch disappeared while applying balance effect: " + entry.getKey());
            }
            log.debug("Pouch {} balance {}", entry.getKey(), entry.getValue().toPlainString());
        }
    }
}
