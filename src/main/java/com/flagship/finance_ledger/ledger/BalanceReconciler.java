package com.flagship.finance_ledger.ledger;

import com.flagship.finance_ledger.account.Account;
import com.flagship.finance_ledger.account.AccountRepository;
import com.flagship.finance_ledger.common.exception.NotFoundException;
import com.flagship.finance_ledger.pouch.Pouch;
import com.flagship.finance_ledger.pouch.PouchRepository;
import com.flagship.finance_ledger.transfer.TransferRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Recomputes balances from the records on the transactions and transfers
 * shards and compares them with the stored ones. Read-only.
 *
 * Expected account balance: initial balance + signed effects of active
 * transactions + net completed transfers. Expected pouch balance: signed
 * apportioned amounts of active transactions and splits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceReconciler {

    private final AccountRepository accountRepository;
    private final PouchRepository pouchRepository;
    private final TransactionRepository transactionRepository;
    private final TransferRepository transferRepository;

    public ReconciliationResult reconcileAccount(String accountId) {
        Account account = accountRepository.findById(accountId)
            .orElseThrow(() -> new NotFoundException("Account", accountId));
        BigDecimal expected = account.getInitialBalance()
            .add(transactionRepository.sumAccountEffects(accountId))
            .add(transferRepository.netFlow(accountId));
        return report(new ReconciliationResult("Account", accountId, account.getCurrentBalance(), expected));
    }

    public ReconciliationResult reconcilePouch(String pouchId) {
        Pouch pouch = pouchRepository.findById(pouchId)
            .orElseThrow(() -> new NotFoundException("Pouch", pouchId));
        BigDecimal expected = transactionRepository.sumPouchEffects(pouchId);
        return report(new ReconciliationResult("Pouch", pouchId, pouch.getBalance(), expected));
    }

    private static ReconciliationResult report(ReconciliationResult result) {
        if (!result.isConsistent()) {
            log.warn("{} {} balance drift: stored {} expected {}", result.getRecordType(), result.getRecordId(),
                result.getStored().toPlainString(), result.getExpected().toPlainString());
        }
        return result;
    }
}
