package com.flagship.finance_ledger.account;

import com.flagship.finance_ledger.common.Amounts;
import com.flagship.finance_ledger.common.CurrencyCode;
import com.flagship.finance_ledger.common.exception.NotFoundException;
import com.flagship.finance_ledger.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Account lifecycle. Balances are not mutated here; see
 * {@link com.flagship.finance_ledger.ledger.LedgerService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;

    /**
     * Opens an account whose current balance starts at {@code initialBalance}.
     * The initial balance may be negative (credit cards, loans).
     */
    public Account createAccount(String ownerId, String name, AccountType type,
                                 CurrencyCode currency, BigDecimal initialBalance) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("Owner is required");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("Account name is required");
        }
        if (type == null || currency == null) {
            throw new ValidationException("Account type and currency are required");
        }
        BigDecimal opening = initialBalance == null
            ? Amounts.zero()
            : Amounts.normalize(initialBalance, "initialBalance");

        Account account = Account.builder()
            .id(UUID.randomUUID().toString())
            .ownerId(ownerId)
            .name(name)
            .type(type)
            .currency(currency)
            .initialBalance(opening)
            .currentBalance(opening)
            .active(true)
            .build();
        accountRepository.insert(account);
        log.info("Created {} account {} for owner {}", type, account.getId(), ownerId);
        return getAccount(account.getId());
    }

    public Optional<Account> findAccount(String accountId) {
        return accountRepository.findById(accountId);
    }

    public Account getAccount(String accountId) {
        return accountRepository.findById(accountId)
            .orElseThrow(() -> new NotFoundException("Account", accountId));
    }

    public List<Account> listAccounts(String ownerId) {
        return accountRepository.findByOwner(ownerId);
    }

    /**
     * Soft-deactivates an account. Accounts with history are never deleted.
     */
    public Account deactivateAccount(String accountId) {
        if (accountRepository.deactivate(accountId) == 0) {
            throw new NotFoundException("Account", accountId);
        }
        log.info("Deactivated account {}", accountId);
        return getAccount(accountId);
    }
}
