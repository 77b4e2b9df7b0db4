package com.flagship.finance_ledger.transfer;

import com.flagship.finance_ledger.account.Account;
import com.flagship.finance_ledger.account.AccountRepository;
import com.flagship.finance_ledger.common.Amounts;
import com.flagship.finance_ledger.common.CurrencyCode;
import com.flagship.finance_ledger.common.exception.NotFoundException;
import com.flagship.finance_ledger.common.exception.ValidationException;
import com.flagship.finance_ledger.ledger.BalanceEffects;
import com.flagship.finance_ledger.ledger.BalanceWriter;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.shard.RecordCollection;
import com.flagship.finance_ledger.shard.ShardRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Moves money between two accounts: the source is debited and the destination
 * credited by the same amount, together with the transfer record, in one unit
 * over the transfers and accounts shards.
 */
@Service
@Slf4j
public class TransferService {

    private final ShardRouter router;
    private final TransferRepository transferRepository;
    private final AccountRepository accountRepository;
    private final BalanceWriter balanceWriter;
    private final LedgerMetrics metrics;
    private final Clock clock;

    public TransferService(ShardRouter router,
                           TransferRepository transferRepository,
                           AccountRepository accountRepository,
                           BalanceWriter balanceWriter,
                           LedgerMetrics metrics,
                           Clock clock) {
        this.router = router;
        this.transferRepository = transferRepository;
        this.accountRepository = accountRepository;
        this.balanceWriter = balanceWriter;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @throws ValidationException if the accounts are equal, unknown or inactive, the
     *                             amount is not positive, or a currency does not match
     */
    public Transfer createTransfer(String ownerId, String fromAccountId, String toAccountId,
                                   BigDecimal amount, CurrencyCode currency, String description) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("ownerId is required");
        }
        if (fromAccountId == null || toAccountId == null) {
            throw new ValidationException("Source and destination accounts are required");
        }
        if (fromAccountId.equals(toAccountId)) {
            throw new ValidationException("Cannot transfer to the same account: " + fromAccountId);
        }
        BigDecimal normalized = Amounts.requirePositive(amount, "amount");
        String transferId = UUID.randomUUID().toString();

        Transfer transfer = metrics.timeMutation("transfer", () -> router.inTransactions(
            List.of(router.shardMap().resolve(RecordCollection.TRANSFERS), router.shardMap().resolve(RecordCollection.ACCOUNTS)),
            () -> {
                // Both rows are locked in id order, the same order BalanceWriter updates them
                Map<String, Account> accounts = new TreeMap<>();
                new TreeSet<>(List.of(fromAccountId, toAccountId))
                    .forEach(accountId -> accounts.put(accountId, requireUsableAccount(accountId)));
                Account from = accounts.get(fromAccountId);
                Account to = accounts.get(toAccountId);
                CurrencyCode transferCurrency = currency != null ? currency : from.getCurrency();
                if (from.getCurrency() != transferCurrency || to.getCurrency() != transferCurrency) {
                    throw new ValidationException(String.format("Transfer currency %s must match both accounts (%s, %s)",
                        transferCurrency, from.getCurrency(), to.getCurrency()));
                }

                Transfer completed = Transfer.builder()
                    .id(transferId)
                    .ownerId(ownerId)
                    .fromAccountId(fromAccountId)
                    .toAccountId(toAccountId)
                    .amount(normalized)
                    .currency(transferCurrency)
                    .description(description)
                    .status(TransferStatus.COMPLETED)
                    .transferDate(clock.instant())
                    .build();
                transferRepository.insert(completed);
                balanceWriter.apply(BalanceEffects.transfer(fromAccountId, toAccountId, normalized));
                return completed;
            }));
        metrics.incrementTransfersCreated();
        log.info("Transferred {} {} from account {} to account {}",
            normalized.toPlainString(), transfer.getCurrency(), fromAccountId, toAccountId);
        return getTransfer(transferId);
    }

    public Optional<Transfer> findTransfer(String transferId) {
        return transferRepository.findById(transferId);
    }

    public Transfer getTransfer(String transferId) {
        return transferRepository.findById(transferId)
            .orElseThrow(() -> new NotFoundException("Transfer", transferId));
    }

    public List<Transfer> listTransfers(String ownerId) {
        return transferRepository.findByOwner(ownerId);
    }

    private Account requireUsableAccount(String accountId) {
        Account account = accountRepository.lockById(accountId)
            .orElseThrow(() -> new ValidationException("Unknown account: " + accountId));
        if (!account.isActive()) {
            throw new ValidationException("Account is inactive: " + accountId);
        }
        return account;
    }
}
