package com.flagship.finance_ledger.ledger;

import com.flagship.finance_ledger.account.Account;
import com.flagship.finance_ledger.account.AccountRepository;
import com.flagship.finance_ledger.common.Amounts;
import com.flagship.finance_ledger.common.CurrencyCode;
import com.flagship.finance_ledger.common.exception.NotFoundException;
import com.flagship.finance_ledger.common.exception.ValidationException;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.pouch.PouchRepository;
import com.flagship.finance_ledger.shard.RecordCollection;
import com.flagship.finance_ledger.shard.Shard;
import com.flagship.finance_ledger.shard.ShardMap;
import com.flagship.finance_ledger.shard.ShardRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Creates, edits and soft-deletes transactions while keeping account and pouch
 * balances equal to the signed sum of the active records that reference them.
 *
 * Every mutation is one ledger unit: the record write and all balance writes
 * run inside local transactions on the transactions, accounts and pouches
 * shards, so any failure leaves balances untouched. All validation happens
 * before the first write; checks against other records run inside the unit.
 */
@Service
@Slf4j
public class LedgerService {

    public static final int DEFAULT_LIST_LIMIT = 100;

    private final ShardRouter router;
    private final TransactionRepository transactionRepository;
    private final AccountRepository accountRepository;
    private final PouchRepository pouchRepository;
    private final BalanceWriter balanceWriter;
    private final LedgerMetrics metrics;
    private final Clock clock;
    private final List<Shard> ledgerShards;

    public LedgerService(ShardRouter router,
                         TransactionRepository transactionRepository,
                         AccountRepository accountRepository,
                         PouchRepository pouchRepository,
                         BalanceWriter balanceWriter,
                         LedgerMetrics metrics,
                         Clock clock) {
        this.router = router;
        this.transactionRepository = transactionRepository;
        this.accountRepository = accountRepository;
        this.pouchRepository = pouchRepository;
        this.balanceWriter = balanceWriter;
        this.metrics = metrics;
        this.clock = clock;
        ShardMap shardMap = router.shardMap();
        this.ledgerShards = List.of(
            shardMap.resolve(RecordCollection.TRANSACTIONS),
            shardMap.resolve(RecordCollection.ACCOUNTS),
            shardMap.resolve(RecordCollection.POUCHES));
    }

    /**
     * Records a transaction and applies its signed effect to the account and
     * to either its splits' pouches or its directly referenced pouch.
     *
     * The account row is locked before it is checked, so a concurrent
     * deactivation either lands before this call sees the account or waits
     * until the transaction is recorded.
     *
     * @throws ValidationException if a required field is missing, the amount is not
     *                             positive, the splits exceed the amount, or a referenced
     *                             account or pouch is unknown or unusable
     */
    public Transaction createTransaction(CreateTransactionRequest request) {
        requireText(request.getOwnerId(), "ownerId");
        requireText(request.getAccountId(), "accountId");
        if (request.getType() == null) {
            throw new ValidationException("type is required");
        }
        BigDecimal amount = Amounts.requirePositive(request.getAmount(), "amount");
        List<SplitAllocation> allocations = validateSplits(request.getSplits(), amount);
        String id = UUID.randomUUID().toString();

        Transaction transaction = metrics.timeMutation("create", () -> inLedgerUnit(() -> {
            Account account = requireUsableAccount(request.getAccountId());
            CurrencyCode currency = request.getCurrency() != null ? request.getCurrency() : account.getCurrency();
            if (currency != account.getCurrency()) {
                throw new ValidationException(String.format("Transaction currency %s does not match account %s currency %s",
                    currency, account.getId(), account.getCurrency()));
            }
            if (request.getPouchId() != null) {
                requirePouch(request.getPouchId());
            }
            requireSplitPouches(allocations);

            Transaction.TransactionBuilder builder = Transaction.builder()
                .id(id)
                .ownerId(request.getOwnerId())
                .accountId(account.getId())
                .amount(amount)
                .currency(currency)
                .type(request.getType())
                .description(request.getDescription())
                .category(request.getCategory())
                .pouchId(request.getPouchId())
                .recurring(request.isRecurring())
                .recurringPattern(request.getRecurringPattern())
                .transactionDate(request.getTransactionDate() != null ? request.getTransactionDate() : clock.instant());
            allocations.forEach(allocation -> builder.split(newSplit(id, allocation)));
            Transaction created = builder.build();

            transactionRepository.insert(created);
            balanceWriter.apply(BalanceEffects.of(created));
            return created;
        }));
        metrics.recordTransaction("create");
        log.info("Created {} transaction {} of {} on account {} ({} splits)",
            transaction.getType(), id, amount.toPlainString(), transaction.getAccountId(), allocations.size());
        return getTransaction(id);
    }

    /**
     * Applies a partial update and moves balances by the difference between the
     * new and the old effect of the transaction. A pouch reassignment reverses
     * the full old effect on the old pouch and applies the full new effect on
     * the new one; split edits are diffed so unchanged splits keep their rows.
     *
     * @throws NotFoundException   if no active transaction has this id
     * @throws ValidationException if the patched transaction would be invalid
     */
    public Transaction updateTransaction(String transactionId, TransactionPatch patch) {
        Transaction updated = metrics.timeMutation("update", () -> inLedgerUnit(() -> {
            Transaction existing = transactionRepository.lockActive(transactionId)
                .orElseThrow(() -> new NotFoundException("Transaction", transactionId));

            BigDecimal amount = patch.getAmount() != null
                ? Amounts.requirePositive(patch.getAmount(), "amount")
                : existing.getAmount();
            String pouchId = patch.isClearPouch() ? null
                : patch.getPouchId() != null ? patch.getPouchId() : existing.getPouchId();
            if (pouchId != null && !pouchId.equals(existing.getPouchId())) {
                requirePouch(pouchId);
            }
            List<SplitAllocation> allocations = patch.getSplits() != null
                ? validateSplits(patch.getSplits(), amount)
                : validateSplits(existing.getSplits().stream().map(TransactionSplit::allocation).toList(), amount);
            requireSplitPouches(allocations);

            SplitDiff diff = diffSplits(existing, patch.getSplits() != null ? allocations : null);
            Transaction result = existing.toBuilder()
                .amount(amount)
                .type(patch.getType() != null ? patch.getType() : existing.getType())
                .description(patch.getDescription() != null ? patch.getDescription() : existing.getDescription())
                .category(patch.getCategory() != null ? patch.getCategory() : existing.getCategory())
                .pouchId(pouchId)
                .clearSplits()
                .splits(diff.result())
                .build();

            transactionRepository.update(result, clock.instant());
            diff.removed().forEach(split -> transactionRepository.deleteSplit(split.getId()));
            diff.added().forEach(transactionRepository::insertSplit);

            BalanceEffects delta = BalanceEffects.of(result).minus(BalanceEffects.of(existing));
            balanceWriter.apply(delta);
            log.debug("Transaction {} balance delta {}", transactionId, delta);
            return result;
        }));
        metrics.recordTransaction("update");
        log.info("Updated transaction {}", transactionId);
        return getTransaction(updated.getId());
    }

    /**
     * Soft-deletes a transaction and reverses its full effect on the account and
     * on every pouch it touched, directly or through splits.
     *
     * @throws NotFoundException if no active transaction has this id
     */
    public void deleteTransaction(String transactionId) {
        metrics.timeMutation("delete", () -> inLedgerUnit(() -> {
            Transaction existing = transactionRepository.lockActive(transactionId)
                .orElseThrow(() -> new NotFoundException("Transaction", transactionId));
            transactionRepository.markDeleted(transactionId, clock.instant());
            balanceWriter.apply(BalanceEffects.of(existing).negate());
            return null;
        }));
        metrics.recordTransaction("delete");
        log.info("Deleted transaction {}", transactionId);
    }

    /**
     * Soft-deleted transactions read as absent.
     */
    public Optional<Transaction> findTransaction(String transactionId) {
        return transactionRepository.findActive(transactionId);
    }

    public Transaction getTransaction(String transactionId) {
        return transactionRepository.findActive(transactionId)
            .orElseThrow(() -> new NotFoundException("Transaction", transactionId));
    }

    public List<Transaction> listTransactions(String ownerId) {
        return listTransactions(ownerId, DEFAULT_LIST_LIMIT);
    }

    public List<Transaction> listTransactions(String ownerId, int limit) {
        if (limit < 1) {
            throw new ValidationException("limit must be at least 1, got " + limit);
        }
        return transactionRepository.findRecent(ownerId, limit);
    }

    public List<TransactionSplit> listSplits(String transactionId) {
        return getTransaction(transactionId).getSplits();
    }

    private <T> T inLedgerUnit(Supplier<T> work) {
        return router.inTransactions(ledgerShards, work);
    }

    private List<SplitAllocation> validateSplits(List<SplitAllocation> splits, BigDecimal amount) {
        List<SplitAllocation> normalized = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (SplitAllocation split : splits) {
            if (split == null) {
                throw new ValidationException("split is required");
            }
            requireText(split.getPouchId(), "split pouchId");
            BigDecimal splitAmount = Amounts.requirePositive(split.getAmount(), "split amount");
            total = total.add(splitAmount);
            normalized.add(SplitAllocation.of(split.getPouchId(), splitAmount));
        }
        if (total.compareTo(amount) > 0) {
            throw new ValidationException(String.format("Split total %s exceeds transaction amount %s",
                total.toPlainString(), amount.toPlainString()));
        }
        return normalized;
    }

    private void requireSplitPouches(List<SplitAllocation> allocations) {
        allocations.stream().map(SplitAllocation::getPouchId).distinct().forEach(this::requirePouch);
    }

    /**
     * Matches requested allocations against stored splits by pouch and amount.
     * A null request keeps the stored splits as they are.
     */
    private static SplitDiff diffSplits(Transaction existing, List<SplitAllocation> requested) {
        if (requested == null) {
            return new SplitDiff(existing.getSplits(), List.of(), List.of());
        }
        List<TransactionSplit> unmatched = new ArrayList<>(existing.getSplits());
        List<TransactionSplit> result = new ArrayList<>();
        List<TransactionSplit> added = new ArrayList<>();
        for (SplitAllocation allocation : requested) {
            Optional<TransactionSplit> kept = unmatched.stream().filter(allocation::sameAs).findFirst();
            if (kept.isPresent()) {
                unmatched.remove(kept.get());
                result.add(kept.get());
            } else {
                TransactionSplit split = newSplit(existing.getId(), allocation);
                added.add(split);
                result.add(split);
            }
        }
        return new SplitDiff(result, added, unmatched);
    }

    private static TransactionSplit newSplit(String transactionId, SplitAllocation allocation) {
        return new TransactionSplit(UUID.randomUUID().toString(), transactionId,
            allocation.getPouchId(), allocation.getAmount());
    }

    private Account requireUsableAccount(String accountId) {
        Account account = accountRepository.lockById(accountId)
            .orElseThrow(() -> new ValidationException("Unknown account: " + accountId));
        if (!account.isActive()) {
            throw new ValidationException("Account is inactive: " + accountId);
        }
        return account;
    }

    private void requirePouch(String pouchId) {
        if (pouchRepository.findById(pouchId).isEmpty()) {
            throw new ValidationException("Unknown pouch: " + pouchId);
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }

    private record SplitDiff(List<TransactionSplit> result, List<TransactionSplit> added, List<TransactionSplit> removed) {
    }
}
