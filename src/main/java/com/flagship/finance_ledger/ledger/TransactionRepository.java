package com.flagship.finance_ledger.ledger;

import com.flagship.finance_ledger.common.CurrencyCode;
import com.flagship.finance_ledger.shard.RecordCollection;
import com.flagship.finance_ledger.shard.RecordQuery;
import com.flagship.finance_ledger.shard.ShardExecutor;
import com.flagship.finance_ledger.shard.ShardRouter;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed access to {@code transactions} and {@code transaction_splits}, which
 * share a shard so a transaction and its splits are written together.
 *
 * Soft-deleted transactions are invisible to every read here.
 */
@Repository
public class TransactionRepository {

    private static final String SIGNED_AMOUNT = "CASE WHEN t.type = 'INCOME' THEN %1$s ELSE -%1$s END";

    private static final RowMapper<Transaction> TRANSACTION_MAPPER = (rs, rowNum) -> Transaction.builder()
        .id(rs.getString("id"))
        .ownerId(rs.getString("user_id"))
        .accountId(rs.getString("account_id"))
        .amount(rs.getBigDecimal("amount"))
        .currency(CurrencyCode.valueOf(rs.getString("currency")))
        .type(TransactionType.valueOf(rs.getString("type")))
        .description(rs.getString("description"))
        .category(rs.getString("category"))
        .pouchId(rs.getString("pouch_id"))
        .recurring(rs.getBoolean("is_recurring"))
        .recurringPattern(rs.getString("recurring_pattern"))
        .transactionDate(toInstant(rs.getTimestamp("transaction_date")))
        .deleted(rs.getBoolean("is_deleted"))
        .createdAt(toInstant(rs.getTimestamp("created_at")))
        .updatedAt(toInstant(rs.getTimestamp("updated_at")))
        .build();

    private static final RowMapper<TransactionSplit> SPLIT_MAPPER = (rs, rowNum) -> new TransactionSplit(
        rs.getString("id"),
        rs.getString("transaction_id"),
        rs.getString("pouch_id"),
        rs.getBigDecimal("amount"));

    private final ShardRouter router;

    public TransactionRepository(ShardRouter router) {
        this.router = router;
    }

    public void insert(Transaction transaction) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("id", transaction.getId());
        values.put("user_id", transaction.getOwnerId());
        values.put("account_id", transaction.getAccountId());
        values.put("amount", transaction.getAmount());
        values.put("currency", transaction.getCurrency().name());
        values.put("type", transaction.getType().name());
        values.put("description", transaction.getDescription());
        values.put("category", transaction.getCategory());
        values.put("pouch_id", transaction.getPouchId());
        values.put("is_recurring", transaction.isRecurring());
        values.put("recurring_pattern", transaction.getRecurringPattern());
        values.put("transaction_date", Timestamp.from(transaction.getTransactionDate()));
        executor().insert(RecordCollection.TRANSACTIONS, values);
        transaction.getSplits().forEach(this::insertSplit);
    }

    public Optional<Transaction> findActive(String id) {
        return executor().findById(RecordCollection.TRANSACTIONS, id, TRANSACTION_MAPPER)
            .filter(transaction -> !transaction.isDeleted())
            .map(this::withSplits);
    }

    /**
     * Reads an active transaction and holds its row lock until the surrounding
     * shard transaction ends, serializing concurrent edits of the same record.
     */
    public Optional<Transaction> lockActive(String id) {
        return executor().jdbc()
            .query("SELECT * FROM transactions WHERE id = ? FOR UPDATE", TRANSACTION_MAPPER, id)
            .stream()
            .findFirst()
            .filter(transaction -> !transaction.isDeleted())
            .map(this::withSplits);
    }

    /**
     * Active transactions of an owner, newest first.
     */
    public List<Transaction> findRecent(String ownerId, int limit) {
        RecordQuery query = RecordQuery.builder()
            .filter("user_id", ownerId)
            .filter("is_deleted", false)
            .orderBy("transaction_date")
            .descending(true)
            .limit(limit)
            .build();
        return executor().query(RecordCollection.TRANSACTIONS, query, TRANSACTION_MAPPER).stream()
            .map(this::withSplits)
            .toList();
    }

    public List<TransactionSplit> findSplits(String transactionId) {
        RecordQuery query = RecordQuery.builder()
            .filter("transaction_id", transactionId)
            .orderBy("created_at")
            .build();
        return executor().query(RecordCollection.TRANSACTION_SPLITS, query, SPLIT_MAPPER);
    }

    public void update(Transaction transaction, Instant updatedAt) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("amount", transaction.getAmount());
        values.put("type", transaction.getType().name());
        values.put("description", transaction.getDescription());
        values.put("category", transaction.getCategory());
        values.put("pouch_id", transaction.getPouchId());
        values.put("updated_at", Timestamp.from(updatedAt));
        executor().update(RecordCollection.TRANSACTIONS, transaction.getId(), values);
    }

    public void insertSplit(TransactionSplit split) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("id", split.getId());
        values.put("transaction_id", split.getTransactionId());
        values.put("pouch_id", split.getPouchId());
        values.put("amount", split.getAmount());
        executor().insert(RecordCollection.TRANSACTION_SPLITS, values);
    }

    public void deleteSplit(String splitId) {
        executor().delete(RecordCollection.TRANSACTION_SPLITS, splitId);
    }

    public int markDeleted(String id, Instant deletedAt) {
        return executor().jdbc().update(
            "UPDATE transactions SET is_deleted = TRUE, deleted_at = ?, updated_at = ? WHERE id = ? AND is_deleted = FALSE",
            Timestamp.from(deletedAt), Timestamp.from(deletedAt), id);
    }

    /**
     * Sum of signed amounts of the active transactions on an account.
     */
    public BigDecimal sumAccountEffects(String accountId) {
        BigDecimal sum = executor().jdbc().queryForObject(
            "SELECT COALESCE(SUM(" + SIGNED_AMOUNT.formatted("t.amount") + "), 0) FROM transactions t " +
            "WHERE t.account_id = ? AND t.is_deleted = FALSE",
            BigDecimal.class, accountId);
        return sum != null ? sum : BigDecimal.ZERO;
    }

    /**
     * Sum of signed apportioned amounts referencing a pouch: split amounts for
     * split transactions, full amounts for unsplit transactions on the pouch.
     */
    public BigDecimal sumPouchEffects(String pouchId) {
        BigDecimal direct = executor().jdbc().queryForObject(
            "SELECT COALESCE(SUM(" + SIGNED_AMOUNT.formatted("t.amount") + "), 0) FROM transactions t " +
            "WHERE t.pouch_id = ? AND t.is_deleted = FALSE " +
            "AND NOT EXISTS (SELECT 1 FROM transaction_splits s WHERE s.transaction_id = t.id)",
            BigDecimal.class, pouchId);
        BigDecimal viaSplits = executor().jdbc().queryForObject(
            "SELECT COALESCE(SUM(" + SIGNED_AMOUNT.formatted("s.amount") + "), 0) FROM transaction_splits s " +
            "JOIN transactions t ON t.id = s.transaction_id " +
            "WHERE s.pouch_id = ? AND t.is_deleted = FALSE",
            BigDecimal.class, pouchId);
        return (direct != null ? direct : BigDecimal.ZERO).add(viaSplits != null ? viaSplits : BigDecimal.ZERO);
    }

    private Transaction withSplits(Transaction transaction) {
        return transaction.toBuilder().splits(findSplits(transaction.getId())).build();
    }

    private ShardExecutor executor() {
        return router.executorFor(RecordCollection.TRANSACTIONS);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
