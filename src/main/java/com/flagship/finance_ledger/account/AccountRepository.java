package com.flagship.finance_ledger.account;

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
 * Typed access to the {@code accounts} collection.
 */
@Repository
public class AccountRepository {

    private static final RowMapper<Account> ROW_MAPPER = (rs, rowNum) -> Account.builder()
        .id(rs.getString("id"))
        .ownerId(rs.getString("user_id"))
        .name(rs.getString("name"))
        .type(AccountType.valueOf(rs.getString("type")))
        .currency(CurrencyCode.valueOf(rs.getString("currency")))
        .initialBalance(rs.getBigDecimal("initial_balance"))
        .currentBalance(rs.getBigDecimal("current_balance"))
        .active(rs.getBoolean("is_active"))
        .createdAt(toInstant(rs.getTimestamp("created_at")))
        .updatedAt(toInstant(rs.getTimestamp("updated_at")))
        .build();

    private final ShardRouter router;

    public AccountRepository(ShardRouter router) {
        this.router = router;
    }

    public void insert(Account account) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("id", account.getId());
        values.put("user_id", account.getOwnerId());
        values.put("name", account.getName());
        values.put("type", account.getType().name());
        values.put("currency", account.getCurrency().name());
        values.put("initial_balance", account.getInitialBalance());
        values.put("current_balance", account.getCurrentBalance());
        values.put("is_active", account.isActive());
        executor().insert(RecordCollection.ACCOUNTS, values);
    }

    public Optional<Account> findById(String id) {
        return executor().findById(RecordCollection.ACCOUNTS, id, ROW_MAPPER);
    }

    /**
     * Reads an account and holds its row lock until the surrounding shard
     * transaction ends.
     */
    public Optional<Account> lockById(String id) {
        return executor().jdbc()
            .query("SELECT * FROM accounts WHERE id = ? FOR UPDATE", ROW_MAPPER, id)
            .stream()
            .findFirst();
    }

    public List<Account> findByOwner(String ownerId) {
        RecordQuery query = RecordQuery.builder()
            .filter("user_id", ownerId)
            .orderBy("created_at")
            .build();
        return executor().query(RecordCollection.ACCOUNTS, query, ROW_MAPPER);
    }

    /**
     * Adds {@code delta} to the stored balance in a single statement, so the
     * row lock taken by the update serializes concurrent writers.
     *
     * @return rows changed, 0 when the account does not exist
     */
    public int applyBalanceDelta(String accountId, BigDecimal delta) {
        return executor().jdbc().update(
            "UPDATE accounts SET current_balance = current_balance + ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            delta, accountId);
    }

    public int deactivate(String accountId) {
        return executor().jdbc().update(
            "UPDATE accounts SET is_active = FALSE, updated_at = CURRENT_TIMESTAMP WHERE id = ?", accountId);
    }

    private ShardExecutor executor() {
        return router.executorFor(RecordCollection.ACCOUNTS);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
