package com.flagship.finance_ledger.transfer;

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
 * Typed access to the {@code transfers} collection.
 */
@Repository
public class TransferRepository {

    private static final RowMapper<Transfer> ROW_MAPPER = (rs, rowNum) -> Transfer.builder()
        .id(rs.getString("id"))
        .ownerId(rs.getString("user_id"))
        .fromAccountId(rs.getString("from_account_id"))
        .toAccountId(rs.getString("to_account_id"))
        .amount(rs.getBigDecimal("amount"))
        .currency(CurrencyCode.valueOf(rs.getString("currency")))
        .description(rs.getString("description"))
        .status(TransferStatus.valueOf(rs.getString("status")))
        .transferDate(toInstant(rs.getTimestamp("transfer_date")))
        .createdAt(toInstant(rs.getTimestamp("created_at")))
        .build();

    private final ShardRouter router;

    public TransferRepository(ShardRouter router) {
        this.router = router;
    }

    public void insert(Transfer transfer) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("id", transfer.getId());
        values.put("user_id", transfer.getOwnerId());
        values.put("from_account_id", transfer.getFromAccountId());
        values.put("to_account_id", transfer.getToAccountId());
        values.put("amount", transfer.getAmount());
        values.put("currency", transfer.getCurrency().name());
        values.put("description", transfer.getDescription());
        values.put("status", transfer.getStatus().name());
        values.put("transfer_date", Timestamp.from(transfer.getTransferDate()));
        executor().insert(RecordCollection.TRANSFERS, values);
    }

    public Optional<Transfer> findById(String id) {
        return executor().findById(RecordCollection.TRANSFERS, id, ROW_MAPPER);
    }

    public List<Transfer> findByOwner(String ownerId) {
        RecordQuery query = RecordQuery.builder()
            .filter("user_id", ownerId)
            .orderBy("transfer_date")
            .descending(true)
            .build();
        return executor().query(RecordCollection.TRANSFERS, query, ROW_MAPPER);
    }

    /**
     * Incoming minus outgoing amount of the completed transfers touching an account.
     */
    public BigDecimal netFlow(String accountId) {
        BigDecimal net = executor().jdbc().queryForObject(
            "SELECT COALESCE(SUM(CASE WHEN to_account_id = ? THEN amount ELSE 0 END), 0) " +
            "- COALESCE(SUM(CASE WHEN from_account_id = ? THEN amount ELSE 0 END), 0) " +
            "FROM transfers WHERE status = 'COMPLETED' AND (from_account_id = ? OR to_account_id = ?)",
            BigDecimal.class, accountId, accountId, accountId, accountId);
        return net != null ? net : BigDecimal.ZERO;
    }

    private ShardExecutor executor() {
        return router.executorFor(RecordCollection.TRANSFERS);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
