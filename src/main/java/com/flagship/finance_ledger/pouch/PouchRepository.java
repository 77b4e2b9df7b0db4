package com.flagship.finance_ledger.pouch;

import com.flagship.finance_ledger.shard.RecordCollection;
import com.flagship.finance_ledger.shard.RecordQuery;
import com.flagship.finance_ledger.shard.ShardExecutor;
import com.flagship.finance_ledger.shard.ShardRouter;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed access to the {@code pouches} and {@code pouch_shares} collections.
 */
@Repository
public class PouchRepository {

    private static final RowMapper<Pouch> POUCH_MAPPER = (rs, rowNum) -> Pouch.builder()
        .id(rs.getString("id"))
        .ownerId(rs.getString("user_id"))
        .name(rs.getString("name"))
        .visibility(PouchVisibility.valueOf(rs.getString("visibility")))
        .budgetAmount(rs.getBigDecimal("budget_amount"))
        .budgetPeriod(rs.getString("budget_period") != null ? BudgetPeriod.valueOf(rs.getString("budget_period")) : null)
        .balance(rs.getBigDecimal("balance"))
        .build();

    private static final RowMapper<PouchShare> SHARE_MAPPER = (rs, rowNum) -> new PouchShare(
        rs.getString("id"),
        rs.getString("pouch_id"),
        rs.getString("user_id"),
        ShareRole.valueOf(rs.getString("role")));

    private final ShardRouter router;

    public PouchRepository(ShardRouter router) {
        this.router = router;
    }

    public void insert(Pouch pouch) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("id", pouch.getId());
        values.put("user_id", pouch.getOwnerId());
        values.put("name", pouch.getName());
        values.put("visibility", pouch.getVisibility().name());
        values.put("budget_amount", pouch.getBudgetAmount());
        values.put("budget_period", pouch.getBudgetPeriod() != null ? pouch.getBudgetPeriod().name() : null);
        values.put("balance", pouch.getBalance());
        executor(RecordCollection.POUCHES).insert(RecordCollection.POUCHES, values);
    }

    public Optional<Pouch> findById(String id) {
        return executor(RecordCollection.POUCHES).findById(RecordCollection.POUCHES, id, POUCH_MAPPER);
    }

    public List<Pouch> findByOwner(String ownerId) {
        return executor(RecordCollection.POUCHES)
            .query(RecordCollection.POUCHES, RecordQuery.where("user_id", ownerId), POUCH_MAPPER);
    }

    /**
     * Atomic in-place increment of the stored balance.
     *
     * @return rows changed, 0 when the pouch does not exist
     */
    public int applyBalanceDelta(String pouchId, BigDecimal delta) {
        return executor(RecordCollection.POUCHES).jdbc().update(
            "UPDATE pouches SET balance = balance + ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            delta, pouchId);
    }

    public void insertShare(PouchShare share) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("id", share.getId());
        values.put("pouch_id", share.getPouchId());
        values.put("user_id", share.getUserId());
        values.put("role", share.getRole().name());
        executor(RecordCollection.POUCH_SHARES).insert(RecordCollection.POUCH_SHARES, values);
    }

    public List<PouchShare> findShares(String pouchId) {
        return executor(RecordCollection.POUCH_SHARES)
            .query(RecordCollection.POUCH_SHARES, RecordQuery.where("pouch_id", pouchId), SHARE_MAPPER);
    }

    private ShardExecutor executor(RecordCollection collection) {
        return router.executorFor(collection);
    }
}
