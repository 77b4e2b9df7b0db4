package com.flagship.finance_ledger.pouch;

import com.flagship.finance_ledger.shard.RecordCollection;
import com.flagship.finance_ledger.shard.RecordQuery;
import com.flagship.finance_ledger.shard.ShardExecutor;
import com.flagship.finance_ledger.shard.ShardRouter;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class GoalRepository {

    private static final RowMapper<Goal> ROW_MAPPER = (rs, rowNum) -> Goal.builder()
        .id(rs.getString("id"))
        .ownerId(rs.getString("user_id"))
        .pouchId(rs.getString("pouch_id"))
        .title(rs.getString("title"))
        .targetAmount(rs.getBigDecimal("target_amount"))
        .currentAmount(rs.getBigDecimal("current_amount"))
        .targetDate(rs.getDate("target_date").toLocalDate())
        .monthlyContribution(rs.getBigDecimal("monthly_contribution"))
        .active(rs.getBoolean("is_active"))
        .build();

    private final ShardRouter router;

    public GoalRepository(ShardRouter router) {
        this.router = router;
    }

    public void insert(Goal goal) {
        executor().insert(RecordCollection.GOALS, columns(goal, true));
    }

    public int update(Goal goal) {
        Map<String, Object> values = columns(goal, false);
        values.put("updated_at", Timestamp.from(Instant.now()));
        return executor().update(RecordCollection.GOALS, goal.getId(), values);
    }

    public Optional<Goal> findById(String id) {
        return executor().findById(RecordCollection.GOALS, id, ROW_MAPPER);
    }

    public List<Goal> findByOwner(String ownerId) {
        return executor().query(RecordCollection.GOALS, RecordQuery.where("user_id", ownerId), ROW_MAPPER);
    }

    private static Map<String, Object> columns(Goal goal, boolean withIdentity) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (withIdentity) {
            values.put("id", goal.getId());
            values.put("user_id", goal.getOwnerId());
            values.put("pouch_id", goal.getPouchId());
        }
        values.put("title", goal.getTitle());
        values.put("target_amount", goal.getTargetAmount());
        values.put("current_amount", goal.getCurrentAmount());
        values.put("target_date", Date.valueOf(goal.getTargetDate()));
        values.put("monthly_contribution", goal.getMonthlyContribution());
        values.put("is_active", goal.isActive());
        return values;
    }

    private ShardExecutor executor() {
        return router.executorFor(RecordCollection.GOALS);
    }
}
