package com.flagship.finance_ledger.migration;

import com.flagship.finance_ledger.common.exception.MigrationException;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.shard.Shard;
import com.flagship.finance_ledger.shard.ShardExecutor;
import com.flagship.finance_ledger.shard.ShardRouter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Applies and rolls back versioned schema changes, shard by shard.
 *
 * Per shard and version the state is NOT_APPLIED or APPLIED, kept in the
 * shard's own {@value #STATE_TABLE} table:
 * 1. Apply skips versions already recorded, so re-running is a no-op
 * 2. A version's forward block and its state row are written in one shard transaction
 * 3. A failing version is reported with shard, version and cause, stops later
 *    versions on that shard for this run, and leaves every other shard alone
 * 4. Rollback moves each shard back by exactly one version per call
 *
 * Runs against the same shard are serialized by a per-shard lock held only
 * for the duration of that shard's work.
 */
@Service
@Slf4j
public class MigrationEngine {

    static final String STATE_TABLE = "schema_migrations";

    private static final String CREATE_STATE_TABLE =
        "CREATE TABLE IF NOT EXISTS " + STATE_TABLE + " (" +
        "version INTEGER PRIMARY KEY, " +
        "name VARCHAR(255) NOT NULL, " +
        "applied_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)";

    private final ShardRouter router;
    private final MigrationRegistry registry;
    private final LedgerMetrics metrics;
    private final Map<Shard, ReentrantLock> locks = new EnumMap<>(Shard.class);

    public MigrationEngine(ShardRouter router, MigrationRegistry registry, LedgerMetrics metrics) {
        this.router = router;
        this.registry = registry;
        this.metrics = metrics;
        for (Shard shard : Shard.values()) {
            locks.put(shard, new ReentrantLock());
        }
    }

    public MigrationReport applyMigrations() {
        return applyMigrations(null);
    }

    /**
     * Brings every shard up to {@code targetVersion} (or the latest registered
     * version when null).
     */
    public MigrationReport applyMigrations(Integer targetVersion) {
        List<MigrationReport> reports = new ArrayList<>();
        for (Shard shard : Shard.values()) {
            reports.add(applyMigrations(shard, targetVersion));
        }
        MigrationReport report = MigrationReport.merge(reports);
        log.info("Migration run finished: {} applied, {} already applied, {} failed",
            report.getCompleted().size(), report.getSkipped().size(), report.getFailures().size());
        return report;
    }

    /**
     * Brings a single shard up to {@code targetVersion} (or the latest
     * registered version when null). A failing version stops the later ones.
     */
    public MigrationReport applyMigrations(Shard shard, Integer targetVersion) {
        return withShardLock(shard, () -> {
            List<MigrationStep> completed = new ArrayList<>();
            List<MigrationStep> skipped = new ArrayList<>();
            ShardExecutor executor = router.executor(shard);
            List<Integer> applied;
            try {
                applied = readState(executor);
            } catch (RuntimeException e) {
                return MigrationReport.failed(stateFailure(shard, e));
            }

            for (Migration migration : registry.forShard(shard, targetVersion)) {
                MigrationStep step = new MigrationStep(shard, migration.version(), migration.name());
                if (applied.contains(migration.version())) {
                    skipped.add(step);
                    continue;
                }
                try {
                    executor.inTransaction(() -> {
                        migration.up(shard).forEach(executor::execute);
                        executor.jdbc().update("INSERT INTO " + STATE_TABLE + " (version, name) VALUES (?, ?)",
                            migration.version(), migration.name());
                        return null;
                    });
                    completed.add(step);
                    metrics.recordMigration(shard, "applied");
                    log.info("Applied migration {} on shard {}", migration, shard.shardName());
                } catch (RuntimeException e) {
                    metrics.recordMigration(shard, "failed");
                    log.error("Migration {} failed on shard {}, skipping remaining versions for this shard",
                        migration, shard.shardName(), e);
                    return new MigrationReport(List.copyOf(completed), List.copyOf(skipped),
                        List.of(new MigrationException(shard, migration.version(), e.getMessage(), e)));
                }
            }
            return new MigrationReport(List.copyOf(completed), List.copyOf(skipped), List.of());
        });
    }

    /**
     * Reverts the highest applied version on every shard that has one.
     */
    public MigrationReport rollbackOne() {
        List<MigrationReport> reports = new ArrayList<>();
        for (Shard shard : Shard.values()) {
            reports.add(rollbackOne(shard));
        }
        return MigrationReport.merge(reports);
    }

    /**
     * Reverts the highest applied version on one shard. A shard with nothing
     * applied yields an empty report.
     */
    public MigrationReport rollbackOne(Shard shard) {
        return withShardLock(shard, () -> {
            ShardExecutor executor = router.executor(shard);
            List<Integer> applied;
            try {
                applied = readState(executor);
            } catch (RuntimeException e) {
                return MigrationReport.failed(stateFailure(shard, e));
            }
            if (applied.isEmpty()) {
                log.info("No migrations to roll back on shard {}", shard.shardName());
                return MigrationReport.empty();
            }

            int version = applied.get(applied.size() - 1);
            Optional<Migration> migration = registry.find(version);
            if (migration.isEmpty()) {
                metrics.recordMigration(shard, "failed");
                return MigrationReport.failed(
                    new MigrationException(shard, version, "no registered migration for applied version", null));
            }

            try {
                executor.inTransaction(() -> {
                    migration.get().down(shard).forEach(executor::execute);
                    executor.jdbc().update("DELETE FROM " + STATE_TABLE + " WHERE version = ?", version);
                    return null;
                });
            } catch (RuntimeException e) {
                metrics.recordMigration(shard, "failed");
                log.error("Rollback of {} failed on shard {}", migration.get(), shard.shardName(), e);
                return MigrationReport.failed(new MigrationException(shard, version, e.getMessage(), e));
            }
            metrics.recordMigration(shard, "rolled_back");
            log.info("Rolled back migration {} on shard {}", migration.get(), shard.shardName());
            return new MigrationReport(List.of(new MigrationStep(shard, version, migration.get().name())), List.of(), List.of());
        });
    }

    public Map<Shard, ShardMigrationStatus> status() {
        Map<Shard, ShardMigrationStatus> status = new EnumMap<>(Shard.class);
        for (Shard shard : Shard.values()) {
            status.put(shard, status(shard));
        }
        return status;
    }

    public ShardMigrationStatus status(Shard shard) {
        List<Integer> applied = readState(router.executor(shard));
        List<Migration> targeting = registry.forShard(shard, null);
        int pending = (int) targeting.stream().filter(migration -> !applied.contains(migration.version())).count();
        return new ShardMigrationStatus(shard, applied, pending, targeting.size());
    }

    private MigrationReport withShardLock(Shard shard, Supplier<MigrationReport> work) {
        ReentrantLock lock = locks.get(shard);
        lock.lock();
        try (MDC.MDCCloseable ignored = MDC.putCloseable("shard", shard.shardName())) {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Creates the state table when missing and returns the applied versions, ascending.
     */
    private static List<Integer> readState(ShardExecutor executor) {
        executor.execute(CREATE_STATE_TABLE);
        return executor.jdbc().queryForList("SELECT version FROM " + STATE_TABLE + " ORDER BY version", Integer.class);
    }

    // Version 0 stands for the state table itself.
    private MigrationException stateFailure(Shard shard, RuntimeException cause) {
        metrics.recordMigration(shard, "failed");
        log.error("Cannot read migration state on shard {}", shard.shardName(), cause);
        return new MigrationException(shard, 0, "cannot read applied versions: " + cause.getMessage(), cause);
    }
}
