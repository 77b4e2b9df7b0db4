package com.flagship.finance_ledger.seed;

import com.flagship.finance_ledger.common.exception.ConfigurationException;
import com.flagship.finance_ledger.common.exception.NotFoundException;
import com.flagship.finance_ledger.common.exception.SeedException;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.shard.Shard;
import com.flagship.finance_ledger.shard.ShardExecutor;
import com.flagship.finance_ledger.shard.ShardRouter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs seed batches against their target shards.
 *
 * A batch that completed on a shard is recorded in that shard's
 * {@value #STATE_TABLE} table and skipped as a whole afterwards. Inside a
 * batch, a row that hits a uniqueness constraint counts as already seeded;
 * any other failure aborts the run with the batch number and shard.
 */
@Service
@Slf4j
public class SeedLoader {

    static final String STATE_TABLE = "seed_batches";

    private static final String CREATE_STATE_TABLE =
        "CREATE TABLE IF NOT EXISTS " + STATE_TABLE + " (" +
        "batch INTEGER PRIMARY KEY, " +
        "name VARCHAR(255) NOT NULL, " +
        "executed_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)";

    private final ShardRouter router;
    private final List<SeedBatch> batches;
    private final LedgerMetrics metrics;

    public SeedLoader(ShardRouter router, List<SeedBatch> batches, LedgerMetrics metrics) {
        List<SeedBatch> sorted = new ArrayList<>(batches);
        sorted.sort(Comparator.comparingInt(SeedBatch::number));
        Set<Integer> numbers = new HashSet<>();
        for (SeedBatch batch : sorted) {
            if (!numbers.add(batch.number())) {
                throw new ConfigurationException("Duplicate seed batch number " + batch.number());
            }
        }
        this.router = router;
        this.batches = List.copyOf(sorted);
        this.metrics = metrics;
    }

    public SeedReport runSeeds() {
        return run(EnumSet.allOf(Shard.class));
    }

    /**
     * Runs every pending batch that writes to {@code shard}.
     */
    public SeedReport runSeeds(Shard shard) {
        return run(EnumSet.of(shard));
    }

    /**
     * Runs one batch on one shard. A batch already recorded on the shard is
     * skipped; a batch with no rows for the shard does nothing.
     *
     * @throws NotFoundException if no batch has this number
     */
    public SeedReport runSeedBatch(Shard shard, int batchNumber) {
        SeedBatch batch = batches.stream()
            .filter(candidate -> candidate.number() == batchNumber)
            .findFirst()
            .orElseThrow(() -> new NotFoundException("Seed batch", batchNumber));
        if (!batch.targets(router.shardMap()).contains(shard)) {
            log.info("Seed batch {} has no rows for shard {}, skipping", batchNumber, shard.shardName());
            return new SeedReport(List.of(), 0);
        }
        return runIfPending(batch, shard)
            .map(run -> new SeedReport(List.of(run), 0))
            .orElseGet(() -> new SeedReport(List.of(), 1));
    }

    /**
     * Forgets which batches ran on a shard. Seeded rows stay in place.
     */
    public void resetSeeds(Shard shard) {
        ShardExecutor executor = router.executor(shard);
        executor.execute(CREATE_STATE_TABLE);
        int cleared = executor.jdbc().update("DELETE FROM " + STATE_TABLE);
        log.info("Reset {} seed batch records on shard {}", cleared, shard.shardName());
    }

    /**
     * Resets and re-runs the batches targeting one shard. Rows that are still
     * present are skipped as duplicates.
     */
    public SeedReport refreshSeeds(Shard shard) {
        resetSeeds(shard);
        return runSeeds(shard);
    }

    public Map<Shard, ShardSeedStatus> seedStatus() {
        Map<Shard, ShardSeedStatus> status = new EnumMap<>(Shard.class);
        for (Shard shard : Shard.values()) {
            List<Integer> executed = executedBatches(router.executor(shard));
            List<Integer> pending = batches.stream()
                .filter(batch -> batch.targets(router.shardMap()).contains(shard))
                .map(SeedBatch::number)
                .filter(number -> !executed.contains(number))
                .toList();
            status.put(shard, new ShardSeedStatus(shard, executed, pending));
        }
        return status;
    }

    private SeedReport run(Set<Shard> shards) {
        List<SeedBatchRun> executed = new ArrayList<>();
        int alreadyExecuted = 0;

        for (SeedBatch batch : batches) {
            for (Shard shard : batch.targets(router.shardMap())) {
                if (!shards.contains(shard)) {
                    continue;
                }
                Optional<SeedBatchRun> run = runIfPending(batch, shard);
                if (run.isPresent()) {
                    executed.add(run.get());
                } else {
                    alreadyExecuted++;
                }
            }
        }

        log.info("Seed run finished: {} batch runs, {} already executed", executed.size(), alreadyExecuted);
        return new SeedReport(List.copyOf(executed), alreadyExecuted);
    }

    /**
     * @return the run, or empty when the batch is already recorded on the shard
     */
    private Optional<SeedBatchRun> runIfPending(SeedBatch batch, Shard shard) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable("shard", shard.shardName())) {
            ShardExecutor executor = router.executor(shard);
            if (executedBatches(executor).contains(batch.number())) {
                log.debug("Seed batch {} already executed on shard {}", batch.number(), shard.shardName());
                return Optional.empty();
            }
            return Optional.of(runBatch(batch, shard, executor));
        }
    }

    private SeedBatchRun runBatch(SeedBatch batch, Shard shard, ShardExecutor executor) {
        log.info("Running seed batch {} ({}) on shard {}", batch.number(), batch.name(), shard.shardName());
        int inserted = 0;
        int duplicates = 0;
        try {
            for (SeedRow row : batch.rows()) {
                if (router.shardMap().resolve(row.getCollection()) != shard) {
                    continue;
                }
                try {
                    executor.insert(row.getCollection(), row.getValues());
                    inserted++;
                    metrics.recordSeedRow(shard, "inserted");
                } catch (DuplicateKeyException e) {
                    duplicates++;
                    metrics.recordSeedRow(shard, "skipped");
                    log.warn("Row {} in {} already seeded, skipping", row.getValues().get("id"),
                        row.getCollection().tableName());
                }
            }
            executor.jdbc().update("INSERT INTO " + STATE_TABLE + " (batch, name) VALUES (?, ?)",
                batch.number(), batch.name());
        } catch (RuntimeException e) {
            log.error("Seed batch {} failed on shard {}", batch.number(), shard.shardName(), e);
            throw new SeedException(batch.number(), shard, e);
        }
        log.info("Seed batch {} on shard {}: {} inserted, {} already present",
            batch.number(), shard.shardName(), inserted, duplicates);
        return new SeedBatchRun(batch.number(), batch.name(), shard, inserted, duplicates);
    }

    private static List<Integer> executedBatches(ShardExecutor executor) {
        executor.execute(CREATE_STATE_TABLE);
        return executor.jdbc().queryForList("SELECT batch FROM " + STATE_TABLE + " ORDER BY batch", Integer.class);
    }
}
