package com.flagship.finance_ledger.observability;

import com.flagship.finance_ledger.shard.Shard;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized metrics for the ledger core.
 *
 * Metrics exposed:
 * - ledger.transactions: counter tagged with operation (create/update/delete)
 * - ledger.transfers.created: counter of completed transfers
 * - ledger.mutation.duration: timer tagged with operation
 * - schema.migrations: counter tagged with shard and outcome (applied/failed/rolled_back)
 * - seed.rows: counter tagged with shard and outcome (inserted/skipped)
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Counter transfersCreated;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.transfersCreated = Counter.builder("ledger.transfers.created")
                .description("Number of transfers that moved money between accounts")
                .register(registry);
    }

    // ==================== Ledger ====================

    public void recordTransaction(String operation) {
        registry.counter("ledger.transactions", "operation", operation).increment();
    }

    public void incrementTransfersCreated() {
        transfersCreated.increment();
    }

    /**
     * Times a balance-affecting ledger operation.
     */
    public <T> T timeMutation(String operation, Supplier<T> mutation) {
        return Timer.builder("ledger.mutation.duration")
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(mutation);
    }

    // ==================== Schema & seeds ====================

    public void recordMigration(Shard shard, String outcome) {
        registry.counter("schema.migrations", "shard", shard.shardName(), "outcome", outcome).increment();
    }

    public void recordSeedRow(Shard shard, String outcome) {
        registry.counter("seed.rows", "shard", shard.shardName(), "outcome", outcome).increment();
    }
}
