package com.flagship.finance_ledger.shard;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Entry point to the sharded store: resolves a collection to its shard's
 * executor. There is no cross-shard operation here; callers that need data
 * from two shards issue two calls and join the results themselves.
 */
@Slf4j
public class ShardRouter implements AutoCloseable {

    private final ShardMap shardMap;
    private final Map<Shard, ShardExecutor> executors;

    public ShardRouter(ShardMap shardMap, Map<Shard, ShardExecutor> executors) {
        if (executors.size() != Shard.values().length) {
            throw new IllegalArgumentException("An executor is required for every shard, got " + executors.keySet());
        }
        this.shardMap = shardMap;
        this.executors = Collections.unmodifiableMap(new EnumMap<>(executors));
    }

    public ShardMap shardMap() {
        return shardMap;
    }

    public ShardExecutor executorFor(RecordCollection collection) {
        return executors.get(shardMap.resolve(collection));
    }

    public ShardExecutor executor(Shard shard) {
        return executors.get(shard);
    }

    /**
     * Runs {@code work} with a local transaction open on each listed shard.
     *
     * Transactions are nested in list order, so the last shard commits first.
     * Any exception thrown by {@code work} rolls back every shard. This is not
     * a distributed transaction: a commit failure on an outer shard after an
     * inner shard committed is not undone.
     */
    public <T> T inTransactions(List<Shard> shards, Supplier<T> work) {
        List<Shard> ordered = new ArrayList<>(new LinkedHashSet<>(shards));
        return nest(ordered, 0, work);
    }

    private <T> T nest(List<Shard> shards, int index, Supplier<T> work) {
        if (index == shards.size()) {
            return work.get();
        }
        return executors.get(shards.get(index)).inTransaction(() -> nest(shards, index + 1, work));
    }

    /**
     * Pings every shard; a failure marks that shard unhealthy without
     * affecting the others.
     */
    public Map<Shard, Boolean> healthCheck() {
        Map<Shard, Boolean> health = new EnumMap<>(Shard.class);
        for (Map.Entry<Shard, ShardExecutor> entry : executors.entrySet()) {
            boolean healthy;
            try {
                healthy = entry.getValue().ping();
            } catch (Exception e) {
                log.error("Shard {} is unhealthy", entry.getKey().shardName(), e);
                healthy = false;
            }
            health.put(entry.getKey(), healthy);
        }
        return health;
    }

    @Override
    public void close() {
        executors.values().forEach(ShardExecutor::close);
    }
}
