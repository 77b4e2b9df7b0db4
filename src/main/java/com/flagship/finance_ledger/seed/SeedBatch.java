package com.flagship.finance_ledger.seed;

import com.flagship.finance_ledger.shard.Shard;
import com.flagship.finance_ledger.shard.ShardMap;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A numbered unit of baseline data.
 *
 * Batches run in ascending number order. Identifiers that other shards refer
 * to are fixed values, so batch N can reference rows created by batch N-1
 * on a different shard.
 */
public interface SeedBatch {

    int number();

    String name();

    List<SeedRow> rows();

    /**
     * Shards owning at least one collection this batch writes to.
     */
    default Set<Shard> targets(ShardMap shardMap) {
        Set<Shard> targets = EnumSet.noneOf(Shard.class);
        rows().forEach(row -> targets.add(shardMap.resolve(row.getCollection())));
        return targets;
    }
}
