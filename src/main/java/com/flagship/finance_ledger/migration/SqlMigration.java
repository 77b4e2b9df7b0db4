package com.flagship.finance_ledger.migration;

import com.flagship.finance_ledger.shard.Shard;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Migration declared as per-shard blocks of SQL statements.
 */
public abstract class SqlMigration implements Migration {

    private final int version;
    private final String name;
    private final Map<Shard, List<String>> upBlocks = new EnumMap<>(Shard.class);
    private final Map<Shard, List<String>> downBlocks = new EnumMap<>(Shard.class);

    protected SqlMigration(int version, String name) {
        this.version = version;
        this.name = name;
    }

    protected void shard(Shard shard, List<String> up, List<String> down) {
        upBlocks.put(shard, List.copyOf(up));
        downBlocks.put(shard, List.copyOf(down));
    }

    @Override
    public int version() {
        return version;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Set<Shard> targets() {
        return Collections.unmodifiableSet(upBlocks.keySet());
    }

    @Override
    public List<String> up(Shard shard) {
        return upBlocks.getOrDefault(shard, List.of());
    }

    @Override
    public List<String> down(Shard shard) {
        return downBlocks.getOrDefault(shard, List.of());
    }

    @Override
    public String toString() {
        return String.format("%03d_%s", version, name);
    }
}
