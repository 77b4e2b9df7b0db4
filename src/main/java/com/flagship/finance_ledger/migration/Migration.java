package com.flagship.finance_ledger.migration;

import com.flagship.finance_ledger.shard.Shard;

import java.util.List;
import java.util.Set;

/**
 * A numbered, shard-targeted, reversible schema change.
 *
 * Shards outside {@link #targets()} are never touched by this migration.
 */
public interface Migration {

    int version();

    String name();

    Set<Shard> targets();

    /**
     * Forward statements for one targeted shard, executed in order.
     */
    List<String> up(Shard shard);

    /**
     * Backward statements for one targeted shard. Additive changes may leave
     * added columns in place and only undo secondary structures such as indexes.
     */
    List<String> down(Shard shard);
}
