package com.flagship.finance_ledger.common.exception;

import com.flagship.finance_ledger.shard.Shard;
import lombok.Getter;

/**
 * A single migration version failed on a single shard.
 * Sibling shards are not affected by this failure.
 */
@Getter
public class MigrationException extends LedgerException {

    private final Shard shard;
    private final int version;

    public MigrationException(Shard shard, int version, String message, Throwable cause) {
        super(String.format("Migration %03d failed on shard %s: %s", version, shard.shardName(), message), cause);
        this.shard = shard;
        this.version = version;
    }
}
