package com.flagship.finance_ledger.common.exception;

import com.flagship.finance_ledger.shard.Shard;
import lombok.Getter;

/**
 * A seed batch aborted on a shard for a reason other than an already-present row.
 */
@Getter
public class SeedException extends LedgerException {

    private final int batch;
    private final Shard shard;

    public SeedException(int batch, Shard shard, Throwable cause) {
        super(String.format("Seed batch %03d failed on shard %s: %s", batch, shard.shardName(), cause.getMessage()), cause);
        this.batch = batch;
        this.shard = shard;
    }
}
