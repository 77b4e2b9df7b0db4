package com.flagship.finance_ledger.seed;

import com.flagship.finance_ledger.shard.Shard;
import lombok.Value;

/**
 * Outcome of one batch on one shard.
 */
@Value
public class SeedBatchRun {
    int batch;
    String name;
    Shard shard;
    int inserted;
    int duplicates;
}
