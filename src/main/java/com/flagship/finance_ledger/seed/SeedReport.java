package com.flagship.finance_ledger.seed;

import lombok.Value;

import java.util.List;

@Value
public class SeedReport {
    List<SeedBatchRun> executed;
    /** Batch/shard pairs skipped because the batch was already recorded on that shard. */
    int alreadyExecuted;

    public int insertedRows() {
        return executed.stream().mapToInt(SeedBatchRun::getInserted).sum();
    }

    public int duplicateRows() {
        return executed.stream().mapToInt(SeedBatchRun::getDuplicates).sum();
    }
}
