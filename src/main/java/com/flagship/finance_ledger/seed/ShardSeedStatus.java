package com.flagship.finance_ledger.seed;

import com.flagship.finance_ledger.shard.Shard;
import lombok.Value;

import java.util.List;

@Value
public class ShardSeedStatus {
    Shard shard;
    List<Integer> executedBatches;
    List<Integer> pendingBatches;
}
