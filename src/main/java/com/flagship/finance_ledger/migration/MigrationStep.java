package com.flagship.finance_ledger.migration;

import com.flagship.finance_ledger.shard.Shard;
import lombok.Value;

/**
 * One version moved on one shard.
 */
@Value
public class MigrationStep {
    Shard shard;
    int version;
    String name;
}
