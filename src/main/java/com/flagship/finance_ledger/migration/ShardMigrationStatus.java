package com.flagship.finance_ledger.migration;

import com.flagship.finance_ledger.shard.Shard;
import lombok.Value;

import java.util.List;

@Value
public class ShardMigrationStatus {
    Shard shard;
    List<Integer> appliedVersions;
    int pending;
    int total;

    /**
     * Highest applied version, or 0 when nothing has been applied.
     */
    public int currentVersion() {
        return appliedVersions.isEmpty() ? 0 : appliedVersions.get(appliedVersions.size() - 1);
    }

    public int applied() {
        return appliedVersions.size();
    }
}
