package com.flagship.finance_ledger.shard;

import com.flagship.finance_ledger.common.exception.ConfigurationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The fixed set of physical stores. Each owns a non-overlapping set of
 * {@link RecordCollection}s and is schema-versioned on its own.
 */
public enum Shard {
    USERS("users"),
    ACCOUNTS("accounts"),
    TRANSACTIONS("transactions"),
    POUCHES("pouches"),
    TRANSFERS("transfers");

    private final String shardName;

    Shard(String shardName) {
        this.shardName = shardName;
    }

    public String shardName() {
        return shardName;
    }

    public static Shard fromName(String name) {
        for (Shard shard : values()) {
            if (shard.shardName.equals(name)) {
                return shard;
            }
        }
        throw new ConfigurationException(String.format("Unknown shard '%s'. Known shards: %s", name,
            Arrays.stream(values()).map(Shard::shardName).collect(Collectors.joining(", "))));
    }
}
