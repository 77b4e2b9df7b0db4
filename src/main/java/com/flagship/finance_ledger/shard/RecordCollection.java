package com.flagship.finance_ledger.shard;

import com.flagship.finance_ledger.common.exception.ConfigurationException;

/**
 * Every record collection (table) the ledger knows about.
 * Which shard holds a collection is decided by {@link ShardMap}, not here.
 */
public enum RecordCollection {
    USERS("users"),
    USER_SESSIONS("user_sessions"),
    USER_PREFERENCES("user_preferences"),
    ACCOUNTS("accounts"),
    ACCOUNT_BALANCES("account_balances"),
    TRANSACTIONS("transactions"),
    TRANSACTION_SPLITS("transaction_splits"),
    POUCHES("pouches"),
    GOALS("goals"),
    POUCH_SHARES("pouch_shares"),
    TRANSFERS("transfers");

    private final String tableName;

    RecordCollection(String tableName) {
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }

    public static RecordCollection fromName(String name) {
        for (RecordCollection collection : values()) {
            if (collection.tableName.equals(name)) {
                return collection;
            }
        }
        throw new ConfigurationException("Unknown record collection: " + name);
    }
}
