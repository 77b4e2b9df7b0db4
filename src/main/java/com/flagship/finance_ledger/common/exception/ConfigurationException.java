package com.flagship.finance_ledger.common.exception;

/**
 * Raised while the shard configuration is being built. Always fatal: the
 * application must not start with a broken shard map.
 */
public class ConfigurationException extends LedgerException {

    public ConfigurationException(String message) {
        super(message);
    }
}
