package com.flagship.finance_ledger.common.exception;

/**
 * Base exception for all ledger core errors.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
