package com.flagship.finance_ledger.common.exception;

/**
 * A uniqueness constraint was violated outside of a seed run.
 */
public class ConstraintException extends LedgerException {

    public ConstraintException(String message, Throwable cause) {
        super(message, cause);
    }
}
