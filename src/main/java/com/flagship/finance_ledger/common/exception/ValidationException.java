package com.flagship.finance_ledger.common.exception;

/**
 * Request rejected before any write was attempted.
 */
public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(message);
    }
}
