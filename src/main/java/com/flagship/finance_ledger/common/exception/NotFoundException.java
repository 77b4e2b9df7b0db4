package com.flagship.finance_ledger.common.exception;

import lombok.Getter;

/**
 * A specific record was addressed by id and does not exist (or is soft-deleted).
 */
@Getter
public class NotFoundException extends LedgerException {

    private final String recordType;
    private final String recordId;

    public NotFoundException(String recordType, Object recordId) {
        super(recordType + " not found: " + recordId);
        this.recordType = recordType;
        this.recordId = String.valueOf(recordId);
    }
}
