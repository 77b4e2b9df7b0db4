package com.flagship.finance_ledger.transfer;

public enum TransferStatus {
    PENDING,
    COMPLETED,
    FAILED
}
