package com.flagship.finance_ledger.pouch;

public enum PouchVisibility {
    PRIVATE,
    SHARED
}
