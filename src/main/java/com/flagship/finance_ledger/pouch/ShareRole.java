package com.flagship.finance_ledger.pouch;

public enum ShareRole {
    OWNER,
    EDITOR,
    VIEWER
}
