package com.flagship.finance_ledger.pouch;

public enum BudgetPeriod {
    WEEKLY,
    MONTHLY,
    YEARLY
}
