package com.flagship.finance_ledger.account;

public enum AccountType {
    CASH,
    SAVINGS,
    CREDIT,
    LOAN,
    CRYPTO,
    INVESTMENT
}
