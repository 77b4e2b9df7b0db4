package com.flagship.finance_ledger.ledger;

import java.math.BigDecimal;

/**
 * Direction of a ledger record. Amounts are stored as positive magnitudes;
 * the type decides the sign of their effect on balances.
 */
public enum TransactionType {
    INCOME,
    EXPENSE;

    /**
     * Signed effect of {@code amount}: +amount for income, -amount for expense.
     */
    public BigDecimal effect(BigDecimal amount) {
        return this == INCOME ? amount : amount.negate();
    }
}
