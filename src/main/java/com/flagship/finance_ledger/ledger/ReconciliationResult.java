package com.flagship.finance_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Stored balance of an account or pouch next to the balance recomputed from
 * the active records that reference it.
 */
@Value
public class ReconciliationResult {
    String recordType;
    String recordId;
    BigDecimal stored;
    BigDecimal expected;

    public boolean isConsistent() {
        return stored.compareTo(expected) == 0;
    }

    public BigDecimal drift() {
        return stored.subtract(expected);
    }
}
