package com.flagship.finance_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Part of a transaction's amount attributed to one pouch.
 */
@Value
public class TransactionSplit {
    String id;
    String transactionId;
    String pouchId;
    BigDecimal amount;

    SplitAllocation allocation() {
        return SplitAllocation.of(pouchId, amount);
    }
}
