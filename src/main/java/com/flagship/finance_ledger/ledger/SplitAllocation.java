package com.flagship.finance_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Requested split: an amount of the parent transaction attributed to a pouch.
 */
@Value(staticConstructor = "of")
public class SplitAllocation {
    String pouchId;
    BigDecimal amount;

    boolean sameAs(TransactionSplit split) {
        return pouchId.equals(split.getPouchId()) && amount.compareTo(split.getAmount()) == 0;
    }
}
