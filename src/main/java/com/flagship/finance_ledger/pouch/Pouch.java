package com.flagship.finance_ledger.pouch;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A budget bucket. {@code balance} is derived from the transactions and
 * splits that reference the pouch and is written only by the ledger.
 */
@Value
@Builder(toBuilder = true)
public class Pouch {
    String id;
    String ownerId;
    String name;
    PouchVisibility visibility;
    BigDecimal budgetAmount;
    BudgetPeriod budgetPeriod;
    BigDecimal balance;
}
