package com.flagship.finance_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Partial transaction update. Null fields are left unchanged.
 *
 * {@code splits} replaces the whole split list when non-null (an empty list
 * removes all splits). {@code clearPouch} detaches the transaction from its pouch.
 */
@Value
@Builder
public class TransactionPatch {
    BigDecimal amount;
    TransactionType type;
    String description;
    String category;
    String pouchId;
    boolean clearPouch;
    List<SplitAllocation> splits;
}
