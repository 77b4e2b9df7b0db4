package com.flagship.finance_ledger.ledger;

import com.flagship.finance_ledger.common.CurrencyCode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Ledger record on one account.
 *
 * When {@code splits} is non-empty the pouch effect comes from the splits
 * only and {@code pouchId} does not move any pouch balance.
 */
@Value
@Builder(toBuilder = true)
public class Transaction {
    String id;
    String ownerId;
    String accountId;
    BigDecimal amount;
    CurrencyCode currency;
    TransactionType type;
    String description;
    String category;
    String pouchId;
    boolean recurring;
    String recurringPattern;
    Instant transactionDate;
    boolean deleted;
    @Singular
    List<TransactionSplit> splits;
    Instant createdAt;
    Instant updatedAt;

    public boolean hasSplits() {
        return !splits.isEmpty();
    }
}
