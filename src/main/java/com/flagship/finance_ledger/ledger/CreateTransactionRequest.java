package com.flagship.finance_ledger.ledger;

import com.flagship.finance_ledger.common.CurrencyCode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class CreateTransactionRequest {
    String ownerId;
    String accountId;
    BigDecimal amount;
    TransactionType type;
    CurrencyCode currency;
    String description;
    String category;
    String pouchId;
    boolean recurring;
    String recurringPattern;
    /** Defaults to now. */
    Instant transactionDate;
    @Singular
    List<SplitAllocation> splits;
}
