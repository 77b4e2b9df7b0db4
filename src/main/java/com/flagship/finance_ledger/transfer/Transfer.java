package com.flagship.finance_ledger.transfer;

import com.flagship.finance_ledger.common.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Money moved between two accounts of the same currency.
 * Only COMPLETED transfers count towards account balances.
 */
@Value
@Builder
public class Transfer {
    String id;
    String ownerId;
    String fromAccountId;
    String toAccountId;
    BigDecimal amount;
    CurrencyCode currency;
    String description;
    TransferStatus status;
    Instant transferDate;
    Instant createdAt;
}
