package com.flagship.finance_ledger.account;

import com.flagship.finance_ledger.common.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A user's money container.
 *
 * {@code currentBalance} is derived state: it is written only by the ledger
 * (transactions and transfers), never set directly by callers.
 */
@Value
@Builder(toBuilder = true)
public class Account {
    String id;
    String ownerId;
    String name;
    AccountType type;
    CurrencyCode currency;
    BigDecimal initialBalance;
    BigDecimal currentBalance;
    boolean active;
    Instant createdAt;
    Instant updatedAt;
}
