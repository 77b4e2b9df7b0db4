package com.flagship.finance_ledger.seed.batches;

import java.math.BigDecimal;

/**
 * Fixed identifiers shared by the demo batches across shards.
 *
 * Stored balances are the values the ledger reaches after the seeded
 * transactions (batch 004) and transfer (batch 005):
 * checking 5000.00 - 45.67 - 12.50 + 2500.00 - 120.00 - 500.00 = 6821.83,
 * credit card -1200.00 - 156.78 = -1356.78, emergency fund 10000.00 + 500.00,
 * groceries -45.67 - 80.00, entertainment -12.50 - 40.00.
 */
final class DemoData {

    static final String DEMO_USER = "demo-user-1";
    static final String PARTNER_USER = "demo-user-2";

    static final String CHECKING = "demo-account-1";
    static final String CREDIT_CARD = "demo-account-2";
    static final String EMERGENCY_FUND = "demo-account-3";
    static final String CASH_WALLET = "demo-account-4";

    static final String GROCERIES = "demo-pouch-1";
    static final String ENTERTAINMENT = "demo-pouch-2";
    static final String VACATION = "demo-pouch-3";

    static final String VACATION_GOAL = "demo-goal-1";

    static final BigDecimal CHECKING_INITIAL = new BigDecimal("5000.00");
    static final BigDecimal CHECKING_BALANCE = new BigDecimal("6821.83");
    static final BigDecimal CREDIT_CARD_INITIAL = new BigDecimal("-1200.00");
    static final BigDecimal CREDIT_CARD_BALANCE = new BigDecimal("-1356.78");
    static final BigDecimal EMERGENCY_FUND_INITIAL = new BigDecimal("10000.00");
    static final BigDecimal EMERGENCY_FUND_BALANCE = new BigDecimal("10500.00");
    static final BigDecimal CASH_WALLET_INITIAL = new BigDecimal("200.00");

    static final BigDecimal GROCERIES_BALANCE = new BigDecimal("-125.67");
    static final BigDecimal ENTERTAINMENT_BALANCE = new BigDecimal("-52.50");

    static final String CURRENCY = "USD";

    private DemoData() {
    }
}
