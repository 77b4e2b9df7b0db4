package com.flagship.finance_ledger.seed.batches;

import com.flagship.finance_ledger.account.AccountType;
import com.flagship.finance_ledger.seed.SeedBatch;
import com.flagship.finance_ledger.seed.SeedRow;
import com.flagship.finance_ledger.shard.RecordCollection;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.Date;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.flagship.finance_ledger.seed.batches.DemoData.*;

/**
 * Accounts of the demo user, each with an opening balance snapshot.
 */
@Component
public class DemoAccountsBatch implements SeedBatch {

    private final Clock clock;

    public DemoAccountsBatch(Clock clock) {
        this.clock = clock;
    }

    @Override
    public int number() {
        return 2;
    }

    @Override
    public String name() {
        return "demo_accounts";
    }

    @Override
    public List<SeedRow> rows() {
        Date today = Date.valueOf(LocalDate.now(clock));
        List<SeedRow> rows = new ArrayList<>();
        rows.add(account(CHECKING, "Main Checking", AccountType.SAVINGS, CHECKING_INITIAL, CHECKING_BALANCE));
        rows.add(account(CREDIT_CARD, "Credit Card", AccountType.CREDIT, CREDIT_CARD_INITIAL, CREDIT_CARD_BALANCE));
        rows.add(account(EMERGENCY_FUND, "Emergency Fund", AccountType.SAVINGS, EMERGENCY_FUND_INITIAL, EMERGENCY_FUND_BALANCE));
        rows.add(account(CASH_WALLET, "Cash Wallet", AccountType.CASH, CASH_WALLET_INITIAL, CASH_WALLET_INITIAL));
        rows.add(snapshot("demo-balance-1", CHECKING, CHECKING_INITIAL, today));
        rows.add(snapshot("demo-balance-2", CREDIT_CARD, CREDIT_CARD_INITIAL, today));
        rows.add(snapshot("demo-balance-3", EMERGENCY_FUND, EMERGENCY_FUND_INITIAL, today));
        rows.add(snapshot("demo-balance-4", CASH_WALLET, CASH_WALLET_INITIAL, today));
        return rows;
    }

    private static SeedRow account(String id, String name, AccountType type, BigDecimal initial, BigDecimal current) {
        return SeedRow.into(RecordCollection.ACCOUNTS)
            .value("id", id)
            .value("user_id", DEMO_USER)
            .value("name", name)
            .value("type", type.name())
            .value("currency", CURRENCY)
            .value("initial_balance", initial)
            .value("current_balance", current)
            .build();
    }

    private static SeedRow snapshot(String id, String accountId, BigDecimal balance, Date date) {
        return SeedRow.into(RecordCollection.ACCOUNT_BALANCES)
            .value("id", id)
            .value("account_id", accountId)
            .value("balance", balance)
            .value("balance_date", date)
            .build();
    }
}
