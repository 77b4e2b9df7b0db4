package com.flagship.finance_ledger.seed.batches;

import com.flagship.finance_ledger.ledger.TransactionType;
import com.flagship.finance_ledger.seed.SeedBatch;
import com.flagship.finance_ledger.seed.SeedRow;
import com.flagship.finance_ledger.shard.RecordCollection;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static com.flagship.finance_ledger.seed.batches.DemoData.*;

/**
 * A week of activity on the checking and credit card accounts, including one
 * expense split across two pouches.
 */
@Component
public class DemoTransactionsBatch implements SeedBatch {

    private final Clock clock;

    public DemoTransactionsBatch(Clock clock) {
        this.clock = clock;
    }

    @Override
    public int number() {
        return 4;
    }

    @Override
    public String name() {
        return "demo_transactions";
    }

    @Override
    public List<SeedRow> rows() {
        return List.of(
            transaction("demo-txn-1", CHECKING, TransactionType.EXPENSE, "45.67", "Grocery Store Purchase", "Groceries", GROCERIES, 2),
            transaction("demo-txn-2", CHECKING, TransactionType.EXPENSE, "12.50", "Coffee Shop", "Entertainment", ENTERTAINMENT, 1),
            transaction("demo-txn-3", CHECKING, TransactionType.INCOME, "2500.00", "Monthly Salary", "Income", null, 5),
            transaction("demo-txn-4", CREDIT_CARD, TransactionType.EXPENSE, "156.78", "Online Shopping", "Shopping", null, 4),
            transaction("demo-txn-5", CHECKING, TransactionType.EXPENSE, "120.00", "Dinner and groceries", "Mixed", null, 3),
            split("demo-split-1", "demo-txn-5", GROCERIES, "80.00"),
            split("demo-split-2", "demo-txn-5", ENTERTAINMENT, "40.00"));
    }

    private SeedRow transaction(String id, String accountId, TransactionType type, String amount,
                                String description, String category, String pouchId, int daysAgo) {
        SeedRow.SeedRowBuilder row = SeedRow.into(RecordCollection.TRANSACTIONS)
            .value("id", id)
            .value("user_id", DEMO_USER)
            .value("account_id", accountId)
            .value("amount", new BigDecimal(amount))
            .value("currency", CURRENCY)
            .value("type", type.name())
            .value("description", description)
            .value("category", category)
            .value("transaction_date", Timestamp.from(clock.instant().minus(Duration.ofDays(daysAgo))));
        if (pouchId != null) {
            row.value("pouch_id", pouchId);
        }
        return row.build();
    }

    private static SeedRow split(String id, String transactionId, String pouchId, String amount) {
        return SeedRow.into(RecordCollection.TRANSACTION_SPLITS)
            .value("id", id)
            .value("transaction_id", transactionId)
            .value("pouch_id", pouchId)
            .value("amount", new BigDecimal(amount))
            .build();
    }
}
