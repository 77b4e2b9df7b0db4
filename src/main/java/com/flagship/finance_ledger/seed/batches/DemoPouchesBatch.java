package com.flagship.finance_ledger.seed.batches;

import com.flagship.finance_ledger.pouch.BudgetPeriod;
import com.flagship.finance_ledger.pouch.ContributionSchedule;
import com.flagship.finance_ledger.pouch.PouchVisibility;
import com.flagship.finance_ledger.pouch.ShareRole;
import com.flagship.finance_ledger.seed.SeedBatch;
import com.flagship.finance_ledger.seed.SeedRow;
import com.flagship.finance_ledger.shard.RecordCollection;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.Date;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

import static com.flagship.finance_ledger.seed.batches.DemoData.*;

/**
 * Budget pouches, a shared vacation pouch and its savings goal.
 */
@Component
public class DemoPouchesBatch implements SeedBatch {

    private static final BigDecimal GOAL_TARGET = new BigDecimal("3000.00");
    private static final BigDecimal GOAL_SAVED = new BigDecimal("750.00");

    private final Clock clock;

    public DemoPouchesBatch(Clock clock) {
        this.clock = clock;
    }

    @Override
    public int number() {
        return 3;
    }

    @Override
    public String name() {
        return "demo_pouches";
    }

    @Override
    public List<SeedRow> rows() {
        LocalDate today = LocalDate.now(clock);
        LocalDate goalDate = today.plusMonths(6);
        return List.of(
            pouch(GROCERIES, "Groceries", PouchVisibility.PRIVATE, new BigDecimal("600.00"), BudgetPeriod.MONTHLY, GROCERIES_BALANCE),
            pouch(ENTERTAINMENT, "Entertainment", PouchVisibility.PRIVATE, new BigDecimal("200.00"), BudgetPeriod.MONTHLY, ENTERTAINMENT_BALANCE),
            pouch(VACATION, "Vacation Fund", PouchVisibility.SHARED, null, null, new BigDecimal("0.00")),
            SeedRow.into(RecordCollection.POUCH_SHARES)
                .value("id", "demo-share-1")
                .value("pouch_id", VACATION)
                .value("user_id", PARTNER_USER)
                .value("role", ShareRole.EDITOR.name())
                .build(),
            SeedRow.into(RecordCollection.GOALS)
                .value("id", VACATION_GOAL)
                .value("user_id", DEMO_USER)
                .value("pouch_id", VACATION)
                .value("title", "Summer Vacation")
                .value("target_amount", GOAL_TARGET)
                .value("current_amount", GOAL_SAVED)
                .value("target_date", Date.valueOf(goalDate))
                .value("monthly_contribution", ContributionSchedule.monthlyContribution(GOAL_TARGET, GOAL_SAVED, goalDate, today))
                .build());
    }

    private static SeedRow pouch(String id, String name, PouchVisibility visibility,
                                 BigDecimal budget, BudgetPeriod period, BigDecimal balance) {
        SeedRow.SeedRowBuilder row = SeedRow.into(RecordCollection.POUCHES)
            .value("id", id)
            .value("user_id", DEMO_USER)
            .value("name", name)
            .value("visibility", visibility.name())
            .value("balance", balance);
        if (budget != null) {
            row.value("budget_amount", budget).value("budget_period", period.name());
        }
        return row.build();
    }
}
