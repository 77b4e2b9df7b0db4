package com.flagship.finance_ledger.seed.batches;

import com.flagship.finance_ledger.seed.SeedBatch;
import com.flagship.finance_ledger.seed.SeedRow;
import com.flagship.finance_ledger.shard.RecordCollection;
import com.flagship.finance_ledger.transfer.TransferStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static com.flagship.finance_ledger.seed.batches.DemoData.*;

@Component
public class DemoTransfersBatch implements SeedBatch {

    private final Clock clock;

    public DemoTransfersBatch(Clock clock) {
        this.clock = clock;
    }

    @Override
    public int number() {
        return 5;
    }

    @Override
    public String name() {
        return "demo_transfers";
    }

    @Override
    public List<SeedRow> rows() {
        return List.of(SeedRow.into(RecordCollection.TRANSFERS)
            .value("id", "demo-transfer-1")
            .value("user_id", DEMO_USER)
            .value("from_account_id", CHECKING)
            .value("to_account_id", EMERGENCY_FUND)
            .value("amount", new BigDecimal("500.00"))
            .value("currency", CURRENCY)
            .value("description", "Monthly savings")
            .value("status", TransferStatus.COMPLETED.name())
            .value("transfer_date", Timestamp.from(clock.instant().minus(Duration.ofDays(1))))
            .build());
    }
}
