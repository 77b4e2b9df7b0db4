package com.flagship.finance_ledger.seed.batches;

import com.flagship.finance_ledger.seed.SeedBatch;
import com.flagship.finance_ledger.seed.SeedRow;
import com.flagship.finance_ledger.shard.RecordCollection;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.flagship.finance_ledger.seed.batches.DemoData.DEMO_USER;
import static com.flagship.finance_ledger.seed.batches.DemoData.PARTNER_USER;

@Component
public class DemoUsersBatch implements SeedBatch {

    @Override
    public int number() {
        return 1;
    }

    @Override
    public String name() {
        return "demo_users";
    }

    @Override
    public List<SeedRow> rows() {
        return List.of(
            user(DEMO_USER, "demo@finance-ledger.local", "Demo User"),
            user(PARTNER_USER, "partner@finance-ledger.local", "Demo Partner"),
            preference("demo-pref-1", DEMO_USER, "currency", "USD"),
            preference("demo-pref-2", DEMO_USER, "theme", "light"),
            preference("demo-pref-3", PARTNER_USER, "currency", "USD"));
    }

    private static SeedRow user(String id, String email, String name) {
        return SeedRow.into(RecordCollection.USERS)
            .value("id", id)
            .value("email", email)
            .value("name", name)
            // Placeholder hash, not a usable credential.
            .value("password_hash", "$2b$10$demo.placeholder.hash." + id)
            .build();
    }

    private static SeedRow preference(String id, String userId, String key, String value) {
        return SeedRow.into(RecordCollection.USER_PREFERENCES)
            .value("id", id)
            .value("user_id", userId)
            .value("pref_key", key)
            .value("pref_value", value)
            .build();
    }
}
