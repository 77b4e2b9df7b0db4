package com.flagship.finance_ledger.migration.versions;

import com.flagship.finance_ledger.migration.SqlMigration;
import com.flagship.finance_ledger.shard.Shard;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Additive profile, merchant and budgeting columns plus their indexes.
 *
 * Down only drops the indexes. Column removal is not portable across the
 * supported storage engines, so the added columns stay after a rollback.
 */
@Component
@Order(2)
public class V002AddEnhancedFeatures extends SqlMigration {

    public V002AddEnhancedFeatures() {
        super(2, "add_enhanced_features");

        shard(Shard.USERS, List.of(
            "ALTER TABLE users ADD COLUMN IF NOT EXISTS phone VARCHAR(32)",
            "ALTER TABLE users ADD COLUMN IF NOT EXISTS timezone VARCHAR(64) DEFAULT 'UTC'",
            "ALTER TABLE users ADD COLUMN IF NOT EXISTS last_login TIMESTAMP",
            "CREATE INDEX IF NOT EXISTS idx_users_phone ON users(phone)",
            "CREATE INDEX IF NOT EXISTS idx_users_last_login ON users(last_login)"
        ), List.of(
            "DROP INDEX IF EXISTS idx_users_phone",
            "DROP INDEX IF EXISTS idx_users_last_login"
        ));

        shard(Shard.ACCOUNTS, List.of(
            "ALTER TABLE accounts ADD COLUMN IF NOT EXISTS account_number VARCHAR(64)",
            "ALTER TABLE accounts ADD COLUMN IF NOT EXISTS bank_name VARCHAR(255)",
            "ALTER TABLE accounts ADD COLUMN IF NOT EXISTS credit_limit DECIMAL(15,2)",
            "ALTER TABLE accounts ADD COLUMN IF NOT EXISTS last_transaction_date TIMESTAMP",
            "CREATE INDEX IF NOT EXISTS idx_accounts_account_number ON accounts(account_number)",
            "CREATE INDEX IF NOT EXISTS idx_accounts_last_transaction ON accounts(last_transaction_date)"
        ), List.of(
            "DROP INDEX IF EXISTS idx_accounts_account_number",
            "DROP INDEX IF EXISTS idx_accounts_last_transaction"
        ));

        shard(Shard.TRANSACTIONS, List.of(
            "ALTER TABLE transactions ADD COLUMN IF NOT EXISTS reference_number VARCHAR(64)",
            "ALTER TABLE transactions ADD COLUMN IF NOT EXISTS merchant_name VARCHAR(255)",
            "ALTER TABLE transactions ADD COLUMN IF NOT EXISTS payment_method VARCHAR(32)",
            "ALTER TABLE transactions ADD COLUMN IF NOT EXISTS notes VARCHAR(1000)",
            "ALTER TABLE transaction_splits ADD COLUMN IF NOT EXISTS percentage DECIMAL(5,2)",
            "CREATE INDEX IF NOT EXISTS idx_transactions_reference ON transactions(reference_number)",
            "CREATE INDEX IF NOT EXISTS idx_transactions_merchant ON transactions(merchant_name)",
            "CREATE INDEX IF NOT EXISTS idx_transactions_payment_method ON transactions(payment_method)"
        ), List.of(
            "DROP INDEX IF EXISTS idx_transactions_reference",
            "DROP INDEX IF EXISTS idx_transactions_merchant",
            "DROP INDEX IF EXISTS idx_transactions_payment_method"
        ));

        shard(Shard.POUCHES, List.of(
            "ALTER TABLE pouches ADD COLUMN IF NOT EXISTS sort_order INTEGER DEFAULT 0",
            "ALTER TABLE pouches ADD COLUMN IF NOT EXISTS alert_threshold DECIMAL(5,2) DEFAULT 80.0",
            "ALTER TABLE goals ADD COLUMN IF NOT EXISTS category VARCHAR(100)",
            "ALTER TABLE goals ADD COLUMN IF NOT EXISTS notes VARCHAR(1000)",
            "CREATE INDEX IF NOT EXISTS idx_pouches_sort_order ON pouches(sort_order)",
            "CREATE INDEX IF NOT EXISTS idx_goals_category ON goals(category)"
        ), List.of(
            "DROP INDEX IF EXISTS idx_pouches_sort_order",
            "DROP INDEX IF EXISTS idx_goals_category"
        ));

        shard(Shard.TRANSFERS, List.of(
            "ALTER TABLE transfers ADD COLUMN IF NOT EXISTS transfer_type VARCHAR(16) DEFAULT 'INTERNAL'",
            "ALTER TABLE transfers ADD COLUMN IF NOT EXISTS external_reference VARCHAR(64)",
            "ALTER TABLE transfers ADD COLUMN IF NOT EXISTS processing_fee DECIMAL(15,2) DEFAULT 0",
            "ALTER TABLE transfers ADD COLUMN IF NOT EXISTS notes VARCHAR(1000)",
            "CREATE INDEX IF NOT EXISTS idx_transfers_type ON transfers(transfer_type)",
            "CREATE INDEX IF NOT EXISTS idx_transfers_external_reference ON transfers(external_reference)"
        ), List.of(
            "DROP INDEX IF EXISTS idx_transfers_type",
            "DROP INDEX IF EXISTS idx_transfers_external_reference"
        ));
    }
}
