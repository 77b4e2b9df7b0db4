package com.flagship.finance_ledger.migration.versions;

import com.flagship.finance_ledger.migration.SqlMigration;
import com.flagship.finance_ledger.shard.Shard;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Base schema of all five shards.
 *
 * Identifiers that point into another shard (user_id everywhere outside the
 * users shard, account_id and pouch_id on transactions, account ids on
 * transfers) are plain columns: no foreign key may cross a shard boundary.
 */
@Component
@Order(1)
public class V001CreateInitialTables extends SqlMigration {

    public V001CreateInitialTables() {
        super(1, "create_initial_tables");

        shard(Shard.USERS, List.of(
            """
            CREATE TABLE IF NOT EXISTS users (
                id VARCHAR(64) PRIMARY KEY,
                email VARCHAR(255) NOT NULL UNIQUE,
                name VARCHAR(255),
                password_hash VARCHAR(255) NOT NULL,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )""",
            """
            CREATE TABLE IF NOT EXISTS user_sessions (
                id VARCHAR(64) PRIMARY KEY,
                user_id VARCHAR(64) NOT NULL REFERENCES users(id),
                token VARCHAR(512) NOT NULL,
                expires_at TIMESTAMP NOT NULL,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )""",
            """
            CREATE TABLE IF NOT EXISTS user_preferences (
                id VARCHAR(64) PRIMARY KEY,
                user_id VARCHAR(64) NOT NULL REFERENCES users(id),
                pref_key VARCHAR(100) NOT NULL,
                pref_value VARCHAR(1000),
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )""",
            "CREATE INDEX IF NOT EXISTS idx_user_sessions_user ON user_sessions(user_id)",
            "CREATE INDEX IF NOT EXISTS idx_user_preferences_user ON user_preferences(user_id)"
        ), List.of(
            "DROP TABLE IF EXISTS user_preferences",
            "DROP TABLE IF EXISTS user_sessions",
            "DROP TABLE IF EXISTS users"
        ));

        shard(Shard.ACCOUNTS, List.of(
            """
            CREATE TABLE IF NOT EXISTS accounts (
                id VARCHAR(64) PRIMARY KEY,
                user_id VARCHAR(64) NOT NULL,
                name VARCHAR(255) NOT NULL,
                type VARCHAR(20) NOT NULL CHECK (type IN ('CASH', 'SAVINGS', 'CREDIT', 'LOAN', 'CRYPTO', 'INVESTMENT')),
                currency VARCHAR(3) NOT NULL,
                initial_balance DECIMAL(15,2) NOT NULL DEFAULT 0,
                current_balance DECIMAL(15,2) NOT NULL DEFAULT 0,
                is_active BOOLEAN NOT NULL DEFAULT TRUE,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )""",
            """
            CREATE TABLE IF NOT EXISTS account_balances (
                id VARCHAR(64) PRIMARY KEY,
                account_id VARCHAR(64) NOT NULL REFERENCES accounts(id),
                balance DECIMAL(15,2) NOT NULL,
                balance_date DATE NOT NULL,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )""",
            "CREATE INDEX IF NOT EXISTS idx_accounts_user ON accounts(user_id)",
            "CREATE INDEX IF NOT EXISTS idx_account_balances_account ON account_balances(account_id)"
        ), List.of(
            "DROP TABLE IF EXISTS account_balances",
            "DROP TABLE IF EXISTS accounts"
        ));

        shard(Shard.TRANSACTIONS, List.of(
            """
            CREATE TABLE IF NOT EXISTS transactions (
                id VARCHAR(64) PRIMARY KEY,
                user_id VARCHAR(64) NOT NULL,
                account_id VARCHAR(64) NOT NULL,
                amount DECIMAL(15,2) NOT NULL CHECK (amount > 0),
                currency VARCHAR(3) NOT NULL,
                type VARCHAR(10) NOT NULL CHECK (type IN ('INCOME', 'EXPENSE')),
                description VARCHAR(500),
                category VARCHAR(100),
                tags VARCHAR(500),
                pouch_id VARCHAR(64),
                is_recurring BOOLEAN NOT NULL DEFAULT FALSE,
                recurring_pattern VARCHAR(100),
                transaction_date TIMESTAMP NOT NULL,
                is_deleted BOOLEAN NOT NULL DEFAULT FALSE,
                deleted_at TIMESTAMP,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )""",
            """
            CREATE TABLE IF NOT EXISTS transaction_splits (
                id VARCHAR(64) PRIMARY KEY,
                transaction_id VARCHAR(64) NOT NULL REFERENCES transactions(id),
                pouch_id VARCHAR(64) NOT NULL,
                amount DECIMAL(15,2) NOT NULL CHECK (amount > 0),
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )""",
            "CREATE INDEX IF NOT EXISTS idx_transactions_user_date ON transactions(user_id, transaction_date)",
            "CREATE INDEX IF NOT EXISTS idx_transactions_account ON transactions(account_id)",
            "CREATE INDEX IF NOT EXISTS idx_transactions_pouch ON transactions(pouch_id)",
            "CREATE INDEX IF NOT EXISTS idx_transaction_splits_transaction ON transaction_splits(transaction_id)",
            "CREATE INDEX IF NOT EXISTS idx_transaction_splits_pouch ON transaction_splits(pouch_id)"
        ), List.of(
            "DROP TABLE IF EXISTS transaction_splits",
            "DROP TABLE IF EXISTS transactions"
        ));

        shard(Shard.POUCHES, List.of(
            """
            CREATE TABLE IF NOT EXISTS pouches (
                id VARCHAR(64) PRIMARY KEY,
                user_id VARCHAR(64) NOT NULL,
                name VARCHAR(255) NOT NULL,
                visibility VARCHAR(10) NOT NULL DEFAULT 'PRIVATE' CHECK (visibility IN ('PRIVATE', 'SHARED')),
                budget_amount DECIMAL(15,2),
                budget_period VARCHAR(10) CHECK (budget_period IN ('WEEKLY', 'MONTHLY', 'YEARLY')),
                balance DECIMAL(15,2) NOT NULL DEFAULT 0,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )""",
            """
            CREATE TABLE IF NOT EXISTS goals (
                id VARCHAR(64) PRIMARY KEY,
                user_id VARCHAR(64) NOT NULL,
                pouch_id VARCHAR(64) REFERENCES pouches(id),
                title VARCHAR(255) NOT NULL,
                target_amount DECIMAL(15,2) NOT NULL,
                current_amount DECIMAL(15,2) NOT NULL DEFAULT 0,
                target_date DATE NOT NULL,
                monthly_contribution DECIMAL(15,2) NOT NULL DEFAULT 0,
                is_active BOOLEAN NOT NULL DEFAULT TRUE,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )""",
            """
            CREATE TABLE IF NOT EXISTS pouch_shares (
                id VARCHAR(64) PRIMARY KEY,
                pouch_id VARCHAR(64) NOT NULL REFERENCES pouches(id),
                user_id VARCHAR(64) NOT NULL,
                role VARCHAR(10) NOT NULL CHECK (role IN ('OWNER', 'EDITOR', 'VIEWER')),
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                CONSTRAINT uq_pouch_shares_member UNIQUE (pouch_id, user_id)
            )""",
            "CREATE INDEX IF NOT EXISTS idx_pouches_user ON pouches(user_id)",
            "CREATE INDEX IF NOT EXISTS idx_goals_user ON goals(user_id)",
            "CREATE INDEX IF NOT EXISTS idx_goals_pouch ON goals(pouch_id)"
        ), List.of(
            "DROP TABLE IF EXISTS pouch_shares",
            "DROP TABLE IF EXISTS goals",
            "DROP TABLE IF EXISTS pouches"
        ));

        shard(Shard.TRANSFERS, List.of(
            """
            CREATE TABLE IF NOT EXISTS transfers (
                id VARCHAR(64) PRIMARY KEY,
                user_id VARCHAR(64) NOT NULL,
                from_account_id VARCHAR(64) NOT NULL,
                to_account_id VARCHAR(64) NOT NULL,
                amount DECIMAL(15,2) NOT NULL CHECK (amount > 0),
                currency VARCHAR(3) NOT NULL,
                description VARCHAR(500),
                status VARCHAR(20) NOT NULL CHECK (status IN ('PENDING', 'COMPLETED', 'FAILED')),
                transfer_date TIMESTAMP NOT NULL,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )""",
            "CREATE INDEX IF NOT EXISTS idx_transfers_user ON transfers(user_id)",
            "CREATE INDEX IF NOT EXISTS idx_transfers_from ON transfers(from_account_id)",
            "CREATE INDEX IF NOT EXISTS idx_transfers_to ON transfers(to_account_id)"
        ), List.of(
            "DROP TABLE IF EXISTS transfers"
        ));
    }
}
