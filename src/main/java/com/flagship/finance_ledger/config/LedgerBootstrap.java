package com.flagship.finance_ledger.config;

import com.flagship.finance_ledger.migration.MigrationEngine;
import com.flagship.finance_ledger.migration.MigrationReport;
import com.flagship.finance_ledger.seed.SeedLoader;
import com.flagship.finance_ledger.seed.SeedReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Brings shard schemas up to date before the application takes traffic, then
 * loads demo data when enabled. A migration failure on any shard fails startup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerBootstrap implements ApplicationRunner {

    private final LedgerProperties properties;
    private final MigrationEngine migrationEngine;
    private final SeedLoader seedLoader;

    @Override
    public void run(ApplicationArguments args) {
        if (properties.getMigrations().isAutoApply()) {
            MigrationReport report = migrationEngine.applyMigrations(properties.getMigrations().getTargetVersion());
            report.throwIfFailed();
            log.info("Shard schemas ready: {} migrations applied, {} already in place",
                report.getCompleted().size(), report.getSkipped().size());
        } else {
            log.info("Automatic migrations disabled");
        }

        if (properties.getSeeds().isEnabled()) {
            SeedReport report = seedLoader.runSeeds();
            log.info("Demo data loaded: {} rows inserted, {} already present",
                report.insertedRows(), report.duplicateRows());
        }
    }
}
