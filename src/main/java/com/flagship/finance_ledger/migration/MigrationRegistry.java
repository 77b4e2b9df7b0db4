package com.flagship.finance_ledger.migration;

import com.flagship.finance_ledger.common.exception.ConfigurationException;
import com.flagship.finance_ledger.shard.Shard;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * All known migrations in ascending version order.
 */
@Component
public class MigrationRegistry {

    private final List<Migration> migrations;

    public MigrationRegistry(List<Migration> migrations) {
        List<Migration> sorted = migrations.stream()
            .sorted(Comparator.comparingInt(Migration::version))
            .toList();
        for (int i = 0; i < sorted.size(); i++) {
            Migration migration = sorted.get(i);
            if (migration.version() <= 0) {
                throw new ConfigurationException("Migration versions must be positive: " + migration);
            }
            if (i > 0 && sorted.get(i - 1).version() == migration.version()) {
                throw new ConfigurationException("Duplicate migration version " + migration.version());
            }
        }
        this.migrations = sorted;
    }

    public List<Migration> all() {
        return migrations;
    }

    /**
     * Migrations targeting {@code shard} with a version at or below {@code targetVersion}
     * (no upper bound when it is null), ascending.
     */
    public List<Migration> forShard(Shard shard, Integer targetVersion) {
        return migrations.stream()
            .filter(migration -> migration.targets().contains(shard))
            .filter(migration -> targetVersion == null || migration.version() <= targetVersion)
            .toList();
    }

    public Optional<Migration> find(int version) {
        return migrations.stream().filter(migration -> migration.version() == version).findFirst();
    }
}
