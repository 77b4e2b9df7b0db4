package com.flagship.finance_ledger.observability;

import com.flagship.finance_ledger.common.exception.ConfigurationException;
import com.flagship.finance_ledger.migration.MigrationEngine;
import com.flagship.finance_ledger.migration.MigrationReport;
import com.flagship.finance_ledger.migration.MigrationStep;
import com.flagship.finance_ledger.migration.ShardMigrationStatus;
import com.flagship.finance_ledger.seed.SeedLoader;
import com.flagship.finance_ledger.seed.SeedReport;
import com.flagship.finance_ledger.seed.ShardSeedStatus;
import com.flagship.finance_ledger.shard.Shard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.endpoint.InvalidEndpointRequestException;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.Selector;
import org.springframework.boot.actuate.endpoint.annotation.WriteOperation;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator commands for shard schemas and demo data.
 *
 * Read returns migration and seed status per shard. Write takes a command:
 * {@code migrate} (all shards, or one with {@code shard}, up to {@code number}),
 * {@code rollback}, {@code seed} (all, one shard, or one batch {@code number}
 * on a shard), {@code seed-reset} and {@code seed-refresh}.
 */
@Component
@Endpoint(id = "ledgerschema")
@RequiredArgsConstructor
@Slf4j
public class SchemaAdminEndpoint {

    private final MigrationEngine migrationEngine;
    private final SeedLoader seedLoader;

    @ReadOperation
    public Map<String, Object> status() {
        Map<Shard, ShardMigrationStatus> migrations = migrationEngine.status();
        Map<Shard, ShardSeedStatus> seeds = seedLoader.seedStatus();

        Map<String, Object> shards = new LinkedHashMap<>();
        for (Shard shard : Shard.values()) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("schemaVersion", migrations.get(shard).currentVersion());
            detail.put("appliedMigrations", migrations.get(shard).getAppliedVersions());
            detail.put("pendingMigrations", migrations.get(shard).getPending());
            detail.put("executedSeedBatches", seeds.get(shard).getExecutedBatches());
            detail.put("pendingSeedBatches", seeds.get(shard).getPendingBatches());
            shards.put(shard.shardName(), detail);
        }
        return Map.of("shards", shards);
    }

    @WriteOperation
    public Map<String, Object> execute(@Selector String command, @Nullable String shard, @Nullable Integer number) {
        log.info("Operator command {} (shard={}, number={})", command, shard, number);
        switch (command) {
            case "migrate":
                return describe(shard == null
                    ? migrationEngine.applyMigrations(number)
                    : migrationEngine.applyMigrations(toShard(shard), number));
            case "rollback":
                return describe(migrationEngine.rollbackOne(requireShard(command, shard)));
            case "seed":
                if (number != null) {
                    return describe(seedLoader.runSeedBatch(requireShard(command, shard), number));
                }
                return describe(shard == null ? seedLoader.runSeeds() : seedLoader.runSeeds(toShard(shard)));
            case "seed-reset":
                Shard target = requireShard(command, shard);
                seedLoader.resetSeeds(target);
                return Map.of("reset", target.shardName());
            case "seed-refresh":
                return describe(seedLoader.refreshSeeds(requireShard(command, shard)));
            default:
                throw new InvalidEndpointRequestException("Unknown command: " + command,
                    "Expected one of migrate, rollback, seed, seed-reset, seed-refresh");
        }
    }

    private static Map<String, Object> describe(MigrationReport report) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("successful", report.isSuccessful());
        result.put("completed", steps(report.getCompleted()));
        result.put("skipped", report.getSkipped().size());
        result.put("failures", report.getFailures().stream().map(Throwable::getMessage).toList());
        return result;
    }

    private static Map<String, Object> describe(SeedReport report) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("batchRuns", report.getExecuted().size());
        result.put("alreadyExecuted", report.getAlreadyExecuted());
        result.put("insertedRows", report.insertedRows());
        result.put("duplicateRows", report.duplicateRows());
        return result;
    }

    private static List<String> steps(List<MigrationStep> steps) {
        return steps.stream()
            .map(step -> step.getShard().shardName() + ":" + step.getVersion() + " " + step.getName())
            .toList();
    }

    private static Shard requireShard(String command, @Nullable String shard) {
        if (shard == null) {
            throw new InvalidEndpointRequestException("Command " + command + " needs a shard", "Missing shard");
        }
        return toShard(shard);
    }

    private static Shard toShard(String name) {
        try {
            return Shard.fromName(name);
        } catch (ConfigurationException e) {
            throw new InvalidEndpointRequestException(e.getMessage(), "Unknown shard");
        }
    }
}
