package com.flagship.finance_ledger.observability;

import com.flagship.finance_ledger.migration.MigrationEngine;
import com.flagship.finance_ledger.migration.ShardMigrationStatus;
import com.flagship.finance_ledger.shard.Shard;
import com.flagship.finance_ledger.shard.ShardRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Custom health indicators for the finance ledger.
 *
 * These checks decide whether the service can take traffic.
 */
public class HealthIndicators {

    /**
     * Pings every shard. One unreachable shard makes the whole component DOWN;
     * details list each shard with its state and applied schema version.
     */
    @Component("shardsHealth")
    @Slf4j
    public static class ShardHealthIndicator implements HealthIndicator {

        private final ShardRouter router;
        private final MigrationEngine migrationEngine;

        public ShardHealthIndicator(ShardRouter router, MigrationEngine migrationEngine) {
            this.router = router;
            this.migrationEngine = migrationEngine;
        }

        @Override
        public Health health() {
            Map<Shard, Boolean> pings = router.healthCheck();
            Map<String, Object> shards = new LinkedHashMap<>();
            Map<Shard, ShardMigrationStatus> schema = schemaStatus(pings);

            pings.forEach((shard, healthy) -> {
                Map<String, Object> detail = new LinkedHashMap<>();
                detail.put("status", healthy ? "healthy" : "unhealthy");
                ShardMigrationStatus status = schema.get(shard);
                if (status != null) {
                    detail.put("schemaVersion", status.currentVersion());
                    detail.put("pendingMigrations", status.getPending());
                }
                shards.put(shard.shardName(), detail);
            });

            Health.Builder builder = pings.values().stream().allMatch(Boolean::booleanValue)
                    ? Health.up()
                    : Health.down();
            return builder.withDetail("shards", shards).build();
        }

        private Map<Shard, ShardMigrationStatus> schemaStatus(Map<Shard, Boolean> pings) {
            if (!pings.values().stream().allMatch(Boolean::booleanValue)) {
                return Map.of();
            }
            try {
                return migrationEngine.status();
            } catch (Exception e) {
                log.warn("Schema status unavailable for health check: {}", e.getMessage());
                return Map.of();
            }
        }
    }
}
