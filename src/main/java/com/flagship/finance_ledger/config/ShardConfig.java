package com.flagship.finance_ledger.config;

import com.flagship.finance_ledger.shard.Shard;
import com.flagship.finance_ledger.shard.ShardExecutor;
import com.flagship.finance_ledger.shard.ShardMap;
import com.flagship.finance_ledger.shard.ShardRouter;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the immutable shard map and one connection pool per shard.
 */
@Configuration
@Slf4j
public class ShardConfig {

    @Bean
    public ShardMap shardMap(LedgerProperties properties) {
        Map<String, List<String>> collectionsByShard = new LinkedHashMap<>();
        properties.getShards().forEach((name, shard) -> collectionsByShard.put(name, shard.getCollections()));
        return ShardMap.fromConfiguration(collectionsByShard);
    }

    @Bean(destroyMethod = "close")
    public ShardRouter shardRouter(ShardMap shardMap, LedgerProperties properties) {
        Map<Shard, ShardExecutor> executors = new EnumMap<>(Shard.class);
        properties.getShards().forEach((name, shardProperties) -> {
            Shard shard = Shard.fromName(name);
            executors.put(shard, new ShardExecutor(shard, shardMap, dataSource(shard, shardProperties)));
            log.info("Configured shard {} -> {}", name, shardProperties.getUrl());
        });
        return new ShardRouter(shardMap, executors);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    static HikariDataSource dataSource(Shard shard, LedgerProperties.ShardProperties properties) {
        HikariDataSource dataSource = DataSourceBuilder.create()
            .type(HikariDataSource.class)
            .url(properties.getUrl())
            .username(properties.getUsername())
            .password(properties.getPassword())
            .build();
        dataSource.setPoolName("shard-" + shard.shardName());
        dataSource.setMaximumPoolSize(properties.getPoolSize());
        return dataSource;
    }
}
