package com.flagship.finance_ledger.shard;

import com.flagship.finance_ledger.common.exception.ConfigurationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable binding of every {@link RecordCollection} to exactly one {@link Shard}.
 *
 * Built once at startup from configuration. All validation happens in
 * {@link #fromConfiguration(Map)} so a broken map fails the application
 * before any traffic, and {@link #resolve(RecordCollection)} can never fail.
 */
public final class ShardMap {

    private final Map<RecordCollection, Shard> homes;

    private ShardMap(Map<RecordCollection, Shard> homes) {
        this.homes = Collections.unmodifiableMap(new EnumMap<>(homes));
    }

    /**
     * @param collectionsByShard shard name to the collection names it owns
     * @throws ConfigurationException on an unknown shard or collection name,
     *         a collection bound twice, or a collection or shard left unbound
     */
    public static ShardMap fromConfiguration(Map<String, List<String>> collectionsByShard) {
        Map<RecordCollection, Shard> homes = new EnumMap<>(RecordCollection.class);
        Set<Shard> configured = EnumSet.noneOf(Shard.class);

        collectionsByShard.forEach((shardName, collectionNames) -> {
            Shard shard = Shard.fromName(shardName);
            configured.add(shard);
            for (String collectionName : collectionNames) {
                RecordCollection collection = RecordCollection.fromName(collectionName);
                Shard previous = homes.putIfAbsent(collection, shard);
                if (previous != null) {
                    throw new ConfigurationException(String.format(
                        "Collection '%s' is bound to both shard '%s' and shard '%s'",
                        collectionName, previous.shardName(), shard.shardName()));
                }
            }
        });

        Set<Shard> missingShards = EnumSet.allOf(Shard.class);
        missingShards.removeAll(configured);
        if (!missingShards.isEmpty()) {
            throw new ConfigurationException("Shards without configuration: " + names(missingShards, Shard::shardName));
        }

        Set<RecordCollection> unbound = EnumSet.allOf(RecordCollection.class);
        unbound.removeAll(homes.keySet());
        if (!unbound.isEmpty()) {
            throw new ConfigurationException("Collections not bound to any shard: " + names(unbound, RecordCollection::tableName));
        }

        return new ShardMap(homes);
    }

    /**
     * Static lookup of the shard that owns a collection.
     */
    public Shard resolve(RecordCollection collection) {
        return homes.get(collection);
    }

    public Set<RecordCollection> collectionsOf(Shard shard) {
        return homes.entrySet().stream()
            .filter(entry -> entry.getValue() == shard)
            .map(Map.Entry::getKey)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(RecordCollection.class)));
    }

    private static <T> String names(Set<T> values, Function<T, String> name) {
        return values.stream().map(name).collect(Collectors.joining(", "));
    }
}
