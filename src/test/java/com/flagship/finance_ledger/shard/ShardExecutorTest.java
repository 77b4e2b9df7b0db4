package com.flagship.finance_ledger.shard;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.RowMapper;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ShardExecutorTest {

    private static final RowMapper<String> NAME = (rs, rowNum) -> rs.getString("name");

    private ShardRouter router;

    @BeforeEach
    void setUp() {
        router = InMemoryShards.migratedRouter("executor");
    }

    @AfterEach
    void tearDown() {
        router.close();
    }

    private static Map<String, Object> pouch(String id, String ownerId, String name) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("id", id);
        values.put("user_id", ownerId);
        values.put("name", name);
        return values;
    }

    @Test
    @DisplayName("Insert, read, update and delete a record on its own shard")
    void testCrudRoundTrip() {
        ShardExecutor executor = router.executorFor(RecordCollection.POUCHES);

        executor.insert(RecordCollection.POUCHES, pouch("p-1", "u-1", "Groceries"));
        assertEquals(Optional.of("Groceries"), executor.findById(RecordCollection.POUCHES, "p-1", NAME));

        assertEquals(1, executor.update(RecordCollection.POUCHES, "p-1", Map.of("name", "Food")));
        assertEquals(Optional.of("Food"), executor.findById(RecordCollection.POUCHES, "p-1", NAME));

        assertEquals(1, executor.delete(RecordCollection.POUCHES, "p-1"));
        assertTrue(executor.findById(RecordCollection.POUCHES, "p-1", NAME).isEmpty());
    }

    @Test
    @DisplayName("Reading or updating a missing record is an absence, not an error")
    void testMissingRecord() {
        ShardExecutor executor = router.executorFor(RecordCollection.POUCHES);

        assertTrue(executor.findById(RecordCollection.POUCHES, "does-not-exist", NAME).isEmpty());
        assertEquals(0, executor.update(RecordCollection.POUCHES, "does-not-exist", Map.of("name", "x")));
        assertEquals(0, executor.delete(RecordCollection.POUCHES, "does-not-exist"));
    }

    @Test
    @DisplayName("An executor refuses collections owned by another shard")
    void testWrongShardRejected() {
        ShardExecutor accounts = router.executor(Shard.ACCOUNTS);

        assertThrows(IllegalArgumentException.class,
            () -> accounts.findById(RecordCollection.POUCHES, "p-1", NAME));
        assertThrows(IllegalArgumentException.class,
            () -> accounts.insert(RecordCollection.TRANSACTIONS, Map.of("id", "t-1")));
    }

    @Test
    @DisplayName("Filtered query honours equality filters, ordering and limit")
    void testFilteredQuery() {
        ShardExecutor executor = router.executorFor(RecordCollection.POUCHES);
        executor.insert(RecordCollection.POUCHES, pouch("p-1", "u-1", "Bills"));
        executor.insert(RecordCollection.POUCHES, pouch("p-2", "u-1", "Allowance"));
        executor.insert(RecordCollection.POUCHES, pouch("p-3", "u-1", "Car"));
        executor.insert(RecordCollection.POUCHES, pouch("p-4", "u-2", "Other"));

        RecordQuery query = RecordQuery.builder()
            .filter("user_id", "u-1")
            .orderBy("name")
            .limit(2)
            .build();

        assertEquals(List.of("Allowance", "Bills"), executor.query(RecordCollection.POUCHES, query, NAME));
        assertEquals(3, executor.query(RecordCollection.POUCHES, RecordQuery.where("user_id", "u-1"), NAME).size());
    }

    @Test
    @DisplayName("Column names must be plain identifiers")
    void testIllegalColumnRejected() {
        ShardExecutor executor = router.executorFor(RecordCollection.POUCHES);

        assertThrows(IllegalArgumentException.class,
            () -> executor.query(RecordCollection.POUCHES, RecordQuery.where("name; DROP TABLE pouches", "x"), NAME));
    }

    @Test
    @DisplayName("A failure inside inTransactions rolls back every listed shard")
    void testMultiShardRollback() {
        ShardExecutor pouches = router.executor(Shard.POUCHES);
        ShardExecutor accounts = router.executor(Shard.ACCOUNTS);

        assertThrows(IllegalStateException.class, () -> router.inTransactions(List.of(Shard.POUCHES, Shard.ACCOUNTS), () -> {
            pouches.insert(RecordCollection.POUCHES, pouch("p-1", "u-1", "Groceries"));
            Map<String, Object> account = new LinkedHashMap<>();
            account.put("id", "a-1");
            account.put("user_id", "u-1");
            account.put("name", "Checking");
            account.put("type", "CASH");
            account.put("currency", "USD");
            account.put("initial_balance", new BigDecimal("10.00"));
            account.put("current_balance", new BigDecimal("10.00"));
            accounts.insert(RecordCollection.ACCOUNTS, account);
            throw new IllegalStateException("boom");
        }));

        assertTrue(pouches.findById(RecordCollection.POUCHES, "p-1", NAME).isEmpty());
        assertTrue(accounts.findById(RecordCollection.ACCOUNTS, "a-1", NAME).isEmpty());
    }

    @Test
    @DisplayName("Health check reports every shard healthy")
    void testHealthCheck() {
        Map<Shard, Boolean> health = router.healthCheck();

        assertEquals(Shard.values().length, health.size());
        assertTrue(health.values().stream().allMatch(Boolean::booleanValue));
    }
}
