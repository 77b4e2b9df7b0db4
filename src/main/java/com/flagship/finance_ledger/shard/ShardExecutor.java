package com.flagship.finance_ledger.shard;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Execution handle for a single shard.
 *
 * Offers generic create/read/update/delete and filtered queries over the
 * collections this shard owns, plus raw statement execution for migrations
 * and seeding. Every collection-addressed call is checked against the
 * {@link ShardMap}: an executor never touches another shard's collections.
 *
 * Column names are taken from code, never from user input, and are still
 * restricted to plain lower-case identifiers.
 */
@Slf4j
public class ShardExecutor implements AutoCloseable {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    private final Shard shard;
    private final ShardMap shardMap;
    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public ShardExecutor(Shard shard, ShardMap shardMap, DataSource dataSource) {
        this.shard = shard;
        this.shardMap = shardMap;
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    public Shard shard() {
        return shard;
    }

    /**
     * Inserts one row. The caller supplies the primary key in {@code values}.
     */
    public int insert(RecordCollection collection, Map<String, Object> values) {
        String table = tableOf(collection);
        List<String> columns = columns(values);
        String sql = String.format("INSERT INTO %s (%s) VALUES (%s)", table,
            String.join(", ", columns),
            columns.stream().map(column -> ":" + column).collect(Collectors.joining(", ")));
        log.debug("Insert into {}.{}", shard.shardName(), table);
        return namedJdbcTemplate.update(sql, new MapSqlParameterSource(values));
    }

    /**
     * Reads a record by primary key. Absence is an empty result, never an error.
     */
    public <T> Optional<T> findById(RecordCollection collection, String id, RowMapper<T> rowMapper) {
        String sql = "SELECT * FROM " + tableOf(collection) + " WHERE id = ?";
        return jdbcTemplate.query(sql, rowMapper, id).stream().findFirst();
    }

    /**
     * @return number of rows changed, 0 when the id does not exist
     */
    public int update(RecordCollection collection, String id, Map<String, Object> values) {
        String table = tableOf(collection);
        List<String> columns = columns(values);
        String sql = String.format("UPDATE %s SET %s WHERE id = :id", table,
            columns.stream().map(column -> column + " = :" + column).collect(Collectors.joining(", ")));
        MapSqlParameterSource params = new MapSqlParameterSource(values).addValue("id", id);
        return namedJdbcTemplate.update(sql, params);
    }

    public int delete(RecordCollection collection, String id) {
        return jdbcTemplate.update("DELETE FROM " + tableOf(collection) + " WHERE id = ?", id);
    }

    public <T> List<T> query(RecordCollection collection, RecordQuery query, RowMapper<T> rowMapper) {
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(tableOf(collection));
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (!query.getFilters().isEmpty()) {
            sql.append(" WHERE ").append(columns(query.getFilters()).stream()
                .map(column -> column + " = :" + column)
                .collect(Collectors.joining(" AND ")));
            params.addValues(query.getFilters());
        }
        if (query.getOrderBy() != null) {
            sql.append(" ORDER BY ").append(checkIdentifier(query.getOrderBy()))
                .append(query.isDescending() ? " DESC" : " ASC");
        }
        if (query.getLimit() != null) {
            sql.append(" FETCH FIRST :limit ROWS ONLY");
            params.addValue("limit", query.getLimit());
        }
        return namedJdbcTemplate.query(sql.toString(), params, rowMapper);
    }

    /**
     * Raw statement execution, used by migrations and seed batches.
     */
    public void execute(String sql) {
        jdbcTemplate.execute(sql);
    }

    /**
     * Direct access for typed repositories that need statements the generic
     * operations do not cover (atomic increments, row locks, aggregates).
     */
    public JdbcTemplate jdbc() {
        return jdbcTemplate;
    }

    /**
     * Runs {@code work} in a local transaction on this shard.
     */
    public <T> T inTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }

    public boolean ping() {
        Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        return one != null && one == 1;
    }

    @Override
    public void close() {
        if (dataSource instanceof AutoCloseable closeable) {
            try {
                closeable.close();
                log.info("Closed connection pool for shard {}", shard.shardName());
            } catch (Exception e) {
                log.warn("Failed to close connection pool for shard {}: {}", shard.shardName(), e.getMessage());
            }
        }
    }

    private String tableOf(RecordCollection collection) {
        Shard home = shardMap.resolve(collection);
        if (home != shard) {
            throw new IllegalArgumentException(String.format(
                "Collection '%s' lives on shard '%s', not on '%s'",
                collection.tableName(), home.shardName(), shard.shardName()));
        }
        return collection.tableName();
    }

    private static List<String> columns(Map<String, Object> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("No column values supplied");
        }
        return values.keySet().stream().map(ShardExecutor::checkIdentifier).toList();
    }

    private static String checkIdentifier(String name) {
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Illegal column name: " + name);
        }
        return name;
    }
}
