package com.coordinator.engine.store;

import com.coordinator.core.exception.TransientStoreException;
import com.coordinator.core.store.CoordinationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * PostgreSQL-backed implementation of CoordinationStore.
 * 
 * Lists are rows ordered by a position drawn from one sequence: tail pushes take
 * {@code nextval}, head pushes take {@code -nextval}, so ascending order is head first.
 * The blocking move claims the head row with {@code FOR UPDATE SKIP LOCKED} and
 * re-keys it onto the destination in the same transaction, then polls until the timeout.
 */
public class JdbcCoordinationStore implements CoordinationStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcCoordinationStore.class);

    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Duration pollInterval;

    public JdbcCoordinationStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this(jdbcTemplate, transactionTemplate, DEFAULT_POLL_INTERVAL);
    }

    public JdbcCoordinationStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate, Duration pollInterval) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.pollInterval = pollInterval;
    }

    // ========== Lists ==========

    @Override
    public void pushHead(String key, String value) {
        execute("pushHead", () -> jdbcTemplate.update("""
            INSERT INTO coord_list_entries (list_key, position, value)
            VALUES (?, -nextval('coord_list_position_seq'), ?)
            """, key, value));
    }

    @Override
    public void pushTail(String key, String value) {
        execute("pushTail", () -> jdbcTemplate.update("""
            INSERT INTO coord_list_entries (list_key, position, value)
            VALUES (?, nextval('coord_list_position_seq'), ?)
            """, key, value));
    }

    @Override
    public Optional<String> moveBlocking(String source, String destination, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            Optional<String> moved = execute("moveBlocking", () -> transactionTemplate.execute(status -> tryMove(source, destination)));
            if (moved != null && moved.isPresent()) {
                return moved;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return Optional.empty();
            }
            try {
                Thread.sleep(Math.min(pollInterval.toMillis(), Math.max(1, remaining / 1_000_000)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }

    private Optional<String> tryMove(String source, String destination) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList("""
            SELECT id, value FROM coord_list_entries
            WHERE list_key = ?
            ORDER BY position
            LIMIT 1
            FOR UPDATE SKIP LOCKED
            """, source);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        long id = ((Number) rows.get(0).get("id")).longValue();
        String value = (String) rows.get(0).get("value");
        jdbcTemplate.update("""
            UPDATE coord_list_entries
            SET list_key = ?, position = nextval('coord_list_position_seq')
            WHERE id = ?
            """, destination, id);
        log.debug("Moved {} from {} to {}", value, source, destination);
        return Optional.of(value);
    }

    @Override
    public long length(String key) {
        Long count = execute("length", () -> jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM coord_list_entries WHERE list_key = ?", Long.class, key));
        return count != null ? count : 0L;
    }

    @Override
    public List<String> range(String key) {
        return execute("range", () -> jdbcTemplate.queryForList(
            "SELECT value FROM coord_list_entries WHERE list_key = ? ORDER BY position", String.class, key));
    }

    @Override
    public long remove(String key, String value, int count) {
        if (count == 0) {
            return execute("remove", () -> jdbcTemplate.update(
                "DELETE FROM coord_list_entries WHERE list_key = ? AND value = ?", key, value));
        }
        return execute("remove", () -> jdbcTemplate.update("""
            DELETE FROM coord_list_entries WHERE id IN (
                SELECT id FROM coord_list_entries
                WHERE list_key = ? AND value = ?
                ORDER BY position
                LIMIT ?
            )
            """, key, value, count));
    }

    // ========== Hashes ==========

    @Override
    public Optional<String> hget(String key, String field) {
        List<String> values = execute("hget", () -> jdbcTemplate.queryForList(
            "SELECT value FROM coord_hash_fields WHERE hash_key = ? AND field = ?", String.class, key, field));
        return values.isEmpty() ? Optional.empty() : Optional.ofNullable(values.get(0));
    }

    @Override
    public Map<String, String> hgetAll(String key) {
        return execute("hgetAll", () -> {
            Map<String, String> fields = new LinkedHashMap<>();
            jdbcTemplate.query("SELECT field, value FROM coord_hash_fields WHERE hash_key = ?",
                rs -> {
                    fields.put(rs.getString("field"), rs.getString("value"));
                }, key);
            return fields;
        });
    }

    @Override
    public void hset(String key, String field, String value) {
        execute("hset", () -> jdbcTemplate.update("""
            INSERT INTO coord_hash_fields (hash_key, field, value) VALUES (?, ?, ?)
            ON CONFLICT (hash_key, field) DO UPDATE SET value = EXCLUDED.value
            """, key, field, value));
    }

    @Override
    public void hsetAll(String key, Map<String, String> fields) {
        if (fields.isEmpty()) {
            return;
        }
        List<Object[]> batch = new ArrayList<>();
        fields.forEach((field, value) -> batch.add(new Object[]{key, field, value}));
        execute("hsetAll", () -> transactionTemplate.execute(status -> jdbcTemplate.batchUpdate("""
            INSERT INTO coord_hash_fields (hash_key, field, value) VALUES (?, ?, ?)
            ON CONFLICT (hash_key, field) DO UPDATE SET value = EXCLUDED.value
            """, batch)));
    }

    @Override
    public boolean hsetIfAbsent(String key, String field, String value) {
        int rows = execute("hsetIfAbsent", () -> jdbcTemplate.update("""
            INSERT INTO coord_hash_fields (hash_key, field, value) VALUES (?, ?, ?)
            ON CONFLICT (hash_key, field) DO NOTHING
            """, key, field, value));
        return rows > 0;
    }

    @Override
    public long hincrBy(String key, String field, long delta) {
        String value = execute("hincrBy", () -> jdbcTemplate.queryForObject("""
            INSERT INTO coord_hash_fields (hash_key, field, value) VALUES (?, ?, ?)
            ON CONFLICT (hash_key, field) DO UPDATE
                SET value = (CAST(coord_hash_fields.value AS BIGINT) + ?)::text
            RETURNING value
            """, String.class, key, field, Long.toString(delta), delta));
        return Long.parseLong(value);
    }

    @Override
    public boolean hdel(String key, String field) {
        int rows = execute("hdel", () -> jdbcTemplate.update(
            "DELETE FROM coord_hash_fields WHERE hash_key = ? AND field = ?", key, field));
        return rows > 0;
    }

    // ========== Sets ==========

    @Override
    public boolean sadd(String key, String member) {
        int rows = execute("sadd", () -> jdbcTemplate.update("""
            INSERT INTO coord_set_members (set_key, member) VALUES (?, ?)
            ON CONFLICT (set_key, member) DO NOTHING
            """, key, member));
        return rows > 0;
    }

    @Override
    public boolean srem(String key, String member) {
        int rows = execute("srem", () -> jdbcTemplate.update(
            "DELETE FROM coord_set_members WHERE set_key = ? AND member = ?", key, member));
        return rows > 0;
    }

    @Override
    public boolean sismember(String key, String member) {
        Integer count = execute("sismember", () -> jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM coord_set_members WHERE set_key = ? AND member = ?", Integer.class, key, member));
        return count != null && count > 0;
    }

    @Override
    public Set<String> smembers(String key) {
        return execute("smembers", () -> new LinkedHashSet<>(jdbcTemplate.queryForList(
            "SELECT member FROM coord_set_members WHERE set_key = ?", String.class, key)));
    }

    // ========== Keys ==========

    @Override
    public void delete(String key) {
        execute("delete", () -> transactionTemplate.execute(status -> {
            jdbcTemplate.update("DELETE FROM coord_list_entries WHERE list_key = ?", key);
            jdbcTemplate.update("DELETE FROM coord_hash_fields WHERE hash_key = ?", key);
            jdbcTemplate.update("DELETE FROM coord_set_members WHERE set_key = ?", key);
            return null;
        }));
    }

    @Override
    public boolean ping() {
        try {
            Integer result = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return result != null && result == 1;
        } catch (Exception e) {
            log.warn("Coordination store ping failed: {}", e.getMessage());
            return false;
        }
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (TransientDataAccessException
                 | RecoverableDataAccessException
                 | DataAccessResourceFailureException e) {
            throw new TransientStoreException(operation, e);
        }
    }
}
