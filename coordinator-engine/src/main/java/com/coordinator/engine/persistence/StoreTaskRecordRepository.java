package com.coordinator.engine.persistence;

import com.coordinator.core.model.Stage;
import com.coordinator.core.model.TaskRecord;
import com.coordinator.core.model.TaskStatus;
import com.coordinator.core.repository.TaskRecordRepository;
import com.coordinator.core.store.CoordinationStore;
import com.coordinator.engine.store.PipelineKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * TaskRecordRepository keeping each record as a hash {@code prp:{id}} in the coordination store,
 * plus an index set of all ids.
 * 
 * The retry counter is owned by {@link #incrementRetries}: {@link #save} only seeds it, so a
 * status write never clobbers a concurrent failure count. Null fields are never written,
 * so a save never erases a stage timestamp stamped since the record was read.
 */
public class StoreTaskRecordRepository implements TaskRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(StoreTaskRecordRepository.class);

    static final String ID = "legacy_id";
    static final String STABLE_ID = "stable_id";
    static final String TITLE = "title";
    static final String STATUS = "status";
    static final String PRIORITY = "priority";
    static final String OWNER = "owner";
    static final String DEPENDENCIES = "dependencies";
    static final String CREATED_AT = "created_at";
    static final String ASSIGNED_AT = "assigned_at";
    static final String DEV_STARTED_AT = "dev_started_at";
    static final String VALIDATION_STARTED_AT = "validation_started_at";
    static final String INTEGRATION_STARTED_AT = "integration_started_at";
    static final String COMPLETED_AT = "completed_at";
    static final String RETRIES = "retries";
    static final String NEEDS_ATTENTION = "needs_attention";
    static final String COMMIT_HASH = "commit_hash";
    static final String DEPRECATED = "deprecated";
    static final String SUPERSEDED_BY = "superseded_by";
    static final String MIGRATED_AT = "migrated_at";

    private final CoordinationStore store;
    private final PipelineKeys keys;

    public StoreTaskRecordRepository(CoordinationStore store, PipelineKeys keys) {
        this.store = store;
        this.keys = keys;
    }

    @Override
    public void save(TaskRecord record) {
        String key = keys.task(record.id());
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(ID, record.id());
        fields.put(STABLE_ID, Long.toString(record.stableId()));
        fields.put(TITLE, record.title());
        fields.put(STATUS, record.status().wireName());
        fields.put(PRIORITY, Integer.toString(record.priority()));
        fields.put(OWNER, record.owner());
        fields.put(DEPENDENCIES, String.join(",", record.dependencies()));
        fields.put(CREATED_AT, format(record.createdAt()));
        fields.put(ASSIGNED_AT, format(record.assignedAt()));
        fields.put(DEV_STARTED_AT, format(record.devStartedAt()));
        fields.put(VALIDATION_STARTED_AT, format(record.validationStartedAt()));
        fields.put(INTEGRATION_STARTED_AT, format(record.integrationStartedAt()));
        fields.put(COMPLETED_AT, format(record.completedAt()));
        fields.put(NEEDS_ATTENTION, Boolean.toString(record.needsAttention()));
        fields.put(COMMIT_HASH, record.commitHash());
        fields.put(DEPRECATED, Boolean.toString(record.deprecated()));
        fields.put(SUPERSEDED_BY, record.supersededBy());
        fields.put(MIGRATED_AT, format(record.migratedAt()));

        // Unset fields are left alone: stage timestamps are stamped independently by the pipeline
        fields.values().removeIf(Objects::isNull);
        store.hsetAll(key, fields);
        store.hsetIfAbsent(key, RETRIES, Integer.toString(record.retries()));
        store.sadd(keys.taskIndex(), record.id());
        log.debug("Saved task record {} ({})", record.id(), record.status().wireName());
    }

    @Override
    public Optional<TaskRecord> findById(String id) {
        Map<String, String> fields = store.hgetAll(keys.task(id));
        if (fields.isEmpty() || !fields.containsKey(STATUS)) {
            return Optional.empty();
        }
        return Optional.of(toRecord(id, fields));
    }

    @Override
    public boolean exists(String id) {
        return store.hget(keys.task(id), STATUS).isPresent();
    }

    @Override
    public List<TaskRecord> findAll() {
        List<TaskRecord> records = new ArrayList<>();
        for (String id : store.smembers(keys.taskIndex())) {
            findById(id).ifPresent(records::add);
        }
        return records;
    }

    @Override
    public List<TaskRecord> findByStatus(TaskStatus status) {
        return findAll().stream()
            .filter(r -> r.status() == status)
            .collect(Collectors.toList());
    }

    @Override
    public int incrementRetries(String id) {
        return (int) store.hincrBy(keys.task(id), RETRIES, 1);
    }

    @Override
    public void resetRetries(String id) {
        store.hset(keys.task(id), RETRIES, "0");
    }

    @Override
    public void markNeedsAttention(String id, boolean needsAttention) {
        store.hset(keys.task(id), NEEDS_ATTENTION, Boolean.toString(needsAttention));
    }

    @Override
    public boolean stampStageStarted(String id, Stage stage, Instant at) {
        if (!exists(id)) {
            return false;
        }
        String field = switch (stage) {
            case NEW -> null;
            case DEVELOPMENT -> DEV_STARTED_AT;
            case VALIDATION -> VALIDATION_STARTED_AT;
            case INTEGRATION -> INTEGRATION_STARTED_AT;
        };
        return field != null && store.hsetIfAbsent(keys.task(id), field, at.toString());
    }

    private static TaskRecord toRecord(String id, Map<String, String> f) {
        String deps = f.get(DEPENDENCIES);
        Set<String> dependencies = deps == null || deps.isBlank()
            ? Set.of()
            : Arrays.stream(deps.split(",")).map(String::trim).filter(s -> !s.isEmpty()).collect(Collectors.toSet());
        return new TaskRecord(
            f.getOrDefault(ID, id),
            parseLong(f.get(STABLE_ID), 0L),
            f.get(TITLE),
            TaskStatus.fromWireName(f.get(STATUS)),
            (int) parseLong(f.get(PRIORITY), TaskRecord.DEFAULT_PRIORITY),
            f.get(OWNER),
            dependencies,
            parse(f.get(CREATED_AT)),
            parse(f.get(ASSIGNED_AT)),
            parse(f.get(DEV_STARTED_AT)),
            parse(f.get(VALIDATION_STARTED_AT)),
            parse(f.get(INTEGRATION_STARTED_AT)),
            parse(f.get(COMPLETED_AT)),
            (int) parseLong(f.get(RETRIES), 0L),
            Boolean.parseBoolean(f.get(NEEDS_ATTENTION)),
            f.get(COMMIT_HASH),
            Boolean.parseBoolean(f.get(DEPRECATED)),
            f.get(SUPERSEDED_BY),
            parse(f.get(MIGRATED_AT))
        );
    }

    private static String format(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    private static Instant parse(String value) {
        return value == null || value.isEmpty() ? null : Instant.parse(value);
    }

    private static long parseLong(String value, long defaultValue) {
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        return Long.parseLong(value);
    }
}
