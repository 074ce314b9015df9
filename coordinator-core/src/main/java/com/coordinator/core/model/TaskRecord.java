package com.coordinator.core.model;

import java.time.Instant;
import java.util.Set;

/**
 * A unit of work (PRP) tracked through the pipeline.
 * 
 * Primary Key: id (legacy/display id)
 * Unique Constraint: stableId
 * 
 * Invariants:
 * - stableId is assigned once at creation and never changes
 * - status transitions follow {@link TaskStatus#canTransitionTo}
 * - supersededBy set iff deprecated
 * - terminal records are retained, never deleted
 */
public record TaskRecord(
    // Identity
    String id,
    long stableId,
    String title,
    
    // State
    TaskStatus status,
    int priority,
    String owner,
    Set<String> dependencies,
    
    // Per-stage timing
    Instant createdAt,
    Instant assignedAt,
    Instant devStartedAt,
    Instant validationStartedAt,
    Instant integrationStartedAt,
    Instant completedAt,
    
    // Failure handling
    int retries,
    boolean needsAttention,
    
    // Completion
    String commitHash,
    
    // Supersession
    boolean deprecated,
    String supersededBy,
    
    // Migration
    Instant migratedAt
) {
    /**
     * Default priority for ingested tasks.
     */
    public static final int DEFAULT_PRIORITY = 50;

    /**
     * Create a new task record in NEW state.
     */
    public static TaskRecord create(
            String id,
            long stableId,
            String title,
            int priority,
            Set<String> dependencies,
            Instant createdAt) {
        return new TaskRecord(
            id,
            stableId,
            title,
            TaskStatus.NEW,
            priority,
            null,
            dependencies != null ? Set.copyOf(dependencies) : Set.of(),
            createdAt,
            null,
            null,
            null,
            null,
            null,
            0,
            false,
            null,
            false,
            null,
            null
        );
    }

    /**
     * Check if the task is in a terminal state.
     */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isAssigned() {
        return owner != null && !owner.isBlank();
    }

    /**
     * Timestamp recorded when the task was first claimed from the given stage, if any.
     */
    public Instant stageStartedAt(Stage stage) {
        return switch (stage) {
            case NEW -> assignedAt;
            case DEVELOPMENT -> devStartedAt;
            case VALIDATION -> validationStartedAt;
            case INTEGRATION -> integrationStartedAt;
        };
    }

    /**
     * Create a copy carrying a stable id issued by a legacy migration.
     */
    public TaskRecord withMigration(long newStableId, Instant at) {
        return new TaskRecord(
            id, newStableId, title, status, priority, owner, dependencies,
            createdAt, assignedAt, devStartedAt, validationStartedAt,
            integrationStartedAt, completedAt, retries, needsAttention,
            commitHash, deprecated, supersededBy, at
        );
    }

    /**
     * Builder for creating modified copies.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private final String id;
        private final long stableId;
        private String title;
        private TaskStatus status;
        private int priority;
        private String owner;
        private Set<String> dependencies;
        private final Instant createdAt;
        private Instant assignedAt;
        private Instant devStartedAt;
        private Instant validationStartedAt;
        private Instant integrationStartedAt;
        private Instant completedAt;
        private int retries;
        private boolean needsAttention;
        private String commitHash;
        private boolean deprecated;
        private String supersededBy;
        private Instant migratedAt;

        public Builder(TaskRecord record) {
            this.id = record.id();
            this.stableId = record.stableId();
            this.title = record.title();
            this.status = record.status();
            this.priority = record.priority();
            this.owner = record.owner();
            this.dependencies = record.dependencies();
            this.createdAt = record.createdAt();
            this.assignedAt = record.assignedAt();
            this.devStartedAt = record.devStartedAt();
            this.validationStartedAt = record.validationStartedAt();
            this.integrationStartedAt = record.integrationStartedAt();
            this.completedAt = record.completedAt();
            this.retries = record.retries();
            this.needsAttention = record.needsAttention();
            this.commitHash = record.commitHash();
            this.deprecated = record.deprecated();
            this.supersededBy = record.supersededBy();
            this.migratedAt = record.migratedAt();
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder owner(String owner) {
            this.owner = owner;
            return this;
        }

        public Builder dependencies(Set<String> dependencies) {
            this.dependencies = Set.copyOf(dependencies);
            return this;
        }

        public Builder assignedAt(Instant assignedAt) {
            this.assignedAt = assignedAt;
            return this;
        }

        public Builder devStartedAt(Instant devStartedAt) {
            this.devStartedAt = devStartedAt;
            return this;
        }

        public Builder validationStartedAt(Instant validationStartedAt) {
            this.validationStartedAt = validationStartedAt;
            return this;
        }

        public Builder integrationStartedAt(Instant integrationStartedAt) {
            this.integrationStartedAt = integrationStartedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder needsAttention(boolean needsAttention) {
            this.needsAttention = needsAttention;
            return this;
        }

        public Builder commitHash(String commitHash) {
            this.commitHash = commitHash;
            return this;
        }

        public Builder deprecated(String supersededBy) {
            this.deprecated = true;
            this.supersededBy = supersededBy;
            this.status = TaskStatus.DEPRECATED;
            return this;
        }

        public Builder migratedAt(Instant migratedAt) {
            this.migratedAt = migratedAt;
            return this;
        }

        public TaskRecord build() {
            return new TaskRecord(
                id, stableId, title, status, priority, owner, dependencies,
                createdAt, assignedAt, devStartedAt, validationStartedAt,
                integrationStartedAt, completedAt, retries, needsAttention,
                commitHash, deprecated, supersededBy, migratedAt
            );
        }
    }
}
