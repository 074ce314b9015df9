package com.coordinator.engine.state;

import java.util.List;

/**
 * Result of a legacy id migration.
 *
 * @param migrated legacy ids that received a stable id in this run, in assignment order
 * @param alreadyMapped legacy ids that had one already and were left unchanged
 */
public record MigrationReport(List<String> migrated, List<String> alreadyMapped) {
}
