package com.coordinator.engine.pipeline;

import java.util.Set;

/**
 * Failure handling knobs for the queue pipeline.
 *
 * @param maxRetries failures a task may accumulate and still be requeued; one more dead-letters it
 * @param nonRetryableReasons failure reasons (or {@code reason:detail} prefixes) that dead-letter immediately
 */
public record PipelineSettings(int maxRetries, Set<String> nonRetryableReasons) {

    public PipelineSettings {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        nonRetryableReasons = nonRetryableReasons != null ? Set.copyOf(nonRetryableReasons) : Set.of();
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(3, Set.of());
    }

    public boolean isRetryable(String reason) {
        if (reason == null) {
            return true;
        }
        return nonRetryableReasons.stream()
            .noneMatch(code -> reason.equals(code) || reason.startsWith(code + ":"));
    }
}
