package com.lidm.core.scheduler;

import com.lidm.core.backend.GenerationOptions;

import java.util.Objects;

/**
 * @param maxInFlight most subtasks of one decomposition dispatched at once
 * @param maxAttempts dispatch attempts per subtask before it fails
 * @param options     sampling parameters for subtask calls
 */
public record SchedulerSettings(int maxInFlight, int maxAttempts, GenerationOptions options) {

    public SchedulerSettings {
        Objects.requireNonNull(options, "options");
        if (maxInFlight < 1) {
            throw new IllegalArgumentException("maxInFlight must be >= 1, got " + maxInFlight);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(4, 3, GenerationOptions.defaults());
    }
}
