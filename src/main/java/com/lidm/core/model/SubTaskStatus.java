package com.lidm.core.model;

/**
 * Execution status of a {@link SubTask}.
 */
public enum SubTaskStatus {
    PENDING,
    READY,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
