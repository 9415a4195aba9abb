package com.lidm.core.scheduler;

/**
 * Thrown when a set of subtasks cannot be scheduled: duplicate ids or
 * dependencies on ids that do not exist.
 */
public class InvalidDecompositionException extends RuntimeException {
    public InvalidDecompositionException(String message) {
        super(message);
    }
}
