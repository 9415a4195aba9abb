package com.lidm.core.scheduler;

import java.util.List;

/**
 * Thrown when subtask dependencies form a cycle. Raised before any subtask runs.
 */
public class CyclicDependencyException extends InvalidDecompositionException {

    private final List<String> involvedIds;

    public CyclicDependencyException(List<String> involvedIds) {
        super("Dependency cycle among subtasks " + involvedIds);
        this.involvedIds = List.copyOf(involvedIds);
    }

    /** Subtasks on or downstream of the cycle. */
    public List<String> involvedIds() {
        return involvedIds;
    }
}
