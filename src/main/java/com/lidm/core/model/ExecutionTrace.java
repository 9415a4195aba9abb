package com.lidm.core.model;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only, thread-safe record of every backend attempt made for a query.
 * Concurrent subtasks append to the same trace.
 */
public class ExecutionTrace {

    private final List<TraceEntry> entries = new CopyOnWriteArrayList<>();

    public void record(TraceEntry entry) {
        entries.add(entry);
    }

    /** Immutable snapshot in append order. */
    public List<TraceEntry> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public long count(DispatchOutcome outcome) {
        return entries.stream().filter(e -> e.outcome() == outcome).count();
    }
}
