package com.lidm.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a query is processed or when a circuit changes state.
 *
 * @param eventType event type (e.g. "query.received", "subtask.completed", "circuit.transition")
 * @param queryId   the query this event belongs to (null for process-level events)
 * @param subtaskId the subtask this event relates to (nullable)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record LidmEvent(
    String eventType,
    String queryId,
    String subtaskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static LidmEvent of(String eventType, String queryId, String subtaskId, Map<String, Object> payload) {
        return new LidmEvent(eventType, queryId, subtaskId, payload, Instant.now());
    }
}
