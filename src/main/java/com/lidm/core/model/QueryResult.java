package com.lidm.core.model;

import java.util.List;

/**
 * Final outcome of one query. Always produced, even when every backend failed.
 *
 * @param queryId        generated identifier (e.g. "LIDM-2026-0001")
 * @param status         {@link QueryStatus#DONE} or {@link QueryStatus#FAILED}
 * @param answer         final answer text, or a human-readable failure message
 * @param error          failure reason, null on success
 * @param strategy       how the query was executed, null if it failed before decomposition
 * @param classification classification used for routing, null if classification failed
 * @param subtasks       subtask outcomes in decomposition order
 * @param trace          every backend attempt in order
 * @param confidence     trust summary for the answer
 * @param durationMs     end-to-end wall time
 */
public record QueryResult(
    String queryId,
    QueryStatus status,
    String answer,
    String error,
    DecompositionStrategy strategy,
    Classification classification,
    List<SubTask> subtasks,
    List<TraceEntry> trace,
    ConfidenceSummary confidence,
    long durationMs
) {

    public QueryResult {
        subtasks = subtasks == null ? List.of() : List.copyOf(subtasks);
        trace = trace == null ? List.of() : List.copyOf(trace);
    }

    public static QueryResult failed(String queryId, String error, List<TraceEntry> trace, long durationMs) {
        return new QueryResult(queryId, QueryStatus.FAILED, "Unable to answer the query: " + error, error,
                null, null, List.of(), trace, ConfidenceSummary.unverified(ConfidenceSummary.METHOD_UNVERIFIED, null),
                durationMs);
    }

    public boolean succeeded() {
        return status == QueryStatus.DONE;
    }
}
