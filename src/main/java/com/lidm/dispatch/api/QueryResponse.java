package com.lidm.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lidm.core.model.Classification;
import com.lidm.core.model.QueryResult;
import com.lidm.core.model.SubTask;
import com.lidm.core.model.TraceEntry;

import java.util.List;
import java.util.Map;

/**
 * JSON response for POST /api/v1/query.
 */
public record QueryResponse(
    @JsonProperty("query_id") String queryId,
    String status,
    String answer,
    String error,
    String strategy,
    Classification classification,
    List<SubtaskResponse> subtasks,
    ConfidenceResponse confidence,
    List<TraceResponse> trace,
    @JsonProperty("duration_ms") long durationMs
) {

    public record SubtaskResponse(
        String id,
        String instruction,
        String status,
        @JsonProperty("depends_on") List<String> dependsOn,
        @JsonProperty("tier_used") String tierUsed,
        int attempts,
        @JsonProperty("duration_ms") Long durationMs,
        String result,
        String error
    ) {}

    public record ConfidenceResponse(
        Double score,
        boolean confident,
        @JsonProperty("needs_tool_verification") boolean needsToolVerification,
        String method,
        @JsonProperty("subtask_scores") Map<String, Double> subtaskScores
    ) {}

    public record TraceResponse(
        String phase,
        @JsonProperty("subtask_id") String subtaskId,
        String tier,
        String backend,
        @JsonProperty("latency_ms") long latencyMs,
        String outcome,
        String detail
    ) {}

    public static QueryResponse from(QueryResult result) {
        var c = result.confidence();
        return new QueryResponse(
                result.queryId(),
                result.status().name(),
                result.answer(),
                result.error(),
                result.strategy() != null ? result.strategy().name() : null,
                result.classification(),
                result.subtasks().stream().map(QueryResponse::toSubtask).toList(),
                new ConfidenceResponse(c.score(), c.confident(), c.needsToolVerification(), c.method(),
                        c.subtaskScores()),
                result.trace().stream().map(QueryResponse::toTrace).toList(),
                result.durationMs());
    }

    private static SubtaskResponse toSubtask(SubTask s) {
        return new SubtaskResponse(s.id(), s.instruction(), s.status().name(), s.dependsOn(),
                s.tierUsed() != null ? s.tierUsed().key() : null, s.attemptCount(), s.durationMs(),
                s.result(), s.error());
    }

    private static TraceResponse toTrace(TraceEntry t) {
        return new TraceResponse(t.phase(), t.subtaskId(), t.tier() != null ? t.tier().key() : null,
                t.backend(), t.latencyMs(), t.outcome().name(), t.detail());
    }
}
