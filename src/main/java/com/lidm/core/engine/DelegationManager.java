package com.lidm.core.engine;

import com.lidm.core.events.EventBus;
import com.lidm.core.events.LidmEvent;
import com.lidm.core.graph.DelegationGraph;
import com.lidm.core.logging.MdcContext;
import com.lidm.core.metrics.LidmMetrics;
import com.lidm.core.model.Classification;
import com.lidm.core.model.ConfidenceSummary;
import com.lidm.core.model.DecompositionStrategy;
import com.lidm.core.model.QueryResult;
import com.lidm.core.model.QueryStatus;
import com.lidm.core.model.SubTask;
import com.lidm.core.model.TaskDecomposition;
import com.lidm.core.state.DelegationState;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the engine: turns a natural-language query into a {@link QueryResult}
 * by running it through the {@link DelegationGraph}.
 * <p>
 * Never throws to the caller; anything that goes wrong is reported as a FAILED result.
 */
@Service
public class DelegationManager {

    private static final Logger log = LoggerFactory.getLogger(DelegationManager.class);
    private static final AtomicInteger QUERY_COUNTER = new AtomicInteger(0);

    private final DelegationGraph delegationGraph;
    private final EventBus eventBus;
    private final LidmMetrics metrics;

    public DelegationManager(DelegationGraph delegationGraph, EventBus eventBus, LidmMetrics metrics) {
        this.delegationGraph = delegationGraph;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public QueryResult handleQuery(String query) {
        return handleQuery(generateQueryId(), query);
    }

    /**
     * Answers {@code query} under a caller-chosen id (e.g. from the REST controller).
     */
    public QueryResult handleQuery(String queryId, String query) {
        long start = System.currentTimeMillis();
        MdcContext.setQuery(queryId);
        try {
            if (query == null || query.isBlank()) {
                return finish(QueryResult.failed(queryId, "query text is required", List.of(), 0L), null);
            }
            log.info("Handling query {} ({} chars)", queryId, query.length());
            eventBus.publish(LidmEvent.of("query.received", queryId, null, Map.of("query", query)));

            var initialState = Map.<String, Object>of(
                    "queryId", queryId,
                    "query", query,
                    "status", QueryStatus.RECEIVED.name());
            var config = RunnableConfig.builder()
                    .threadId(queryId)
                    .build();

            DelegationState state = delegationGraph.getCompiledGraph()
                    .invoke(initialState, config)
                    .orElseThrow(() -> new IllegalStateException("Graph returned no state for query " + queryId));

            return finish(toResult(state, System.currentTimeMillis() - start), state.classification().orElse(null));
        } catch (Exception e) {
            log.error("Query {} failed unexpectedly: {}", queryId, e.getMessage(), e);
            return finish(QueryResult.failed(queryId, "internal error: " + e.getMessage(), List.of(),
                    System.currentTimeMillis() - start), null);
        } finally {
            MdcContext.clear();
        }
    }

    QueryResult toResult(DelegationState state, long durationMs) {
        Classification classification = state.classification().orElse(null);
        TaskDecomposition decomposition = state.decomposition().orElse(null);
        List<SubTask> subtasks = decomposition != null ? decomposition.subtasks() : List.of();
        DecompositionStrategy strategy = decomposition != null ? decomposition.strategy() : null;

        if (state.status() == QueryStatus.FAILED) {
            String error = state.error().isBlank() ? String.join("; ", state.errors()) : state.error();
            return new QueryResult(state.queryId(), QueryStatus.FAILED, "Unable to answer the query: " + error,
                    error, strategy, classification, subtasks, state.trace(),
                    ConfidenceSummary.unverified(ConfidenceSummary.METHOD_UNVERIFIED, state.subtaskScores()),
                    durationMs);
        }

        ConfidenceSummary confidence = state.consistency()
                .map(c -> ConfidenceSummary.fromConsistency(c, state.subtaskScores()))
                .orElseGet(() -> ConfidenceSummary.unverified(
                        strategy == DecompositionStrategy.DIRECT
                                ? ConfidenceSummary.METHOD_DIRECT
                                : ConfidenceSummary.METHOD_UNVERIFIED,
                        state.subtaskScores()));
        return new QueryResult(state.queryId(), QueryStatus.DONE, state.answer(), null, strategy,
                classification, subtasks, state.trace(), confidence, durationMs);
    }

    private QueryResult finish(QueryResult result, Classification classification) {
        var payload = new HashMap<String, Object>();
        payload.put("status", result.status().name());
        payload.put("durationMs", result.durationMs());
        payload.put("backendCalls", result.trace().size());
        if (result.strategy() != null) {
            payload.put("strategy", result.strategy().name());
        }
        if (result.error() != null) {
            payload.put("error", result.error());
        }
        String eventType = result.succeeded() ? "query.completed" : "query.failed";
        eventBus.publish(LidmEvent.of(eventType, result.queryId(), null, payload));

        metrics.recordQueryResult(result.status(), result.strategy());
        metrics.recordQueryDuration(result.durationMs());
        if (classification != null) {
            metrics.recordComplexity(classification.complexity());
        }
        if (result.strategy() == DecompositionStrategy.DECOMPOSE) {
            metrics.recordSubtaskCount(result.subtasks().size());
        }
        if (result.succeeded()) {
            log.info("Query {} done in {}ms ({} backend calls, confidence {})", result.queryId(),
                    result.durationMs(), result.trace().size(), result.confidence().method());
        } else {
            log.error("Query {} failed: {}", result.queryId(), result.error());
        }
        return result;
    }

    /**
     * Generates a unique query ID in the format LIDM-YYYY-NNNN.
     */
    public String generateQueryId() {
        int count = QUERY_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("LIDM-%d-%04d", year, count);
    }
}
