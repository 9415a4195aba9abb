package com.lidm.core.state;

import com.lidm.core.model.Classification;
import com.lidm.core.model.ConsistencyResult;
import com.lidm.core.model.QueryStatus;
import com.lidm.core.model.TaskDecomposition;
import com.lidm.core.model.TraceEntry;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for one query moving through the delegation pipeline.
 * <p>
 * Trace entries and errors use appender channels: each node returns only the
 * entries it produced and they are concatenated in node order.
 */
public class DelegationState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Scalar channels ──────────────────────────────────────────
        Map.entry("queryId",              Channels.base(() -> "")),
        Map.entry("query",                Channels.base(() -> "")),
        Map.entry("status",               Channels.base(() -> QueryStatus.RECEIVED.name())),
        Map.entry("error",                Channels.base(() -> "")),
        Map.entry("classification",       Channels.base((Reducer<Classification>) null)),
        Map.entry("decomposition",        Channels.base((Reducer<TaskDecomposition>) null)),
        Map.entry("answer",               Channels.base(() -> "")),
        Map.entry("verificationPrompt",   Channels.base(() -> "")),
        Map.entry("verificationRequired", Channels.base(() -> false)),
        Map.entry("consistency",          Channels.base((Reducer<ConsistencyResult>) null)),
        Map.entry("subtaskScores",        Channels.base((Supplier<Map<String, Double>>) Map::of)),
        Map.entry("escalatedTier",        Channels.base(() -> "")),

        // ── Appender channels (list accumulation) ────────────────────
        Map.entry("trace",                Channels.appender(ArrayList::new)),
        Map.entry("errors",               Channels.appender(ArrayList::new))
    );

    public DelegationState(Map<String, Object> initData) {
        super(initData);
    }

    // ── Scalar accessors ─────────────────────────────────────────────

    public String queryId() {
        return this.<String>value("queryId").orElse("");
    }

    public String query() {
        return this.<String>value("query").orElse("");
    }

    public QueryStatus status() {
        String raw = this.<String>value("status").orElse(QueryStatus.RECEIVED.name());
        return QueryStatus.valueOf(raw);
    }

    public String error() {
        return this.<String>value("error").orElse("");
    }

    public Optional<Classification> classification() {
        return value("classification");
    }

    public Optional<TaskDecomposition> decomposition() {
        return value("decomposition");
    }

    public String answer() {
        return this.<String>value("answer").orElse("");
    }

    public String verificationPrompt() {
        return this.<String>value("verificationPrompt").orElse("");
    }

    public boolean verificationRequired() {
        return this.<Boolean>value("verificationRequired").orElse(false);
    }

    public Optional<ConsistencyResult> consistency() {
        return value("consistency");
    }

    public Map<String, Double> subtaskScores() {
        return this.<Map<String, Double>>value("subtaskScores").orElse(Map.of());
    }

    public String escalatedTier() {
        return this.<String>value("escalatedTier").orElse("");
    }

    // ── List accessors ───────────────────────────────────────────────

    public List<TraceEntry> trace() {
        return this.<List<TraceEntry>>value("trace").orElse(List.of());
    }

    public List<String> errors() {
        return this.<List<String>>value("errors").orElse(List.of());
    }
}
