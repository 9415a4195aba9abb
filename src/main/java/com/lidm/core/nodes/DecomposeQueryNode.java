package com.lidm.core.nodes;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.lidm.core.backend.DispatchRequest;
import com.lidm.core.backend.DispatchResult;
import com.lidm.core.backend.GenerationOptions;
import com.lidm.core.backend.GuardedDispatcher;
import com.lidm.core.engine.DelegationSettings;
import com.lidm.core.events.EventBus;
import com.lidm.core.events.LidmEvent;
import com.lidm.core.llm.LlmParseException;
import com.lidm.core.llm.StructuredOutputParser;
import com.lidm.core.model.Classification;
import com.lidm.core.model.DecompositionStrategy;
import com.lidm.core.model.ExecutionTrace;
import com.lidm.core.model.QueryStatus;
import com.lidm.core.model.SubTask;
import com.lidm.core.model.SubTaskPlan;
import com.lidm.core.model.TaskDecomposition;
import com.lidm.core.scheduler.DependencyGraph;
import com.lidm.core.scheduler.InvalidDecompositionException;
import com.lidm.core.state.DelegationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Asks the control tier to split a complex query into dependent subtasks.
 * <p>
 * The proposal is capped at the configured subtask limit and validated as a
 * DAG. A failed call, unusable output or an invalid graph falls back to a
 * single subtask carrying the whole query.
 */
@Component
public class DecomposeQueryNode {

    private static final Logger log = LoggerFactory.getLogger(DecomposeQueryNode.class);

    private static final String PROMPT_TEMPLATE = """
            Break the query below into at most %d subtasks that together answer it.
            Each subtask must be answerable on its own, given the results of the subtasks it depends on.
            - id: "st_1", "st_2", ...
            - instruction: what to do, phrased as a complete request
            - capabilities: capabilities the subtask needs (e.g. "reasoning", "coding", "math", "fast_response")
            - depends_on: ids of earlier subtasks whose results this subtask needs (may be empty)

            Respond with a JSON array and nothing else, for example:
            [{"id": "st_1", "instruction": "...", "capabilities": ["reasoning"], "depends_on": []}]

            Task type: %s
            Query: %s
            """;

    private static final List<String> WRAPPER_FIELDS = List.of("subtasks", "sub_tasks", "tasks");

    static final GenerationOptions OPTIONS = new GenerationOptions(1024, 0.2);

    private final GuardedDispatcher dispatcher;
    private final StructuredOutputParser parser;
    private final DelegationSettings settings;
    private final EventBus eventBus;

    public DecomposeQueryNode(GuardedDispatcher dispatcher, StructuredOutputParser parser,
                              DelegationSettings settings, EventBus eventBus) {
        this.dispatcher = dispatcher;
        this.parser = parser;
        this.settings = settings;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(DelegationState state) {
        var trace = new ExecutionTrace();
        Classification classification = state.classification().orElseGet(Classification::defaults);
        String prompt = String.format(PROMPT_TEMPLATE, settings.maxSubtasks(),
                classification.taskType(), state.query());
        DispatchResult<String> result = dispatcher.generate(
                DispatchRequest.of(settings.controlTier(), prompt, OPTIONS, "decompose"), trace);

        if (!result.succeeded()) {
            return fallback(state, classification, trace, "decomposition call failed: " + result.error());
        }

        List<SubTask> subtasks;
        try {
            subtasks = toSubtasks(result.value(), classification);
        } catch (LlmParseException e) {
            return fallback(state, classification, trace, "unparseable decomposition: " + e.getMessage());
        } catch (RuntimeException e) {
            return fallback(state, classification, trace, "malformed decomposition: " + e);
        }
        if (subtasks.isEmpty()) {
            return fallback(state, classification, trace, "decomposition produced no subtasks");
        }
        try {
            DependencyGraph.validate(subtasks);
        } catch (InvalidDecompositionException e) {
            return fallback(state, classification, trace, e.getMessage());
        }

        var decomposition = new TaskDecomposition(state.query(), subtasks, DecompositionStrategy.DECOMPOSE,
                classification.taskType(), classification.complexity(), classification.capabilities());
        log.info("Decomposed query into {} subtask(s): {}", subtasks.size(),
                subtasks.stream().map(SubTask::id).toList());
        eventBus.publish(LidmEvent.of("query.decomposed", state.queryId(), null, Map.of(
                "strategy", DecompositionStrategy.DECOMPOSE.name(),
                "subtasks", subtasks.stream().map(SubTask::id).toList())));
        return Map.of(
                "decomposition", decomposition,
                "status", QueryStatus.DECOMPOSED.name(),
                "trace", trace.entries());
    }

    List<SubTask> toSubtasks(String raw, Classification classification) {
        JsonNode root = parser.parseTree(raw)
                .orElseThrow(() -> new LlmParseException("no JSON found in decomposition output"));
        JsonNode items = unwrap(root)
                .orElseThrow(() -> new LlmParseException("decomposition is not a list of subtasks"));
        List<SubTaskPlan> plans = parser.convert(items, new TypeReference<List<SubTaskPlan>>() {});

        var subtasks = new ArrayList<SubTask>();
        for (SubTaskPlan plan : plans) {
            if (subtasks.size() >= settings.maxSubtasks()) {
                log.info("Decomposition truncated to {} subtasks", settings.maxSubtasks());
                break;
            }
            if (plan == null || plan.instruction() == null || plan.instruction().isBlank()) {
                continue;
            }
            String id = plan.id() == null || plan.id().isBlank()
                    ? "st_" + (subtasks.size() + 1)
                    : plan.id().trim();
            List<String> capabilities = nonBlank(plan.capabilities());
            if (capabilities.isEmpty()) {
                capabilities = classification.capabilities();
            }
            subtasks.add(SubTask.pending(id, plan.instruction().trim(), capabilities, nonBlank(plan.dependsOn())));
        }
        return subtasks;
    }

    // Model lists may carry null or blank entries.
    private static List<String> nonBlank(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
    }

    private Optional<JsonNode> unwrap(JsonNode root) {
        if (root.isArray()) {
            return Optional.of(root);
        }
        if (root.isObject()) {
            for (String field : WRAPPER_FIELDS) {
                JsonNode nested = root.get(field);
                if (nested != null && nested.isArray()) {
                    return Optional.of(nested);
                }
            }
            if (root.has("instruction")) {
                return Optional.of(root);
            }
        }
        return Optional.empty();
    }

    private Map<String, Object> fallback(DelegationState state, Classification classification,
                                         ExecutionTrace trace, String reason) {
        log.warn("Falling back to a single subtask: {}", reason);
        eventBus.publish(LidmEvent.of("query.decomposed", state.queryId(), null, Map.of(
                "strategy", DecompositionStrategy.DIRECT.name(),
                "reason", reason)));
        return Map.of(
                "decomposition", TaskDecomposition.direct(state.query(), classification),
                "status", QueryStatus.DIRECT.name(),
                "errors", List.of("Decomposition fell back to direct execution: " + reason),
                "trace", trace.entries());
    }
}
