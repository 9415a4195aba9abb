package com.lidm.core.nodes;

import com.lidm.core.backend.DispatchRequest;
import com.lidm.core.backend.DispatchResult;
import com.lidm.core.backend.GenerationOptions;
import com.lidm.core.backend.GuardedDispatcher;
import com.lidm.core.consistency.SelfConsistencyVerifier;
import com.lidm.core.engine.DelegationSettings;
import com.lidm.core.model.Classification;
import com.lidm.core.model.ConsistencyResult;
import com.lidm.core.model.ExecutionTrace;
import com.lidm.core.model.QueryStatus;
import com.lidm.core.model.SubTask;
import com.lidm.core.model.TaskDecomposition;
import com.lidm.core.scheduler.DependencyGraph;
import com.lidm.core.state.DelegationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Combines completed subtask results into one answer.
 * <p>
 * One completed subtask is the answer as is. Several are concatenated in
 * dependency order and, when synthesis is enabled, merged by one call to the
 * control tier; the concatenation stands if that call fails. No completed
 * subtask fails the query. Also decides whether the final answer is verified.
 */
@Component
public class AggregateResultsNode {

    private static final Logger log = LoggerFactory.getLogger(AggregateResultsNode.class);

    private static final String SYNTHESIS_TEMPLATE = """
            Combine the partial results below into one complete, coherent answer to the original query.
            Resolve contradictions, drop repetition and do not mention the subtasks.

            Original query: %s

            Partial results:
            %s
            """;

    static final GenerationOptions OPTIONS = new GenerationOptions(2048, 0.3);

    private final GuardedDispatcher dispatcher;
    private final SelfConsistencyVerifier verifier;
    private final DelegationSettings settings;

    public AggregateResultsNode(GuardedDispatcher dispatcher, SelfConsistencyVerifier verifier,
                                DelegationSettings settings) {
        this.dispatcher = dispatcher;
        this.verifier = verifier;
        this.settings = settings;
    }

    public Map<String, Object> apply(DelegationState state) {
        var trace = new ExecutionTrace();
        Classification classification = state.classification().orElseGet(Classification::defaults);
        TaskDecomposition decomposition = state.decomposition()
                .orElseGet(() -> TaskDecomposition.direct(state.query(), classification));

        List<SubTask> completed = inExecutionOrder(decomposition).stream()
                .filter(SubTask::isCompleted)
                .toList();
        if (completed.isEmpty()) {
            String error = "All subtasks failed: " + decomposition.failed().stream()
                    .map(s -> s.id() + " (" + s.error() + ")")
                    .collect(Collectors.joining(", "));
            log.error(error);
            return Map.of(
                    "status", QueryStatus.FAILED.name(),
                    "error", error,
                    "trace", trace.entries());
        }

        var scores = new LinkedHashMap<String, Double>();
        if (settings.verifySubtasks() && decomposition.isDecomposed()) {
            completed = verifySubtasks(completed, scores, trace);
            decomposition = decomposition.withSubtasks(replace(decomposition.subtasks(), completed));
        }

        String answer;
        String verificationPrompt;
        if (completed.size() == 1) {
            SubTask only = completed.get(0);
            answer = only.result();
            verificationPrompt = only.prompt() != null ? only.prompt() : only.instruction();
        } else {
            String partials = completed.stream()
                    .map(s -> "[" + s.id() + "] " + s.result())
                    .collect(Collectors.joining("\n\n"));
            verificationPrompt = String.format(SYNTHESIS_TEMPLATE, state.query(), partials);
            answer = settings.synthesize() ? synthesize(verificationPrompt, partials, trace) : partials;
        }

        boolean anyFailed = !decomposition.failed().isEmpty();
        boolean verify = settings.verifyFinal() && decomposition.isDecomposed()
                && (classification.complexity() >= settings.verifyComplexityThreshold() || anyFailed);
        log.info("Aggregated {} of {} subtask result(s){}", completed.size(), decomposition.subtasks().size(),
                verify ? ", final answer will be verified" : "");

        var updates = new HashMap<String, Object>();
        updates.put("decomposition", decomposition);
        updates.put("answer", answer);
        updates.put("verificationPrompt", verificationPrompt);
        updates.put("verificationRequired", verify);
        updates.put("subtaskScores", Map.copyOf(scores));
        updates.put("status", verify ? QueryStatus.VERIFYING.name() : QueryStatus.DONE.name());
        updates.put("trace", trace.entries());
        return updates;
    }

    private String synthesize(String prompt, String concatenation, ExecutionTrace trace) {
        DispatchResult<String> result = dispatcher.generate(
                DispatchRequest.of(settings.controlTier(), prompt, OPTIONS, "aggregate"), trace);
        if (result.succeeded()) {
            return result.value();
        }
        log.warn("Synthesis failed ({}), using concatenated results", result.error());
        return concatenation;
    }

    /**
     * Resamples each subtask on the tier that answered it. A confident majority
     * replaces the original result; otherwise the result stands with its score.
     */
    private List<SubTask> verifySubtasks(List<SubTask> completed, Map<String, Double> scores,
                                         ExecutionTrace trace) {
        var verified = new ArrayList<SubTask>(completed.size());
        for (SubTask subtask : completed) {
            String prompt = subtask.prompt() != null ? subtask.prompt() : subtask.instruction();
            ConsistencyResult result = verifier.verify(prompt,
                    subtask.tierUsed() != null ? subtask.tierUsed() : settings.controlTier(),
                    "aggregate", subtask.id(), trace);
            scores.put(subtask.id(), result.pHat());
            if (result.confident() && !result.majorityAnswer().isBlank()) {
                verified.add(subtask.withResult(result.majorityAnswer()));
            } else {
                log.info("Subtask {} not confident (p={}), keeping its original result",
                        subtask.id(), String.format("%.2f", result.pHat()));
                verified.add(subtask);
            }
        }
        return verified;
    }

    private static List<SubTask> inExecutionOrder(TaskDecomposition decomposition) {
        Map<String, SubTask> byId = new LinkedHashMap<>();
        decomposition.subtasks().forEach(s -> byId.put(s.id(), s));
        return DependencyGraph.topologicalOrder(decomposition.subtasks()).stream()
                .map(byId::get)
                .toList();
    }

    private static List<SubTask> replace(List<SubTask> all, List<SubTask> updated) {
        Map<String, SubTask> byId = new HashMap<>();
        updated.forEach(s -> byId.put(s.id(), s));
        return all.stream().map(s -> byId.getOrDefault(s.id(), s)).toList();
    }
}
