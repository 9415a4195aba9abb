package com.lidm.core.nodes;

import com.lidm.core.backend.DispatchRequest;
import com.lidm.core.backend.DispatchResult;
import com.lidm.core.backend.GenerationOptions;
import com.lidm.core.backend.GuardedDispatcher;
import com.lidm.core.engine.DelegationSettings;
import com.lidm.core.events.EventBus;
import com.lidm.core.events.LidmEvent;
import com.lidm.core.llm.LlmEmptyResponseException;
import com.lidm.core.llm.LlmParseException;
import com.lidm.core.llm.StructuredOutputParser;
import com.lidm.core.model.Classification;
import com.lidm.core.model.ExecutionTrace;
import com.lidm.core.model.QueryStatus;
import com.lidm.core.scheduler.CapabilityTierResolver;
import com.lidm.core.state.DelegationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Asks the control tier to classify the query by task type, required
 * capabilities and complexity.
 * <p>
 * A classification call that cannot be dispatched fails the query. Output that
 * cannot be parsed falls back to {@link Classification#defaults()}.
 */
@Component
public class ClassifyQueryNode {

    private static final Logger log = LoggerFactory.getLogger(ClassifyQueryNode.class);

    private static final String PROMPT_TEMPLATE = """
            You are a query router. Classify the user query below.
            - task_type: a short category such as "factual", "coding", "analysis", "math", "research"
            - capabilities: the capabilities needed to answer, chosen from: %s
            - complexity: a number from 0.0 (one-line factual answer) to 1.0 (multi-step expert work)

            Respond with a single JSON object and nothing else, for example:
            {"task_type": "factual", "capabilities": ["fast_response"], "complexity": 0.2}

            Query: %s
            """;

    static final GenerationOptions OPTIONS = new GenerationOptions(256, 0.1);

    private final GuardedDispatcher dispatcher;
    private final StructuredOutputParser parser;
    private final CapabilityTierResolver tierResolver;
    private final DelegationSettings settings;
    private final EventBus eventBus;

    public ClassifyQueryNode(GuardedDispatcher dispatcher, StructuredOutputParser parser,
                             CapabilityTierResolver tierResolver, DelegationSettings settings,
                             EventBus eventBus) {
        this.dispatcher = dispatcher;
        this.parser = parser;
        this.tierResolver = tierResolver;
        this.settings = settings;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(DelegationState state) {
        var trace = new ExecutionTrace();
        String capabilities = String.join(", ", new TreeSet<>(tierResolver.table().keySet()));
        String prompt = String.format(PROMPT_TEMPLATE, capabilities, state.query());
        DispatchResult<String> result = dispatcher.generate(
                DispatchRequest.of(settings.controlTier(), prompt, OPTIONS, "classify"), trace);

        if (!result.succeeded()) {
            String error = "Classification failed: " + result.error();
            log.error("{} ({})", error, result.outcome());
            return Map.of(
                    "status", QueryStatus.FAILED.name(),
                    "error", error,
                    "errors", List.of(error),
                    "trace", trace.entries());
        }

        Classification classification;
        try {
            classification = parser.parse(result.value(), Classification.class);
        } catch (LlmParseException | LlmEmptyResponseException e) {
            log.warn("Unparseable classification, using defaults: {}", e.getMessage());
            classification = Classification.defaults();
        }
        log.info("Classified as {} (complexity {}, capabilities {})", classification.taskType(),
                String.format("%.2f", classification.complexity()), classification.capabilities());
        eventBus.publish(LidmEvent.of("query.classified", state.queryId(), null, Map.of(
                "taskType", classification.taskType(),
                "capabilities", classification.capabilities(),
                "complexity", classification.complexity())));
        return Map.of(
                "classification", classification,
                "status", QueryStatus.CLASSIFIED.name(),
                "trace", trace.entries());
    }
}
