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
import com.lidm.core.model.Tier;
import com.lidm.core.state.DelegationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Self-consistency pass over the final answer of a decomposed query.
 * <p>
 * A confident majority replaces the aggregated answer. When agreement is too
 * low and escalation is enabled, the same prompt goes once to HEAVY, or to
 * ULTRA for queries above the verification complexity threshold, and that
 * answer is used instead.
 */
@Component
public class VerifyAnswerNode {

    private static final Logger log = LoggerFactory.getLogger(VerifyAnswerNode.class);

    static final GenerationOptions ESCALATION_OPTIONS = new GenerationOptions(2048, 0.2);

    private final GuardedDispatcher dispatcher;
    private final SelfConsistencyVerifier verifier;
    private final DelegationSettings settings;

    public VerifyAnswerNode(GuardedDispatcher dispatcher, SelfConsistencyVerifier verifier,
                            DelegationSettings settings) {
        this.dispatcher = dispatcher;
        this.verifier = verifier;
        this.settings = settings;
    }

    public Map<String, Object> apply(DelegationState state) {
        var trace = new ExecutionTrace();
        Classification classification = state.classification().orElseGet(Classification::defaults);
        String prompt = state.verificationPrompt().isBlank() ? state.query() : state.verificationPrompt();

        ConsistencyResult consistency = verifier.verify(prompt, settings.controlTier(),
                verifier.settings().finalSamples(), verifier.settings().temperature(), "verify", null, trace);

        var updates = new HashMap<String, Object>();
        updates.put("consistency", consistency);
        updates.put("status", QueryStatus.DONE.name());

        if (consistency.confident() && !consistency.majorityAnswer().isBlank()) {
            log.info("Final answer confirmed by self-consistency (p={})", String.format("%.2f", consistency.pHat()));
            updates.put("answer", consistency.majorityAnswer());
        } else if (settings.escalateOnLowConfidence()) {
            Tier target = classification.complexity() > settings.verifyComplexityThreshold() ? Tier.ULTRA : Tier.HEAVY;
            log.info("Low agreement (p={}), escalating to {}", String.format("%.2f", consistency.pHat()), target);
            DispatchResult<String> escalated = dispatcher.generate(
                    DispatchRequest.of(target, prompt, ESCALATION_OPTIONS, "verify"), trace);
            if (escalated.succeeded()) {
                updates.put("answer", escalated.value());
                updates.put("escalatedTier", escalated.tier().key());
            } else {
                log.warn("Escalation failed ({}), keeping aggregated answer", escalated.error());
            }
        }
        updates.put("trace", trace.entries());
        return updates;
    }
}
