package com.lidm.core.consistency;

import com.lidm.core.backend.BatchGeneration;
import com.lidm.core.backend.DispatchRequest;
import com.lidm.core.backend.DispatchResult;
import com.lidm.core.backend.GenerationOptions;
import com.lidm.core.backend.GuardedDispatcher;
import com.lidm.core.metrics.LidmMetrics;
import com.lidm.core.model.ConsistencyResult;
import com.lidm.core.model.ExecutionTrace;
import com.lidm.core.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates answer reliability by sampling the same prompt several times and
 * measuring agreement. Responses are always re-scored locally, whatever majority
 * the backend reported. A batch that cannot be obtained yields an empty,
 * non-confident result instead of an error.
 */
public class SelfConsistencyVerifier {

    private static final Logger log = LoggerFactory.getLogger(SelfConsistencyVerifier.class);

    private final GuardedDispatcher dispatcher;
    private final ConsistencySettings settings;
    private final LidmMetrics metrics;

    public SelfConsistencyVerifier(GuardedDispatcher dispatcher, ConsistencySettings settings, LidmMetrics metrics) {
        this.dispatcher = dispatcher;
        this.settings = settings;
        this.metrics = metrics;
    }

    public ConsistencySettings settings() {
        return settings;
    }

    /**
     * Samples {@code prompt} with the configured sample count and temperature.
     */
    public ConsistencyResult verify(String prompt, Tier tier, String phase, String subtaskId, ExecutionTrace trace) {
        return verify(prompt, tier, settings.samples(), settings.temperature(), phase, subtaskId, trace);
    }

    public ConsistencyResult verify(String prompt, Tier tier, int numSamples, double temperature,
                                    String phase, String subtaskId, ExecutionTrace trace) {
        var options = new GenerationOptions(settings.maxTokens(), temperature);
        var request = new DispatchRequest(tier, prompt, options, phase, subtaskId);
        DispatchResult<BatchGeneration> batch = dispatcher.generateBatch(request, numSamples, trace);
        if (!batch.succeeded() || batch.value() == null) {
            log.warn("Self-consistency sampling failed ({}): {}", batch.outcome(), batch.error());
            return ConsistencyResult.empty();
        }
        ConsistencyResult result = ConsistencyScorer.compute(batch.value().responses(), settings.threshold());
        log.info("Self-consistency on {}: {}/{} agree (p={}, confident={})", batch.tier(),
                result.agreementCount(), result.responses().size(),
                String.format("%.2f", result.pHat()), result.confident());
        if (metrics != null) {
            metrics.recordConsistency(result.pHat(), result.confident());
        }
        return result;
    }
}
