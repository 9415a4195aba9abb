package com.lidm.core.metrics;

import com.lidm.core.model.DecompositionStrategy;
import com.lidm.core.model.DispatchOutcome;
import com.lidm.core.model.QueryStatus;
import com.lidm.core.model.Tier;
import com.lidm.core.resilience.CircuitState;
import com.lidm.core.resilience.RejectionReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for query delegation.
 */
@Service
public class LidmMetrics {

    private final MeterRegistry registry;

    public LidmMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDispatch(Tier tier, DispatchOutcome outcome, long ms) {
        Timer.builder("lidm.dispatch.duration")
                .description("Backend call latency by tier and outcome")
                .tag("tier", tier.key())
                .tag("outcome", outcome.name().toLowerCase())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a call refused before reaching the backend.
     *
     * @param reason circuit open or rate limited
     */
    public void recordRejection(Tier tier, RejectionReason reason) {
        Counter.builder("lidm.dispatch.rejections")
                .description("Calls refused by a circuit breaker or rate limiter")
                .tag("tier", tier.key())
                .tag("reason", reason.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void recordQueryResult(QueryStatus status, DecompositionStrategy strategy) {
        Counter.builder("lidm.queries.total")
                .tag("status", status.name().toLowerCase())
                .tag("strategy", strategy == null ? "none" : strategy.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void recordQueryDuration(long ms) {
        Timer.builder("lidm.query.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordComplexity(double complexity) {
        DistributionSummary.builder("lidm.classification.complexity")
                .register(registry)
                .record(complexity);
    }

    public void recordSubtaskCount(int count) {
        DistributionSummary.builder("lidm.decomposition.subtasks")
                .description("Subtasks per decomposed query")
                .register(registry)
                .record(count);
    }

    public void recordSubtaskResult(boolean completed, int attempts) {
        Counter.builder("lidm.subtasks.total")
                .tag("result", completed ? "completed" : "failed")
                .register(registry)
                .increment();
        DistributionSummary.builder("lidm.subtasks.attempts")
                .register(registry)
                .record(attempts);
    }

    public void recordConsistency(double pHat, boolean confident) {
        DistributionSummary.builder("lidm.consistency.p_hat")
                .description("Self-consistency agreement ratio")
                .register(registry)
                .record(pHat);
        Counter.builder("lidm.consistency.verifications")
                .tag("confident", String.valueOf(confident))
                .register(registry)
                .increment();
    }

    public void recordCircuitTransition(String breaker, CircuitState to) {
        Counter.builder("lidm.circuit.transitions")
                .tag("breaker", breaker)
                .tag("to", to.name().toLowerCase())
                .register(registry)
                .increment();
    }
}
