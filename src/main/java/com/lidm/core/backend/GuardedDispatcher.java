package com.lidm.core.backend;

import com.lidm.core.logging.MdcContext;
import com.lidm.core.metrics.LidmMetrics;
import com.lidm.core.model.DispatchOutcome;
import com.lidm.core.model.ExecutionTrace;
import com.lidm.core.model.Tier;
import com.lidm.core.model.TraceEntry;
import com.lidm.core.resilience.Admission;
import com.lidm.core.resilience.CircuitBreaker;
import com.lidm.core.resilience.CircuitBreakerRegistry;
import com.lidm.core.resilience.RateLimiterRegistry;
import com.lidm.core.resilience.RejectionReason;
import com.lidm.core.resilience.TokenBucketRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * The only path from the engine to a backend.
 * <p>
 * Walks the pool's fallback chain for the requested tier. For each candidate the
 * tier's circuit breaker is asked first, then the provider's rate limiter (with a
 * bounded wait). A refusal by either moves straight to the next candidate. The
 * first candidate admitted by both is called under a timeout and its outcome is
 * recorded on the breaker exactly once; a timeout counts as a failure. Call
 * failures are returned to the caller, which owns the retry policy.
 * <p>
 * Every attempt, including refusals, is appended to the trace.
 */
public class GuardedDispatcher {

    private static final Logger log = LoggerFactory.getLogger(GuardedDispatcher.class);

    private final BackendPool pool;
    private final CircuitBreakerRegistry breakers;
    private final RateLimiterRegistry limiters;
    private final ExecutorService executor;
    private final DispatchSettings settings;
    private final LidmMetrics metrics;

    public GuardedDispatcher(BackendPool pool, CircuitBreakerRegistry breakers, RateLimiterRegistry limiters,
                             ExecutorService executor, DispatchSettings settings, LidmMetrics metrics) {
        this.pool = pool;
        this.breakers = breakers;
        this.limiters = limiters;
        this.executor = executor;
        this.settings = settings;
        this.metrics = metrics;
    }

    public DispatchResult<String> generate(DispatchRequest request, ExecutionTrace trace) {
        return dispatch(request, trace, backend -> backend.generate(request.prompt(), request.options()));
    }

    public DispatchResult<BatchGeneration> generateBatch(DispatchRequest request, int numSamples,
                                                         ExecutionTrace trace) {
        return dispatch(request, trace,
                backend -> backend.generateBatch(request.prompt(), numSamples, request.options()));
    }

    public BackendPool pool() {
        return pool;
    }

    private <T> DispatchResult<T> dispatch(DispatchRequest request, ExecutionTrace trace,
                                           Function<InferenceBackend, T> call) {
        List<BackendHandle> chain = pool.fallbackChain(request.tier());
        if (chain.isEmpty()) {
            String detail = "No live backend registered";
            log.error("{} (requested tier {}, phase {})", detail, request.tier(), request.phase());
            record(trace, request, null, null, 0L, DispatchOutcome.UNAVAILABLE, detail);
            return DispatchResult.failure(request.tier(), null, DispatchOutcome.UNAVAILABLE, detail, 0L);
        }

        DispatchResult<T> lastRejection = null;
        for (BackendHandle handle : chain) {
            Tier tier = handle.tier();
            CircuitBreaker breaker = breakers.get(tier.key());
            Admission admission = breaker.tryAcquire();
            if (admission.isRejected()) {
                String detail = String.format("circuit '%s' open, retry after %.1fs",
                        breaker.name(), admission.retryAfterSeconds());
                log.warn("Skipping {} backend '{}': {}", tier, handle.name(), detail);
                record(trace, request, tier, handle.name(), 0L, DispatchOutcome.CIRCUIT_OPEN, detail);
                recordRejection(tier, RejectionReason.CIRCUIT_OPEN);
                lastRejection = DispatchResult.failure(tier, handle.name(), DispatchOutcome.CIRCUIT_OPEN, detail, 0L);
                continue;
            }

            TokenBucketRateLimiter limiter = limiters.get(handle.descriptor().provider());
            Admission throttle = limiter.tryAcquire() || limiter.acquireOrWait(1, settings.maxRateLimitWait())
                    ? Admission.allow()
                    : limiter.admit(1);
            if (throttle.isRejected()) {
                breaker.releasePermission();
                String detail = String.format("provider '%s' rate limited, retry after %.1fs",
                        limiter.name(), throttle.retryAfterSeconds());
                log.warn("Skipping {} backend '{}': {}", tier, handle.name(), detail);
                record(trace, request, tier, handle.name(), 0L, DispatchOutcome.RATE_LIMITED, detail);
                recordRejection(tier, RejectionReason.RATE_LIMITED);
                lastRejection = DispatchResult.failure(tier, handle.name(), DispatchOutcome.RATE_LIMITED, detail, 0L);
                continue;
            }

            return invoke(request, trace, handle, breaker, call);
        }
        return lastRejection;
    }

    private <T> DispatchResult<T> invoke(DispatchRequest request, ExecutionTrace trace, BackendHandle handle,
                                         CircuitBreaker breaker, Function<InferenceBackend, T> call) {
        Tier tier = handle.tier();
        boolean fallback = tier != request.tier();
        long start = System.currentTimeMillis();
        Future<T> future;
        try {
            future = executor.submit(MdcContext.propagate(() -> call.apply(handle.backend())));
        } catch (RejectedExecutionException e) {
            breaker.releasePermission();
            String detail = "dispatch executor rejected the call";
            record(trace, request, tier, handle.name(), 0L, DispatchOutcome.UNAVAILABLE, detail);
            return DispatchResult.failure(tier, handle.name(), DispatchOutcome.UNAVAILABLE, detail, 0L);
        }
        try {
            T value = future.get(settings.callTimeout().toMillis(), TimeUnit.MILLISECONDS);
            long elapsed = System.currentTimeMillis() - start;
            breaker.recordSuccess();
            DispatchOutcome outcome = fallback ? DispatchOutcome.FALLBACK : DispatchOutcome.SUCCESS;
            String detail = fallback ? "requested " + request.tier().key() : null;
            record(trace, request, tier, handle.name(), elapsed, outcome, detail);
            recordDispatch(tier, outcome, elapsed);
            log.debug("{} call on {} backend '{}' succeeded in {}ms", request.phase(), tier, handle.name(), elapsed);
            return DispatchResult.success(value, tier, handle.name(), fallback, elapsed);
        } catch (TimeoutException e) {
            future.cancel(true);
            return failed(request, trace, handle, breaker, start,
                    "timed out after " + settings.callTimeout().toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return failed(request, trace, handle, breaker, start, describe(cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return failed(request, trace, handle, breaker, start, "interrupted");
        }
    }

    private <T> DispatchResult<T> failed(DispatchRequest request, ExecutionTrace trace, BackendHandle handle,
                                         CircuitBreaker breaker, long start, String detail) {
        long elapsed = System.currentTimeMillis() - start;
        breaker.recordFailure();
        log.warn("{} call on {} backend '{}' failed after {}ms: {}",
                request.phase(), handle.tier(), handle.name(), elapsed, detail);
        record(trace, request, handle.tier(), handle.name(), elapsed, DispatchOutcome.FAILURE, detail);
        recordDispatch(handle.tier(), DispatchOutcome.FAILURE, elapsed);
        return DispatchResult.failure(handle.tier(), handle.name(), DispatchOutcome.FAILURE, detail, elapsed);
    }

    private static void record(ExecutionTrace trace, DispatchRequest request, Tier tier, String backend,
                               long latencyMs, DispatchOutcome outcome, String detail) {
        if (trace != null) {
            trace.record(new TraceEntry(request.phase(), request.subtaskId(), tier, backend,
                    latencyMs, outcome, detail, Instant.now()));
        }
    }

    private void recordDispatch(Tier tier, DispatchOutcome outcome, long elapsed) {
        if (metrics != null) {
            metrics.recordDispatch(tier, outcome, elapsed);
        }
    }

    private void recordRejection(Tier tier, RejectionReason reason) {
        if (metrics != null) {
            metrics.recordRejection(tier, reason);
        }
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
    }
}
