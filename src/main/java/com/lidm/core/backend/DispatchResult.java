package com.lidm.core.backend;

import com.lidm.core.model.DispatchOutcome;
import com.lidm.core.model.Tier;

import java.util.Optional;

/**
 * Outcome of a guarded dispatch. Backend trouble is reported here rather than thrown.
 *
 * @param value     backend output, null unless the dispatch succeeded
 * @param tier      tier that served the call, or the last tier tried
 * @param backend   backend name that served the call, or the last one tried
 * @param outcome   final outcome
 * @param error     failure or rejection detail, null on success
 * @param latencyMs time spent in the serving (or last) attempt
 */
public record DispatchResult<T>(
    T value,
    Tier tier,
    String backend,
    DispatchOutcome outcome,
    String error,
    long latencyMs
) {

    public static <T> DispatchResult<T> success(T value, Tier tier, String backend,
                                                boolean fallback, long latencyMs) {
        return new DispatchResult<>(value, tier, backend,
                fallback ? DispatchOutcome.FALLBACK : DispatchOutcome.SUCCESS, null, latencyMs);
    }

    public static <T> DispatchResult<T> failure(Tier tier, String backend, DispatchOutcome outcome,
                                                String error, long latencyMs) {
        return new DispatchResult<>(null, tier, backend, outcome, error, latencyMs);
    }

    public boolean succeeded() {
        return outcome.succeeded();
    }

    public Optional<T> valueIfSucceeded() {
        return succeeded() ? Optional.ofNullable(value) : Optional.empty();
    }
}
