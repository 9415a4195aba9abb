package com.lidm.core.backend;

import java.time.Duration;
import java.util.Objects;

/**
 * Limits applied to every guarded backend call.
 *
 * @param callTimeout      wall-clock cap on a single backend call
 * @param maxRateLimitWait longest a call may wait for a rate-limit token before falling back
 */
public record DispatchSettings(Duration callTimeout, Duration maxRateLimitWait) {

    public DispatchSettings {
        Objects.requireNonNull(callTimeout, "callTimeout");
        Objects.requireNonNull(maxRateLimitWait, "maxRateLimitWait");
        if (callTimeout.isZero() || callTimeout.isNegative()) {
            throw new IllegalArgumentException("callTimeout must be positive, got " + callTimeout);
        }
        if (maxRateLimitWait.isNegative()) {
            throw new IllegalArgumentException("maxRateLimitWait must not be negative, got " + maxRateLimitWait);
        }
    }

    public static DispatchSettings defaults() {
        return new DispatchSettings(Duration.ofSeconds(120), Duration.ofSeconds(2));
    }
}
