package com.lidm.core.resilience;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable circuit breaker tuning, validated on construction.
 *
 * @param failureThreshold  consecutive failures that open a closed circuit
 * @param successThreshold  consecutive half-open successes that close the circuit
 * @param recoveryTimeout   initial backoff, restored whenever the circuit closes
 * @param backoffMultiplier factor applied to the backoff each time the circuit opens
 * @param maxBackoff        upper bound for the backoff
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    int successThreshold,
    Duration recoveryTimeout,
    double backoffMultiplier,
    Duration maxBackoff
) {

    public CircuitBreakerConfig {
        Objects.requireNonNull(recoveryTimeout, "recoveryTimeout");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got " + failureThreshold);
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1, got " + successThreshold);
        }
        if (recoveryTimeout.isZero() || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must be positive, got " + recoveryTimeout);
        }
        if (backoffMultiplier < 1.0 || Double.isNaN(backoffMultiplier)) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0, got " + backoffMultiplier);
        }
        if (maxBackoff.compareTo(recoveryTimeout) < 0) {
            throw new IllegalArgumentException("maxBackoff " + maxBackoff
                    + " must not be shorter than recoveryTimeout " + recoveryTimeout);
        }
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(3, 1, Duration.ofSeconds(60), 2.0, Duration.ofSeconds(300));
    }
}
