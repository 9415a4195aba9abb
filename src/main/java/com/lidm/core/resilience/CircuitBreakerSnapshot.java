package com.lidm.core.resilience;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time copy of a breaker's state and lifetime counters.
 */
public record CircuitBreakerSnapshot(
    String name,
    CircuitState state,
    int consecutiveFailures,
    int consecutiveSuccesses,
    Instant lastFailureTime,
    Duration currentBackoff,
    long totalCalls,
    long successfulCalls,
    long failedCalls,
    long rejectedCalls,
    long stateChanges
) {}
