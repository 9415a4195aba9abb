package com.lidm.core.resilience;

import java.time.Duration;
import java.time.Instant;

/**
 * A state change of a named circuit breaker.
 *
 * @param breaker        breaker name
 * @param from           previous state
 * @param to             new state
 * @param currentBackoff backoff in force after the change
 * @param timestamp      when the change happened
 */
public record CircuitTransition(
    String breaker,
    CircuitState from,
    CircuitState to,
    Duration currentBackoff,
    Instant timestamp
) {}
