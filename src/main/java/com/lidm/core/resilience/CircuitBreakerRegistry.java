package com.lidm.core.resilience;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Process-wide set of circuit breakers, created on first use and sharing one config.
 */
public class CircuitBreakerRegistry {

    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final Consumer<CircuitTransition> transitionListener;

    public CircuitBreakerRegistry(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC(), transition -> {});
    }

    public CircuitBreakerRegistry(CircuitBreakerConfig config, Clock clock,
                                  Consumer<CircuitTransition> transitionListener) {
        this.config = config;
        this.clock = clock;
        this.transitionListener = transitionListener;
    }

    public CircuitBreaker get(String name) {
        return breakers.computeIfAbsent(name, n -> new CircuitBreaker(n, config, clock, transitionListener));
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    public List<CircuitBreakerSnapshot> snapshots() {
        return breakers.values().stream()
                .map(CircuitBreaker::snapshot)
                .sorted(Comparator.comparing(CircuitBreakerSnapshot::name))
                .toList();
    }

    /** @return false if no breaker with that name exists */
    public boolean reset(String name) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }

    public CircuitBreakerConfig config() {
        return config;
    }
}
