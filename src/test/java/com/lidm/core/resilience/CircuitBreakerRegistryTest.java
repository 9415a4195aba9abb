package com.lidm.core.resilience;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerRegistryTest {

    @Test
    @DisplayName("returns one breaker per name")
    void oneBreakerPerName() {
        var registry = new CircuitBreakerRegistry(CircuitBreakerConfig.defaults());

        assertSame(registry.get("heavy"), registry.get("heavy"));
        assertNotSame(registry.get("heavy"), registry.get("light"));
        assertTrue(registry.find("ultra").isEmpty());
    }

    @Test
    @DisplayName("snapshots are sorted by name")
    void snapshotsSorted() {
        var registry = new CircuitBreakerRegistry(CircuitBreakerConfig.defaults());
        registry.get("standard");
        registry.get("heavy");
        registry.get("light");

        assertEquals(List.of("heavy", "light", "standard"),
                registry.snapshots().stream().map(CircuitBreakerSnapshot::name).toList());
    }

    @Test
    @DisplayName("shares the transition listener across breakers and resets by name")
    void listenerAndReset() {
        var transitions = new ArrayList<CircuitTransition>();
        var registry = new CircuitBreakerRegistry(CircuitBreakerConfig.defaults(), new MutableClock(),
                transitions::add);
        CircuitBreaker heavy = registry.get("heavy");
        for (int i = 0; i < 3; i++) {
            heavy.tryAcquire();
            heavy.recordFailure();
        }
        assertEquals(1, transitions.size());
        assertEquals("heavy", transitions.get(0).breaker());

        assertTrue(registry.reset("heavy"));
        assertFalse(registry.reset("missing"));
        assertEquals(CircuitState.CLOSED, heavy.state());
    }
}
