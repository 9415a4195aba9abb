package com.lidm.core.health;

import com.lidm.core.backend.BackendHandle;
import com.lidm.core.backend.BackendPool;
import com.lidm.core.graph.DelegationGraph;
import com.lidm.core.resilience.CircuitBreakerRegistry;
import com.lidm.core.resilience.CircuitBreakerSnapshot;
import com.lidm.core.resilience.CircuitState;
import com.lidm.core.resilience.RateLimitSnapshot;
import com.lidm.core.resilience.RateLimiterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the component checks behind {@code lidm health} and {@code GET /api/v1/health}.
 * <p>
 * Backend checks ping each registered backend and write the result back into
 * the {@link BackendPool}, so a backend that recovers is routed to again.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DelegationGraph delegationGraph;
    private final BackendPool backendPool;
    private final CircuitBreakerRegistry circuitBreakers;
    private final RateLimiterRegistry rateLimiters;

    public HealthCheckService(
            @Autowired(required = false) DelegationGraph delegationGraph,
            BackendPool backendPool,
            CircuitBreakerRegistry circuitBreakers,
            RateLimiterRegistry rateLimiters) {
        this.delegationGraph = delegationGraph;
        this.backendPool = backendPool;
        this.circuitBreakers = circuitBreakers;
        this.rateLimiters = rateLimiters;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGraph());
        results.addAll(checkBackends());
        results.add(checkCircuits());
        return results;
    }

    public List<CircuitBreakerSnapshot> circuitSnapshots() {
        return circuitBreakers.snapshots();
    }

    public List<RateLimitSnapshot> rateLimitSnapshots() {
        return rateLimiters.snapshots();
    }

    /** Closes every breaker, e.g. after an operator has fixed a backend. */
    public void resetCircuits() {
        log.info("Resetting all circuit breakers");
        circuitBreakers.resetAll();
    }

    private HealthStatus checkGraph() {
        if (delegationGraph != null) {
            return new HealthStatus("graph", HealthStatus.Status.UP,
                    "Graph compiled and available", Map.of());
        }
        return new HealthStatus("graph", HealthStatus.Status.DOWN,
                "Graph not available", Map.of());
    }

    List<HealthStatus> checkBackends() {
        if (backendPool.size() == 0) {
            return List.of(new HealthStatus("backends", HealthStatus.Status.DOWN,
                    "No backends configured", Map.of()));
        }
        var results = new ArrayList<HealthStatus>();
        for (BackendHandle handle : backendPool.handles()) {
            results.add(checkBackend(handle));
        }
        return results;
    }

    private HealthStatus checkBackend(BackendHandle handle) {
        String component = "backend:" + handle.tier().key();
        var metadata = new LinkedHashMap<String, String>();
        metadata.put("name", handle.name());
        metadata.put("endpoint", String.valueOf(handle.descriptor().endpoint()));
        metadata.put("provider", handle.descriptor().provider().key());

        boolean alive;
        try {
            alive = handle.backend().ping();
        } catch (Exception e) {
            log.warn("Health ping of backend '{}' threw: {}", handle.name(), e.getMessage());
            alive = false;
        }
        backendPool.markAlive(handle.tier(), alive);

        if (alive) {
            return new HealthStatus(component, HealthStatus.Status.UP,
                    handle.name() + " reachable", metadata);
        }
        return new HealthStatus(component, HealthStatus.Status.DOWN,
                handle.name() + " unreachable", metadata);
    }

    private HealthStatus checkCircuits() {
        var metadata = new LinkedHashMap<String, String>();
        int open = 0;
        for (CircuitBreakerSnapshot snapshot : circuitBreakers.snapshots()) {
            metadata.put(snapshot.name(), snapshot.state().name());
            if (snapshot.state() != CircuitState.CLOSED) {
                open++;
            }
        }
        if (open == 0) {
            return new HealthStatus("circuits", HealthStatus.Status.UP,
                    "All circuits closed", metadata);
        }
        return new HealthStatus("circuits", HealthStatus.Status.DEGRADED,
                open + " circuit(s) open or half-open", metadata);
    }
}
