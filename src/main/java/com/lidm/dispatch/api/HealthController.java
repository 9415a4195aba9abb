package com.lidm.dispatch.api;

import com.lidm.core.health.HealthCheckService;
import com.lidm.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for backend, circuit and rate-limit status.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health: System health check.
     * Returns 200 unless a component is DOWN, then 503. Open circuits report DEGRADED.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> result = new LinkedHashMap<>();

        if (healthCheckService == null) {
            result.put("status", "DOWN");
            result.put("components", Map.of());
            return ResponseEntity.status(503).body(result);
        }

        var checks = healthCheckService.checkAll();
        boolean anyDown = false;
        boolean anyDegraded = false;

        Map<String, Object> components = new LinkedHashMap<>();
        for (var check : checks) {
            Map<String, Object> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                componentInfo.put("metadata", check.metadata());
            }
            components.put(check.component(), componentInfo);

            if (check.status() == HealthStatus.Status.DOWN) {
                anyDown = true;
            } else if (check.status() == HealthStatus.Status.DEGRADED) {
                anyDegraded = true;
            }
        }

        result.put("status", anyDown ? "DOWN" : anyDegraded ? "DEGRADED" : "UP");
        result.put("components", components);
        result.put("circuit_breakers", healthCheckService.circuitSnapshots());
        result.put("rate_limits", healthCheckService.rateLimitSnapshots());

        return anyDown ? ResponseEntity.status(503).body(result)
                       : ResponseEntity.ok(result);
    }

    /**
     * POST /api/v1/health/circuits/reset: Close every circuit breaker.
     */
    @PostMapping("/circuits/reset")
    public ResponseEntity<Map<String, Object>> resetCircuits() {
        if (healthCheckService == null) {
            return ResponseEntity.status(503).body(Map.of("error", "health service not available"));
        }
        healthCheckService.resetCircuits();
        return ResponseEntity.ok(Map.of("reset", true, "circuit_breakers",
                List.copyOf(healthCheckService.circuitSnapshots())));
    }
}
