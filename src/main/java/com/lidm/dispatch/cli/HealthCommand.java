package com.lidm.dispatch.cli;

import com.lidm.core.health.HealthCheckService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: lidm health
 * <p>
 * Pings every backend, reports circuit states and, with {@code --verbose},
 * the rate-limit buckets. Exit code 1 when any component is not UP.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check backend and circuit health")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = {"--verbose", "-v"}, description = "Also show circuit breaker and rate limit details")
    private boolean verbose;

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        var checks = healthCheckService.checkAll();
        boolean allUp = true;

        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
                case DEGRADED -> {
                    ConsoleOutput.warn(label);
                    allUp = false;
                }
            }
        }

        if (verbose) {
            healthCheckService.circuitSnapshots().forEach(ConsoleOutput::circuit);
            healthCheckService.rateLimitSnapshots().forEach(ConsoleOutput::rateLimit);
        }

        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: all systems operational");
            return 0;
        }
        ConsoleOutput.error("Overall: one or more components degraded or down");
        return 1;
    }
}
