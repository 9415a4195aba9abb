package com.lidm.core.backend;

import com.lidm.core.metrics.LidmMetrics;
import com.lidm.core.model.Provider;
import com.lidm.core.model.Tier;
import com.lidm.core.resilience.CircuitBreakerConfig;
import com.lidm.core.resilience.CircuitBreakerRegistry;
import com.lidm.core.resilience.MutableClock;
import com.lidm.core.resilience.RateLimiterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * A real {@link GuardedDispatcher} over scripted backends, for tests above the
 * dispatch layer. Close it to stop the executor.
 */
public class DispatcherFixture implements AutoCloseable {

    public final ExecutorService executor = Executors.newCachedThreadPool();
    public final BackendPool pool = new BackendPool();
    public final MutableClock clock = new MutableClock();
    public final CircuitBreakerRegistry breakers =
            new CircuitBreakerRegistry(CircuitBreakerConfig.defaults(), clock, t -> {});
    public final RateLimiterRegistry limiters = new RateLimiterRegistry();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final LidmMetrics metrics = new LidmMetrics(meterRegistry);

    private final GuardedDispatcher dispatcher;

    public DispatcherFixture() {
        this(new DispatchSettings(Duration.ofSeconds(5), Duration.ofMillis(200)));
    }

    public DispatcherFixture(DispatchSettings settings) {
        this.dispatcher = new GuardedDispatcher(pool, breakers, limiters, executor, settings, metrics);
    }

    public ScriptedBackend register(Tier tier, ScriptedBackend backend) {
        pool.register(new BackendDescriptor(tier, backend.name(), "http://localhost/" + tier.key(),
                Provider.LOCAL, "test-model", List.of(), true), backend);
        return backend;
    }

    public GuardedDispatcher dispatcher() {
        return dispatcher;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
