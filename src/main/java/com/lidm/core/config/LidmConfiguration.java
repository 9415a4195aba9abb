package com.lidm.core.config;

import com.lidm.core.backend.BackendDescriptor;
import com.lidm.core.backend.BackendPool;
import com.lidm.core.backend.GuardedDispatcher;
import com.lidm.core.backend.InferenceBackend;
import com.lidm.core.backend.OpenAiCompatibleBackend;
import com.lidm.core.consistency.ConsistencySettings;
import com.lidm.core.consistency.SelfConsistencyVerifier;
import com.lidm.core.engine.DelegationSettings;
import com.lidm.core.events.EventBus;
import com.lidm.core.events.LidmEvent;
import com.lidm.core.metrics.LidmMetrics;
import com.lidm.core.model.Provider;
import com.lidm.core.model.Tier;
import com.lidm.core.resilience.CircuitBreakerRegistry;
import com.lidm.core.resilience.RateLimiterRegistry;
import com.lidm.core.scheduler.CapabilityTierResolver;
import com.lidm.core.scheduler.SubtaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Assembles the engine from {@link LidmProperties}: the shared dispatch
 * executor, the resilience registries, the backend pool and the components
 * that sit on top of them.
 */
@Configuration
public class LidmConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LidmConfiguration.class);

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService lidmDispatchExecutor() {
        var counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "lidm-dispatch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(LidmProperties properties, EventBus eventBus,
                                                         LidmMetrics metrics) {
        return new CircuitBreakerRegistry(properties.toCircuitBreakerConfig(), Clock.systemUTC(), transition -> {
            metrics.recordCircuitTransition(transition.breaker(), transition.to());
            eventBus.publish(LidmEvent.of("circuit.transition", null, null, Map.of(
                    "breaker", transition.breaker(),
                    "from", transition.from().name(),
                    "to", transition.to().name(),
                    "backoffSeconds", transition.currentBackoff().toSeconds())));
        });
    }

    @Bean
    public RateLimiterRegistry rateLimiterRegistry(LidmProperties properties) {
        return new RateLimiterRegistry(properties.toRateLimits(), Clock.systemUTC());
    }

    /**
     * Registers one OpenAI-compatible backend per configured tier. Entries whose
     * key is not a tier, that are disabled, or that have no endpoint are skipped.
     */
    @Bean
    public BackendPool backendPool(LidmProperties properties, ExecutorService lidmDispatchExecutor) {
        var pool = new BackendPool();
        var dispatch = properties.getDispatch();
        properties.getBackends().forEach((key, config) -> {
            Optional<Tier> tier = Tier.tryParse(key);
            if (tier.isEmpty()) {
                log.warn("Ignoring backend '{}': not a tier (light, standard, heavy, ultra)", key);
                return;
            }
            if (!config.isEnabled() || config.getEndpoint() == null || config.getEndpoint().isBlank()) {
                log.info("Backend for tier {} is disabled or has no endpoint", tier.get());
                return;
            }
            String name = config.getName() == null || config.getName().isBlank() ? key : config.getName();
            InferenceBackend backend = new OpenAiCompatibleBackend(name, config.getEndpoint(),
                    config.getApiKey(), config.getModel(), lidmDispatchExecutor, dispatch.getSampleConcurrency());
            boolean alive = !dispatch.isProbeOnStartup() || probe(name, backend);
            pool.register(new BackendDescriptor(tier.get(), name, config.getEndpoint(),
                    Provider.parse(config.getProvider()), config.getModel(), config.getCapabilities(), alive), backend);
        });
        if (pool.size() == 0) {
            log.warn("No backends configured under lidm.backends; every query will fail");
        }
        return pool;
    }

    @Bean
    public CapabilityTierResolver capabilityTierResolver(LidmProperties properties) {
        return new CapabilityTierResolver(properties.toCapabilityTiers());
    }

    @Bean
    public GuardedDispatcher guardedDispatcher(BackendPool backendPool, CircuitBreakerRegistry circuitBreakerRegistry,
                                               RateLimiterRegistry rateLimiterRegistry,
                                               ExecutorService lidmDispatchExecutor,
                                               LidmProperties properties, LidmMetrics metrics) {
        return new GuardedDispatcher(backendPool, circuitBreakerRegistry, rateLimiterRegistry,
                lidmDispatchExecutor, properties.toDispatchSettings(), metrics);
    }

    @Bean
    public ConsistencySettings consistencySettings(LidmProperties properties) {
        return properties.toConsistencySettings();
    }

    @Bean
    public DelegationSettings delegationSettings(LidmProperties properties) {
        return properties.toDelegationSettings();
    }

    @Bean
    public SelfConsistencyVerifier selfConsistencyVerifier(GuardedDispatcher guardedDispatcher,
                                                           ConsistencySettings consistencySettings,
                                                           LidmMetrics metrics) {
        return new SelfConsistencyVerifier(guardedDispatcher, consistencySettings, metrics);
    }

    @Bean
    public SubtaskScheduler subtaskScheduler(GuardedDispatcher guardedDispatcher,
                                             CapabilityTierResolver capabilityTierResolver,
                                             ExecutorService lidmDispatchExecutor,
                                             LidmProperties properties, EventBus eventBus, LidmMetrics metrics) {
        return new SubtaskScheduler(guardedDispatcher, capabilityTierResolver, lidmDispatchExecutor,
                properties.toSchedulerSettings(), eventBus, metrics);
    }

    private static boolean probe(String name, InferenceBackend backend) {
        boolean alive = backend.ping();
        if (!alive) {
            log.warn("Backend '{}' did not answer its liveness ping; registered as down", name);
        }
        return alive;
    }
}
