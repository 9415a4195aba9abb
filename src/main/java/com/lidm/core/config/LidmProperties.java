package com.lidm.core.config;

import com.lidm.core.backend.DispatchSettings;
import com.lidm.core.backend.GenerationOptions;
import com.lidm.core.consistency.ConsistencySettings;
import com.lidm.core.engine.DelegationSettings;
import com.lidm.core.model.Provider;
import com.lidm.core.model.Tier;
import com.lidm.core.resilience.CircuitBreakerConfig;
import com.lidm.core.resilience.RateLimiterRegistry;
import com.lidm.core.scheduler.SchedulerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration bound from {@code lidm.*}.
 * <p>
 * Mutable for binding only; the {@code to*} methods turn each section into the
 * validated immutable settings record the engine consumes.
 */
@Component
@ConfigurationProperties(prefix = "lidm")
public class LidmProperties {

    /** Backends keyed by tier name (light, standard, heavy, ultra). */
    private Map<String, Backend> backends = new LinkedHashMap<>();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private RateLimit rateLimit = new RateLimit();
    private Dispatch dispatch = new Dispatch();
    private Scheduler scheduler = new Scheduler();
    private Consistency consistency = new Consistency();
    private Delegation delegation = new Delegation();
    private Routing routing = new Routing();

    public Map<String, Backend> getBackends() {
        return backends;
    }

    public void setBackends(Map<String, Backend> backends) {
        this.backends = backends;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public void setCircuitBreaker(CircuitBreaker circuitBreaker) {
        this.circuitBreaker = circuitBreaker;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public void setDispatch(Dispatch dispatch) {
        this.dispatch = dispatch;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Consistency getConsistency() {
        return consistency;
    }

    public void setConsistency(Consistency consistency) {
        this.consistency = consistency;
    }

    public Delegation getDelegation() {
        return delegation;
    }

    public void setDelegation(Delegation delegation) {
        this.delegation = delegation;
    }

    public Routing getRouting() {
        return routing;
    }

    public void setRouting(Routing routing) {
        this.routing = routing;
    }

    // ── Conversions ──────────────────────────────────────────────────

    public CircuitBreakerConfig toCircuitBreakerConfig() {
        return new CircuitBreakerConfig(circuitBreaker.failureThreshold, circuitBreaker.successThreshold,
                circuitBreaker.recoveryTimeout, circuitBreaker.backoffMultiplier, circuitBreaker.maxBackoff);
    }

    public Map<Provider, RateLimiterRegistry.Limit> toRateLimits() {
        var limits = new EnumMap<Provider, RateLimiterRegistry.Limit>(Provider.class);
        rateLimit.providers.forEach((key, limit) -> {
            Provider provider = Provider.parse(key);
            limits.put(provider, new RateLimiterRegistry.Limit(
                    limit.rate != null ? limit.rate : provider.defaultRate(),
                    limit.burst != null ? limit.burst : provider.defaultBurst()));
        });
        return limits;
    }

    public DispatchSettings toDispatchSettings() {
        return new DispatchSettings(dispatch.timeout, rateLimit.maxWait);
    }

    public SchedulerSettings toSchedulerSettings() {
        return new SchedulerSettings(scheduler.maxInFlight, scheduler.maxAttempts,
                new GenerationOptions(scheduler.maxTokens, scheduler.temperature));
    }

    public ConsistencySettings toConsistencySettings() {
        return new ConsistencySettings(consistency.threshold, consistency.samples, consistency.finalSamples,
                consistency.temperature, consistency.maxTokens);
    }

    public DelegationSettings toDelegationSettings() {
        return new DelegationSettings(delegation.complexityThreshold, delegation.maxSubtasks,
                delegation.synthesize, delegation.verifySubtasks, delegation.verifyFinal,
                delegation.verifyComplexityThreshold, delegation.escalateOnLowConfidence,
                Tier.parse(delegation.controlTier));
    }

    public Map<String, Tier> toCapabilityTiers() {
        var table = new LinkedHashMap<String, Tier>();
        routing.capabilities.forEach((capability, tier) -> table.put(capability, Tier.parse(tier)));
        return table;
    }

    // ── Sections ─────────────────────────────────────────────────────

    public static class Backend {

        private String name = "";
        private String endpoint = "";
        private String apiKey = "";
        private String model = "";
        private String provider = "local";
        private List<String> capabilities = new ArrayList<>();
        private boolean enabled = true;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public List<String> getCapabilities() {
            return capabilities;
        }

        public void setCapabilities(List<String> capabilities) {
            this.capabilities = capabilities;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class CircuitBreaker {

        private int failureThreshold = 3;
        private int successThreshold = 1;
        private Duration recoveryTimeout = Duration.ofSeconds(60);
        private double backoffMultiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(300);

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public int getSuccessThreshold() {
            return successThreshold;
        }

        public void setSuccessThreshold(int successThreshold) {
            this.successThreshold = successThreshold;
        }

        public Duration getRecoveryTimeout() {
            return recoveryTimeout;
        }

        public void setRecoveryTimeout(Duration recoveryTimeout) {
            this.recoveryTimeout = recoveryTimeout;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }
    }

    public static class RateLimit {

        /** Longest a dispatch waits for a token before moving to the next tier. */
        private Duration maxWait = Duration.ofSeconds(2);
        /** Per-provider overrides keyed by provider name; unset fields keep the provider default. */
        private Map<String, Limit> providers = new LinkedHashMap<>();

        public Duration getMaxWait() {
            return maxWait;
        }

        public void setMaxWait(Duration maxWait) {
            this.maxWait = maxWait;
        }

        public Map<String, Limit> getProviders() {
            return providers;
        }

        public void setProviders(Map<String, Limit> providers) {
            this.providers = providers;
        }
    }

    public static class Limit {

        private Double rate;
        private Integer burst;

        public Double getRate() {
            return rate;
        }

        public void setRate(Double rate) {
            this.rate = rate;
        }

        public Integer getBurst() {
            return burst;
        }

        public void setBurst(Integer burst) {
            this.burst = burst;
        }
    }

    public static class Dispatch {

        private Duration timeout = Duration.ofSeconds(120);
        private int sampleConcurrency = 5;
        /** Ping every backend while building the pool; when off, backends start out alive. */
        private boolean probeOnStartup = true;

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getSampleConcurrency() {
            return sampleConcurrency;
        }

        public void setSampleConcurrency(int sampleConcurrency) {
            this.sampleConcurrency = sampleConcurrency;
        }

        public boolean isProbeOnStartup() {
            return probeOnStartup;
        }

        public void setProbeOnStartup(boolean probeOnStartup) {
            this.probeOnStartup = probeOnStartup;
        }
    }

    public static class Scheduler {

        private int maxInFlight = 4;
        private int maxAttempts = 3;
        private int maxTokens = 1024;
        private double temperature = 0.7;

        public int getMaxInFlight() {
            return maxInFlight;
        }

        public void setMaxInFlight(int maxInFlight) {
            this.maxInFlight = maxInFlight;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }
    }

    public static class Consistency {

        private double threshold = 0.6;
        private int samples = 5;
        private int finalSamples = 3;
        private double temperature = 0.7;
        private int maxTokens = 1024;

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public int getSamples() {
            return samples;
        }

        public void setSamples(int samples) {
            this.samples = samples;
        }

        public int getFinalSamples() {
            return finalSamples;
        }

        public void setFinalSamples(int finalSamples) {
            this.finalSamples = finalSamples;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }
    }

    public static class Delegation {

        private double complexityThreshold = 0.5;
        private int maxSubtasks = 5;
        private boolean synthesize = true;
        private boolean verifySubtasks = true;
        private boolean verifyFinal = true;
        private double verifyComplexityThreshold = 0.8;
        private boolean escalateOnLowConfidence = true;
        private String controlTier = "standard";

        public double getComplexityThreshold() {
            return complexityThreshold;
        }

        public void setComplexityThreshold(double complexityThreshold) {
            this.complexityThreshold = complexityThreshold;
        }

        public int getMaxSubtasks() {
            return maxSubtasks;
        }

        public void setMaxSubtasks(int maxSubtasks) {
            this.maxSubtasks = maxSubtasks;
        }

        public boolean isSynthesize() {
            return synthesize;
        }

        public void setSynthesize(boolean synthesize) {
            this.synthesize = synthesize;
        }

        public boolean isVerifySubtasks() {
            return verifySubtasks;
        }

        public void setVerifySubtasks(boolean verifySubtasks) {
            this.verifySubtasks = verifySubtasks;
        }

        public boolean isVerifyFinal() {
            return verifyFinal;
        }

        public void setVerifyFinal(boolean verifyFinal) {
            this.verifyFinal = verifyFinal;
        }

        public double getVerifyComplexityThreshold() {
            return verifyComplexityThreshold;
        }

        public void setVerifyComplexityThreshold(double verifyComplexityThreshold) {
            this.verifyComplexityThreshold = verifyComplexityThreshold;
        }

        public boolean isEscalateOnLowConfidence() {
            return escalateOnLowConfidence;
        }

        public void setEscalateOnLowConfidence(boolean escalateOnLowConfidence) {
            this.escalateOnLowConfidence = escalateOnLowConfidence;
        }

        public String getControlTier() {
            return controlTier;
        }

        public void setControlTier(String controlTier) {
            this.controlTier = controlTier;
        }
    }

    public static class Routing {

        /** Capability to tier overrides merged over the built-in table. */
        private Map<String, String> capabilities = new LinkedHashMap<>();

        public Map<String, String> getCapabilities() {
            return capabilities;
        }

        public void setCapabilities(Map<String, String> capabilities) {
            this.capabilities = capabilities;
        }
    }
}
