package com.lidm.core.config;

import com.lidm.core.backend.DispatchSettings;
import com.lidm.core.consistency.ConsistencySettings;
import com.lidm.core.engine.DelegationSettings;
import com.lidm.core.model.Provider;
import com.lidm.core.model.Tier;
import com.lidm.core.resilience.CircuitBreakerConfig;
import com.lidm.core.resilience.RateLimiterRegistry;
import com.lidm.core.scheduler.SchedulerSettings;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LidmPropertiesTest {

    @Test
    void defaultsMatchEngineDefaults() {
        var props = new LidmProperties();

        assertEquals(CircuitBreakerConfig.defaults(), props.toCircuitBreakerConfig());
        assertEquals(DispatchSettings.defaults(), props.toDispatchSettings());
        assertEquals(SchedulerSettings.defaults(), props.toSchedulerSettings());
        assertEquals(ConsistencySettings.defaults(), props.toConsistencySettings());
        assertEquals(DelegationSettings.defaults(), props.toDelegationSettings());
        assertTrue(props.toRateLimits().isEmpty());
        assertTrue(props.toCapabilityTiers().isEmpty());
    }

    @Test
    void backendDefaults() {
        var backend = new LidmProperties.Backend();
        assertEquals("local", backend.getProvider());
        assertTrue(backend.isEnabled());
        assertTrue(backend.getCapabilities().isEmpty());
        assertTrue(new LidmProperties().getDispatch().isProbeOnStartup());
        assertEquals(5, new LidmProperties().getDispatch().getSampleConcurrency());
    }

    @Test
    void circuitBreakerSectionIsCarriedOver() {
        var props = new LidmProperties();
        props.getCircuitBreaker().setFailureThreshold(5);
        props.getCircuitBreaker().setSuccessThreshold(2);
        props.getCircuitBreaker().setRecoveryTimeout(Duration.ofSeconds(10));
        props.getCircuitBreaker().setBackoffMultiplier(3.0);
        props.getCircuitBreaker().setMaxBackoff(Duration.ofSeconds(90));

        assertEquals(new CircuitBreakerConfig(5, 2, Duration.ofSeconds(10), 3.0, Duration.ofSeconds(90)),
                props.toCircuitBreakerConfig());
    }

    @Test
    void invalidCircuitBreakerSectionIsRejected() {
        var props = new LidmProperties();
        props.getCircuitBreaker().setFailureThreshold(0);

        assertThrows(IllegalArgumentException.class, props::toCircuitBreakerConfig);
    }

    @Test
    void rateLimitsFillUnsetFieldsFromProviderDefaults() {
        var props = new LidmProperties();
        var openai = new LidmProperties.Limit();
        openai.setRate(10.0);
        var anthropic = new LidmProperties.Limit();
        anthropic.setBurst(5);
        var providers = new LinkedHashMap<String, LidmProperties.Limit>();
        providers.put("openai", openai);
        providers.put("Anthropic", anthropic);
        props.getRateLimit().setProviders(providers);

        Map<Provider, RateLimiterRegistry.Limit> limits = props.toRateLimits();

        assertEquals(new RateLimiterRegistry.Limit(10.0, 100), limits.get(Provider.OPENAI));
        assertEquals(new RateLimiterRegistry.Limit(40.0, 5), limits.get(Provider.ANTHROPIC));
        assertFalse(limits.containsKey(Provider.LOCAL));
    }

    @Test
    void unknownRateLimitProviderIsRejected() {
        var props = new LidmProperties();
        props.getRateLimit().setProviders(Map.of("acme", new LidmProperties.Limit()));

        assertThrows(IllegalArgumentException.class, props::toRateLimits);
    }

    @Test
    void dispatchSettingsCombineTimeoutAndRateLimitWait() {
        var props = new LidmProperties();
        props.getDispatch().setTimeout(Duration.ofSeconds(30));
        props.getRateLimit().setMaxWait(Duration.ofMillis(500));

        assertEquals(new DispatchSettings(Duration.ofSeconds(30), Duration.ofMillis(500)), props.toDispatchSettings());
    }

    @Test
    void schedulerAndConsistencySections() {
        var props = new LidmProperties();
        props.getScheduler().setMaxInFlight(8);
        props.getScheduler().setMaxAttempts(2);
        props.getScheduler().setMaxTokens(256);
        props.getScheduler().setTemperature(0.2);
        props.getConsistency().setThreshold(0.75);
        props.getConsistency().setSamples(7);

        SchedulerSettings scheduler = props.toSchedulerSettings();
        assertEquals(8, scheduler.maxInFlight());
        assertEquals(2, scheduler.maxAttempts());
        assertEquals(256, scheduler.options().maxTokens());
        assertEquals(0.2, scheduler.options().temperature());

        ConsistencySettings consistency = props.toConsistencySettings();
        assertEquals(0.75, consistency.threshold());
        assertEquals(7, consistency.samples());
        assertEquals(3, consistency.finalSamples());
    }

    @Test
    void delegationControlTierIsParsed() {
        var props = new LidmProperties();
        props.getDelegation().setControlTier("Light");
        props.getDelegation().setVerifyFinal(false);
        props.getDelegation().setMaxSubtasks(3);

        DelegationSettings settings = props.toDelegationSettings();

        assertEquals(Tier.LIGHT, settings.controlTier());
        assertFalse(settings.verifyFinal());
        assertEquals(3, settings.maxSubtasks());
    }

    @Test
    void unknownControlTierIsRejected() {
        var props = new LidmProperties();
        props.getDelegation().setControlTier("gigantic");

        assertThrows(IllegalArgumentException.class, props::toDelegationSettings);
    }

    @Test
    void capabilityTiersAreParsedInOrder() {
        var props = new LidmProperties();
        var capabilities = new LinkedHashMap<String, String>();
        capabilities.put("translation", "light");
        capabilities.put("legal", "ULTRA");
        props.getRouting().setCapabilities(capabilities);

        assertEquals(Map.of("translation", Tier.LIGHT, "legal", Tier.ULTRA), props.toCapabilityTiers());
        assertEquals("translation", props.toCapabilityTiers().keySet().iterator().next());
    }
}
