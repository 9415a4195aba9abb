package com.lidm.core.resilience;

import com.lidm.core.model.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One token bucket per provider, created lazily from the provider's defaults
 * unless a limit was configured for it.
 */
public class RateLimiterRegistry {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterRegistry.class);

    /**
     * Configured bucket parameters for a provider.
     */
    public record Limit(double rate, int burst) {
        public Limit {
            if (!(rate > 0.0)) {
                throw new IllegalArgumentException("rate must be positive, got " + rate);
            }
            if (burst < 1) {
                throw new IllegalArgumentException("burst must be >= 1, got " + burst);
            }
        }
    }

    private final ConcurrentHashMap<Provider, TokenBucketRateLimiter> limiters = new ConcurrentHashMap<>();
    private final Map<Provider, Limit> overrides;
    private final Clock clock;

    public RateLimiterRegistry() {
        this(Map.of(), Clock.systemUTC());
    }

    public RateLimiterRegistry(Map<Provider, Limit> overrides, Clock clock) {
        this.overrides = overrides.isEmpty() ? Map.of() : new EnumMap<>(overrides);
        this.clock = clock;
    }

    public TokenBucketRateLimiter get(Provider provider) {
        return limiters.computeIfAbsent(provider, this::create);
    }

    public List<RateLimitSnapshot> snapshots() {
        return limiters.values().stream()
                .map(TokenBucketRateLimiter::snapshot)
                .sorted(Comparator.comparing(RateLimitSnapshot::name))
                .toList();
    }

    public void resetAll() {
        limiters.values().forEach(TokenBucketRateLimiter::reset);
    }

    private TokenBucketRateLimiter create(Provider provider) {
        Limit limit = overrides.getOrDefault(provider, new Limit(provider.defaultRate(), provider.defaultBurst()));
        log.debug("Creating rate limiter for provider {} (rate={}/s, burst={})",
                provider.key(), limit.rate(), limit.burst());
        return new TokenBucketRateLimiter(provider.key(), limit.rate(), limit.burst(), clock);
    }
}
