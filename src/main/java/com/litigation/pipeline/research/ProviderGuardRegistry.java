package com.litigation.pipeline.research;

import com.litigation.pipeline.resilience.CircuitBreaker;
import com.litigation.pipeline.resilience.CircuitBreakerConfig;
import com.litigation.pipeline.resilience.RateLimitConfig;
import com.litigation.pipeline.resilience.TokenBucketRateLimiter;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * One rate limiter and one circuit breaker per provider name, shared by every session
 * and every research layer holding this registry.
 */
public class ProviderGuardRegistry {

    /**
     * Guards of a single provider.
     */
    public record ProviderGuard(String providerName, TokenBucketRateLimiter rateLimiter,
                                CircuitBreaker circuitBreaker) {
    }

    private final RateLimitConfig defaultRateLimit;
    private final CircuitBreakerConfig circuitBreakerConfig;
    private final LongSupplier breakerTicker;
    private final Map<String, RateLimitConfig> rateLimits = new ConcurrentHashMap<>();
    private final Map<String, ProviderGuard> guards = new ConcurrentHashMap<>();

    public ProviderGuardRegistry() {
        this(RateLimitConfig.defaults(), CircuitBreakerConfig.defaults());
    }

    public ProviderGuardRegistry(RateLimitConfig defaultRateLimit, CircuitBreakerConfig circuitBreakerConfig) {
        this(defaultRateLimit, circuitBreakerConfig, System::nanoTime);
    }

    public ProviderGuardRegistry(RateLimitConfig defaultRateLimit, CircuitBreakerConfig circuitBreakerConfig,
                                 LongSupplier breakerTicker) {
        this.defaultRateLimit = Objects.requireNonNull(defaultRateLimit);
        this.circuitBreakerConfig = Objects.requireNonNull(circuitBreakerConfig);
        this.breakerTicker = Objects.requireNonNull(breakerTicker);
    }

    /**
     * Sets the rate limit of one provider. Must be called before the provider's first use.
     */
    public ProviderGuardRegistry withRateLimit(String providerName, RateLimitConfig config) {
        if (guards.containsKey(providerName)) {
            throw new IllegalStateException("Provider " + providerName + " is already in use");
        }
        rateLimits.put(providerName, config);
        return this;
    }

    public ProviderGuard guardFor(String providerName) {
        return guards.computeIfAbsent(providerName, name -> new ProviderGuard(name,
                new TokenBucketRateLimiter(name, rateLimits.getOrDefault(name, defaultRateLimit)),
                new CircuitBreaker(name, circuitBreakerConfig, breakerTicker)));
    }

    public Map<String, ProviderGuard> getGuards() {
        return Map.copyOf(guards);
    }
}
