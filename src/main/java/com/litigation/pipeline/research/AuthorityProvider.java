package com.litigation.pipeline.research;

/**
 * External legal research source. One implementation per provider.
 *
 * <p>Implementations report a rate-limited or failed search through the returned
 * {@link ProviderResponse} rather than by throwing, and should report their remaining
 * quota on success. Thrown exceptions are treated as provider errors.</p>
 */
public interface AuthorityProvider {

    /**
     * Stable name, used to key the provider's rate limiter and circuit breaker.
     */
    String getName();

    ProviderResponse search(ResearchQuery query);
}
