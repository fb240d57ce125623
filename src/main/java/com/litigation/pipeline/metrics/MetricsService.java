package com.litigation.pipeline.metrics;

import com.litigation.pipeline.core.model.EntityType;

import java.time.Duration;

/**
 * Interface for recording pipeline metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works without any
 * metrics dependency on the classpath.
 */
public interface MetricsService {

    void incrementEntityCreated(EntityType type);

    void incrementEntityUpdated(EntityType type);

    void incrementRelationshipCreated(String relationshipType);

    void recordConfidenceDecay(int affectedEntities);

    void recordCausesDetected(int count);

    /**
     * @param outcome one of success, rate_limited, error, timeout, throttled, cancelled, circuit_open
     */
    void incrementProviderCall(String provider, String outcome);

    /**
     * @param kind {@code stale} or {@code insufficient_coverage}
     */
    void incrementResearchFallback(String kind);

    void recordResearchDuration(Duration duration);

    void recordCacheHit();

    void recordCacheMiss();

    void incrementTaskOutcome(String capability, String outcome);

    void incrementPhaseAdvanced(String fromPhase);
}
