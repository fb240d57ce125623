package com.litigation.pipeline.metrics;

import com.litigation.pipeline.core.model.EntityType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}. Used when no metrics backend is configured.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void incrementEntityCreated(EntityType type) {
    }

    @Override
    public void incrementEntityUpdated(EntityType type) {
    }

    @Override
    public void incrementRelationshipCreated(String relationshipType) {
    }

    @Override
    public void recordConfidenceDecay(int affectedEntities) {
    }

    @Override
    public void recordCausesDetected(int count) {
    }

    @Override
    public void incrementProviderCall(String provider, String outcome) {
    }

    @Override
    public void incrementResearchFallback(String kind) {
    }

    @Override
    public void recordResearchDuration(Duration duration) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void incrementTaskOutcome(String capability, String outcome) {
    }

    @Override
    public void incrementPhaseAdvanced(String fromPhase) {
    }
}
