package com.litigation.pipeline.metrics;

import com.litigation.pipeline.core.model.EntityType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code pipeline.graph.entity.created} / {@code .updated} - Counter (tag: entityType)</li>
 *   <li>{@code pipeline.graph.relationship.created} - Counter (tag: relationshipType)</li>
 *   <li>{@code pipeline.graph.decay.affected} - DistributionSummary</li>
 *   <li>{@code pipeline.claims.causes.detected} - DistributionSummary</li>
 *   <li>{@code pipeline.research.provider.calls} - Counter (tags: provider, outcome)</li>
 *   <li>{@code pipeline.research.fallback} - Counter (tag: kind)</li>
 *   <li>{@code pipeline.research.duration} - Timer</li>
 *   <li>{@code pipeline.research.cache.hit} / {@code .miss} - Counter</li>
 *   <li>{@code pipeline.workflow.task.outcome} - Counter (tags: capability, outcome)</li>
 *   <li>{@code pipeline.workflow.phase.advanced} - Counter (tag: fromPhase)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary decaySummary;
    private final DistributionSummary causesSummary;
    private final Timer researchTimer;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.decaySummary = DistributionSummary.builder("pipeline.graph.decay.affected")
                .description("Entities whose confidence was reduced per decay run")
                .register(registry);
        this.causesSummary = DistributionSummary.builder("pipeline.claims.causes.detected")
                .description("Causes of action returned per detection run")
                .register(registry);
        this.researchTimer = Timer.builder("pipeline.research.duration")
                .description("Duration of research query execution")
                .register(registry);
        this.cacheHitCounter = Counter.builder("pipeline.research.cache.hit")
                .description("Number of research cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("pipeline.research.cache.miss")
                .description("Number of research cache misses")
                .register(registry);
    }

    @Override
    public void incrementEntityCreated(EntityType type) {
        counter("pipeline.graph.entity.created", "Entities inserted into the graph",
                "entityType", type.name()).increment();
    }

    @Override
    public void incrementEntityUpdated(EntityType type) {
        counter("pipeline.graph.entity.updated", "Entity revisions produced by merges",
                "entityType", type.name()).increment();
    }

    @Override
    public void incrementRelationshipCreated(String relationshipType) {
        counter("pipeline.graph.relationship.created", "Relationships added to the graph",
                "relationshipType", relationshipType).increment();
    }

    @Override
    public void recordConfidenceDecay(int affectedEntities) {
        decaySummary.record(affectedEntities);
    }

    @Override
    public void recordCausesDetected(int count) {
        causesSummary.record(count);
    }

    @Override
    public void incrementProviderCall(String provider, String outcome) {
        String key = "provider:" + provider + ":" + outcome;
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("pipeline.research.provider.calls")
                        .description("Authority provider calls by outcome")
                        .tag("provider", provider)
                        .tag("outcome", outcome)
                        .register(registry)).increment();
    }

    @Override
    public void incrementResearchFallback(String kind) {
        counter("pipeline.research.fallback", "Research results served by a fallback",
                "kind", kind).increment();
    }

    @Override
    public void recordResearchDuration(Duration duration) {
        researchTimer.record(duration);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void incrementTaskOutcome(String capability, String outcome) {
        String key = "task:" + capability + ":" + outcome;
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("pipeline.workflow.task.outcome")
                        .description("Agent task outcomes")
                        .tag("capability", capability)
                        .tag("outcome", outcome)
                        .register(registry)).increment();
    }

    @Override
    public void incrementPhaseAdvanced(String fromPhase) {
        counter("pipeline.workflow.phase.advanced", "Phase transitions",
                "fromPhase", fromPhase).increment();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
