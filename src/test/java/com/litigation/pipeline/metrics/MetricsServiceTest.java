package com.litigation.pipeline.metrics;

import com.litigation.pipeline.core.model.EntityType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.incrementEntityCreated(EntityType.FACT);
                noOp.incrementEntityUpdated(EntityType.PARTY);
                noOp.incrementRelationshipCreated("CITED_FOR");
                noOp.recordConfidenceDecay(3);
                noOp.recordCausesDetected(2);
                noOp.incrementProviderCall("alpha", "success");
                noOp.incrementResearchFallback("stale");
                noOp.recordResearchDuration(Duration.ofMillis(20));
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
                noOp.incrementTaskOutcome("RESEARCH", "completed");
                noOp.incrementPhaseAdvanced("INTAKE");
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should count created entities per type")
        void incrementEntityCreated() {
            metrics.incrementEntityCreated(EntityType.FACT);
            metrics.incrementEntityCreated(EntityType.FACT);
            metrics.incrementEntityCreated(EntityType.PARTY);

            Counter facts = registry.find("pipeline.graph.entity.created").tag("entityType", "FACT").counter();
            Counter parties = registry.find("pipeline.graph.entity.created").tag("entityType", "PARTY").counter();

            assertNotNull(facts);
            assertEquals(2.0, facts.count());
            assertNotNull(parties);
            assertEquals(1.0, parties.count());
        }

        @Test
        @DisplayName("Should tag provider calls by provider and outcome")
        void incrementProviderCall() {
            metrics.incrementProviderCall("alpha", "success");
            metrics.incrementProviderCall("alpha", "timeout");
            metrics.incrementProviderCall("alpha", "timeout");

            Counter timeouts = registry.find("pipeline.research.provider.calls")
                    .tag("provider", "alpha")
                    .tag("outcome", "timeout")
                    .counter();

            assertNotNull(timeouts);
            assertEquals(2.0, timeouts.count());
        }

        @Test
        @DisplayName("Should time research executions")
        void recordResearchDuration() {
            metrics.recordResearchDuration(Duration.ofMillis(150));
            metrics.recordResearchDuration(Duration.ofMillis(250));

            Timer timer = registry.find("pipeline.research.duration").timer();

            assertNotNull(timer);
            assertEquals(2, timer.count());
        }

        @Test
        @DisplayName("Should record detected causes in a distribution")
        void recordCausesDetected() {
            metrics.recordCausesDetected(1);
            metrics.recordCausesDetected(3);

            DistributionSummary summary = registry.find("pipeline.claims.causes.detected").summary();

            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(4.0, summary.totalAmount());
        }

        @Test
        @DisplayName("Should count cache hits and misses separately")
        void cacheCounters() {
            metrics.recordCacheHit();
            metrics.recordCacheMiss();
            metrics.recordCacheMiss();

            assertEquals(1.0, registry.find("pipeline.research.cache.hit").counter().count());
            assertEquals(2.0, registry.find("pipeline.research.cache.miss").counter().count());
        }

        @Test
        @DisplayName("Should count task outcomes and phase transitions")
        void workflowCounters() {
            metrics.incrementTaskOutcome("RESEARCH", "retried");
            metrics.incrementTaskOutcome("RESEARCH", "completed");
            metrics.incrementPhaseAdvanced("INTAKE");

            assertEquals(1.0, registry.find("pipeline.workflow.task.outcome")
                    .tag("capability", "RESEARCH").tag("outcome", "retried").counter().count());
            assertEquals(1.0, registry.find("pipeline.workflow.phase.advanced")
                    .tag("fromPhase", "INTAKE").counter().count());
        }

        @Test
        @DisplayName("Should count research fallbacks by kind")
        void incrementResearchFallback() {
            metrics.incrementResearchFallback("stale");
            metrics.incrementResearchFallback("insufficient_coverage");

            assertEquals(1.0, registry.find("pipeline.research.fallback").tag("kind", "stale").counter().count());
        }
    }
}
