package com.litigation.pipeline.cdi;

import com.litigation.pipeline.api.LitigationPipeline;
import com.litigation.pipeline.claims.ClaimsMatrixOptions;
import com.litigation.pipeline.graph.KnowledgeGraphStore;
import com.litigation.pipeline.research.AuthorityProvider;
import com.litigation.pipeline.research.ProviderGuardRegistry;
import com.litigation.pipeline.research.ResearchIntegrationLayer;
import com.litigation.pipeline.research.ResearchOptions;
import com.litigation.pipeline.research.cache.CaffeineResearchCache;
import com.litigation.pipeline.research.cache.NoOpResearchCache;
import com.litigation.pipeline.research.cache.ResearchCacheConfig;
import com.litigation.pipeline.resilience.CircuitBreakerConfig;
import com.litigation.pipeline.resilience.RateLimitConfig;
import com.litigation.pipeline.resilience.RetryPolicy;
import com.litigation.pipeline.review.ReviewQueue;
import com.litigation.pipeline.scoring.ScoringConfig;
import com.litigation.pipeline.workflow.Agent;
import com.litigation.pipeline.workflow.WorkflowOptions;
import com.litigation.pipeline.workflow.WorkflowOrchestrator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * CDI producer that wires a {@link LitigationPipeline} from MicroProfile Config properties.
 *
 * <p>Every {@link AuthorityProvider} and {@link Agent} bean in the container is registered
 * with the pipeline. Providers are tried in bean discovery order. All properties have
 * defaults, listed in {@code META-INF/microprofile-config.properties}:</p>
 * <pre>
 * litigation-pipeline.research.provider-timeout-ms=10000
 * litigation-pipeline.rate-limit.permits-per-second=10
 * litigation-pipeline.workflow.auto-advance=false
 * </pre>
 */
@ApplicationScoped
public class PipelineProducer {

    private static final Logger log = LoggerFactory.getLogger(PipelineProducer.class);

    // ── Scoring and claims ────────────────────────────────────

    @Inject
    @ConfigProperty(name = "litigation-pipeline.scoring.foundational-boost", defaultValue = "0.2")
    double foundationalBoost;

    @Inject
    @ConfigProperty(name = "litigation-pipeline.scoring.decay-horizon-years", defaultValue = "10")
    double decayHorizonYears;

    @Inject
    @ConfigProperty(name = "litigation-pipeline.claims.min-confidence", defaultValue = "0.25")
    double claimsMinConfidence;

    @Inject
    @ConfigProperty(name = "litigation-pipeline.claims.satisfaction-threshold", defaultValue = "0.5")
    double claimsSatisfactionThreshold;

    // ── Research ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "litigation-pipeline.research.provider-timeout-ms", defaultValue = "10000")
    long providerTimeoutMs;

    @Inject
    @ConfigProperty(name = "litigation-pipeline.research.rate-limit-max-wait-ms", defaultValue = "2000")
    long rateLimitMaxWaitMs;

    @Inject
    @ConfigProperty(name = "litigation-pipeline.research.recency-horizon-years", defaultValue = "10")
    int recencyHorizonYears;

    @Inject
    @ConfigProperty(name = "litigation-pipeline.research.max-citations", defaultValue = "25")
    int maxCitations;

    @Inject
    @ConfigProperty(name = "litigation-pipeline.research.write-to-graph", defaultValue = "true")
    boolean writeToGraph;

    @Inject
    @ConfigProperty(name = "litigation-pipeline.research.max-attempts", defaultValue = "3")
    int providerMaxAttempts;

    @Inject
    @ConfigProperty(name = "litigation-pipeline.research.initial-backoff-ms", defaultValue = "100")
    long providerInitialBackoffMs;

    // ── Rate limiting and circuit breaking ────────────────────

    @Inject
    @ConfigProperty(name = "litigation-pipeline.rate-limit.permits-per-second", defaultValue = "10")
    int permitsPerSecond;

    @Inject
    @ConfigProperty(name = "litigation-pipeline.circuit-breaker.failure-threshold", defaultValue = "3")
    int failureThreshold;

    @Inject
    @ConfigProperty(name = "litigation-pipeline.circuit-breaker.cooldown-seconds", defaultValue = "30")
    long cooldownSeconds;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "litigation-pipeline.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "litigation-pipeline.cache.max-size", defaultValue = "1000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "litigation-pipeline.cache.ttl-seconds", defaultValue = "3600")
    int cacheTtlSeconds;

    @Inject
    @ConfigProperty(name = "litigation-pipeline.cache.stale-retention-seconds", defaultValue = "604800")
    int cacheStaleRetentionSeconds;

    // ── Workflow ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "litigation-pipeline.workflow.max-attempts", defaultValue = "3")
    int taskMaxAttempts;

    @Inject
    @ConfigProperty(name = "litigation-pipeline.workflow.initial-backoff-ms", defaultValue = "500")
    long taskInitialBackoffMs;

    @Inject
    @ConfigProperty(name = "litigation-pipeline.workflow.max-backoff-seconds", defaultValue = "30")
    long taskMaxBackoffSeconds;

    @Inject
    @ConfigProperty(name = "litigation-pipeline.workflow.concurrency", defaultValue = "4")
    int taskConcurrency;

    @Inject
    @ConfigProperty(name = "litigation-pipeline.workflow.worker-threads", defaultValue = "8")
    int workerThreads;

    @Inject
    @ConfigProperty(name = "litigation-pipeline.workflow.auto-advance", defaultValue = "false")
    boolean autoAdvance;

    @Inject
    @ConfigProperty(name = "litigation-pipeline.workflow.archive-directory")
    Optional<String> archiveDirectory;

    @Inject
    @ConfigProperty(name = "litigation-pipeline.review.backlog-threshold", defaultValue = "100")
    int reviewBacklogThreshold;

    @Inject
    @Any
    Instance<AuthorityProvider> providers;

    @Inject
    @Any
    Instance<Agent> agents;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public LitigationPipeline litigationPipeline() {
        LitigationPipeline.Builder builder = LitigationPipeline.builder()
                .scoringConfig(new ScoringConfig(foundationalBoost, decayHorizonYears))
                .claimsOptions(new ClaimsMatrixOptions(claimsMinConfidence, claimsSatisfactionThreshold))
                .guards(new ProviderGuardRegistry(
                        new RateLimitConfig(permitsPerSecond, Duration.ofSeconds(1)),
                        new CircuitBreakerConfig(failureThreshold, Duration.ofSeconds(cooldownSeconds))))
                .researchCache(cacheEnabled
                        ? new CaffeineResearchCache(new ResearchCacheConfig(cacheMaxSize, cacheTtlSeconds,
                        cacheStaleRetentionSeconds, true))
                        : new NoOpResearchCache())
                .researchOptions(new ResearchOptions(Duration.ofMillis(providerTimeoutMs),
                        Duration.ofMillis(rateLimitMaxWaitMs), recencyHorizonYears, maxCitations, writeToGraph))
                .providerRetry(new RetryPolicy(providerMaxAttempts, Duration.ofMillis(providerInitialBackoffMs),
                        2.0, Duration.ofSeconds(2)))
                .workflowOptions(new WorkflowOptions(
                        new RetryPolicy(taskMaxAttempts, Duration.ofMillis(taskInitialBackoffMs), 2.0,
                                Duration.ofSeconds(taskMaxBackoffSeconds)),
                        taskConcurrency, Map.of(), workerThreads, autoAdvance,
                        archiveDirectory.map(Path::of).orElse(null)))
                .reviewBacklogThreshold(reviewBacklogThreshold);

        int providerCount = 0;
        for (AuthorityProvider provider : providers) {
            builder.provider(provider);
            providerCount++;
        }
        int agentCount = 0;
        for (Agent agent : agents) {
            builder.agent(agent);
            agentCount++;
        }
        if (providerCount == 0) {
            log.warn("No AuthorityProvider beans found; research will report insufficient coverage");
        }
        log.info("Producing LitigationPipeline: providers={} agents={} cacheEnabled={} autoAdvance={}",
                providerCount, agentCount, cacheEnabled, autoAdvance);
        return builder.build();
    }

    public void closePipeline(@Disposes LitigationPipeline pipeline) {
        log.info("Closing LitigationPipeline");
        pipeline.close();
    }

    @Produces
    @ApplicationScoped
    public WorkflowOrchestrator workflowOrchestrator(LitigationPipeline pipeline) {
        return pipeline.getOrchestrator();
    }

    @Produces
    @ApplicationScoped
    public ResearchIntegrationLayer researchIntegrationLayer(LitigationPipeline pipeline) {
        return pipeline.getResearch();
    }

    @Produces
    @ApplicationScoped
    public KnowledgeGraphStore knowledgeGraphStore(LitigationPipeline pipeline) {
        return pipeline.getGraphStore();
    }

    @Produces
    @ApplicationScoped
    public ReviewQueue reviewQueue(LitigationPipeline pipeline) {
        return pipeline.getReviewQueue();
    }
}
