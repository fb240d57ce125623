package com.litigation.pipeline.api;

import com.litigation.pipeline.agents.AuthorityResearchAgent;
import com.litigation.pipeline.agents.ClaimsOutlineAgent;
import com.litigation.pipeline.audit.AuditService;
import com.litigation.pipeline.claims.CauseOfAction;
import com.litigation.pipeline.claims.CauseTemplateCatalogue;
import com.litigation.pipeline.claims.ClaimsMatrixEngine;
import com.litigation.pipeline.claims.ClaimsMatrixOptions;
import com.litigation.pipeline.claims.StrengthAnalysis;
import com.litigation.pipeline.graph.InMemoryKnowledgeGraphStore;
import com.litigation.pipeline.graph.KnowledgeGraphStore;
import com.litigation.pipeline.health.HealthCheckRegistry;
import com.litigation.pipeline.health.HealthStatus;
import com.litigation.pipeline.health.ProviderCircuitHealthCheck;
import com.litigation.pipeline.health.ReviewBacklogHealthCheck;
import com.litigation.pipeline.jurisdiction.AuthorityHierarchyRegistry;
import com.litigation.pipeline.jurisdiction.JurisdictionAuthorityResolver;
import com.litigation.pipeline.metrics.MetricsService;
import com.litigation.pipeline.metrics.NoOpMetricsService;
import com.litigation.pipeline.research.AuthorityProvider;
import com.litigation.pipeline.research.ProviderGuardRegistry;
import com.litigation.pipeline.research.ResearchIntegrationLayer;
import com.litigation.pipeline.research.ResearchOptions;
import com.litigation.pipeline.research.ResearchResult;
import com.litigation.pipeline.research.cache.CaffeineResearchCache;
import com.litigation.pipeline.research.cache.ResearchCache;
import com.litigation.pipeline.research.cache.ResearchCacheConfig;
import com.litigation.pipeline.resilience.RetryPolicy;
import com.litigation.pipeline.review.InMemoryReviewQueue;
import com.litigation.pipeline.review.ReviewQueue;
import com.litigation.pipeline.scoring.ConfidenceScorer;
import com.litigation.pipeline.scoring.ScoringConfig;
import com.litigation.pipeline.snapshot.GraphSnapshot;
import com.litigation.pipeline.snapshot.JsonSnapshotWriter;
import com.litigation.pipeline.tracing.NoOpTracingService;
import com.litigation.pipeline.tracing.TracingService;
import com.litigation.pipeline.workflow.Agent;
import com.litigation.pipeline.workflow.AgentRegistry;
import com.litigation.pipeline.workflow.InMemorySessionStore;
import com.litigation.pipeline.workflow.SessionStore;
import com.litigation.pipeline.workflow.TaskContextKeys;
import com.litigation.pipeline.workflow.WorkflowDefinition;
import com.litigation.pipeline.workflow.WorkflowOptions;
import com.litigation.pipeline.workflow.WorkflowOrchestrator;
import com.litigation.pipeline.workflow.WorkflowSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Main entry point of the library. Wires the knowledge graph, claims engine, research
 * layer and workflow orchestrator around shared review, audit, metrics and tracing
 * services.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (LitigationPipeline pipeline = LitigationPipeline.builder()
 *         .provider(courtListener)
 *         .agent(intakeAgent).agent(draftingAgent).agent(reviewAgent).agent(editingAgent)
 *         .build()) {
 *     String sessionId = pipeline.startCase("CA", Map.of("matter", "Acme v. Widget Co"));
 *     pipeline.getOrchestrator().dispatchPhaseTasks(sessionId);
 *     ...
 *     CaseArtifact artifact = pipeline.assembleArtifact(sessionId);
 * }
 * </pre>
 *
 * <p>The built-in outline and research agents are registered unless disabled; agents
 * for the remaining capabilities must be supplied.</p>
 */
public class LitigationPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LitigationPipeline.class);

    private final KnowledgeGraphStore graphStore;
    private final ClaimsMatrixEngine claimsEngine;
    private final ResearchIntegrationLayer research;
    private final WorkflowOrchestrator orchestrator;
    private final ReviewQueue reviewQueue;
    private final AuditService auditService;
    private final AuthorityHierarchyRegistry hierarchyRegistry;
    private final HealthCheckRegistry healthChecks;
    private final JsonSnapshotWriter snapshotWriter = new JsonSnapshotWriter();
    private final Clock clock;

    private LitigationPipeline(Builder builder) {
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.reviewQueue = builder.reviewQueue != null ? builder.reviewQueue : new InMemoryReviewQueue();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();
        this.hierarchyRegistry = builder.hierarchyRegistry != null
                ? builder.hierarchyRegistry : new AuthorityHierarchyRegistry();
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        ConfidenceScorer scorer = new ConfidenceScorer(
                builder.scoringConfig != null ? builder.scoringConfig : ScoringConfig.defaults());
        JurisdictionAuthorityResolver resolver = new JurisdictionAuthorityResolver(hierarchyRegistry.current());

        this.graphStore = builder.graphStore != null ? builder.graphStore
                : InMemoryKnowledgeGraphStore.builder()
                .scorer(scorer)
                .reviewQueue(reviewQueue)
                .auditService(auditService)
                .metricsService(metricsService)
                .clock(clock)
                .build();

        this.claimsEngine = ClaimsMatrixEngine.builder()
                .catalogue(builder.catalogue != null ? builder.catalogue : CauseTemplateCatalogue.defaults())
                .resolver(resolver)
                .reviewQueue(reviewQueue)
                .metricsService(metricsService)
                .options(builder.claimsOptions != null ? builder.claimsOptions : ClaimsMatrixOptions.defaults())
                .build();

        ProviderGuardRegistry guards = builder.guards != null ? builder.guards : new ProviderGuardRegistry();
        ResearchCache cache = builder.researchCache != null ? builder.researchCache
                : new CaffeineResearchCache(ResearchCacheConfig.defaults());
        this.research = ResearchIntegrationLayer.builder()
                .providers(builder.providers)
                .guards(guards)
                .cache(cache)
                .resolver(resolver)
                .scorer(scorer)
                .graphStore(graphStore)
                .retryPolicy(builder.providerRetry != null ? builder.providerRetry : RetryPolicy.defaults())
                .options(builder.researchOptions != null ? builder.researchOptions : ResearchOptions.defaults())
                .metricsService(metricsService)
                .tracingService(tracingService)
                .clock(clock)
                .build();

        AgentRegistry agents = new AgentRegistry();
        if (builder.builtInAgents) {
            agents.register(new ClaimsOutlineAgent(graphStore, claimsEngine));
            agents.register(new AuthorityResearchAgent(graphStore, research));
        }
        builder.agents.forEach(agents::register);

        this.orchestrator = WorkflowOrchestrator.builder()
                .agents(agents)
                .definition(builder.definition)
                .sessionStore(builder.sessionStore != null ? builder.sessionStore : new InMemorySessionStore())
                .reviewQueue(reviewQueue)
                .auditService(auditService)
                .metricsService(metricsService)
                .tracingService(tracingService)
                .hierarchyRegistry(hierarchyRegistry)
                .options(builder.workflowOptions)
                .clock(clock)
                .build();

        this.healthChecks = new HealthCheckRegistry()
                .register(new ProviderCircuitHealthCheck(guards, research.getProviderNames()))
                .register(new ReviewBacklogHealthCheck(reviewQueue, builder.reviewBacklogThreshold));

        log.info("LitigationPipeline initialized: providers={} agents={} hierarchyVersion={}",
                research.getProviderNames(), agents.size(), hierarchyRegistry.current().getVersion());
    }

    // ========== Case API ==========

    /**
     * Starts a workflow session for a case in the given jurisdiction.
     *
     * @return the session id
     */
    public String startCase(String jurisdictionId, Map<String, Object> intakeContext) {
        if (jurisdictionId == null || jurisdictionId.isBlank()) {
            throw new IllegalArgumentException("jurisdictionId is required");
        }
        Map<String, Object> context = new HashMap<>(intakeContext != null ? intakeContext : Map.of());
        context.put(TaskContextKeys.JURISDICTION_ID, jurisdictionId);
        return orchestrator.startSession(context);
    }

    /**
     * Runs cause detection over the current graph outside any workflow session.
     */
    public List<CauseOfAction> detectCauses(String jurisdictionId) {
        return claimsEngine.detectCauses(graphStore, jurisdictionId);
    }

    /**
     * Assembles the read-only artifact of a session. Causes and research results are those
     * published by the session's tasks; when the outline phase has not run yet the causes
     * are derived from the current graph.
     */
    public CaseArtifact assembleArtifact(String sessionId) {
        WorkflowSession session = orchestrator.getSession(sessionId);
        Map<String, Object> shared = session.getSharedContext();
        String jurisdictionId = (String) shared.get(TaskContextKeys.JURISDICTION_ID);

        List<CauseOfAction> causes = listValue(shared, TaskContextKeys.CAUSES);
        if (!shared.containsKey(TaskContextKeys.CAUSES)) {
            causes = detectCauses(jurisdictionId);
        }
        List<StrengthAnalysis> strengths = causes.stream()
                .map(claimsEngine::analyzeStrength)
                .collect(Collectors.toList());
        List<ResearchResult> results = listValue(shared, TaskContextKeys.RESEARCH_RESULTS);
        boolean degraded = results.stream().anyMatch(r -> r.stale() || r.insufficientCoverage());

        return new CaseArtifact(sessionId, jurisdictionId, causes, strengths,
                new ArrayList<>(graphStore.getAllEntities()), new ArrayList<>(graphStore.getAllRelationships()),
                results, degraded, clock.instant());
    }

    /**
     * Writes the current graph contents as JSON.
     */
    public GraphSnapshot exportGraph(Path target) throws IOException {
        GraphSnapshot snapshot = GraphSnapshot.of(graphStore, clock.instant());
        snapshotWriter.writeGraph(snapshot, target);
        log.info("graph.exported target={} entities={} relationships={}",
                target, snapshot.entities().size(), snapshot.relationships().size());
        return snapshot;
    }

    public HealthStatus health() {
        return healthChecks.checkAll();
    }

    // ========== Accessors ==========

    public KnowledgeGraphStore getGraphStore() {
        return graphStore;
    }

    public ClaimsMatrixEngine getClaimsEngine() {
        return claimsEngine;
    }

    public ResearchIntegrationLayer getResearch() {
        return research;
    }

    public WorkflowOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public ReviewQueue getReviewQueue() {
        return reviewQueue;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public AuthorityHierarchyRegistry getHierarchyRegistry() {
        return hierarchyRegistry;
    }

    public HealthCheckRegistry getHealthChecks() {
        return healthChecks;
    }

    @Override
    public void close() {
        orchestrator.close();
        research.close();
        log.info("LitigationPipeline closed");
    }

    @SuppressWarnings("unchecked")
    private static <T> List<T> listValue(Map<String, Object> context, String key) {
        Object value = context.get(key);
        return value instanceof List ? (List<T>) value : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<AuthorityProvider> providers = new ArrayList<>();
        private final List<Agent> agents = new ArrayList<>();
        private boolean builtInAgents = true;
        private KnowledgeGraphStore graphStore;
        private ReviewQueue reviewQueue;
        private AuditService auditService;
        private MetricsService metricsService;
        private TracingService tracingService;
        private AuthorityHierarchyRegistry hierarchyRegistry;
        private ScoringConfig scoringConfig;
        private CauseTemplateCatalogue catalogue;
        private ClaimsMatrixOptions claimsOptions;
        private ProviderGuardRegistry guards;
        private ResearchCache researchCache;
        private ResearchOptions researchOptions;
        private RetryPolicy providerRetry;
        private WorkflowDefinition definition;
        private WorkflowOptions workflowOptions;
        private SessionStore sessionStore;
        private int reviewBacklogThreshold = 100;
        private Clock clock;

        public Builder provider(AuthorityProvider provider) {
            this.providers.add(provider);
            return this;
        }

        public Builder providers(List<AuthorityProvider> providers) {
            this.providers.addAll(providers);
            return this;
        }

        public Builder agent(Agent agent) {
            this.agents.add(agent);
            return this;
        }

        /**
         * Whether to register the built-in outline and research agents. Enabled by default.
         */
        public Builder builtInAgents(boolean enabled) {
            this.builtInAgents = enabled;
            return this;
        }

        public Builder graphStore(KnowledgeGraphStore graphStore) {
            this.graphStore = graphStore;
            return this;
        }

        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder hierarchyRegistry(AuthorityHierarchyRegistry hierarchyRegistry) {
            this.hierarchyRegistry = hierarchyRegistry;
            return this;
        }

        public Builder scoringConfig(ScoringConfig scoringConfig) {
            this.scoringConfig = scoringConfig;
            return this;
        }

        public Builder catalogue(CauseTemplateCatalogue catalogue) {
            this.catalogue = catalogue;
            return this;
        }

        public Builder claimsOptions(ClaimsMatrixOptions claimsOptions) {
            this.claimsOptions = claimsOptions;
            return this;
        }

        public Builder guards(ProviderGuardRegistry guards) {
            this.guards = guards;
            return this;
        }

        public Builder researchCache(ResearchCache researchCache) {
            this.researchCache = researchCache;
            return this;
        }

        public Builder researchOptions(ResearchOptions researchOptions) {
            this.researchOptions = researchOptions;
            return this;
        }

        public Builder providerRetry(RetryPolicy providerRetry) {
            this.providerRetry = providerRetry;
            return this;
        }

        public Builder definition(WorkflowDefinition definition) {
            this.definition = definition;
            return this;
        }

        public Builder workflowOptions(WorkflowOptions workflowOptions) {
            this.workflowOptions = workflowOptions;
            return this;
        }

        public Builder sessionStore(SessionStore sessionStore) {
            this.sessionStore = sessionStore;
            return this;
        }

        public Builder reviewBacklogThreshold(int threshold) {
            this.reviewBacklogThreshold = threshold;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public LitigationPipeline build() {
            return new LitigationPipeline(this);
        }
    }
}
