package com.litigation.pipeline.api;

import com.litigation.pipeline.claims.CauseOfAction;
import com.litigation.pipeline.core.CancellationToken;
import com.litigation.pipeline.core.model.EntityType;
import com.litigation.pipeline.core.model.Provenance;
import com.litigation.pipeline.graph.EntityCandidate;
import com.litigation.pipeline.graph.InMemoryKnowledgeGraphStore;
import com.litigation.pipeline.health.HealthStatus;
import com.litigation.pipeline.research.AuthorityProvider;
import com.litigation.pipeline.research.ProviderResponse;
import com.litigation.pipeline.research.RawCitation;
import com.litigation.pipeline.research.ResearchIntegrationLayer;
import com.litigation.pipeline.resilience.RetryPolicy;
import com.litigation.pipeline.review.InMemoryReviewQueue;
import com.litigation.pipeline.review.ReviewReason;
import com.litigation.pipeline.scoring.ConfidenceFactors;
import com.litigation.pipeline.snapshot.GraphSnapshot;
import com.litigation.pipeline.workflow.Agent;
import com.litigation.pipeline.workflow.AgentCapability;
import com.litigation.pipeline.workflow.PhaseNotReadyException;
import com.litigation.pipeline.workflow.TaskResult;
import com.litigation.pipeline.workflow.WorkflowOptions;
import com.litigation.pipeline.workflow.WorkflowOrchestrator;
import com.litigation.pipeline.workflow.WorkflowPhase;
import com.litigation.pipeline.workflow.WorkflowTask;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("LitigationPipeline Tests")
class LitigationPipelineTest {

    private static final WorkflowOptions FAST_OPTIONS = new WorkflowOptions(
            new RetryPolicy(2, Duration.ZERO, 1.0, Duration.ZERO), 4, Map.of(), 4, false, null);

    private InMemoryReviewQueue reviewQueue;
    private InMemoryKnowledgeGraphStore store;
    private AuthorityProvider provider;
    private LitigationPipeline pipeline;

    @BeforeEach
    void setUp() {
        reviewQueue = new InMemoryReviewQueue();
        store = InMemoryKnowledgeGraphStore.builder().reviewQueue(reviewQueue).build();
        provider = mock(AuthorityProvider.class);
        when(provider.getName()).thenReturn("alpha");
        lenient().when(provider.search(any())).thenReturn(ProviderResponse.success(List.of(
                RawCitation.of("cal-1", "Contract damages", "Supreme Court of California", "CA",
                        LocalDate.of(2023, 1, 10), "Breach of contract damages"))));
    }

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.close();
        }
    }

    private LitigationPipeline.Builder builder() {
        return LitigationPipeline.builder()
                .graphStore(store)
                .reviewQueue(reviewQueue)
                .providerRetry(new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO))
                .workflowOptions(FAST_OPTIONS)
                .agent(new IntakeAgent())
                .agent(passThrough("drafter", AgentCapability.DRAFTING))
                .agent(passThrough("reviewer", AgentCapability.REVIEW))
                .agent(passThrough("editor", AgentCapability.EDITING));
    }

    private static Agent passThrough(String id, AgentCapability capability) {
        return new Agent() {
            @Override
            public String getId() {
                return id;
            }

            @Override
            public AgentCapability getCapability() {
                return capability;
            }

            @Override
            public TaskResult executeTask(WorkflowTask task, CancellationToken token) {
                return TaskResult.completed(Map.of(id, "done"));
            }
        };
    }

    /**
     * Writes the facts of a contract dispute into the graph.
     */
    private class IntakeAgent implements Agent {

        @Override
        public String getId() {
            return "intake";
        }

        @Override
        public AgentCapability getCapability() {
            return AgentCapability.INTAKE;
        }

        @Override
        public TaskResult executeTask(WorkflowTask task, CancellationToken token) {
            for (String text : List.of("Parties signed a purchase agreement",
                    "Plaintiff delivered the goods on schedule",
                    "Defendant refused to replace defective units",
                    "Plaintiff lost $50,000 in refunds")) {
                store.upsertEntity(EntityCandidate.builder()
                        .type(EntityType.FACT)
                        .name(text)
                        .jurisdictionId("CA")
                        .factors(ConfidenceFactors.of(0.9, true))
                        .provenance(Provenance.foundational("complaint"))
                        .build());
            }
            return TaskResult.completed(Map.of("factsLoaded", 4));
        }
    }

    private void runPhase(WorkflowOrchestrator orchestrator, String sessionId) throws Exception {
        orchestrator.dispatchPhaseTasks(sessionId);
        orchestrator.whenPhaseSettled(sessionId).get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Should carry a case from intake through research into an artifact")
    void endToEnd() throws Exception {
        pipeline = builder().provider(provider).build();
        WorkflowOrchestrator orchestrator = pipeline.getOrchestrator();
        String sessionId = pipeline.startCase("CA", Map.of("matter", "Acme v. Widget Co"));

        runPhase(orchestrator, sessionId);
        assertEquals(WorkflowPhase.OUTLINE, orchestrator.advancePhase(sessionId));

        runPhase(orchestrator, sessionId);
        assertThrows(PhaseNotReadyException.class, () -> orchestrator.advancePhase(sessionId));
        orchestrator.requestApproval(sessionId, WorkflowPhase.OUTLINE);
        assertEquals(1, reviewQueue.getPendingByReason(ReviewReason.PHASE_APPROVAL).size());
        orchestrator.grantApproval(sessionId, WorkflowPhase.OUTLINE, "partner");
        assertEquals(WorkflowPhase.RESEARCH, orchestrator.advancePhase(sessionId));

        runPhase(orchestrator, sessionId);
        assertEquals(WorkflowPhase.DRAFTING, orchestrator.advancePhase(sessionId));

        CaseArtifact artifact = pipeline.assembleArtifact(sessionId);

        assertEquals("CA", artifact.jurisdictionId());
        CauseOfAction breach = artifact.causes().get(0);
        assertEquals("breach_of_contract", breach.causeType());
        assertEquals(artifact.causes().size(), artifact.strengths().size());
        assertEquals(artifact.causes().size(), artifact.researchResults().size());
        assertFalse(artifact.degradedResearch());
        assertFalse(artifact.hasUnresolvedConflicts());
        assertTrue(artifact.relationships().stream()
                .anyMatch(r -> ResearchIntegrationLayer.CITED_FOR.equals(r.getType())));
        assertTrue(artifact.entities().stream().anyMatch(e -> e.getType() == EntityType.AUTHORITY));
    }

    @Test
    @DisplayName("Should derive causes from the graph when the outline phase has not run")
    void artifactBeforeOutline() throws Exception {
        pipeline = builder().provider(provider).build();
        String sessionId = pipeline.startCase("CA", Map.of());
        runPhase(pipeline.getOrchestrator(), sessionId);

        CaseArtifact artifact = pipeline.assembleArtifact(sessionId);

        assertFalse(artifact.causes().isEmpty());
        assertTrue(artifact.researchResults().isEmpty());
        assertFalse(artifact.degradedResearch());
    }

    @Test
    @DisplayName("Should flag degraded research when every provider fails")
    void degradedResearch() throws Exception {
        when(provider.search(any())).thenReturn(ProviderResponse.error("upstream 503"));
        pipeline = builder().provider(provider).build();
        WorkflowOrchestrator orchestrator = pipeline.getOrchestrator();
        String sessionId = pipeline.startCase("CA", Map.of());

        runPhase(orchestrator, sessionId);
        orchestrator.advancePhase(sessionId);
        runPhase(orchestrator, sessionId);
        orchestrator.grantApproval(sessionId, WorkflowPhase.OUTLINE, "partner");
        orchestrator.advancePhase(sessionId);
        runPhase(orchestrator, sessionId);

        assertTrue(pipeline.assembleArtifact(sessionId).degradedResearch());
    }

    @Test
    @DisplayName("Should pin the session to the hierarchy current at start")
    void pinsHierarchy() {
        pipeline = builder().provider(provider).build();
        String sessionId = pipeline.startCase("CA", Map.of());

        assertEquals(pipeline.getHierarchyRegistry().current().getVersion(),
                pipeline.getOrchestrator().getSession(sessionId).getHierarchyVersion());
    }

    @Test
    @DisplayName("Should reject a case without a jurisdiction")
    void requiresJurisdiction() {
        pipeline = builder().provider(provider).build();

        assertThrows(IllegalArgumentException.class, () -> pipeline.startCase(" ", Map.of()));
    }

    @Test
    @DisplayName("Should report health from the provider circuits")
    void health() {
        pipeline = builder().provider(provider).build();
        assertTrue(pipeline.health().isUp());
        pipeline.close();

        pipeline = builder().build();
        HealthStatus noProviders = pipeline.health();
        assertTrue(noProviders.isDown());
    }

    @Test
    @DisplayName("Should export the graph as JSON")
    void exportGraph(@TempDir Path tempDir) throws Exception {
        pipeline = builder().provider(provider).build();
        pipeline.startCase("CA", Map.of());
        new IntakeAgent().executeTask(null, CancellationToken.none());

        Path target = tempDir.resolve("graph.json");
        GraphSnapshot snapshot = pipeline.exportGraph(target);

        assertTrue(Files.size(target) > 0);
        assertEquals(4, snapshot.entities().size());
    }
}
