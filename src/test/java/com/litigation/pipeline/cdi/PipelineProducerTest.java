package com.litigation.pipeline.cdi;

import com.litigation.pipeline.api.LitigationPipeline;
import com.litigation.pipeline.core.CancellationToken;
import com.litigation.pipeline.research.AuthorityProvider;
import com.litigation.pipeline.workflow.Agent;
import com.litigation.pipeline.workflow.AgentCapability;
import com.litigation.pipeline.workflow.TaskResult;
import com.litigation.pipeline.workflow.WorkflowConfigurationException;
import com.litigation.pipeline.workflow.WorkflowTask;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("PipelineProducer Tests")
class PipelineProducerTest {

    private PipelineProducer producer;

    @BeforeEach
    void setUp() {
        producer = new PipelineProducer();
        producer.foundationalBoost = 0.2;
        producer.decayHorizonYears = 10;
        producer.claimsMinConfidence = 0.25;
        producer.claimsSatisfactionThreshold = 0.5;
        producer.providerTimeoutMs = 10_000;
        producer.rateLimitMaxWaitMs = 2_000;
        producer.recencyHorizonYears = 10;
        producer.maxCitations = 25;
        producer.writeToGraph = true;
        producer.providerMaxAttempts = 3;
        producer.providerInitialBackoffMs = 100;
        producer.permitsPerSecond = 10;
        producer.failureThreshold = 3;
        producer.cooldownSeconds = 30;
        producer.cacheEnabled = true;
        producer.cacheMaxSize = 1_000;
        producer.cacheTtlSeconds = 3_600;
        producer.cacheStaleRetentionSeconds = 604_800;
        producer.taskMaxAttempts = 3;
        producer.taskInitialBackoffMs = 500;
        producer.taskMaxBackoffSeconds = 30;
        producer.taskConcurrency = 4;
        producer.workerThreads = 2;
        producer.autoAdvance = false;
        producer.archiveDirectory = Optional.empty();
        producer.reviewBacklogThreshold = 100;
    }

    @SuppressWarnings("unchecked")
    private static <T> Instance<T> instanceOf(List<T> beans) {
        Instance<T> instance = mock(Instance.class);
        when(instance.iterator()).thenAnswer(invocation -> beans.iterator());
        return instance;
    }

    private static Agent agent(AgentCapability capability) {
        return new Agent() {
            @Override
            public String getId() {
                return capability.name().toLowerCase(java.util.Locale.ROOT);
            }

            @Override
            public AgentCapability getCapability() {
                return capability;
            }

            @Override
            public TaskResult executeTask(WorkflowTask task, CancellationToken token) {
                return TaskResult.completed(Map.of());
            }
        };
    }

    @Test
    @DisplayName("Should register every provider and agent bean with the produced pipeline")
    void producesPipeline() {
        AuthorityProvider provider = mock(AuthorityProvider.class);
        when(provider.getName()).thenReturn("alpha");
        producer.providers = instanceOf(List.of(provider));
        producer.agents = instanceOf(Stream.of(AgentCapability.INTAKE, AgentCapability.DRAFTING,
                        AgentCapability.REVIEW, AgentCapability.EDITING)
                .map(PipelineProducerTest::agent)
                .collect(Collectors.toList()));

        LitigationPipeline pipeline = producer.litigationPipeline();
        try {
            assertEquals(List.of("alpha"), pipeline.getResearch().getProviderNames());
            assertSame(pipeline.getOrchestrator(), producer.workflowOrchestrator(pipeline));
            assertSame(pipeline.getGraphStore(), producer.knowledgeGraphStore(pipeline));
            assertSame(pipeline.getReviewQueue(), producer.reviewQueue(pipeline));
            assertTrue(pipeline.health().isUp());
        } finally {
            producer.closePipeline(pipeline);
        }
    }

    @Test
    @DisplayName("Should fail fast when a workflow capability has no agent bean")
    void missingAgents() {
        producer.providers = instanceOf(List.of());
        producer.agents = instanceOf(List.of());

        assertThrows(WorkflowConfigurationException.class, () -> producer.litigationPipeline());
    }
}
