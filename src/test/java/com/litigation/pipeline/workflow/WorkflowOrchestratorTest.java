package com.litigation.pipeline.workflow;

import com.litigation.pipeline.audit.AuditAction;
import com.litigation.pipeline.audit.AuditService;
import com.litigation.pipeline.jurisdiction.AuthorityHierarchy;
import com.litigation.pipeline.review.InMemoryReviewQueue;
import com.litigation.pipeline.review.ReviewItem;
import com.litigation.pipeline.review.ReviewReason;
import com.litigation.pipeline.review.ReviewStatus;
import com.litigation.pipeline.resilience.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowOrchestratorTest {

    private static final WorkflowOptions FAST_OPTIONS =
            new WorkflowOptions(new RetryPolicy(3, Duration.ZERO, 1.0, Duration.ZERO), 4, Map.of(), 4, false, null);

    private InMemoryReviewQueue reviewQueue;
    private AuditService auditService;
    private WorkflowOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        reviewQueue = new InMemoryReviewQueue();
        auditService = new AuditService();
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.close();
        }
    }

    private static AgentRegistry completingAgents() {
        AgentRegistry registry = new AgentRegistry();
        for (AgentCapability capability : AgentCapability.values()) {
            registry.register(ScriptedAgent.completing(capability.name().toLowerCase(Locale.ROOT), capability));
        }
        return registry;
    }

    private static AgentRegistry withIntakeAgent(Agent intake) {
        AgentRegistry registry = new AgentRegistry();
        registry.register(intake);
        for (AgentCapability capability : AgentCapability.values()) {
            if (capability != AgentCapability.INTAKE) {
                registry.register(ScriptedAgent.completing(capability.name().toLowerCase(Locale.ROOT), capability));
            }
        }
        return registry;
    }

    private WorkflowOrchestrator build(AgentRegistry agents, WorkflowOptions options) {
        return build(agents, WorkflowDefinition.defaults(), options);
    }

    private WorkflowOrchestrator build(AgentRegistry agents, WorkflowDefinition definition, WorkflowOptions options) {
        orchestrator = WorkflowOrchestrator.builder()
                .agents(agents)
                .definition(definition)
                .reviewQueue(reviewQueue)
                .auditService(auditService)
                .options(options)
                .build();
        return orchestrator;
    }

    private static WorkflowPhase settle(WorkflowOrchestrator orchestrator, String sessionId) throws Exception {
        return orchestrator.whenPhaseSettled(sessionId).get(5, TimeUnit.SECONDS);
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    @Nested
    @DisplayName("Sessions and dispatch")
    class Dispatch {

        @Test
        @DisplayName("Should start a session in INTAKE pinned to the current hierarchy")
        void testStartSession() {
            WorkflowOrchestrator o = build(completingAgents(), FAST_OPTIONS);

            String sessionId = o.startSession(Map.of("client", "Acme"));
            WorkflowSession session = o.getSession(sessionId);

            assertEquals(WorkflowPhase.INTAKE, session.getCurrentPhase());
            assertEquals(PhaseStatus.PENDING, session.getPhaseStatus(WorkflowPhase.INTAKE));
            assertEquals(SessionStatus.ACTIVE, session.getStatus());
            assertEquals(AuthorityHierarchy.defaults().getVersion(), session.getHierarchyVersion());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.SESSION_STARTED).size());
        }

        @Test
        @DisplayName("Should run the phase tasks and publish their outputs")
        void testDispatchAndSettle() throws Exception {
            WorkflowOrchestrator o = build(completingAgents(), FAST_OPTIONS);
            String sessionId = o.startSession(Map.of());

            List<WorkflowTask> tasks = o.dispatchPhaseTasks(sessionId);

            assertEquals(1, tasks.size());
            assertEquals(WorkflowPhase.INTAKE, settle(o, sessionId));
            WorkflowSession session = o.getSession(sessionId);
            assertEquals(PhaseStatus.TASKS_COMPLETE, session.getPhaseStatus(WorkflowPhase.INTAKE));
            assertEquals(TaskStatus.COMPLETED, o.getTask(tasks.get(0).getId()).getStatus());
            assertEquals("done", session.getSharedContext().get("intake"));
        }

        @Test
        @DisplayName("Should not create new tasks when a phase is dispatched twice")
        void testDispatchIdempotent() throws Exception {
            WorkflowOrchestrator o = build(completingAgents(), FAST_OPTIONS);
            String sessionId = o.startSession(Map.of());

            List<WorkflowTask> first = o.dispatchPhaseTasks(sessionId);
            settle(o, sessionId);
            List<WorkflowTask> second = o.dispatchPhaseTasks(sessionId);

            assertEquals(first.get(0).getId(), second.get(0).getId());
            assertEquals(1, o.getSession(sessionId).getTasks().size());
        }

        @Test
        @DisplayName("Should pass the intake context and session identity to agents")
        void testTaskContext() throws Exception {
            List<WorkflowTask> seen = new ArrayList<>();
            ScriptedAgent intake = new ScriptedAgent("intake", AgentCapability.INTAKE, (task, token) -> {
                synchronized (seen) {
                    seen.add(task);
                }
                return TaskResult.completed(Map.of());
            });
            WorkflowOrchestrator o = build(withIntakeAgent(intake), FAST_OPTIONS);
            String sessionId = o.startSession(Map.of("client", "Acme"));

            o.dispatchPhaseTasks(sessionId);
            settle(o, sessionId);

            WorkflowTask task = seen.get(0);
            assertEquals("Acme", task.getContextValue("client"));
            assertEquals(sessionId, task.getContextValue(TaskContextKeys.SESSION_ID));
            assertEquals("INTAKE", task.getContextValue(TaskContextKeys.PHASE));
            assertSame(o.getSession(sessionId).getAuthorityHierarchy(),
                    task.getContextValue(TaskContextKeys.AUTHORITY_HIERARCHY));
        }

        @Test
        @DisplayName("Should settle a phase with no assigned capability immediately")
        void testEmptyPhase() throws Exception {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .phase(new PhaseDefinition(WorkflowPhase.INTAKE, List.of(), false))
                    .phase(PhaseDefinition.of(WorkflowPhase.OUTLINE, AgentCapability.OUTLINE))
                    .phase(PhaseDefinition.of(WorkflowPhase.RESEARCH, AgentCapability.RESEARCH))
                    .phase(PhaseDefinition.of(WorkflowPhase.DRAFTING, AgentCapability.DRAFTING))
                    .phase(PhaseDefinition.of(WorkflowPhase.REVIEW, AgentCapability.REVIEW))
                    .phase(PhaseDefinition.of(WorkflowPhase.EDITING, AgentCapability.EDITING))
                    .build();
            WorkflowOrchestrator o = build(completingAgents(), definition, FAST_OPTIONS);
            String sessionId = o.startSession(Map.of());

            assertTrue(o.dispatchPhaseTasks(sessionId).isEmpty());
            assertEquals(WorkflowPhase.INTAKE, settle(o, sessionId));
            assertEquals(WorkflowPhase.OUTLINE, o.advancePhase(sessionId));
        }

        @Test
        @DisplayName("Should limit concurrent tasks per capability")
        void testConcurrencyLimit() throws Exception {
            AtomicInteger running = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            ScriptedAgent.Script slow = (task, token) -> {
                peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                Thread.sleep(50);
                running.decrementAndGet();
                return TaskResult.completed(Map.of());
            };
            AgentRegistry registry = completingAgents();
            registry.register(new ScriptedAgent("intake-2", AgentCapability.INTAKE, slow));
            registry.register(new ScriptedAgent("intake-3", AgentCapability.INTAKE, slow));
            registry.register(new ScriptedAgent("intake-4", AgentCapability.INTAKE, slow));
            WorkflowOrchestrator o = build(registry, FAST_OPTIONS.withConcurrency(AgentCapability.INTAKE, 1));
            String sessionId = o.startSession(Map.of());

            assertEquals(4, o.dispatchPhaseTasks(sessionId).size());
            settle(o, sessionId);

            assertEquals(1, peak.get());
        }

        @Test
        @DisplayName("Should keep other capabilities running while one waits for a permit")
        void testThrottledCapabilityDoesNotStarveWorkers() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            CountDownLatch researchRan = new CountDownLatch(1);
            ScriptedAgent.Script held = (task, token) -> {
                release.await(5, TimeUnit.SECONDS);
                return TaskResult.completed(Map.of());
            };
            AgentRegistry registry = new AgentRegistry();
            registry.register(new ScriptedAgent("intake-1", AgentCapability.INTAKE, held));
            registry.register(new ScriptedAgent("intake-2", AgentCapability.INTAKE, held));
            registry.register(new ScriptedAgent("intake-3", AgentCapability.INTAKE, held));
            registry.register(new ScriptedAgent("research", AgentCapability.RESEARCH, (task, token) -> {
                researchRan.countDown();
                return TaskResult.completed(Map.of());
            }));
            for (AgentCapability capability : AgentCapability.values()) {
                if (capability != AgentCapability.INTAKE && capability != AgentCapability.RESEARCH) {
                    registry.register(ScriptedAgent.completing(capability.name().toLowerCase(Locale.ROOT), capability));
                }
            }
            WorkflowDefinition.Builder definition = WorkflowDefinition.builder()
                    .phase(new PhaseDefinition(WorkflowPhase.INTAKE,
                            List.of(AgentCapability.INTAKE, AgentCapability.RESEARCH), false));
            for (WorkflowPhase phase : WorkflowPhase.values()) {
                if (phase != WorkflowPhase.INTAKE && !phase.isTerminal()) {
                    definition.phase(WorkflowDefinition.defaults().get(phase));
                }
            }
            WorkflowOptions options = new WorkflowOptions(new RetryPolicy(3, Duration.ZERO, 1.0, Duration.ZERO),
                    4, Map.of(AgentCapability.INTAKE, 1), 2, false, null);
            WorkflowOrchestrator o = build(registry, definition.build(), options);
            String sessionId = o.startSession(Map.of());

            List<WorkflowTask> tasks = o.dispatchPhaseTasks(sessionId);

            assertEquals(4, tasks.size());
            assertTrue(researchRan.await(5, TimeUnit.SECONDS), "research task starved behind throttled intake tasks");
            release.countDown();
            assertEquals(WorkflowPhase.INTAKE, settle(o, sessionId));
            for (WorkflowTask task : tasks) {
                assertEquals(TaskStatus.COMPLETED, o.getTask(task.getId()).getStatus());
            }
        }
    }

    @Nested
    @DisplayName("Advancing")
    class Advancing {

        @Test
        @DisplayName("Should refuse to advance while tasks are outstanding")
        void testNotReady() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            ScriptedAgent blocking = new ScriptedAgent("intake", AgentCapability.INTAKE, (task, token) -> {
                release.await(5, TimeUnit.SECONDS);
                return TaskResult.completed(Map.of());
            });
            WorkflowOrchestrator o = build(withIntakeAgent(blocking), FAST_OPTIONS);
            String sessionId = o.startSession(Map.of());

            assertThrows(PhaseNotReadyException.class, () -> o.advancePhase(sessionId));
            o.dispatchPhaseTasks(sessionId);
            assertThrows(PhaseNotReadyException.class, () -> o.advancePhase(sessionId));

            release.countDown();
            settle(o, sessionId);
            assertEquals(WorkflowPhase.OUTLINE, o.advancePhase(sessionId));
        }

        @Test
        @DisplayName("Should treat a repeated advance as a no-op")
        void testDoubleAdvance() throws Exception {
            WorkflowOrchestrator o = build(completingAgents(), FAST_OPTIONS);
            String sessionId = o.startSession(Map.of());
            o.dispatchPhaseTasks(sessionId);
            settle(o, sessionId);

            assertEquals(WorkflowPhase.OUTLINE, o.advancePhase(sessionId, "attorney-1"));
            assertEquals(WorkflowPhase.OUTLINE, o.advancePhase(sessionId, "attorney-1"));

            WorkflowSession session = o.getSession(sessionId);
            assertEquals(1, session.getPhaseHistory().size());
            assertEquals("attorney-1", session.getPhaseHistory().get(0).actorId());
            assertEquals(PhaseStatus.COMPLETED, session.getPhaseStatus(WorkflowPhase.INTAKE));
            assertEquals(1, auditService.getEntriesByAction(AuditAction.PHASE_ADVANCED).size());
        }

        @Test
        @DisplayName("Should hold a gated phase until approval is granted")
        void testApprovalGate() throws Exception {
            WorkflowOrchestrator o = build(completingAgents(), FAST_OPTIONS);
            String sessionId = o.startSession(Map.of());
            o.dispatchPhaseTasks(sessionId);
            settle(o, sessionId);
            o.advancePhase(sessionId);
            o.dispatchPhaseTasks(sessionId);
            settle(o, sessionId);

            assertEquals(PhaseStatus.AWAITING_APPROVAL, o.getSession(sessionId).getPhaseStatus(WorkflowPhase.OUTLINE));
            assertThrows(PhaseNotReadyException.class, () -> o.advancePhase(sessionId));

            String reviewId = o.requestApproval(sessionId, WorkflowPhase.OUTLINE);
            assertEquals(reviewId, o.requestApproval(sessionId, WorkflowPhase.OUTLINE));
            List<ReviewItem> pending = reviewQueue.getPendingByReason(ReviewReason.PHASE_APPROVAL);
            assertEquals(1, pending.size());
            assertEquals(sessionId, pending.get(0).getSubjectId());

            o.grantApproval(sessionId, WorkflowPhase.OUTLINE, "partner-7");

            assertEquals(PhaseStatus.TASKS_COMPLETE, o.getSession(sessionId).getPhaseStatus(WorkflowPhase.OUTLINE));
            assertEquals(ReviewStatus.APPROVED, reviewQueue.get(reviewId).orElseThrow().getStatus());
            assertNull(o.requestApproval(sessionId, WorkflowPhase.OUTLINE));
            assertEquals(WorkflowPhase.RESEARCH, o.advancePhase(sessionId));
            assertEquals("partner-7",
                    auditService.getEntriesByAction(AuditAction.APPROVAL_GRANTED).get(0).actorId());
        }

        @Test
        @DisplayName("Should accept approval before the gated phase finishes")
        void testEarlyApproval() throws Exception {
            WorkflowOrchestrator o = build(completingAgents(), FAST_OPTIONS);
            String sessionId = o.startSession(Map.of());
            o.dispatchPhaseTasks(sessionId);
            settle(o, sessionId);
            o.advancePhase(sessionId);

            o.grantApproval(sessionId, WorkflowPhase.OUTLINE, "partner-7");
            o.dispatchPhaseTasks(sessionId);
            settle(o, sessionId);

            assertEquals(WorkflowPhase.RESEARCH, o.advancePhase(sessionId));
        }

        @Test
        @DisplayName("Should reject approval requests for ungated phases")
        void testUngatedApproval() {
            WorkflowOrchestrator o = build(completingAgents(), FAST_OPTIONS);
            String sessionId = o.startSession(Map.of());

            assertThrows(IllegalArgumentException.class, () -> o.requestApproval(sessionId, WorkflowPhase.INTAKE));
            assertThrows(IllegalArgumentException.class,
                    () -> o.grantApproval(sessionId, WorkflowPhase.DRAFTING, "partner-7"));
        }

        @Test
        @DisplayName("Should advance through every phase on its own when enabled")
        void testAutoAdvance(@TempDir Path archive) throws Exception {
            WorkflowDefinition ungated = WorkflowDefinition.builder()
                    .phase(PhaseDefinition.of(WorkflowPhase.INTAKE, AgentCapability.INTAKE))
                    .phase(PhaseDefinition.of(WorkflowPhase.OUTLINE, AgentCapability.OUTLINE))
                    .phase(PhaseDefinition.of(WorkflowPhase.RESEARCH, AgentCapability.RESEARCH))
                    .phase(PhaseDefinition.of(WorkflowPhase.DRAFTING, AgentCapability.DRAFTING))
                    .phase(PhaseDefinition.of(WorkflowPhase.REVIEW, AgentCapability.REVIEW))
                    .phase(PhaseDefinition.of(WorkflowPhase.EDITING, AgentCapability.EDITING))
                    .build();
            WorkflowOrchestrator o = build(completingAgents(), ungated,
                    FAST_OPTIONS.withAutoAdvance(true).withArchiveDirectory(archive));
            String sessionId = o.startSession(Map.of());

            o.dispatchPhaseTasks(sessionId);
            await(() -> o.getSession(sessionId).getStatus() == SessionStatus.COMPLETED);

            WorkflowSession session = o.getSession(sessionId);
            assertEquals(WorkflowPhase.DONE, session.getCurrentPhase());
            assertEquals(6, session.getPhaseHistory().size());
            assertEquals(WorkflowPhase.DONE, o.advancePhase(sessionId));
            assertTrue(o.getSessionStore().archivedSessions().contains(session));
            assertEquals(1, auditService.getEntriesByAction(AuditAction.SESSION_RETIRED).size());
            await(() -> Files.exists(archive.resolve(sessionId + ".json")));
        }
    }

    @Nested
    @DisplayName("Failures and retries")
    class Failures {

        @Test
        @DisplayName("Should retry a failing task until it succeeds")
        void testRetryThenSucceed() throws Exception {
            AtomicInteger attempts = new AtomicInteger();
            ScriptedAgent flaky = new ScriptedAgent("intake", AgentCapability.INTAKE, (task, token) -> {
                if (attempts.incrementAndGet() < 3) {
                    throw new IllegalStateException("transient");
                }
                return TaskResult.completed(Map.of());
            });
            WorkflowOrchestrator o = build(withIntakeAgent(flaky), FAST_OPTIONS);
            String sessionId = o.startSession(Map.of());

            WorkflowTask task = o.dispatchPhaseTasks(sessionId).get(0);
            settle(o, sessionId);

            assertEquals(TaskStatus.COMPLETED, o.getTask(task.getId()).getStatus());
            assertEquals(3, o.getTask(task.getId()).getAttempt());
        }

        @Test
        @DisplayName("Should put the phase in error once attempts are exhausted")
        void testExhaustedRetries() throws Exception {
            ScriptedAgent broken = new ScriptedAgent("intake", AgentCapability.INTAKE, (task, token) -> {
                throw new IllegalStateException("court system offline");
            });
            WorkflowOrchestrator o = build(withIntakeAgent(broken), FAST_OPTIONS);
            String sessionId = o.startSession(Map.of());

            WorkflowTask task = o.dispatchPhaseTasks(sessionId).get(0);
            ExecutionException e = assertThrows(ExecutionException.class, () -> settle(o, sessionId));

            assertInstanceOf(PhaseFailedException.class, e.getCause());
            assertEquals(3, broken.calls());
            assertEquals(TaskStatus.FAILED, o.getTask(task.getId()).getStatus());
            assertTrue(o.getTask(task.getId()).getLastError().contains("court system offline"));
            assertEquals(PhaseStatus.ERROR, o.getSession(sessionId).getPhaseStatus(WorkflowPhase.INTAKE));
            assertThrows(PhaseFailedException.class, () -> o.advancePhase(sessionId));
            assertEquals(1, auditService.getEntriesByAction(AuditAction.TASK_FAILED).size());
        }

        @Test
        @DisplayName("Should fail the task when the agent throws an Error")
        void testAgentError() throws Exception {
            ScriptedAgent broken = new ScriptedAgent("intake", AgentCapability.INTAKE, (task, token) -> {
                throw new AssertionError("agent invariant broken");
            });
            WorkflowOrchestrator o = build(withIntakeAgent(broken),
                    FAST_OPTIONS.withTaskRetry(new RetryPolicy(2, Duration.ZERO, 1.0, Duration.ZERO)));
            String sessionId = o.startSession(Map.of());

            WorkflowTask task = o.dispatchPhaseTasks(sessionId).get(0);
            ExecutionException e = assertThrows(ExecutionException.class, () -> settle(o, sessionId));

            assertInstanceOf(PhaseFailedException.class, e.getCause());
            assertEquals(2, broken.calls());
            assertEquals(TaskStatus.FAILED, o.getTask(task.getId()).getStatus());
            assertTrue(o.getTask(task.getId()).getLastError().contains("agent invariant broken"));
            assertEquals(PhaseStatus.ERROR, o.getSession(sessionId).getPhaseStatus(WorkflowPhase.INTAKE));
        }

        @Test
        @DisplayName("Should re-dispatch failed tasks with a fresh attempt budget")
        void testRetryFailedPhase() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            ScriptedAgent recovering = new ScriptedAgent("intake", AgentCapability.INTAKE, (task, token) -> {
                if (calls.incrementAndGet() <= 3) {
                    throw new IllegalStateException("outage");
                }
                return TaskResult.completed(Map.of("recovered", true));
            });
            WorkflowOrchestrator o = build(withIntakeAgent(recovering), FAST_OPTIONS);
            String sessionId = o.startSession(Map.of());
            o.dispatchPhaseTasks(sessionId);
            assertThrows(ExecutionException.class, () -> settle(o, sessionId));

            List<WorkflowTask> retried = o.retryFailedPhase(sessionId);

            assertEquals(1, retried.size());
            assertEquals(WorkflowPhase.INTAKE, settle(o, sessionId));
            assertEquals(1, o.getTask(retried.get(0).getId()).getAttempt());
            assertEquals(PhaseStatus.TASKS_COMPLETE, o.getSession(sessionId).getPhaseStatus(WorkflowPhase.INTAKE));
            assertThrows(IllegalStateException.class, () -> o.retryFailedPhase(sessionId));
            assertEquals(1, auditService.getEntriesByAction(AuditAction.PHASE_RETRIED).size());
        }

        @Test
        @DisplayName("Should ignore a result for a task that already finished")
        void testLateResultIgnored() throws Exception {
            WorkflowOrchestrator o = build(completingAgents(), FAST_OPTIONS);
            String sessionId = o.startSession(Map.of());
            WorkflowTask task = o.dispatchPhaseTasks(sessionId).get(0);
            settle(o, sessionId);

            assertFalse(o.reportTaskResult(task.getId(), TaskResult.completed(Map.of("late", true))));
            assertFalse(o.reportTaskFailure(task.getId(), new IllegalStateException("late")));
            assertNull(o.getSession(sessionId).getSharedContext().get("late"));
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("Should stop running tasks and retire the session as abandoned")
        void testCancelSession() throws Exception {
            CountDownLatch started = new CountDownLatch(1);
            ScriptedAgent waiting = new ScriptedAgent("intake", AgentCapability.INTAKE, (task, token) -> {
                started.countDown();
                while (!token.isCancelled()) {
                    Thread.sleep(5);
                }
                return TaskResult.cancelled("stopped");
            });
            WorkflowOrchestrator o = build(withIntakeAgent(waiting), FAST_OPTIONS);
            String sessionId = o.startSession(Map.of());
            WorkflowTask task = o.dispatchPhaseTasks(sessionId).get(0);
            assertTrue(started.await(5, TimeUnit.SECONDS));

            assertTrue(o.cancelSession(sessionId, "client withdrew"));

            assertThrows(CancellationException.class, () -> settle(o, sessionId));
            await(() -> o.getTask(task.getId()).getStatus() == TaskStatus.CANCELLED);
            WorkflowSession session = o.getSession(sessionId);
            assertEquals(SessionStatus.ABANDONED, session.getStatus());
            assertEquals(PhaseStatus.CANCELLED, session.getPhaseStatus(WorkflowPhase.INTAKE));
            assertTrue(session.getCancellationToken().isCancelled());
            assertFalse(o.cancelSession(sessionId, "again"));
            assertThrows(PhaseNotReadyException.class, () -> o.advancePhase(sessionId));
            assertThrows(IllegalStateException.class, () -> o.dispatchPhaseTasks(sessionId));
            assertEquals("client withdrew",
                    auditService.getEntriesByAction(AuditAction.SESSION_CANCELLED).get(0).details().get("reason"));
        }

        @Test
        @DisplayName("Should cancel tasks that never started")
        void testCancelPendingTasks() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            ScriptedAgent.Script blocking = (task, token) -> {
                release.await(5, TimeUnit.SECONDS);
                return TaskResult.completed(Map.of());
            };
            AgentRegistry registry = completingAgents();
            registry.register(new ScriptedAgent("intake-slow", AgentCapability.INTAKE, blocking));
            WorkflowOrchestrator o = build(registry, FAST_OPTIONS.withConcurrency(AgentCapability.INTAKE, 1));
            String sessionId = o.startSession(Map.of());
            List<WorkflowTask> tasks = o.dispatchPhaseTasks(sessionId);

            o.cancelSession(sessionId, "stop");
            release.countDown();

            for (WorkflowTask task : tasks) {
                await(() -> o.getTask(task.getId()).getStatus() == TaskStatus.CANCELLED
                        || o.getTask(task.getId()).getStatus() == TaskStatus.COMPLETED);
            }
            assertTrue(tasks.stream().anyMatch(t -> o.getTask(t.getId()).getStatus() == TaskStatus.CANCELLED));
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Should report unknown sessions and tasks")
        void testNotFound() {
            WorkflowOrchestrator o = build(completingAgents(), FAST_OPTIONS);

            assertThrows(SessionNotFoundException.class, () -> o.dispatchPhaseTasks("missing"));
            assertThrows(SessionNotFoundException.class, () -> o.advancePhase("missing"));
            assertThrows(TaskNotFoundException.class, () -> o.reportTaskResult("missing", TaskResult.completed(Map.of())));
        }

        @Test
        @DisplayName("Should refuse a definition with a capability nobody serves")
        void testMissingCapability() {
            AgentRegistry registry = new AgentRegistry();
            registry.register(ScriptedAgent.completing("intake", AgentCapability.INTAKE));

            assertThrows(WorkflowConfigurationException.class, () -> build(registry, FAST_OPTIONS));
        }

        @Test
        @DisplayName("Should refuse duplicate agent ids")
        void testDuplicateAgent() {
            AgentRegistry registry = new AgentRegistry();
            registry.register(ScriptedAgent.completing("a", AgentCapability.INTAKE));

            assertThrows(WorkflowConfigurationException.class,
                    () -> registry.register(ScriptedAgent.completing("a", AgentCapability.OUTLINE)));
        }

        @Test
        @DisplayName("Should refuse an incomplete workflow definition")
        void testIncompleteDefinition() {
            assertThrows(WorkflowConfigurationException.class, () -> WorkflowDefinition.builder()
                    .phase(PhaseDefinition.of(WorkflowPhase.INTAKE, AgentCapability.INTAKE))
                    .build());
        }
    }
}
