package com.litigation.pipeline.workflow;

import com.litigation.pipeline.audit.AuditAction;
import com.litigation.pipeline.audit.AuditService;
import com.litigation.pipeline.core.CancellationToken;
import com.litigation.pipeline.core.OperationCancelledException;
import com.litigation.pipeline.jurisdiction.AuthorityHierarchyRegistry;
import com.litigation.pipeline.logging.LogContext;
import com.litigation.pipeline.metrics.MetricsService;
import com.litigation.pipeline.metrics.NoOpMetricsService;
import com.litigation.pipeline.resilience.RetryPolicy;
import com.litigation.pipeline.review.InMemoryReviewQueue;
import com.litigation.pipeline.review.ReviewItem;
import com.litigation.pipeline.review.ReviewQueue;
import com.litigation.pipeline.review.ReviewReason;
import com.litigation.pipeline.snapshot.JsonSnapshotWriter;
import com.litigation.pipeline.snapshot.SessionSnapshot;
import com.litigation.pipeline.tracing.NoOpTracingService;
import com.litigation.pipeline.tracing.Span;
import com.litigation.pipeline.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Moves workflow sessions through their phases.
 *
 * <p>Tasks of a phase run concurrently on a worker pool, at most
 * {@link WorkflowOptions#concurrencyFor(AgentCapability)} per capability, and report back
 * through {@link #reportTaskResult} or {@link #reportTaskFailure}. Agents running outside
 * this process report through the same methods. Failed tasks are retried with backoff
 * until their attempts are exhausted; the phase then enters {@link PhaseStatus#ERROR} and
 * stays there until {@link #retryFailedPhase} or cancellation.</p>
 *
 * <p>A session is mutated only while holding its monitor. Agents never run under it.</p>
 */
public class WorkflowOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    private final AgentRegistry agents;
    private final WorkflowDefinition definition;
    private final SessionStore sessionStore;
    private final ReviewQueue reviewQueue;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final AuthorityHierarchyRegistry hierarchyRegistry;
    private final WorkflowOptions options;
    private final Clock clock;
    private final JsonSnapshotWriter snapshotWriter;

    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final Map<AgentCapability, Semaphore> permits = new EnumMap<>(AgentCapability.class);
    private final Map<AgentCapability, Queue<Runnable>> parked = new EnumMap<>(AgentCapability.class);
    private final Map<String, String> sessionByTask = new ConcurrentHashMap<>();

    private WorkflowOrchestrator(Builder builder) {
        this.agents = Objects.requireNonNull(builder.agents, "agents are required");
        this.definition = builder.definition != null ? builder.definition : WorkflowDefinition.defaults();
        this.sessionStore = builder.sessionStore != null ? builder.sessionStore : new InMemorySessionStore();
        this.reviewQueue = builder.reviewQueue != null ? builder.reviewQueue : new InMemoryReviewQueue();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.hierarchyRegistry = builder.hierarchyRegistry != null
                ? builder.hierarchyRegistry : new AuthorityHierarchyRegistry();
        this.options = builder.options != null ? builder.options : WorkflowOptions.defaults();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.snapshotWriter = new JsonSnapshotWriter();

        agents.validate(definition);
        for (AgentCapability capability : AgentCapability.values()) {
            permits.put(capability, new Semaphore(options.concurrencyFor(capability)));
            parked.put(capability, new ConcurrentLinkedQueue<>());
        }
        this.workers = Executors.newFixedThreadPool(options.workerThreads(), namedThreads("workflow-worker"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(namedThreads("workflow-retry"));
        log.info("WorkflowOrchestrator initialized: agents={} workers={} maxAttempts={} autoAdvance={}",
                agents.size(), options.workerThreads(), options.taskRetry().maxAttempts(), options.autoAdvance());
    }

    /**
     * Creates a session in the first phase, pinned to the current authority hierarchy.
     *
     * @return the new session id
     */
    public String startSession(Map<String, Object> intakeContext) {
        String sessionId = UUID.randomUUID().toString();
        WorkflowSession session = new WorkflowSession(sessionId, intakeContext, hierarchyRegistry.current(),
                clock.instant());
        sessionStore.save(session);
        auditService.record(AuditAction.SESSION_STARTED, sessionId, AuditService.SYSTEM_ACTOR,
                Map.of("hierarchyVersion", session.getHierarchyVersion()));
        try (LogContext ignored = LogContext.forSession(sessionId, "start")) {
            log.info("session.started sessionId={} hierarchyVersion={}", sessionId, session.getHierarchyVersion());
        }
        return sessionId;
    }

    /**
     * Creates and starts one task per agent assigned to the current phase. Calling it again
     * for a phase that was already dispatched returns that phase's tasks without creating
     * new ones.
     */
    public List<WorkflowTask> dispatchPhaseTasks(String sessionId) {
        WorkflowSession session = requireSession(sessionId);
        List<WorkflowTask> created = new ArrayList<>();
        synchronized (session) {
            requireActive(session);
            WorkflowPhase phase = session.getCurrentPhase();
            if (phase.isTerminal()) {
                return List.of();
            }
            if (session.getPhaseStatus(phase) != PhaseStatus.PENDING) {
                return session.getTasks(phase);
            }
            Map<String, Object> context = taskContext(session, phase);
            Instant now = clock.instant();
            for (AgentCapability capability : definition.get(phase).capabilities()) {
                for (Agent agent : agents.agentsFor(capability)) {
                    WorkflowTask task = new WorkflowTask(sessionId, phase, agent, context, now);
                    session.addTask(task);
                    sessionByTask.put(task.getId(), sessionId);
                    created.add(task);
                }
            }
            session.setPhaseStatus(phase, PhaseStatus.IN_PROGRESS);
            log.info("phase.dispatched sessionId={} phase={} tasks={}", sessionId, phase, created.size());
            if (created.isEmpty()) {
                settle(session, phase);
            }
        }
        created.forEach(task -> submit(session, task));
        return List.copyOf(created);
    }

    /**
     * Records a task's result. A result for a task that already finished is ignored, and a
     * result arriving after the session was cancelled marks the task cancelled.
     *
     * @return false if the result was ignored
     */
    public boolean reportTaskResult(String taskId, TaskResult result) {
        Objects.requireNonNull(result, "result is required");
        WorkflowSession session = sessionForTask(taskId);
        synchronized (session) {
            WorkflowTask task = requireTask(session, taskId);
            if (task.getStatus().isTerminal()) {
                log.debug("task.report.ignored taskId={} status={}", taskId, task.getStatus());
                return false;
            }
            Instant now = clock.instant();
            CancellationToken token = session.getCancellationToken();
            if (result.cancelled() || token.isCancelled()) {
                task.cancel(token.getReason() != null ? token.getReason() : result.summary(), now);
                metricsService.incrementTaskOutcome(task.getCapability().name(), "cancelled");
                log.info("task.cancelled sessionId={} taskId={}", session.getId(), taskId);
                return true;
            }
            task.complete(result, now);
            session.publish(result.outputs());
            metricsService.incrementTaskOutcome(task.getCapability().name(), "completed");
            log.info("task.completed sessionId={} taskId={} agent={} attempt={}",
                    session.getId(), taskId, task.getAgentId(), task.getAttempt());
            evaluatePhase(session, task.getPhase());
        }
        autoAdvance(session);
        return true;
    }

    /**
     * Records a task failure. The task is requeued with exponential backoff while attempts
     * remain; otherwise it fails and the phase enters {@link PhaseStatus#ERROR}.
     *
     * @return false if the failure was ignored because the task already finished
     */
    public boolean reportTaskFailure(String taskId, Throwable error) {
        WorkflowSession session = sessionForTask(taskId);
        synchronized (session) {
            WorkflowTask task = requireTask(session, taskId);
            if (task.getStatus().isTerminal()) {
                log.debug("task.failure.ignored taskId={} status={}", taskId, task.getStatus());
                return false;
            }
            Instant now = clock.instant();
            String message = String.valueOf(error);
            CancellationToken token = session.getCancellationToken();
            if (token.isCancelled()) {
                task.cancel(token.getReason(), now);
                metricsService.incrementTaskOutcome(task.getCapability().name(), "cancelled");
                return true;
            }
            RetryPolicy retry = options.taskRetry();
            if (retry.canRetry(task.getAttempt())) {
                Duration backoff = retry.backoffFor(task.getAttempt());
                task.requeue(message, now);
                metricsService.incrementTaskOutcome(task.getCapability().name(), "retried");
                log.warn("task.retry sessionId={} taskId={} nextAttempt={} backoffMs={} error={}",
                        session.getId(), taskId, task.getAttempt(), backoff.toMillis(), message);
                scheduleRetry(session, task, backoff);
                return true;
            }
            task.fail(message, now);
            session.setPhaseStatus(task.getPhase(), PhaseStatus.ERROR);
            metricsService.incrementTaskOutcome(task.getCapability().name(), "failed");
            auditService.record(AuditAction.TASK_FAILED, session.getId(), AuditService.SYSTEM_ACTOR,
                    Map.of("taskId", taskId, "phase", task.getPhase().name(),
                            "attempts", task.getAttempt(), "error", message));
            log.error("task.failed sessionId={} taskId={} phase={} attempts={} error={}",
                    session.getId(), taskId, task.getPhase(), task.getAttempt(), message);
            session.phaseSettledFuture().completeExceptionally(new PhaseFailedException(
                    "Phase " + task.getPhase() + " of session " + session.getId() + " failed: task "
                            + taskId + " exhausted " + task.getAttempt() + " attempts (" + message + ")"));
        }
        return true;
    }

    /**
     * Submits a human-review item asking to approve leaving the given phase.
     *
     * @return id of the review item; the existing one if already requested, null if the phase is already approved
     */
    public String requestApproval(String sessionId, WorkflowPhase phase) {
        requireGated(phase);
        WorkflowSession session = requireSession(sessionId);
        synchronized (session) {
            requireActive(session);
            if (session.isApproved(phase)) {
                return null;
            }
            String existing = session.getApprovalRequest(phase);
            if (existing != null) {
                return existing;
            }
            ReviewItem item = reviewQueue.submit(ReviewItem.builder()
                    .reason(ReviewReason.PHASE_APPROVAL)
                    .subjectId(sessionId)
                    .relatedIds(List.of(phase.name()))
                    .summary("Approve leaving phase " + phase + " of session " + sessionId)
                    .submittedAt(clock.instant())
                    .build());
            session.setApprovalRequest(phase, item.getId());
            auditService.record(AuditAction.APPROVAL_REQUESTED, sessionId, AuditService.SYSTEM_ACTOR,
                    Map.of("phase", phase.name(), "reviewId", item.getId()));
            log.info("approval.requested sessionId={} phase={} reviewId={}", sessionId, phase, item.getId());
            return item.getId();
        }
    }

    /**
     * Grants the approval gate of a phase. Granting twice has no further effect.
     */
    public void grantApproval(String sessionId, WorkflowPhase phase, String approverId) {
        requireGated(phase);
        Objects.requireNonNull(approverId, "approverId is required");
        WorkflowSession session = requireSession(sessionId);
        synchronized (session) {
            requireActive(session);
            if (session.isApproved(phase)) {
                return;
            }
            session.approve(phase);
            String reviewId = session.getApprovalRequest(phase);
            if (reviewId != null && reviewQueue.get(reviewId).map(ReviewItem::isPending).orElse(false)) {
                reviewQueue.approve(reviewId, approverId, "phase approval granted");
            }
            auditService.record(AuditAction.APPROVAL_GRANTED, sessionId, approverId, Map.of("phase", phase.name()));
            log.info("approval.granted sessionId={} phase={} approver={}", sessionId, phase, approverId);
            if (phase == session.getCurrentPhase() && session.getPhaseStatus(phase) == PhaseStatus.AWAITING_APPROVAL) {
                session.setPhaseStatus(phase, PhaseStatus.TASKS_COMPLETE);
            }
        }
        autoAdvance(session);
    }

    public WorkflowPhase advancePhase(String sessionId) {
        return advancePhase(sessionId, AuditService.SYSTEM_ACTOR);
    }

    /**
     * Moves the session to the next phase once every task of the current phase completed
     * and, where the phase is gated, approval was granted.
     *
     * <p>A call right after an advance, while the new phase has not been dispatched yet,
     * is a no-op, so a retried request cannot advance twice. Advancing a completed session
     * is a no-op too.</p>
     *
     * @return the session's phase after the call
     * @throws PhaseNotReadyException if tasks are outstanding or approval is missing
     * @throws PhaseFailedException   if the current phase is in error
     */
    public WorkflowPhase advancePhase(String sessionId, String actorId) {
        WorkflowSession session = requireSession(sessionId);
        WorkflowPhase reached;
        synchronized (session) {
            if (session.getStatus() == SessionStatus.COMPLETED) {
                return WorkflowPhase.DONE;
            }
            if (session.getStatus() == SessionStatus.ABANDONED) {
                throw new PhaseNotReadyException("Session " + sessionId + " was cancelled");
            }
            WorkflowPhase phase = session.getCurrentPhase();
            PhaseStatus status = session.getPhaseStatus(phase);
            if (status == PhaseStatus.PENDING && justAdvancedInto(session, phase)) {
                log.debug("phase.advance.noop sessionId={} phase={}", sessionId, phase);
                return phase;
            }
            if (status == PhaseStatus.ERROR) {
                throw new PhaseFailedException("Phase " + phase + " of session " + sessionId + " is in error");
            }
            if (status == PhaseStatus.PENDING || status == PhaseStatus.IN_PROGRESS) {
                throw new PhaseNotReadyException("Phase " + phase + " of session " + sessionId
                        + " has outstanding tasks (" + status + ")");
            }
            if (definition.requiresApproval(phase) && !session.isApproved(phase)) {
                throw new PhaseNotReadyException("Phase " + phase + " of session " + sessionId
                        + " requires approval");
            }
            reached = advance(session, actorId);
        }
        afterAdvance(session, reached);
        return reached;
    }

    /**
     * Signals every in-flight task and provider call of the session to stop, and retires
     * the session as abandoned. Graph writes already made are kept.
     *
     * @return false if the session was already retired
     */
    public boolean cancelSession(String sessionId, String reason) {
        WorkflowSession session = requireSession(sessionId);
        synchronized (session) {
            if (session.isRetired()) {
                return false;
            }
            session.getCancellationToken().cancel(reason);
            Instant now = clock.instant();
            for (WorkflowTask task : session.getTasks()) {
                if (task.getStatus() == TaskStatus.PENDING) {
                    task.cancel(reason, now);
                }
            }
            session.setPhaseStatus(session.getCurrentPhase(), PhaseStatus.CANCELLED);
            session.phaseSettledFuture().completeExceptionally(
                    new CancellationException("Session " + sessionId + " cancelled: " + reason));
            session.retire(SessionStatus.ABANDONED, now);
            sessionStore.archive(session);
            auditService.record(AuditAction.SESSION_CANCELLED, sessionId, AuditService.SYSTEM_ACTOR,
                    Map.of("reason", String.valueOf(reason)));
            log.info("session.cancelled sessionId={} reason={}", sessionId, reason);
        }
        exportArchive(session);
        return true;
    }

    /**
     * Future completing when every task of the current phase has completed. It completes
     * exceptionally with {@link PhaseFailedException} when the phase fails and with
     * {@link CancellationException} when the session is cancelled.
     */
    public CompletableFuture<WorkflowPhase> whenPhaseSettled(String sessionId) {
        WorkflowSession session = requireSession(sessionId);
        synchronized (session) {
            return session.phaseSettledFuture();
        }
    }

    /**
     * Re-dispatches the failed tasks of a phase in error, each with a fresh attempt budget.
     */
    public List<WorkflowTask> retryFailedPhase(String sessionId) {
        WorkflowSession session = requireSession(sessionId);
        List<WorkflowTask> retried;
        synchronized (session) {
            requireActive(session);
            WorkflowPhase phase = session.getCurrentPhase();
            if (session.getPhaseStatus(phase) != PhaseStatus.ERROR) {
                throw new IllegalStateException("Phase " + phase + " of session " + sessionId + " is not in error");
            }
            Instant now = clock.instant();
            retried = session.getTasks(phase).stream()
                    .filter(task -> task.getStatus() == TaskStatus.FAILED)
                    .collect(Collectors.toList());
            retried.forEach(task -> task.resetForRetry(now));
            session.setPhaseStatus(phase, PhaseStatus.IN_PROGRESS);
            session.resetPhaseSettled();
            auditService.record(AuditAction.PHASE_RETRIED, sessionId, AuditService.SYSTEM_ACTOR,
                    Map.of("phase", phase.name(), "tasks", retried.size()));
            log.info("phase.retried sessionId={} phase={} tasks={}", sessionId, phase, retried.size());
        }
        retried.forEach(task -> submit(session, task));
        return List.copyOf(retried);
    }

    public WorkflowSession getSession(String sessionId) {
        return requireSession(sessionId);
    }

    public SessionSnapshot snapshot(String sessionId) {
        return SessionSnapshot.from(requireSession(sessionId));
    }

    public WorkflowTask getTask(String taskId) {
        return requireTask(sessionForTask(taskId), taskId);
    }

    public SessionStore getSessionStore() {
        return sessionStore;
    }

    public WorkflowDefinition getDefinition() {
        return definition;
    }

    // ---- task execution ----

    private void submit(WorkflowSession session, WorkflowTask task) {
        try {
            workers.execute(() -> runTask(session, task));
        } catch (RejectedExecutionException e) {
            log.warn("task.rejected sessionId={} taskId={} reason=orchestrator_closed", session.getId(), task.getId());
        }
    }

    private void scheduleRetry(WorkflowSession session, WorkflowTask task, Duration backoff) {
        try {
            scheduler.schedule(() -> submit(session, task), backoff.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("task.retry.rejected sessionId={} taskId={} reason=orchestrator_closed",
                    session.getId(), task.getId());
        }
    }

    private void runTask(WorkflowSession session, WorkflowTask task) {
        Agent agent = agents.get(task.getAgentId()).orElse(null);
        if (agent == null) {
            reportTaskFailure(task.getId(), new WorkflowConfigurationException("Agent " + task.getAgentId() + " is gone"));
            return;
        }
        AgentCapability capability = task.getCapability();
        Semaphore semaphore = permits.get(capability);
        if (!semaphore.tryAcquire()) {
            parked.get(capability).add(() -> runTask(session, task));
            // a permit released between the failed tryAcquire and the park would otherwise be missed
            if (semaphore.tryAcquire()) {
                semaphore.release();
                resumeParked(capability);
            }
            return;
        }
        try {
            CancellationToken token = session.getCancellationToken();
            synchronized (session) {
                if (task.getStatus() != TaskStatus.PENDING) {
                    return;
                }
                if (token.isCancelled()) {
                    task.cancel(token.getReason(), clock.instant());
                    return;
                }
                task.markActive(clock.instant());
            }
            execute(agent, task, token);
        } finally {
            semaphore.release();
            resumeParked(capability);
        }
    }

    private void resumeParked(AgentCapability capability) {
        Runnable next = parked.get(capability).poll();
        if (next == null) {
            return;
        }
        try {
            workers.execute(next);
        } catch (RejectedExecutionException e) {
            log.warn("task.resume.rejected capability={} reason=orchestrator_closed", capability);
        }
    }

    private void execute(Agent agent, WorkflowTask task, CancellationToken token) {
        try (LogContext ignored = LogContext.forTask(task.getSessionId(), task.getId(), task.getPhase().name());
             Span span = tracingService.startSpan("workflow.task", Map.of(
                     "sessionId", task.getSessionId(),
                     "phase", task.getPhase().name(),
                     "agent", task.getAgentId(),
                     "attempt", String.valueOf(task.getAttempt())))) {
            TaskResult result;
            try {
                token.throwIfCancelled();
                result = agent.executeTask(task, token);
                if (result == null) {
                    throw new IllegalStateException("Agent " + agent.getId() + " returned no result");
                }
            } catch (OperationCancelledException e) {
                result = TaskResult.cancelled(e.getMessage());
            } catch (Exception | Error e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                reportTaskFailure(task.getId(), e);
                if (e instanceof VirtualMachineError) {
                    throw (VirtualMachineError) e;
                }
                return;
            }
            span.setStatus(Span.SpanStatus.OK);
            reportTaskResult(task.getId(), result);
        }
    }

    // ---- phase state, called under the session monitor ----

    private void evaluatePhase(WorkflowSession session, WorkflowPhase phase) {
        if (phase != session.getCurrentPhase() || session.getPhaseStatus(phase) != PhaseStatus.IN_PROGRESS) {
            return;
        }
        boolean allCompleted = session.getTasks(phase).stream()
                .allMatch(task -> task.getStatus() == TaskStatus.COMPLETED);
        if (allCompleted) {
            settle(session, phase);
        }
    }

    private void settle(WorkflowSession session, WorkflowPhase phase) {
        boolean awaitingApproval = definition.requiresApproval(phase) && !session.isApproved(phase);
        session.setPhaseStatus(phase, awaitingApproval ? PhaseStatus.AWAITING_APPROVAL : PhaseStatus.TASKS_COMPLETE);
        session.phaseSettledFuture().complete(phase);
        log.info("phase.tasks_complete sessionId={} phase={} awaitingApproval={}",
                session.getId(), phase, awaitingApproval);
    }

    private boolean isReady(WorkflowSession session) {
        WorkflowPhase phase = session.getCurrentPhase();
        return session.getStatus() == SessionStatus.ACTIVE
                && !phase.isTerminal()
                && session.getPhaseStatus(phase) == PhaseStatus.TASKS_COMPLETE
                && (!definition.requiresApproval(phase) || session.isApproved(phase));
    }

    private boolean justAdvancedInto(WorkflowSession session, WorkflowPhase phase) {
        List<PhaseTransition> history = session.getPhaseHistory();
        return !history.isEmpty() && history.get(history.size() - 1).to() == phase;
    }

    private WorkflowPhase advance(WorkflowSession session, String actorId) {
        WorkflowPhase from = session.getCurrentPhase();
        WorkflowPhase to = from.next();
        Instant now = clock.instant();
        session.setPhaseStatus(from, PhaseStatus.COMPLETED);
        session.advanceTo(to, new PhaseTransition(from, to, now, actorId));
        metricsService.incrementPhaseAdvanced(from.name());
        auditService.record(AuditAction.PHASE_ADVANCED, session.getId(), actorId,
                Map.of("from", from.name(), "to", to.name()));
        log.info("phase.advanced sessionId={} from={} to={}", session.getId(), from, to);
        if (to.isTerminal()) {
            session.setPhaseStatus(to, PhaseStatus.COMPLETED);
            session.phaseSettledFuture().complete(to);
            session.retire(SessionStatus.COMPLETED, now);
            sessionStore.archive(session);
            auditService.record(AuditAction.SESSION_RETIRED, session.getId(), AuditService.SYSTEM_ACTOR);
            log.info("session.retired sessionId={} status={}", session.getId(), SessionStatus.COMPLETED);
        }
        return to;
    }

    private void autoAdvance(WorkflowSession session) {
        if (!options.autoAdvance()) {
            return;
        }
        WorkflowPhase reached;
        synchronized (session) {
            if (!session.markEvaluated() || !isReady(session)) {
                return;
            }
            reached = advance(session, AuditService.SYSTEM_ACTOR);
        }
        afterAdvance(session, reached);
    }

    private void afterAdvance(WorkflowSession session, WorkflowPhase reached) {
        if (reached.isTerminal()) {
            exportArchive(session);
        } else if (options.autoAdvance()) {
            dispatchPhaseTasks(session.getId());
        }
    }

    // ---- helpers ----

    private Map<String, Object> taskContext(WorkflowSession session, WorkflowPhase phase) {
        Map<String, Object> context = new HashMap<>();
        session.getSharedContext().forEach((key, value) -> {
            if (value != null) {
                context.put(key, value);
            }
        });
        context.put(TaskContextKeys.SESSION_ID, session.getId());
        context.put(TaskContextKeys.PHASE, phase.name());
        context.put(TaskContextKeys.AUTHORITY_HIERARCHY, session.getAuthorityHierarchy());
        return context;
    }

    private void exportArchive(WorkflowSession session) {
        if (options.archiveDirectory() == null) {
            return;
        }
        try {
            snapshotWriter.writeSession(SessionSnapshot.from(session),
                    options.archiveDirectory().resolve(session.getId() + ".json"));
        } catch (IOException e) {
            log.warn("session.archive.export.failed sessionId={} error={}", session.getId(), e.getMessage());
        }
    }

    private WorkflowSession requireSession(String sessionId) {
        return sessionStore.find(sessionId)
                .orElseThrow(() -> new SessionNotFoundException("Session not found: " + sessionId));
    }

    private WorkflowSession sessionForTask(String taskId) {
        String sessionId = sessionByTask.get(taskId);
        if (sessionId == null) {
            throw new TaskNotFoundException("Task not found: " + taskId);
        }
        return requireSession(sessionId);
    }

    private static WorkflowTask requireTask(WorkflowSession session, String taskId) {
        return session.getTask(taskId).orElseThrow(() -> new TaskNotFoundException("Task not found: " + taskId));
    }

    private static void requireActive(WorkflowSession session) {
        if (session.getStatus() != SessionStatus.ACTIVE) {
            throw new IllegalStateException("Session " + session.getId() + " is " + session.getStatus());
        }
    }

    private void requireGated(WorkflowPhase phase) {
        if (!definition.requiresApproval(phase)) {
            throw new IllegalArgumentException("Phase " + phase + " does not require approval");
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private AgentRegistry agents;
        private WorkflowDefinition definition;
        private SessionStore sessionStore;
        private ReviewQueue reviewQueue;
        private AuditService auditService;
        private MetricsService metricsService;
        private TracingService tracingService;
        private AuthorityHierarchyRegistry hierarchyRegistry;
        private WorkflowOptions options;
        private Clock clock;

        public Builder agents(AgentRegistry agents) {
            this.agents = agents;
            return this;
        }

        public Builder definition(WorkflowDefinition definition) {
            this.definition = definition;
            return this;
        }

        public Builder sessionStore(SessionStore sessionStore) {
            this.sessionStore = sessionStore;
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

        public Builder options(WorkflowOptions options) {
            this.options = options;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public WorkflowOrchestrator build() {
            return new WorkflowOrchestrator(this);
        }
    }
}
