package com.litigation.pipeline.workflow;

import com.litigation.pipeline.core.CancellationToken;
import com.litigation.pipeline.jurisdiction.AuthorityHierarchy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * State of one workflow run, from intake to retirement.
 *
 * <p>The orchestrator mutates a session only while holding its monitor. The public
 * accessors synchronize on the same monitor and return copies.</p>
 */
public final class WorkflowSession {

    private final String id;
    private final Map<String, Object> intakeContext;
    private final AuthorityHierarchy authorityHierarchy;
    private final CancellationToken cancellationToken = CancellationToken.create();
    private final Instant createdAt;

    private final Map<String, WorkflowTask> tasks = new LinkedHashMap<>();
    private final Map<WorkflowPhase, PhaseStatus> phaseStatuses = new EnumMap<>(WorkflowPhase.class);
    private final Map<WorkflowPhase, Boolean> approvals = new EnumMap<>(WorkflowPhase.class);
    private final Map<WorkflowPhase, String> approvalRequests = new EnumMap<>(WorkflowPhase.class);
    private final List<PhaseTransition> phaseHistory = new ArrayList<>();
    private final Map<String, Object> sharedContext = new LinkedHashMap<>();

    private WorkflowPhase currentPhase = WorkflowPhase.INTAKE;
    private SessionStatus status = SessionStatus.ACTIVE;
    private CompletableFuture<WorkflowPhase> phaseSettled = new CompletableFuture<>();
    private long stateVersion;
    private long evaluatedVersion = -1;
    private Instant retiredAt;

    WorkflowSession(String id, Map<String, Object> intakeContext, AuthorityHierarchy authorityHierarchy, Instant now) {
        this.id = Objects.requireNonNull(id);
        this.intakeContext = intakeContext != null ? Map.copyOf(intakeContext) : Map.of();
        this.authorityHierarchy = Objects.requireNonNull(authorityHierarchy);
        this.createdAt = now;
        this.sharedContext.putAll(this.intakeContext);
        this.phaseStatuses.put(currentPhase, PhaseStatus.PENDING);
    }

    public String getId() {
        return id;
    }

    public Map<String, Object> getIntakeContext() {
        return intakeContext;
    }

    /**
     * Authority hierarchy pinned when the session started. Later hierarchy versions
     * apply to later sessions only.
     */
    public AuthorityHierarchy getAuthorityHierarchy() {
        return authorityHierarchy;
    }

    public long getHierarchyVersion() {
        return authorityHierarchy.getVersion();
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized WorkflowPhase getCurrentPhase() {
        return currentPhase;
    }

    public synchronized SessionStatus getStatus() {
        return status;
    }

    public synchronized PhaseStatus getPhaseStatus(WorkflowPhase phase) {
        return phaseStatuses.getOrDefault(phase, PhaseStatus.PENDING);
    }

    public synchronized Map<WorkflowPhase, PhaseStatus> getPhaseStatuses() {
        return Map.copyOf(phaseStatuses);
    }

    public synchronized List<PhaseTransition> getPhaseHistory() {
        return List.copyOf(phaseHistory);
    }

    public synchronized List<WorkflowTask> getTasks() {
        return List.copyOf(tasks.values());
    }

    public synchronized List<WorkflowTask> getTasks(WorkflowPhase phase) {
        return tasks.values().stream().filter(t -> t.getPhase() == phase).collect(Collectors.toList());
    }

    public synchronized Optional<WorkflowTask> getTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public synchronized Map<WorkflowPhase, Boolean> getApprovals() {
        return Map.copyOf(approvals);
    }

    public synchronized boolean isApproved(WorkflowPhase phase) {
        return approvals.getOrDefault(phase, false);
    }

    public synchronized Map<String, Object> getSharedContext() {
        return Map.copyOf(sharedContext);
    }

    public synchronized Instant getRetiredAt() {
        return retiredAt;
    }

    public synchronized boolean isRetired() {
        return status != SessionStatus.ACTIVE;
    }

    // mutators, called by the orchestrator under this session's monitor

    void addTask(WorkflowTask task) {
        tasks.put(task.getId(), task);
    }

    void setPhaseStatus(WorkflowPhase phase, PhaseStatus phaseStatus) {
        phaseStatuses.put(phase, phaseStatus);
        stateVersion++;
    }

    void approve(WorkflowPhase phase) {
        approvals.put(phase, true);
        stateVersion++;
    }

    String getApprovalRequest(WorkflowPhase phase) {
        return approvalRequests.get(phase);
    }

    void setApprovalRequest(WorkflowPhase phase, String reviewId) {
        approvalRequests.put(phase, reviewId);
    }

    void publish(Map<String, Object> outputs) {
        sharedContext.putAll(outputs);
    }

    void advanceTo(WorkflowPhase next, PhaseTransition transition) {
        phaseHistory.add(transition);
        currentPhase = next;
        phaseStatuses.put(next, PhaseStatus.PENDING);
        phaseSettled = new CompletableFuture<>();
        stateVersion++;
    }

    CompletableFuture<WorkflowPhase> phaseSettledFuture() {
        return phaseSettled;
    }

    void resetPhaseSettled() {
        phaseSettled = new CompletableFuture<>();
    }

    /**
     * Marks the current state as evaluated for advancement.
     *
     * @return false if this state was evaluated before
     */
    boolean markEvaluated() {
        if (evaluatedVersion == stateVersion) {
            return false;
        }
        evaluatedVersion = stateVersion;
        return true;
    }

    void retire(SessionStatus finalStatus, Instant now) {
        status = finalStatus;
        retiredAt = now;
    }

    @Override
    public synchronized String toString() {
        return "WorkflowSession{id='" + id + "', phase=" + currentPhase + ", status=" + status
                + ", tasks=" + tasks.size() + '}';
    }
}
