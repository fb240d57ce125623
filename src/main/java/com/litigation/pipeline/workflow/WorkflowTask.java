package com.litigation.pipeline.workflow;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One unit of agent work within a phase.
 *
 * <p>State changes are made by the orchestrator while holding the owning session's
 * monitor; readers see the latest values through volatile fields.</p>
 */
public final class WorkflowTask {

    private final String id;
    private final String sessionId;
    private final WorkflowPhase phase;
    private final String agentId;
    private final AgentCapability capability;
    private final Map<String, Object> context;
    private final Instant createdAt;

    private volatile TaskStatus status = TaskStatus.PENDING;
    private volatile int attempt = 1;
    private volatile String lastError;
    private volatile TaskResult result;
    private volatile Instant updatedAt;

    WorkflowTask(String sessionId, WorkflowPhase phase, Agent agent, Map<String, Object> context, Instant now) {
        this.id = UUID.randomUUID().toString();
        this.sessionId = Objects.requireNonNull(sessionId);
        this.phase = Objects.requireNonNull(phase);
        this.agentId = agent.getId();
        this.capability = agent.getCapability();
        this.context = Map.copyOf(context);
        this.createdAt = now;
        this.updatedAt = now;
    }

    public String getId() {
        return id;
    }

    public String getSessionId() {
        return sessionId;
    }

    public WorkflowPhase getPhase() {
        return phase;
    }

    public String getAgentId() {
        return agentId;
    }

    public AgentCapability getCapability() {
        return capability;
    }

    /**
     * Intake context plus the outputs of earlier phases, as of dispatch.
     */
    public Map<String, Object> getContext() {
        return context;
    }

    public Object getContextValue(String key) {
        return context.get(key);
    }

    public TaskStatus getStatus() {
        return status;
    }

    /**
     * 1-based attempt number.
     */
    public int getAttempt() {
        return attempt;
    }

    public String getLastError() {
        return lastError;
    }

    public TaskResult getResult() {
        return result;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    void markActive(Instant now) {
        status = TaskStatus.ACTIVE;
        updatedAt = now;
    }

    void complete(TaskResult taskResult, Instant now) {
        status = TaskStatus.COMPLETED;
        result = taskResult;
        updatedAt = now;
    }

    void requeue(String error, Instant now) {
        status = TaskStatus.PENDING;
        lastError = error;
        attempt++;
        updatedAt = now;
    }

    void fail(String error, Instant now) {
        status = TaskStatus.FAILED;
        lastError = error;
        updatedAt = now;
    }

    void cancel(String reason, Instant now) {
        status = TaskStatus.CANCELLED;
        lastError = reason;
        updatedAt = now;
    }

    void resetForRetry(Instant now) {
        status = TaskStatus.PENDING;
        attempt = 1;
        updatedAt = now;
    }

    @Override
    public String toString() {
        return "WorkflowTask{id='" + id + "', phase=" + phase + ", agent='" + agentId
                + "', status=" + status + ", attempt=" + attempt + '}';
    }
}
