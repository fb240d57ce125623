package com.litigation.pipeline.snapshot;

import com.litigation.pipeline.workflow.AgentCapability;
import com.litigation.pipeline.workflow.PhaseStatus;
import com.litigation.pipeline.workflow.PhaseTransition;
import com.litigation.pipeline.workflow.SessionStatus;
import com.litigation.pipeline.workflow.TaskStatus;
import com.litigation.pipeline.workflow.WorkflowPhase;
import com.litigation.pipeline.workflow.WorkflowSession;
import com.litigation.pipeline.workflow.WorkflowTask;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Read-only copy of a workflow session for consumers outside the orchestrator. Task
 * outputs are listed by key only.
 */
public record SessionSnapshot(String id, SessionStatus status, WorkflowPhase currentPhase,
                              Map<WorkflowPhase, PhaseStatus> phaseStatuses, List<PhaseTransition> phaseHistory,
                              List<TaskSnapshot> tasks, Map<WorkflowPhase, Boolean> approvals,
                              long hierarchyVersion, Instant createdAt, Instant retiredAt) {

    public record TaskSnapshot(String id, WorkflowPhase phase, String agentId, AgentCapability capability,
                               TaskStatus status, int attempt, String lastError, List<String> outputKeys) {

        static TaskSnapshot from(WorkflowTask task) {
            List<String> keys = task.getResult() != null
                    ? new ArrayList<>(new TreeMap<>(task.getResult().outputs()).keySet())
                    : List.of();
            return new TaskSnapshot(task.getId(), task.getPhase(), task.getAgentId(), task.getCapability(),
                    task.getStatus(), task.getAttempt(), task.getLastError(), keys);
        }
    }

    public static SessionSnapshot from(WorkflowSession session) {
        synchronized (session) {
            return new SessionSnapshot(session.getId(), session.getStatus(), session.getCurrentPhase(),
                    new TreeMap<>(session.getPhaseStatuses()), session.getPhaseHistory(),
                    session.getTasks().stream().map(TaskSnapshot::from).collect(Collectors.toList()),
                    new TreeMap<>(session.getApprovals()), session.getHierarchyVersion(),
                    session.getCreatedAt(), session.getRetiredAt());
        }
    }
}
