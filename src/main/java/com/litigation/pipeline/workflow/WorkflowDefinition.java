package com.litigation.pipeline.workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Phase definitions for every non-terminal phase.
 */
public final class WorkflowDefinition {

    private final Map<WorkflowPhase, PhaseDefinition> phases;

    private WorkflowDefinition(Map<WorkflowPhase, PhaseDefinition> phases) {
        for (WorkflowPhase phase : WorkflowPhase.values()) {
            if (!phase.isTerminal() && !phases.containsKey(phase)) {
                throw new WorkflowConfigurationException("No definition for phase " + phase);
            }
        }
        if (phases.containsKey(WorkflowPhase.DONE)) {
            throw new WorkflowConfigurationException("DONE is terminal and cannot have tasks");
        }
        this.phases = Collections.unmodifiableMap(new EnumMap<>(phases));
    }

    /**
     * One capability per phase; OUTLINE and REVIEW need approval before advancing.
     */
    public static WorkflowDefinition defaults() {
        return builder()
                .phase(PhaseDefinition.of(WorkflowPhase.INTAKE, AgentCapability.INTAKE))
                .phase(PhaseDefinition.gated(WorkflowPhase.OUTLINE, AgentCapability.OUTLINE))
                .phase(PhaseDefinition.of(WorkflowPhase.RESEARCH, AgentCapability.RESEARCH))
                .phase(PhaseDefinition.of(WorkflowPhase.DRAFTING, AgentCapability.DRAFTING))
                .phase(PhaseDefinition.gated(WorkflowPhase.REVIEW, AgentCapability.REVIEW))
                .phase(PhaseDefinition.of(WorkflowPhase.EDITING, AgentCapability.EDITING))
                .build();
    }

    public PhaseDefinition get(WorkflowPhase phase) {
        PhaseDefinition definition = phases.get(phase);
        if (definition == null) {
            throw new IllegalArgumentException("No definition for phase " + phase);
        }
        return definition;
    }

    public boolean requiresApproval(WorkflowPhase phase) {
        return !phase.isTerminal() && get(phase).approvalRequired();
    }

    /**
     * Every capability some phase dispatches to.
     */
    public List<AgentCapability> requiredCapabilities() {
        List<AgentCapability> capabilities = new ArrayList<>();
        phases.values().forEach(p -> p.capabilities().stream()
                .filter(c -> !capabilities.contains(c))
                .forEach(capabilities::add));
        return capabilities;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<WorkflowPhase, PhaseDefinition> phases = new EnumMap<>(WorkflowPhase.class);

        public Builder phase(PhaseDefinition definition) {
            phases.put(definition.phase(), definition);
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(phases);
        }
    }
}
