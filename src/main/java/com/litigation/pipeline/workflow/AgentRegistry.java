package com.litigation.pipeline.workflow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registered agents, looked up by id and capability.
 */
public class AgentRegistry {

    private final Map<String, Agent> byId = new LinkedHashMap<>();
    private final Map<AgentCapability, List<Agent>> byCapability = new EnumMap<>(AgentCapability.class);

    public AgentRegistry() {
    }

    public AgentRegistry(Collection<Agent> agents) {
        agents.forEach(this::register);
    }

    public synchronized AgentRegistry register(Agent agent) {
        if (byId.containsKey(agent.getId())) {
            throw new WorkflowConfigurationException("Duplicate agent id " + agent.getId());
        }
        byId.put(agent.getId(), agent);
        byCapability.computeIfAbsent(agent.getCapability(), c -> new ArrayList<>()).add(agent);
        return this;
    }

    public synchronized Optional<Agent> get(String agentId) {
        return Optional.ofNullable(byId.get(agentId));
    }

    public synchronized List<Agent> agentsFor(AgentCapability capability) {
        return List.copyOf(byCapability.getOrDefault(capability, List.of()));
    }

    /**
     * @throws WorkflowConfigurationException if a capability the definition dispatches to has no agent
     */
    public synchronized void validate(WorkflowDefinition definition) {
        for (AgentCapability capability : definition.requiredCapabilities()) {
            if (byCapability.getOrDefault(capability, List.of()).isEmpty()) {
                throw new WorkflowConfigurationException("No agent registered for capability " + capability);
            }
        }
    }

    public synchronized int size() {
        return byId.size();
    }
}
