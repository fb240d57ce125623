package com.litigation.pipeline.workflow;

import com.litigation.pipeline.core.CancellationToken;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Agent whose behavior is supplied by the test.
 */
final class ScriptedAgent implements Agent {

    @FunctionalInterface
    interface Script {
        TaskResult run(WorkflowTask task, CancellationToken token) throws Exception;
    }

    private final String id;
    private final AgentCapability capability;
    private final Script script;
    private final AtomicInteger calls = new AtomicInteger();

    ScriptedAgent(String id, AgentCapability capability, Script script) {
        this.id = id;
        this.capability = capability;
        this.script = script;
    }

    static ScriptedAgent completing(String id, AgentCapability capability) {
        return new ScriptedAgent(id, capability,
                (task, token) -> TaskResult.completed(Map.of(id, "done"), id + " finished"));
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public AgentCapability getCapability() {
        return capability;
    }

    @Override
    public TaskResult executeTask(WorkflowTask task, CancellationToken token) throws Exception {
        calls.incrementAndGet();
        return script.run(task, token);
    }

    int calls() {
        return calls.get();
    }
}
