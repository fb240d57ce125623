package com.litigation.pipeline.workflow;

import com.litigation.pipeline.core.CancellationToken;

/**
 * Worker that executes tasks of one capability. Agents are opaque to the orchestrator:
 * it only knows the capability and the result.
 */
public interface Agent {

    String getId();

    AgentCapability getCapability();

    /**
     * Executes the task. The agent checks the token at its checkpoints and, once it is
     * cancelled, returns {@link TaskResult#cancelled(String)} or throws
     * {@link com.litigation.pipeline.core.OperationCancelledException}.
     *
     * @throws Exception on failure; the orchestrator retries the task with backoff
     */
    TaskResult executeTask(WorkflowTask task, CancellationToken token) throws Exception;
}
