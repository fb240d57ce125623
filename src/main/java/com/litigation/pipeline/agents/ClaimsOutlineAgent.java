package com.litigation.pipeline.agents;

import com.litigation.pipeline.claims.CauseOfAction;
import com.litigation.pipeline.claims.ClaimsMatrixEngine;
import com.litigation.pipeline.core.CancellationToken;
import com.litigation.pipeline.graph.KnowledgeGraphStore;
import com.litigation.pipeline.workflow.Agent;
import com.litigation.pipeline.workflow.AgentCapability;
import com.litigation.pipeline.workflow.TaskContextKeys;
import com.litigation.pipeline.workflow.TaskResult;
import com.litigation.pipeline.workflow.WorkflowTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outline agent: derives the causes of action supported by the facts currently in the
 * knowledge graph and publishes them under {@link TaskContextKeys#CAUSES}.
 */
public class ClaimsOutlineAgent implements Agent {
    private static final Logger log = LoggerFactory.getLogger(ClaimsOutlineAgent.class);

    public static final String DEFAULT_ID = "claims-outline";

    private final String id;
    private final KnowledgeGraphStore graphStore;
    private final ClaimsMatrixEngine claimsEngine;

    public ClaimsOutlineAgent(KnowledgeGraphStore graphStore, ClaimsMatrixEngine claimsEngine) {
        this(DEFAULT_ID, graphStore, claimsEngine);
    }

    public ClaimsOutlineAgent(String id, KnowledgeGraphStore graphStore, ClaimsMatrixEngine claimsEngine) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.graphStore = Objects.requireNonNull(graphStore, "graphStore is required");
        this.claimsEngine = Objects.requireNonNull(claimsEngine, "claimsEngine is required");
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public AgentCapability getCapability() {
        return AgentCapability.OUTLINE;
    }

    @Override
    public TaskResult executeTask(WorkflowTask task, CancellationToken token) {
        token.throwIfCancelled();
        String jurisdictionId = (String) task.getContextValue(TaskContextKeys.JURISDICTION_ID);
        List<CauseOfAction> causes = claimsEngine.detectCauses(graphStore, jurisdictionId);
        long conflicts = causes.stream().filter(CauseOfAction::unresolvedConflict).count();
        log.info("outline.completed sessionId={} jurisdiction={} causes={} unresolvedConflicts={}",
                task.getSessionId(), jurisdictionId, causes.size(), conflicts);
        return TaskResult.completed(Map.of(TaskContextKeys.CAUSES, causes),
                causes.size() + " causes of action detected");
    }
}
