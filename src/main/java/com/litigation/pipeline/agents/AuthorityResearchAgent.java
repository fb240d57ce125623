package com.litigation.pipeline.agents;

import com.litigation.pipeline.claims.CauseOfAction;
import com.litigation.pipeline.claims.LegalElement;
import com.litigation.pipeline.core.CancellationToken;
import com.litigation.pipeline.core.model.Entity;
import com.litigation.pipeline.graph.KnowledgeGraphStore;
import com.litigation.pipeline.research.ResearchIntegrationLayer;
import com.litigation.pipeline.research.ResearchQuery;
import com.litigation.pipeline.research.ResearchResult;
import com.litigation.pipeline.workflow.Agent;
import com.litigation.pipeline.workflow.AgentCapability;
import com.litigation.pipeline.workflow.TaskContextKeys;
import com.litigation.pipeline.workflow.TaskResult;
import com.litigation.pipeline.workflow.WorkflowTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Research agent: runs one research query per cause published by the outline phase.
 *
 * <p>The query is built from the cause's supporting facts, with the cause name and its
 * element names as the legal issues. The session's cancellation token is handed to the
 * research layer, so cancelling the session aborts in-flight provider calls.</p>
 */
public class AuthorityResearchAgent implements Agent {
    private static final Logger log = LoggerFactory.getLogger(AuthorityResearchAgent.class);

    public static final String DEFAULT_ID = "authority-research";

    private final String id;
    private final KnowledgeGraphStore graphStore;
    private final ResearchIntegrationLayer research;

    public AuthorityResearchAgent(KnowledgeGraphStore graphStore, ResearchIntegrationLayer research) {
        this(DEFAULT_ID, graphStore, research);
    }

    public AuthorityResearchAgent(String id, KnowledgeGraphStore graphStore, ResearchIntegrationLayer research) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.graphStore = Objects.requireNonNull(graphStore, "graphStore is required");
        this.research = Objects.requireNonNull(research, "research is required");
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public AgentCapability getCapability() {
        return AgentCapability.RESEARCH;
    }

    @Override
    public TaskResult executeTask(WorkflowTask task, CancellationToken token) {
        String jurisdictionId = (String) task.getContextValue(TaskContextKeys.JURISDICTION_ID);
        List<CauseOfAction> causes = causesOf(task);
        List<ResearchResult> results = new ArrayList<>();
        int degraded = 0;
        for (CauseOfAction cause : causes) {
            token.throwIfCancelled();
            ResearchQuery query = research.formulateQuery(supportingFacts(cause), legalIssues(cause),
                    jurisdictionId != null ? jurisdictionId : cause.jurisdictionId());
            ResearchResult result = research.execute(query, token);
            if (result.stale() || result.insufficientCoverage()) {
                degraded++;
            }
            results.add(result);
        }
        log.info("research.agent.completed sessionId={} causes={} degradedResults={}",
                task.getSessionId(), causes.size(), degraded);
        return TaskResult.completed(Map.of(TaskContextKeys.RESEARCH_RESULTS, results),
                results.size() + " research results, " + degraded + " degraded");
    }

    private List<Entity> supportingFacts(CauseOfAction cause) {
        List<Entity> facts = new ArrayList<>();
        for (String factId : cause.supportingFactIds()) {
            Optional<Entity> fact = graphStore.getEntity(factId);
            fact.ifPresent(facts::add);
        }
        return facts;
    }

    static List<String> legalIssues(CauseOfAction cause) {
        List<String> issues = new ArrayList<>();
        issues.add(cause.name().toLowerCase(Locale.ROOT));
        for (LegalElement element : cause.elements()) {
            issues.add(element.name().replace('_', ' ').toLowerCase(Locale.ROOT));
        }
        return issues;
    }

    @SuppressWarnings("unchecked")
    private static List<CauseOfAction> causesOf(WorkflowTask task) {
        Object value = task.getContextValue(TaskContextKeys.CAUSES);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new IllegalStateException("Task context value '" + TaskContextKeys.CAUSES
                    + "' is not a list: " + value.getClass().getName());
        }
        return (List<CauseOfAction>) value;
    }
}
