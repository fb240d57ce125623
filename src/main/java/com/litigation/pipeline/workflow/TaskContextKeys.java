package com.litigation.pipeline.workflow;

/**
 * Keys the orchestrator and the built-in agents use in a task's context.
 */
public final class TaskContextKeys {

    public static final String SESSION_ID = "sessionId";
    public static final String PHASE = "phase";
    /** The {@link com.litigation.pipeline.jurisdiction.AuthorityHierarchy} pinned by the session. */
    public static final String AUTHORITY_HIERARCHY = "authorityHierarchy";
    /** Jurisdiction of the case, supplied in the intake context. */
    public static final String JURISDICTION_ID = "jurisdictionId";
    /** {@code List<CauseOfAction>} published by the outline phase. */
    public static final String CAUSES = "causes";
    /** {@code List<ResearchResult>} published by the research phase. */
    public static final String RESEARCH_RESULTS = "researchResults";

    private TaskContextKeys() {
    }
}
