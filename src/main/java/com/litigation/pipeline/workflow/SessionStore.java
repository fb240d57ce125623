package com.litigation.pipeline.workflow;

import java.util.Collection;
import java.util.Optional;

/**
 * Holds workflow sessions by id. Retired sessions are archived, never deleted.
 */
public interface SessionStore {

    void save(WorkflowSession session);

    /**
     * Finds an active or archived session.
     */
    Optional<WorkflowSession> find(String sessionId);

    /**
     * Moves a session from the active set to the archive.
     */
    void archive(WorkflowSession session);

    Collection<WorkflowSession> activeSessions();

    Collection<WorkflowSession> archivedSessions();
}
