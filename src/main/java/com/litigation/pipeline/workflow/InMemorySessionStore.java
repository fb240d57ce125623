package com.litigation.pipeline.workflow;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySessionStore implements SessionStore {

    private final Map<String, WorkflowSession> active = new ConcurrentHashMap<>();
    private final Map<String, WorkflowSession> archived = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowSession session) {
        if (!archived.containsKey(session.getId())) {
            active.put(session.getId(), session);
        }
    }

    @Override
    public Optional<WorkflowSession> find(String sessionId) {
        WorkflowSession session = active.get(sessionId);
        return Optional.ofNullable(session != null ? session : archived.get(sessionId));
    }

    @Override
    public void archive(WorkflowSession session) {
        archived.put(session.getId(), session);
        active.remove(session.getId());
    }

    @Override
    public Collection<WorkflowSession> activeSessions() {
        return List.copyOf(active.values());
    }

    @Override
    public Collection<WorkflowSession> archivedSessions() {
        return List.copyOf(archived.values());
    }
}
