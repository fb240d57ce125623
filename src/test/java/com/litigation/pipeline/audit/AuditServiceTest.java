package com.litigation.pipeline.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AuditService Tests")
class AuditServiceTest {

    private AuditService auditService;

    @BeforeEach
    void setUp() {
        auditService = new AuditService();
    }

    @Test
    @DisplayName("Should record entries with details and a generated id")
    void recordWithDetails() {
        AuditEntry entry = auditService.record(AuditAction.PHASE_ADVANCED, "session-1", AuditService.SYSTEM_ACTOR,
                Map.of("from", "INTAKE", "to", "ANALYSIS"));

        assertNotNull(entry.id());
        assertNotNull(entry.timestamp());
        assertEquals("INTAKE", entry.details().get("from"));
        assertEquals(1, auditService.size());
    }

    @Test
    @DisplayName("Should filter entries by subject and by action")
    void filters() {
        auditService.record(AuditAction.SESSION_STARTED, "session-1", "system");
        auditService.record(AuditAction.PHASE_ADVANCED, "session-1", "system");
        auditService.record(AuditAction.ENTITY_CREATED, "entity-9", "intake-agent");

        List<AuditEntry> forSession = auditService.getEntriesForSubject("session-1");
        assertEquals(2, forSession.size());
        assertEquals(AuditAction.SESSION_STARTED, forSession.get(0).action());

        assertEquals(1, auditService.getEntriesByAction(AuditAction.ENTITY_CREATED).size());
        assertTrue(auditService.getEntriesByAction(AuditAction.SESSION_CANCELLED).isEmpty());
    }

    @Test
    @DisplayName("Should return a snapshot of all entries that callers cannot modify")
    void unmodifiableSnapshot() {
        auditService.record(AuditAction.SESSION_STARTED, "session-1", "system");

        List<AuditEntry> all = auditService.getAllEntries();

        assertThrows(UnsupportedOperationException.class, () -> all.add(all.get(0)));
        auditService.record(AuditAction.SESSION_RETIRED, "session-1", "system");
        assertEquals(1, all.size());
    }

    @Test
    @DisplayName("Should require an action")
    void requiresAction() {
        assertThrows(NullPointerException.class, () -> AuditEntry.builder().subjectId("x").build());
    }
}
