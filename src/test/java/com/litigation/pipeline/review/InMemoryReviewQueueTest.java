package com.litigation.pipeline.review;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryReviewQueue Tests")
class InMemoryReviewQueueTest {

    private static final Instant T0 = Instant.parse("2024-05-01T09:00:00Z");

    private InMemoryReviewQueue queue;

    @BeforeEach
    void setUp() {
        queue = new InMemoryReviewQueue();
    }

    private ReviewItem item(String id, ReviewReason reason, Instant submittedAt) {
        return ReviewItem.builder()
                .id(id)
                .reason(reason)
                .subjectId("subject-" + id)
                .relatedIds(List.of("a", "b"))
                .summary("needs a look")
                .submittedAt(submittedAt)
                .build();
    }

    @Test
    @DisplayName("Should list pending items oldest first")
    void pendingOrder() {
        queue.submit(item("late", ReviewReason.PHASE_APPROVAL, T0.plusSeconds(60)));
        queue.submit(item("early", ReviewReason.CONFLICTING_RELATIONSHIP, T0));

        List<ReviewItem> pending = queue.getPending();

        assertEquals(List.of("early", "late"), pending.stream().map(ReviewItem::getId).toList());
        assertEquals(2, queue.countPending());
    }

    @Test
    @DisplayName("Should filter pending items by reason")
    void pendingByReason() {
        queue.submit(item("1", ReviewReason.PHASE_APPROVAL, T0));
        queue.submit(item("2", ReviewReason.UNRESOLVED_AUTHORITY_CONFLICT, T0));

        List<ReviewItem> conflicts = queue.getPendingByReason(ReviewReason.UNRESOLVED_AUTHORITY_CONFLICT);

        assertEquals(1, conflicts.size());
        assertEquals("2", conflicts.get(0).getId());
    }

    @Test
    @DisplayName("Should record the reviewer when approving and drop the item from pending")
    void approve() {
        queue.submit(item("1", ReviewReason.PHASE_APPROVAL, T0));

        queue.approve("1", "partner", "looks right");

        ReviewItem reviewed = queue.get("1").orElseThrow();
        assertEquals(ReviewStatus.APPROVED, reviewed.getStatus());
        assertEquals("partner", reviewed.getReviewerId());
        assertEquals("looks right", reviewed.getNotes());
        assertNotNull(reviewed.getReviewedAt());
        assertEquals(0, queue.countPending());
    }

    @Test
    @DisplayName("Should refuse to resolve an item twice")
    void resolveTwice() {
        queue.submit(item("1", ReviewReason.CONFLICTING_RELATIONSHIP, T0));
        queue.reject("1", "partner", "wrong");

        assertThrows(IllegalStateException.class, () -> queue.approve("1", "partner", null));
        assertEquals(ReviewStatus.REJECTED, queue.get("1").orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Should throw for unknown items")
    void unknownItem() {
        assertThrows(IllegalArgumentException.class, () -> queue.approve("missing", "partner", null));
        assertTrue(queue.get("missing").isEmpty());
    }
}
