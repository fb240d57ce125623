package com.litigation.pipeline.review;

import java.util.List;
import java.util.Optional;

/**
 * Queue of derivation ambiguities and approval requests awaiting a human decision.
 */
public interface ReviewQueue {

    ReviewItem submit(ReviewItem item);

    /**
     * Pending items, oldest first.
     */
    List<ReviewItem> getPending();

    List<ReviewItem> getPendingByReason(ReviewReason reason);

    /**
     * Marks an item approved.
     *
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item is not pending
     */
    void approve(String reviewId, String reviewerId, String notes);

    /**
     * Marks an item rejected.
     *
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item is not pending
     */
    void reject(String reviewId, String reviewerId, String notes);

    Optional<ReviewItem> get(String reviewId);

    long countPending();
}
