package com.litigation.pipeline.review;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link ReviewQueue}.
 */
public class InMemoryReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private final ConcurrentMap<String, ReviewItem> items = new ConcurrentHashMap<>();

    @Override
    public ReviewItem submit(ReviewItem item) {
        items.put(item.getId(), item);
        log.info("review.submitted id={} reason={} subject={}", item.getId(), item.getReason(), item.getSubjectId());
        return item;
    }

    @Override
    public List<ReviewItem> getPending() {
        return items.values().stream()
                .filter(ReviewItem::isPending)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt))
                .collect(Collectors.toList());
    }

    @Override
    public List<ReviewItem> getPendingByReason(ReviewReason reason) {
        return getPending().stream()
                .filter(item -> item.getReason() == reason)
                .collect(Collectors.toList());
    }

    @Override
    public void approve(String reviewId, String reviewerId, String notes) {
        require(reviewId).resolve(ReviewStatus.APPROVED, reviewerId, notes);
        log.info("review.approved id={} reviewer={}", reviewId, reviewerId);
    }

    @Override
    public void reject(String reviewId, String reviewerId, String notes) {
        require(reviewId).resolve(ReviewStatus.REJECTED, reviewerId, notes);
        log.info("review.rejected id={} reviewer={}", reviewId, reviewerId);
    }

    @Override
    public Optional<ReviewItem> get(String reviewId) {
        return Optional.ofNullable(items.get(reviewId));
    }

    @Override
    public long countPending() {
        return items.values().stream().filter(ReviewItem::isPending).count();
    }

    private ReviewItem require(String reviewId) {
        ReviewItem item = items.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        return item;
    }
}
