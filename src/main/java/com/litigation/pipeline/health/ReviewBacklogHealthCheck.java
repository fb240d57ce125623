package com.litigation.pipeline.health;

import com.litigation.pipeline.review.ReviewQueue;

/**
 * DEGRADED when more human-review items are pending than the threshold allows.
 */
public class ReviewBacklogHealthCheck implements HealthCheck {

    static final int DEFAULT_THRESHOLD = 100;

    private final ReviewQueue reviewQueue;
    private final int threshold;

    public ReviewBacklogHealthCheck(ReviewQueue reviewQueue) {
        this(reviewQueue, DEFAULT_THRESHOLD);
    }

    public ReviewBacklogHealthCheck(ReviewQueue reviewQueue, int threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must be >= 0");
        }
        this.reviewQueue = reviewQueue;
        this.threshold = threshold;
    }

    @Override
    public String getName() {
        return "reviewBacklog";
    }

    @Override
    public HealthStatus check() {
        long pending = reviewQueue.countPending();
        HealthStatus status = pending > threshold
                ? HealthStatus.degraded(pending + " review items pending")
                : HealthStatus.up();
        return status.withDetail("pending", pending).withDetail("threshold", threshold);
    }
}
