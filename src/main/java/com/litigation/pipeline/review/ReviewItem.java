package com.litigation.pipeline.review;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * An item in the human review queue. Carries the ids of the graph elements, causes or
 * sessions involved so a reviewer can locate them.
 */
public class ReviewItem {

    private final String id;
    private final ReviewReason reason;
    private final String subjectId;
    private final List<String> relatedIds;
    private final String summary;
    private volatile ReviewStatus status;
    private final Instant submittedAt;
    private volatile Instant reviewedAt;
    private volatile String reviewerId;
    private volatile String notes;

    private ReviewItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.reason = Objects.requireNonNull(builder.reason, "reason is required");
        this.subjectId = Objects.requireNonNull(builder.subjectId, "subjectId is required");
        this.relatedIds = builder.relatedIds != null ? List.copyOf(builder.relatedIds) : List.of();
        this.summary = builder.summary;
        this.status = ReviewStatus.PENDING;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public ReviewReason getReason() {
        return reason;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public List<String> getRelatedIds() {
        return relatedIds;
    }

    public String getSummary() {
        return summary;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public String getReviewerId() {
        return reviewerId;
    }

    public String getNotes() {
        return notes;
    }

    public boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    synchronized void resolve(ReviewStatus outcome, String reviewerId, String notes) {
        if (status != ReviewStatus.PENDING) {
            throw new IllegalStateException("Review item is not pending: " + id);
        }
        this.status = outcome;
        this.reviewedAt = Instant.now();
        this.reviewerId = reviewerId;
        this.notes = notes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReviewItem that = (ReviewItem) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ReviewItem{" +
                "id='" + id + '\'' +
                ", reason=" + reason +
                ", subjectId='" + subjectId + '\'' +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private ReviewReason reason;
        private String subjectId;
        private List<String> relatedIds;
        private String summary;
        private Instant submittedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder reason(ReviewReason reason) {
            this.reason = reason;
            return this;
        }

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder relatedIds(List<String> relatedIds) {
            this.relatedIds = relatedIds;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public ReviewItem build() {
            return new ReviewItem(this);
        }
    }
}
