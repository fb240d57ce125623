package com.litigation.pipeline.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Directed, typed edge between two graph entities, addressed by entity id only.
 *
 * <p>Endpoints are referenced by id rather than object so that cyclic relationship
 * structures stay representable.</p>
 */
public final class Relationship {

    private final String id;
    private final String fromEntityId;
    private final String toEntityId;
    private final String type;
    private final double confidence;
    private final TemporalValidity temporalValidity;
    private final List<String> evidenceRefs;
    private final boolean flaggedForReview;
    private final Instant createdAt;

    private Relationship(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.fromEntityId = Objects.requireNonNull(builder.fromEntityId, "fromEntityId is required");
        this.toEntityId = Objects.requireNonNull(builder.toEntityId, "toEntityId is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.confidence = builder.confidence;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.temporalValidity = builder.temporalValidity != null
                ? builder.temporalValidity : TemporalValidity.from(this.createdAt);
        this.evidenceRefs = builder.evidenceRefs != null ? List.copyOf(builder.evidenceRefs) : List.of();
        this.flaggedForReview = builder.flaggedForReview;
    }

    public String getId() {
        return id;
    }

    public String getFromEntityId() {
        return fromEntityId;
    }

    public String getToEntityId() {
        return toEntityId;
    }

    public String getType() {
        return type;
    }

    public double getConfidence() {
        return confidence;
    }

    public TemporalValidity getTemporalValidity() {
        return temporalValidity;
    }

    public List<String> getEvidenceRefs() {
        return evidenceRefs;
    }

    /**
     * Whether this relationship contradicts another one between the same endpoints
     * and awaits human review.
     */
    public boolean isFlaggedForReview() {
        return flaggedForReview;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Returns a copy of this relationship marked for human review.
     */
    public Relationship flagged() {
        if (flaggedForReview) {
            return this;
        }
        return builder()
                .id(id)
                .fromEntityId(fromEntityId)
                .toEntityId(toEntityId)
                .type(type)
                .confidence(confidence)
                .temporalValidity(temporalValidity)
                .evidenceRefs(evidenceRefs)
                .flaggedForReview(true)
                .createdAt(createdAt)
                .build();
    }

    public boolean connects(String entityA, String entityB) {
        return (fromEntityId.equals(entityA) && toEntityId.equals(entityB))
                || (fromEntityId.equals(entityB) && toEntityId.equals(entityA));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Relationship that = (Relationship) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Relationship{" +
                "id='" + id + '\'' +
                ", from='" + fromEntityId + '\'' +
                ", to='" + toEntityId + '\'' +
                ", type='" + type + '\'' +
                ", confidence=" + confidence +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String fromEntityId;
        private String toEntityId;
        private String type;
        private double confidence = 1.0;
        private TemporalValidity temporalValidity;
        private List<String> evidenceRefs;
        private boolean flaggedForReview;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder fromEntityId(String fromEntityId) {
            this.fromEntityId = fromEntityId;
            return this;
        }

        public Builder toEntityId(String toEntityId) {
            this.toEntityId = toEntityId;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder temporalValidity(TemporalValidity temporalValidity) {
            this.temporalValidity = temporalValidity;
            return this;
        }

        public Builder evidenceRefs(List<String> evidenceRefs) {
            this.evidenceRefs = evidenceRefs;
            return this;
        }

        public Builder flaggedForReview(boolean flaggedForReview) {
            this.flaggedForReview = flaggedForReview;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Relationship build() {
            return new Relationship(this);
        }
    }
}
