package com.litigation.pipeline.snapshot;

import com.litigation.pipeline.core.model.Relationship;
import com.litigation.pipeline.core.model.TemporalValidity;

import java.time.Instant;
import java.util.List;

/**
 * Serializable form of a {@link Relationship}.
 */
public record RelationshipSnapshot(String id, String fromEntityId, String toEntityId, String type,
                                   double confidence, Instant validFrom, Instant validTo,
                                   List<String> evidenceRefs, boolean flaggedForReview, Instant createdAt) {

    public static RelationshipSnapshot from(Relationship relationship) {
        TemporalValidity validity = relationship.getTemporalValidity();
        return new RelationshipSnapshot(relationship.getId(), relationship.getFromEntityId(),
                relationship.getToEntityId(), relationship.getType(), relationship.getConfidence(),
                validity.start(), validity.end(), relationship.getEvidenceRefs(),
                relationship.isFlaggedForReview(), relationship.getCreatedAt());
    }

    public Relationship toRelationship() {
        return Relationship.builder()
                .id(id)
                .fromEntityId(fromEntityId)
                .toEntityId(toEntityId)
                .type(type)
                .confidence(confidence)
                .temporalValidity(new TemporalValidity(validFrom, validTo))
                .evidenceRefs(evidenceRefs)
                .flaggedForReview(flaggedForReview)
                .createdAt(createdAt)
                .build();
    }
}
