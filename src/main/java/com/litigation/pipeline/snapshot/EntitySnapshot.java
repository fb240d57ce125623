package com.litigation.pipeline.snapshot;

import com.litigation.pipeline.core.model.AttributeRevision;
import com.litigation.pipeline.core.model.Entity;
import com.litigation.pipeline.core.model.EntityType;
import com.litigation.pipeline.core.model.Provenance;
import com.litigation.pipeline.core.model.TemporalContext;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Serializable form of an {@link Entity}.
 */
public record EntitySnapshot(String id, EntityType type, String name, String normalizedKey, String jurisdictionId,
                             Map<String, Object> attributes, Map<String, List<AttributeRevision>> attributeHistory,
                             double confidence, double baseConfidence, String provenanceSource,
                             boolean foundational, Instant validFrom, Instant validTo, int revision,
                             Instant createdAt, Instant updatedAt) {

    public static EntitySnapshot from(Entity entity) {
        TemporalContext temporal = entity.getTemporalContext();
        return new EntitySnapshot(entity.getId(), entity.getType(), entity.getName(), entity.getNormalizedKey(),
                entity.getJurisdictionId(), entity.getAttributes(), entity.getAttributeHistory(),
                entity.getConfidence(), entity.getBaseConfidence(), entity.getProvenance().source(),
                entity.getProvenance().foundational(),
                temporal != null ? temporal.validFrom() : null, temporal != null ? temporal.validTo() : null,
                entity.getRevision(), entity.getCreatedAt(), entity.getUpdatedAt());
    }

    public Entity toEntity() {
        Entity.Builder builder = Entity.builder()
                .id(id)
                .type(type)
                .name(name)
                .normalizedKey(normalizedKey)
                .jurisdictionId(jurisdictionId)
                .attributes(attributes)
                .confidence(confidence)
                .baseConfidence(baseConfidence)
                .provenance(new Provenance(provenanceSource, foundational))
                .revision(revision)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
        if (validFrom != null || validTo != null) {
            builder.temporalContext(new TemporalContext(validFrom, validTo));
        }
        if (attributeHistory != null) {
            attributeHistory.forEach((key, revisions) -> revisions.forEach(r -> builder.addAttributeRevision(key, r)));
        }
        return builder.build();
    }
}
