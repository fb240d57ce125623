package com.litigation.pipeline.snapshot;

import com.litigation.pipeline.core.model.Entity;
import com.litigation.pipeline.core.model.Relationship;
import com.litigation.pipeline.graph.KnowledgeGraphStore;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Point-in-time copy of the current revision of every entity and every relationship.
 */
public record GraphSnapshot(Instant takenAt, List<EntitySnapshot> entities, List<RelationshipSnapshot> relationships) {

    public GraphSnapshot {
        entities = entities != null ? List.copyOf(entities) : List.of();
        relationships = relationships != null ? List.copyOf(relationships) : List.of();
    }

    public static GraphSnapshot of(KnowledgeGraphStore store, Instant takenAt) {
        List<EntitySnapshot> entities = store.getAllEntities().stream()
                .sorted(Comparator.comparing(Entity::getId))
                .map(EntitySnapshot::from)
                .collect(Collectors.toList());
        List<RelationshipSnapshot> relationships = store.getAllRelationships().stream()
                .sorted(Comparator.comparing(Relationship::getId))
                .map(RelationshipSnapshot::from)
                .collect(Collectors.toList());
        return new GraphSnapshot(takenAt, entities, relationships);
    }

    public List<Entity> toEntities() {
        return entities.stream().map(EntitySnapshot::toEntity).collect(Collectors.toList());
    }

    public List<Relationship> toRelationships() {
        return relationships.stream().map(RelationshipSnapshot::toRelationship).collect(Collectors.toList());
    }
}
