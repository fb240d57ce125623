package com.litigation.pipeline.graph;

import com.litigation.pipeline.core.model.Entity;
import com.litigation.pipeline.core.model.EntityType;
import com.litigation.pipeline.core.model.Relationship;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Store of case entities and the relationships between them.
 *
 * <p>Entities are never deleted. Each change produces a new revision and earlier revisions
 * stay available through {@link #getEntityHistory(String)}. Relationships address their
 * endpoints by id, so cyclic structures are representable.</p>
 *
 * <p>Mutations of one entity are serialized. Reads never block and always observe a
 * complete revision.</p>
 */
public interface KnowledgeGraphStore {

    /**
     * Inserts the candidate, or merges it into the stored entity with the same canonical
     * key. A merge fills empty attributes, records differing values as attribute history
     * and keeps the higher of the stored and scored confidence. Submitting an identical
     * candidate twice leaves the stored entity unchanged.
     */
    Entity upsertEntity(EntityCandidate candidate);

    /**
     * Adds a relationship between two existing entities.
     *
     * @throws DanglingReferenceException if either endpoint does not exist
     * @throws GraphValidationException   if the type is blank, the validity interval ends
     *                                    before it starts, or the confidence is out of range
     */
    Relationship addRelationship(RelationshipRequest request);

    default Relationship addRelationship(String fromEntityId, String toEntityId, String type,
                                         List<String> evidenceRefs) {
        return addRelationship(RelationshipRequest.of(fromEntityId, toEntityId, type, evidenceRefs));
    }

    Optional<Entity> getEntity(String entityId);

    Optional<Entity> findByCanonicalKey(EntityType type, String normalizedKey);

    /**
     * All revisions of an entity, oldest first.
     */
    List<Entity> getEntityHistory(String entityId);

    /**
     * Current entities of the given type, optionally restricted to one jurisdiction,
     * ordered by confidence descending.
     */
    List<Entity> queryByType(EntityType type, String jurisdictionId);

    default List<Entity> queryByType(EntityType type) {
        return queryByType(type, null);
    }

    Collection<Entity> getAllEntities();

    Optional<Relationship> getRelationship(String relationshipId);

    /**
     * Relationships with the given entity at either end.
     */
    List<Relationship> getRelationships(String entityId);

    Collection<Relationship> getAllRelationships();

    /**
     * Lowers the confidence of entities whose validity ended before {@code now}, following
     * the scorer's recency curve measured from the end of validity, down to a floor.
     * Decay is computed from the pre-decay confidence, so repeated calls with the same
     * {@code now} do not compound.
     *
     * @return the number of entities whose confidence changed
     */
    int decayConfidence(Instant now);

    int entityCount();

    int relationshipCount();
}
