package com.litigation.pipeline.graph;

import com.litigation.pipeline.audit.AuditAction;
import com.litigation.pipeline.audit.AuditService;
import com.litigation.pipeline.core.model.AttributeRevision;
import com.litigation.pipeline.core.model.Entity;
import com.litigation.pipeline.core.model.EntityType;
import com.litigation.pipeline.core.model.Relationship;
import com.litigation.pipeline.core.model.TemporalValidity;
import com.litigation.pipeline.lock.KeyedLock;
import com.litigation.pipeline.lock.LocalKeyedLock;
import com.litigation.pipeline.metrics.MetricsService;
import com.litigation.pipeline.metrics.NoOpMetricsService;
import com.litigation.pipeline.review.InMemoryReviewQueue;
import com.litigation.pipeline.review.ReviewItem;
import com.litigation.pipeline.review.ReviewQueue;
import com.litigation.pipeline.review.ReviewReason;
import com.litigation.pipeline.scoring.ConfidenceScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory {@link KnowledgeGraphStore}.
 *
 * <p>Entities live in an arena keyed by id, each slot holding the current immutable
 * revision. A canonical-key index maps {@code TYPE:normalizedKey} to the id. Writes to one
 * entity take the per-key lock for its canonical key, which maps one-to-one to its id.
 * Relationships are kept in an adjacency list of relationship ids per entity.</p>
 */
public class InMemoryKnowledgeGraphStore implements KnowledgeGraphStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryKnowledgeGraphStore.class);

    public static final double DEFAULT_DECAY_FLOOR = 0.1;
    private static final double DAYS_PER_YEAR = 365.25;

    private final ConcurrentMap<String, Entity> entities = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<Entity>> revisions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> canonicalIndex = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Relationship> relationships = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<String>> adjacency = new ConcurrentHashMap<>();

    private final ConfidenceScorer scorer;
    private final KeyedLock lock;
    private final ReviewQueue reviewQueue;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final RelationshipConflictRules conflictRules;
    private final double decayFloor;
    private final Clock clock;

    private InMemoryKnowledgeGraphStore(Builder builder) {
        this.scorer = builder.scorer != null ? builder.scorer : new ConfidenceScorer();
        this.lock = builder.lock != null ? builder.lock : new LocalKeyedLock();
        this.reviewQueue = builder.reviewQueue != null ? builder.reviewQueue : new InMemoryReviewQueue();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.conflictRules = builder.conflictRules != null ? builder.conflictRules : RelationshipConflictRules.defaults();
        this.decayFloor = builder.decayFloor;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    @Override
    public Entity upsertEntity(EntityCandidate candidate) {
        Objects.requireNonNull(candidate, "candidate is required");
        String canonicalKey = Entity.canonicalKey(candidate.getType(), candidate.getNormalizedKey());
        double scored = scorer.score(candidate.getFactors());
        if (candidate.getProvenance().foundational()) {
            scored = scorer.applyFoundationalBoost(scored);
        }
        double incoming = scored;

        return lock.withLock(lockKey(canonicalKey), () -> {
            String existingId = canonicalIndex.get(canonicalKey);
            if (existingId == null) {
                return insert(candidate, incoming);
            }
            return merge(entities.get(existingId), candidate, incoming);
        });
    }

    private Entity insert(EntityCandidate candidate, double confidence) {
        Instant now = clock.instant();
        Entity entity = Entity.builder()
                .type(candidate.getType())
                .name(candidate.getName())
                .normalizedKey(candidate.getNormalizedKey())
                .jurisdictionId(candidate.getJurisdictionId())
                .attributes(candidate.getAttributes())
                .confidence(confidence)
                .provenance(candidate.getProvenance())
                .temporalContext(candidate.getTemporalContext())
                .createdAt(now)
                .build();
        store(entity);
        canonicalIndex.put(entity.getCanonicalKey(), entity.getId());

        auditService.record(AuditAction.ENTITY_CREATED, entity.getId(), candidate.getProvenance().source(),
                Map.of("type", entity.getType().name(), "confidence", confidence));
        metricsService.incrementEntityCreated(entity.getType());
        log.debug("graph.entity.created id={} key={} confidence={}", entity.getId(), entity.getCanonicalKey(),
                confidence);
        return entity;
    }

    private Entity merge(Entity stored, EntityCandidate candidate, double scored) {
        Instant now = clock.instant();
        Entity.Builder next = Entity.builder(stored);
        boolean changed = false;

        for (Map.Entry<String, Object> attribute : candidate.getAttributes().entrySet()) {
            Object value = attribute.getValue();
            if (isEmpty(value)) {
                continue;
            }
            String key = attribute.getKey();
            Object current = stored.getAttribute(key);
            if (isEmpty(current)) {
                next.attribute(key, value);
                changed = true;
            } else if (!current.equals(value) && !alreadyRecorded(stored, key, value)) {
                next.addAttributeRevision(key, new AttributeRevision(value, candidate.getProvenance().source(), now));
                changed = true;
            }
        }

        if (stored.getJurisdictionId() == null && candidate.getJurisdictionId() != null) {
            next.jurisdictionId(candidate.getJurisdictionId());
            changed = true;
        }
        if (stored.getTemporalContext() == null && candidate.getTemporalContext() != null) {
            next.temporalContext(candidate.getTemporalContext());
            changed = true;
        }
        if (scored > stored.getConfidence()) {
            next.confidence(scored);
            next.baseConfidence(Math.max(stored.getBaseConfidence(), scored));
            changed = true;
        }

        if (!changed) {
            log.trace("graph.entity.unchanged id={}", stored.getId());
            return stored;
        }

        Entity updated = next.revision(stored.getRevision() + 1).updatedAt(now).build();
        store(updated);
        auditService.record(AuditAction.ENTITY_UPDATED, updated.getId(), candidate.getProvenance().source(),
                Map.of("revision", updated.getRevision(), "confidence", updated.getConfidence()));
        metricsService.incrementEntityUpdated(updated.getType());
        log.debug("graph.entity.merged id={} revision={} confidence={}", updated.getId(), updated.getRevision(),
                updated.getConfidence());
        return updated;
    }

    @Override
    public Relationship addRelationship(RelationshipRequest request) {
        Objects.requireNonNull(request, "request is required");
        if (request.type() == null || request.type().isBlank()) {
            throw new GraphValidationException("Relationship type is required");
        }
        String from = request.fromEntityId();
        String to = request.toEntityId();
        Entity fromEntity = from != null ? entities.get(from) : null;
        Entity toEntity = to != null ? entities.get(to) : null;
        if (fromEntity == null || toEntity == null) {
            throw new DanglingReferenceException(from, fromEntity == null, to, toEntity == null);
        }

        TemporalValidity validity = request.validity() != null
                ? request.validity() : TemporalValidity.from(clock.instant());
        if (validity.end() != null && validity.end().isBefore(validity.start())) {
            throw new GraphValidationException("Relationship validity ends before it starts: " + validity);
        }
        double confidence;
        if (request.confidence() != null) {
            confidence = request.confidence();
            if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
                throw new GraphValidationException("Relationship confidence must be between 0.0 and 1.0, got "
                        + confidence);
            }
        } else {
            confidence = Math.min(fromEntity.getConfidence(), toEntity.getConfidence());
        }

        Relationship draft = Relationship.builder()
                .fromEntityId(from)
                .toEntityId(to)
                .type(request.type())
                .confidence(confidence)
                .temporalValidity(validity)
                .evidenceRefs(request.evidenceRefs())
                .createdAt(clock.instant())
                .build();

        return lock.withLock(pairLockKey(from, to), () -> {
            List<Relationship> conflicting = getRelationships(from).stream()
                    .filter(existing -> existing.connects(from, to))
                    .filter(existing -> conflictRules.conflicts(existing.getType(), draft.getType()))
                    .collect(Collectors.toList());

            Relationship relationship = conflicting.isEmpty() ? draft : draft.flagged();
            relationships.put(relationship.getId(), relationship);
            adjacency.computeIfAbsent(from, k -> new CopyOnWriteArrayList<>()).add(relationship.getId());
            if (!from.equals(to)) {
                adjacency.computeIfAbsent(to, k -> new CopyOnWriteArrayList<>()).add(relationship.getId());
            }
            auditService.record(AuditAction.RELATIONSHIP_CREATED, relationship.getId(), AuditService.SYSTEM_ACTOR,
                    Map.of("type", relationship.getType(), "from", from, "to", to));
            metricsService.incrementRelationshipCreated(relationship.getType());

            if (!conflicting.isEmpty()) {
                flagConflict(relationship, conflicting);
            }
            log.debug("graph.relationship.created id={} type={} from={} to={} flagged={}",
                    relationship.getId(), relationship.getType(), from, to, relationship.isFlaggedForReview());
            return relationship;
        });
    }

    private void flagConflict(Relationship added, List<Relationship> conflicting) {
        List<String> related = new ArrayList<>();
        for (Relationship existing : conflicting) {
            relationships.put(existing.getId(), existing.flagged());
            related.add(existing.getId());
        }
        reviewQueue.submit(ReviewItem.builder()
                .reason(ReviewReason.CONFLICTING_RELATIONSHIP)
                .subjectId(added.getId())
                .relatedIds(related)
                .summary(added.getType() + " between " + added.getFromEntityId() + " and " + added.getToEntityId()
                        + " contradicts " + conflicting.stream().map(Relationship::getType)
                        .distinct().collect(Collectors.joining(",")))
                .build());
        auditService.record(AuditAction.RELATIONSHIP_FLAGGED, added.getId(), AuditService.SYSTEM_ACTOR,
                Map.of("conflictsWith", related));
        log.warn("graph.relationship.conflict id={} type={} conflicting={}", added.getId(), added.getType(), related);
    }

    @Override
    public Optional<Entity> getEntity(String entityId) {
        return entityId == null ? Optional.empty() : Optional.ofNullable(entities.get(entityId));
    }

    @Override
    public Optional<Entity> findByCanonicalKey(EntityType type, String normalizedKey) {
        String id = canonicalIndex.get(Entity.canonicalKey(type, normalizedKey));
        return id == null ? Optional.empty() : getEntity(id);
    }

    @Override
    public List<Entity> getEntityHistory(String entityId) {
        List<Entity> history = revisions.get(entityId);
        return history == null ? List.of() : List.copyOf(history);
    }

    @Override
    public List<Entity> queryByType(EntityType type, String jurisdictionId) {
        return entities.values().stream()
                .filter(e -> e.getType() == type)
                .filter(e -> jurisdictionId == null || jurisdictionId.equalsIgnoreCase(e.getJurisdictionId()))
                .sorted(Comparator.comparingDouble(Entity::getConfidence).reversed().thenComparing(Entity::getId))
                .collect(Collectors.toList());
    }

    @Override
    public Collection<Entity> getAllEntities() {
        return Collections.unmodifiableCollection(new ArrayList<>(entities.values()));
    }

    @Override
    public Optional<Relationship> getRelationship(String relationshipId) {
        return Optional.ofNullable(relationships.get(relationshipId));
    }

    @Override
    public List<Relationship> getRelationships(String entityId) {
        List<String> ids = adjacency.get(entityId);
        if (ids == null) {
            return List.of();
        }
        return ids.stream()
                .map(relationships::get)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    @Override
    public Collection<Relationship> getAllRelationships() {
        return Collections.unmodifiableCollection(new ArrayList<>(relationships.values()));
    }

    @Override
    public int decayConfidence(Instant now) {
        Objects.requireNonNull(now, "now is required");
        int affected = 0;
        for (Entity snapshot : entities.values()) {
            if (snapshot.getTemporalContext() == null || !snapshot.getTemporalContext().isExpiredAt(now)) {
                continue;
            }
            Boolean changed = lock.withLock(lockKey(snapshot.getCanonicalKey()), () -> decay(snapshot.getId(), now));
            if (changed) {
                affected++;
            }
        }
        metricsService.recordConfidenceDecay(affected);
        if (affected > 0) {
            log.info("graph.decay.applied affected={} at={}", affected, now);
        }
        return affected;
    }

    private boolean decay(String entityId, Instant now) {
        Entity current = entities.get(entityId);
        Instant validTo = current.getTemporalContext().validTo();
        double years = Duration.between(validTo, now).toMillis() / (DAYS_PER_YEAR * 24 * 3600 * 1000);
        double base = current.getBaseConfidence();
        double target = Math.min(base, Math.max(decayFloor, base * scorer.recencyDecay(years)));
        target = ConfidenceScorer.clamp(target);
        if (target >= current.getConfidence()) {
            return false;
        }
        Entity decayed = Entity.builder(current)
                .confidence(target)
                .baseConfidence(base)
                .revision(current.getRevision() + 1)
                .updatedAt(now)
                .build();
        store(decayed);
        auditService.record(AuditAction.CONFIDENCE_DECAYED, entityId, AuditService.SYSTEM_ACTOR,
                Map.of("from", current.getConfidence(), "to", target));
        return true;
    }

    /**
     * Loads previously exported entities and relationships. Existing entries with the same
     * ids are replaced and canonical keys are re-indexed.
     */
    public void restore(Collection<Entity> restoredEntities, Collection<Relationship> restoredRelationships) {
        for (Entity entity : restoredEntities) {
            store(entity);
            canonicalIndex.put(entity.getCanonicalKey(), entity.getId());
        }
        for (Relationship relationship : restoredRelationships) {
            if (!entities.containsKey(relationship.getFromEntityId())
                    || !entities.containsKey(relationship.getToEntityId())) {
                throw new DanglingReferenceException(relationship.getFromEntityId(),
                        !entities.containsKey(relationship.getFromEntityId()),
                        relationship.getToEntityId(), !entities.containsKey(relationship.getToEntityId()));
            }
            if (relationships.put(relationship.getId(), relationship) == null) {
                adjacency.computeIfAbsent(relationship.getFromEntityId(), k -> new CopyOnWriteArrayList<>())
                        .add(relationship.getId());
                if (!relationship.getFromEntityId().equals(relationship.getToEntityId())) {
                    adjacency.computeIfAbsent(relationship.getToEntityId(), k -> new CopyOnWriteArrayList<>())
                            .add(relationship.getId());
                }
            }
        }
        log.info("graph.restored entities={} relationships={}", restoredEntities.size(), restoredRelationships.size());
    }

    @Override
    public int entityCount() {
        return entities.size();
    }

    @Override
    public int relationshipCount() {
        return relationships.size();
    }

    private void store(Entity entity) {
        revisions.computeIfAbsent(entity.getId(), k -> new CopyOnWriteArrayList<>()).add(entity);
        entities.put(entity.getId(), entity);
    }

    private static boolean alreadyRecorded(Entity stored, String key, Object value) {
        List<AttributeRevision> history = stored.getAttributeHistory().get(key);
        return history != null && history.stream().anyMatch(r -> value.equals(r.value()));
    }

    private static boolean isEmpty(Object value) {
        return value == null || (value instanceof CharSequence cs && cs.toString().isBlank());
    }

    private static String lockKey(String canonicalKey) {
        return "entity:" + canonicalKey;
    }

    private static String pairLockKey(String a, String b) {
        return a.compareTo(b) <= 0 ? "pair:" + a + ":" + b : "pair:" + b + ":" + a;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ConfidenceScorer scorer;
        private KeyedLock lock;
        private ReviewQueue reviewQueue;
        private AuditService auditService;
        private MetricsService metricsService;
        private RelationshipConflictRules conflictRules;
        private double decayFloor = DEFAULT_DECAY_FLOOR;
        private Clock clock;

        public Builder scorer(ConfidenceScorer scorer) {
            this.scorer = scorer;
            return this;
        }

        public Builder lock(KeyedLock lock) {
            this.lock = lock;
            return this;
        }

        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder conflictRules(RelationshipConflictRules conflictRules) {
            this.conflictRules = conflictRules;
            return this;
        }

        public Builder decayFloor(double decayFloor) {
            if (decayFloor < 0.0 || decayFloor > 1.0) {
                throw new IllegalArgumentException("decayFloor must be between 0.0 and 1.0");
            }
            this.decayFloor = decayFloor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public InMemoryKnowledgeGraphStore build() {
            return new InMemoryKnowledgeGraphStore(this);
        }
    }
}
