package com.litigation.pipeline.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Represents an entity node in the case knowledge graph.
 *
 * <p>Instances are immutable snapshots. The graph store never mutates an entity in
 * place: a confidence update or attribute merge produces the next revision, and
 * earlier revisions stay readable as history.</p>
 */
public final class Entity {
    private final String id;
    private final EntityType type;
    private final String name;
    private final String normalizedKey;
    private final String jurisdictionId;
    private final Map<String, Object> attributes;
    private final Map<String, List<AttributeRevision>> attributeHistory;
    private final double confidence;
    private final double baseConfidence;
    private final Provenance provenance;
    private final TemporalContext temporalContext;
    private final int revision;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Entity(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.type = builder.type;
        this.name = builder.name;
        this.normalizedKey = builder.normalizedKey;
        this.jurisdictionId = builder.jurisdictionId;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        Map<String, List<AttributeRevision>> history = new LinkedHashMap<>();
        builder.attributeHistory.forEach((key, revisions) -> history.put(key, List.copyOf(revisions)));
        this.attributeHistory = Collections.unmodifiableMap(history);
        this.confidence = builder.confidence;
        this.baseConfidence = builder.baseConfidence != null ? builder.baseConfidence : builder.confidence;
        this.provenance = builder.provenance;
        this.temporalContext = builder.temporalContext;
        this.revision = builder.revision;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public EntityType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public String getNormalizedKey() {
        return normalizedKey;
    }

    /**
     * Canonical identity used to detect that two observations describe the same entity.
     */
    public String getCanonicalKey() {
        return canonicalKey(type, normalizedKey);
    }

    public String getJurisdictionId() {
        return jurisdictionId;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    /**
     * Competing values retained for attributes whose stored value was kept.
     */
    public Map<String, List<AttributeRevision>> getAttributeHistory() {
        return attributeHistory;
    }

    public double getConfidence() {
        return confidence;
    }

    /**
     * Confidence before any temporal decay was applied.
     */
    public double getBaseConfidence() {
        return baseConfidence;
    }

    public Provenance getProvenance() {
        return provenance;
    }

    public TemporalContext getTemporalContext() {
        return temporalContext;
    }

    public int getRevision() {
        return revision;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Name and attribute values joined into one lower-case string, used for
     * keyword matching.
     */
    public String searchableText() {
        StringBuilder sb = new StringBuilder(name);
        attributes.values().forEach(value -> sb.append(' ').append(value));
        return sb.toString().replace('_', ' ').toLowerCase(Locale.ROOT);
    }

    public static String canonicalKey(EntityType type, String normalizedKey) {
        return type.name() + ":" + normalizedKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return revision == entity.revision && Objects.equals(id, entity.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, revision);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", name='" + name + '\'' +
                ", confidence=" + confidence +
                ", revision=" + revision +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Entity entity) {
        Builder builder = new Builder()
                .id(entity.id)
                .type(entity.type)
                .name(entity.name)
                .normalizedKey(entity.normalizedKey)
                .jurisdictionId(entity.jurisdictionId)
                .attributes(entity.attributes)
                .confidence(entity.confidence)
                .baseConfidence(entity.baseConfidence)
                .provenance(entity.provenance)
                .temporalContext(entity.temporalContext)
                .revision(entity.revision)
                .createdAt(entity.createdAt)
                .updatedAt(entity.updatedAt);
        entity.attributeHistory.forEach((key, revisions) ->
                builder.attributeHistory.put(key, new ArrayList<>(revisions)));
        return builder;
    }

    public static class Builder {
        private String id;
        private EntityType type;
        private String name;
        private String normalizedKey;
        private String jurisdictionId;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final Map<String, List<AttributeRevision>> attributeHistory = new LinkedHashMap<>();
        private double confidence;
        private Double baseConfidence;
        private Provenance provenance;
        private TemporalContext temporalContext;
        private int revision = 1;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(EntityType type) {
            this.type = type;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder normalizedKey(String normalizedKey) {
            this.normalizedKey = normalizedKey;
            return this;
        }

        public Builder jurisdictionId(String jurisdictionId) {
            this.jurisdictionId = jurisdictionId;
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            this.attributes.clear();
            if (attributes != null) {
                this.attributes.putAll(attributes);
            }
            return this;
        }

        public Builder attribute(String key, Object value) {
            this.attributes.put(key, value);
            return this;
        }

        public Builder addAttributeRevision(String key, AttributeRevision revision) {
            this.attributeHistory.computeIfAbsent(key, k -> new ArrayList<>()).add(revision);
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder baseConfidence(double baseConfidence) {
            this.baseConfidence = baseConfidence;
            return this;
        }

        public Builder provenance(Provenance provenance) {
            this.provenance = provenance;
            return this;
        }

        public Builder temporalContext(TemporalContext temporalContext) {
            this.temporalContext = temporalContext;
            return this;
        }

        public Builder revision(int revision) {
            this.revision = revision;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Entity build() {
            Objects.requireNonNull(type, "type is required");
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(normalizedKey, "normalizedKey is required");
            Objects.requireNonNull(provenance, "provenance is required");
            if (confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got " + confidence);
            }
            return new Entity(this);
        }
    }
}
