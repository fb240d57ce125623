package com.litigation.pipeline.graph;

import com.litigation.pipeline.core.model.EntityType;
import com.litigation.pipeline.core.model.Provenance;
import com.litigation.pipeline.core.model.TemporalContext;
import com.litigation.pipeline.scoring.ConfidenceFactors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An observation of an entity submitted for ingestion. The graph store scores it, then
 * either inserts it or merges it into the stored entity with the same canonical key.
 */
public final class EntityCandidate {

    private final EntityType type;
    private final String name;
    private final String normalizedKey;
    private final String jurisdictionId;
    private final Map<String, Object> attributes;
    private final ConfidenceFactors factors;
    private final Provenance provenance;
    private final TemporalContext temporalContext;

    private EntityCandidate(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.normalizedKey = builder.normalizedKey != null
                ? builder.normalizedKey : EntityKeys.normalize(builder.name);
        if (normalizedKey.isEmpty()) {
            throw new GraphValidationException("Entity name '" + name + "' normalizes to an empty key");
        }
        this.jurisdictionId = builder.jurisdictionId;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.factors = Objects.requireNonNull(builder.factors, "factors is required");
        this.provenance = Objects.requireNonNull(builder.provenance, "provenance is required");
        this.temporalContext = builder.temporalContext;
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

    public String getJurisdictionId() {
        return jurisdictionId;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public ConfidenceFactors getFactors() {
        return factors;
    }

    public Provenance getProvenance() {
        return provenance;
    }

    public TemporalContext getTemporalContext() {
        return temporalContext;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EntityType type;
        private String name;
        private String normalizedKey;
        private String jurisdictionId;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private ConfidenceFactors factors;
        private Provenance provenance;
        private TemporalContext temporalContext;

        public Builder type(EntityType type) {
            this.type = type;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Overrides the key derived from the name.
         */
        public Builder normalizedKey(String normalizedKey) {
            this.normalizedKey = normalizedKey;
            return this;
        }

        public Builder jurisdictionId(String jurisdictionId) {
            this.jurisdictionId = jurisdictionId;
            return this;
        }

        public Builder attribute(String key, Object value) {
            this.attributes.put(key, value);
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            if (attributes != null) {
                this.attributes.putAll(attributes);
            }
            return this;
        }

        public Builder factors(ConfidenceFactors factors) {
            this.factors = factors;
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

        public EntityCandidate build() {
            return new EntityCandidate(this);
        }
    }
}
