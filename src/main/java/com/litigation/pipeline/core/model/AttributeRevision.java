package com.litigation.pipeline.core.model;

import java.time.Instant;

/**
 * A competing value observed for an attribute that already had a stored value.
 */
public record AttributeRevision(Object value, String source, Instant observedAt) {
}
