package com.litigation.pipeline.graph;

import java.util.List;

/**
 * Thrown when a relationship names an endpoint entity that does not exist.
 */
public class DanglingReferenceException extends GraphValidationException {

    private final List<String> missingEntityIds;
    private final boolean fromMissing;
    private final boolean toMissing;

    public DanglingReferenceException(String fromEntityId, boolean fromMissing,
                                      String toEntityId, boolean toMissing) {
        super(buildMessage(fromEntityId, fromMissing, toEntityId, toMissing));
        this.fromMissing = fromMissing;
        this.toMissing = toMissing;
        if (fromMissing && toMissing) {
            this.missingEntityIds = List.of(fromEntityId, toEntityId);
        } else {
            this.missingEntityIds = List.of(fromMissing ? fromEntityId : toEntityId);
        }
    }

    public List<String> getMissingEntityIds() {
        return missingEntityIds;
    }

    public boolean isFromMissing() {
        return fromMissing;
    }

    public boolean isToMissing() {
        return toMissing;
    }

    private static String buildMessage(String from, boolean fromMissing, String to, boolean toMissing) {
        StringBuilder sb = new StringBuilder("Relationship references missing entity:");
        if (fromMissing) {
            sb.append(" from=").append(from);
        }
        if (toMissing) {
            sb.append(" to=").append(to);
        }
        return sb.toString();
    }
}
