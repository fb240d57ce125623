package com.litigation.pipeline.graph;

import com.litigation.pipeline.core.model.TemporalValidity;

import java.util.List;

/**
 * Parameters of a relationship to add to the graph.
 *
 * @param confidence explicit confidence, or {@code null} to take the lower of the two
 *                   endpoint confidences
 * @param validity   validity interval, or {@code null} for open-ended from now
 */
public record RelationshipRequest(String fromEntityId, String toEntityId, String type,
                                  List<String> evidenceRefs, Double confidence, TemporalValidity validity) {

    public RelationshipRequest {
        evidenceRefs = evidenceRefs != null ? List.copyOf(evidenceRefs) : List.of();
    }

    public static RelationshipRequest of(String fromEntityId, String toEntityId, String type,
                                         List<String> evidenceRefs) {
        return new RelationshipRequest(fromEntityId, toEntityId, type, evidenceRefs, null, null);
    }
}
