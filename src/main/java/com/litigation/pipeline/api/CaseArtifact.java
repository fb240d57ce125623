package com.litigation.pipeline.api;

import com.litigation.pipeline.claims.CauseOfAction;
import com.litigation.pipeline.claims.StrengthAnalysis;
import com.litigation.pipeline.core.model.Entity;
import com.litigation.pipeline.core.model.Relationship;
import com.litigation.pipeline.research.ResearchResult;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of a case handed to the rendering layer: the detected causes with their
 * strength, the graph contents and the research results.
 *
 * @param degradedResearch whether any research result is stale or has insufficient coverage
 */
public record CaseArtifact(String sessionId, String jurisdictionId, List<CauseOfAction> causes,
                           List<StrengthAnalysis> strengths, List<Entity> entities,
                           List<Relationship> relationships, List<ResearchResult> researchResults,
                           boolean degradedResearch, Instant assembledAt) {

    public CaseArtifact {
        causes = causes != null ? List.copyOf(causes) : List.of();
        strengths = strengths != null ? List.copyOf(strengths) : List.of();
        entities = entities != null ? List.copyOf(entities) : List.of();
        relationships = relationships != null ? List.copyOf(relationships) : List.of();
        researchResults = researchResults != null ? List.copyOf(researchResults) : List.of();
    }

    public boolean hasUnresolvedConflicts() {
        return causes.stream().anyMatch(CauseOfAction::unresolvedConflict);
    }
}
