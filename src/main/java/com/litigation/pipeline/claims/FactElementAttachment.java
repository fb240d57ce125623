package com.litigation.pipeline.claims;

import java.util.List;

/**
 * Scored link between a fact entity and an element it supports.
 *
 * @param strength           min(1, sum of the weights of the answered questions)
 * @param matchedQuestionIds questions of the element the fact answers
 */
public record FactElementAttachment(String factEntityId, String elementId, double strength,
                                    List<String> matchedQuestionIds) {

    public FactElementAttachment {
        if (strength < 0.0 || strength > 1.0) {
            throw new IllegalArgumentException("strength must be between 0.0 and 1.0, got " + strength);
        }
        matchedQuestionIds = matchedQuestionIds != null ? List.copyOf(matchedQuestionIds) : List.of();
    }
}
