package com.litigation.pipeline.claims;

import java.util.Map;

/**
 * How close a cause is to being fully supported.
 *
 * @param weakestElement   the element with the lowest best-attachment strength, the one that
 *                         most needs supporting facts
 * @param elementStrengths best attachment strength per element id, in element order
 */
public record StrengthAnalysis(String causeId, int satisfiedCount, int totalCount,
                               LegalElement weakestElement, Map<String, Double> elementStrengths) {

    public boolean isFullySupported() {
        return satisfiedCount == totalCount;
    }
}
