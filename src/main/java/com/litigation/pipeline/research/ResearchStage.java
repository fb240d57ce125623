package com.litigation.pipeline.research;

import java.time.Instant;

/**
 * Stages a research query passes through.
 */
public enum ResearchStage {
    FORMULATED,
    DISPATCHED,
    PROVIDER_SUCCEEDED,
    PROVIDER_FAILED,
    RANKED,
    GAP_ANALYZED,
    CACHED;

    /**
     * One recorded stage.
     *
     * @param detail provider name or failure reason, may be null
     */
    public record Transition(ResearchStage stage, String detail, Instant at) {
    }
}
