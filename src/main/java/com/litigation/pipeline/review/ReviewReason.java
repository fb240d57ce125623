package com.litigation.pipeline.review;

/**
 * Why an item needs a human decision.
 */
public enum ReviewReason {
    /** Competing authorities share the best precedence rank. */
    UNRESOLVED_AUTHORITY_CONFLICT,
    /** Two relationships between the same entities contradict each other. */
    CONFLICTING_RELATIONSHIP,
    /** A workflow phase awaits approval before the session may advance. */
    PHASE_APPROVAL
}
