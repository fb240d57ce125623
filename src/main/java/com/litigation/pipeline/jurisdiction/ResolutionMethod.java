package com.litigation.pipeline.jurisdiction;

/**
 * How an {@link AuthorityResolution} was reached.
 */
public enum ResolutionMethod {
    PREEMPTION,
    PRECEDENCE,
    UNRESOLVED_CONFLICT
}
