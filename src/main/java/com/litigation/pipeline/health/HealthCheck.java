package com.litigation.pipeline.health;

/**
 * A check of one pipeline component, such as the research providers or the review backlog.
 */
public interface HealthCheck {

    String getName();

    /**
     * Inspects the component. Implementations report failures as a DOWN status rather than
     * throwing.
     */
    HealthStatus check();
}
