package com.litigation.pipeline.jurisdiction;

/**
 * Thrown when an authority hierarchy cannot be loaded, for example because its
 * preemption declarations form a cycle.
 */
public class AuthorityConfigurationException extends RuntimeException {

    public AuthorityConfigurationException(String message) {
        super(message);
    }
}
