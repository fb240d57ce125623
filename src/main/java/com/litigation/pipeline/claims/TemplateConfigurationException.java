package com.litigation.pipeline.claims;

/**
 * Thrown when a cause template is malformed: no elements, an element without questions,
 * a question without patterns, an invalid pattern or weight, or a duplicate id.
 */
public class TemplateConfigurationException extends RuntimeException {

    public TemplateConfigurationException(String message) {
        super(message);
    }

    public TemplateConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
