package com.litigation.pipeline.workflow;

/**
 * Invalid workflow definition or agent registration. Thrown at startup.
 */
public class WorkflowConfigurationException extends RuntimeException {

    public WorkflowConfigurationException(String message) {
        super(message);
    }
}
