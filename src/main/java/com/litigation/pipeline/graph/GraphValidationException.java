package com.litigation.pipeline.graph;

/**
 * Thrown when a graph write is rejected because its input is invalid. Invalid input is
 * never coerced into a valid shape.
 */
public class GraphValidationException extends RuntimeException {

    public GraphValidationException(String message) {
        super(message);
    }
}
