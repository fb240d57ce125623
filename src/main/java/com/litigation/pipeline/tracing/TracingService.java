package com.litigation.pipeline.tracing;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Tracing integration point. {@link NoOpTracingService} is the default, so the library
 * runs without a tracing backend.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);

    /**
     * Runs the action inside a span, marking it OK on return and ERROR when the action throws.
     */
    default <T> T traced(String operationName, Map<String, String> attributes, Supplier<T> action) {
        try (Span span = startSpan(operationName, attributes)) {
            try {
                T result = action.get();
                span.setStatus(Span.SpanStatus.OK);
                return result;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }
        }
    }
}
