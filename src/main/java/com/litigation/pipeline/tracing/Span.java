package com.litigation.pipeline.tracing;

/**
 * A unit of traced work. Closing the span ends it, so spans are used in
 * try-with-resources blocks.
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, boolean value);

    /**
     * Records a point-in-time event on the span, such as a provider fallback.
     */
    void addEvent(String name);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
