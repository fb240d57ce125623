package com.litigation.pipeline.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forTask(sessionId, taskId, "RESEARCH")) {
 *     log.info("workflow.task.completed taskId={} attempt={}", taskId, attempt);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();
    private final List<String> previousValues = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forSession(String sessionId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("sessionId", sessionId);
        ctx.put("operation", operation);
        return ctx;
    }

    public static LogContext forTask(String sessionId, String taskId, String phase) {
        LogContext ctx = new LogContext();
        ctx.put("sessionId", sessionId);
        ctx.put("taskId", taskId);
        ctx.put("phase", phase);
        ctx.put("operation", "task");
        return ctx;
    }

    public static LogContext forResearch(String queryFingerprint) {
        LogContext ctx = new LogContext();
        ctx.put("queryFingerprint", queryFingerprint);
        ctx.put("operation", "research");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        previousValues.add(MDC.get(key));
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }

    /**
     * Removes the keys added by this context, restoring values that an enclosing
     * context had set for the same keys.
     */
    @Override
    public void close() {
        for (int i = keys.size() - 1; i >= 0; i--) {
            String previous = previousValues.get(i);
            if (previous == null) {
                MDC.remove(keys.get(i));
            } else {
                MDC.put(keys.get(i), previous);
            }
        }
        keys.clear();
        previousValues.clear();
    }
}
