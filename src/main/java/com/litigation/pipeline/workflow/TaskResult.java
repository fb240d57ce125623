package com.litigation.pipeline.workflow;

import java.util.Map;

/**
 * Structured result an agent returns for a task.
 *
 * @param outputs   values published to later phases of the session
 * @param summary   short human-readable description, may be null
 * @param cancelled whether the agent stopped because the session was cancelled
 */
public record TaskResult(Map<String, Object> outputs, String summary, boolean cancelled) {

    public TaskResult {
        outputs = outputs != null ? Map.copyOf(outputs) : Map.of();
    }

    public static TaskResult completed(Map<String, Object> outputs) {
        return new TaskResult(outputs, null, false);
    }

    public static TaskResult completed(Map<String, Object> outputs, String summary) {
        return new TaskResult(outputs, summary, false);
    }

    public static TaskResult cancelled(String reason) {
        return new TaskResult(Map.of(), reason, true);
    }
}
