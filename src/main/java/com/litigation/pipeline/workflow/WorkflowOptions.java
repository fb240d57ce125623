package com.litigation.pipeline.workflow;

import com.litigation.pipeline.resilience.RetryPolicy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Orchestrator options.
 *
 * @param taskRetry          attempts and backoff of failed tasks; {@code maxAttempts} is the
 *                           task's maxRetries
 * @param defaultConcurrency tasks of one capability running at once, unless overridden
 * @param concurrency        per-capability overrides of {@code defaultConcurrency}
 * @param workerThreads      size of the task worker pool
 * @param autoAdvance        advance automatically once a phase is ready
 * @param archiveDirectory   where retired sessions are exported as JSON, null to skip export
 */
public record WorkflowOptions(RetryPolicy taskRetry, int defaultConcurrency,
                              Map<AgentCapability, Integer> concurrency, int workerThreads,
                              boolean autoAdvance, Path archiveDirectory) {

    public WorkflowOptions {
        Objects.requireNonNull(taskRetry, "taskRetry is required");
        if (defaultConcurrency <= 0) {
            throw new IllegalArgumentException("defaultConcurrency must be > 0");
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be > 0");
        }
        concurrency = concurrency != null ? Map.copyOf(concurrency) : Map.of();
        concurrency.forEach((capability, limit) -> {
            if (limit <= 0) {
                throw new IllegalArgumentException("concurrency for " + capability + " must be > 0");
            }
        });
    }

    /**
     * Default: 3 attempts with 500ms doubling backoff up to 30s, 4 concurrent tasks per
     * capability, 8 workers, manual advancement, no archive export.
     */
    public static WorkflowOptions defaults() {
        return new WorkflowOptions(new RetryPolicy(3, Duration.ofMillis(500), 2.0, Duration.ofSeconds(30)),
                4, Map.of(), 8, false, null);
    }

    public int concurrencyFor(AgentCapability capability) {
        return concurrency.getOrDefault(capability, defaultConcurrency);
    }

    public WorkflowOptions withAutoAdvance(boolean enabled) {
        return new WorkflowOptions(taskRetry, defaultConcurrency, concurrency, workerThreads, enabled, archiveDirectory);
    }

    public WorkflowOptions withTaskRetry(RetryPolicy policy) {
        return new WorkflowOptions(policy, defaultConcurrency, concurrency, workerThreads, autoAdvance, archiveDirectory);
    }

    public WorkflowOptions withConcurrency(AgentCapability capability, int limit) {
        Map<AgentCapability, Integer> updated = new EnumMap<>(AgentCapability.class);
        updated.putAll(concurrency);
        updated.put(capability, limit);
        return new WorkflowOptions(taskRetry, defaultConcurrency, updated, workerThreads, autoAdvance, archiveDirectory);
    }

    public WorkflowOptions withArchiveDirectory(Path directory) {
        return new WorkflowOptions(taskRetry, defaultConcurrency, concurrency, workerThreads, autoAdvance, directory);
    }
}
