package dev.dmcode.scheduler.executor;

import lombok.With;

import java.time.Duration;
import java.util.Objects;

@With
public record TaskExecutorConfiguration(
    String threadName,
    Duration threadTerminationTimeout
) {
    private static final String DEFAULT_THREAD_NAME = "task-executor";
    private static final Duration DEFAULT_THREAD_TERMINATION_TIMEOUT = Duration.ofSeconds(60);

    public TaskExecutorConfiguration {
        Objects.requireNonNull(threadName, "Thread name must be provided");
        if (threadName.isBlank()) {
            throw new IllegalArgumentException("Thread name must not be blank");
        }
        Objects.requireNonNull(threadTerminationTimeout, "Thread termination timeout must be provided");
        if (threadTerminationTimeout.isNegative()) {
            throw new IllegalArgumentException("Thread termination timeout must not be negative");
        }
    }

    public static TaskExecutorConfiguration createDefault() {
        return new TaskExecutorConfiguration(
            DEFAULT_THREAD_NAME,
            DEFAULT_THREAD_TERMINATION_TIMEOUT
        );
    }
}
