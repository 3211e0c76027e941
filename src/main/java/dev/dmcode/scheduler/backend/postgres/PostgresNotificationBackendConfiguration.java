package dev.dmcode.scheduler.backend.postgres;

import lombok.With;

import java.time.Duration;
import java.util.Objects;

@With
public record PostgresNotificationBackendConfiguration(
    String channelName,
    Duration pollTimeout,
    Duration onErrorPause,
    Duration threadTerminationTimeout
) {
    private static final String DEFAULT_CHANNEL_NAME = "task_scheduler_wakeup";
    private static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_ON_ERROR_PAUSE = DEFAULT_POLL_TIMEOUT.dividedBy(2);
    private static final Duration DEFAULT_THREAD_TERMINATION_TIMEOUT = Duration.ofSeconds(60);

    public PostgresNotificationBackendConfiguration {
        Objects.requireNonNull(channelName, "Channel name must be provided");
        if (channelName.isBlank() || channelName.contains("\"")) {
            throw new IllegalArgumentException("Channel name must be a non-blank identifier without quotes");
        }
        Objects.requireNonNull(pollTimeout, "Poll timeout must be provided");
        if (pollTimeout.isNegative() || pollTimeout.isZero()) {
            throw new IllegalArgumentException("Poll timeout must be positive");
        }
        Objects.requireNonNull(onErrorPause, "On error pause must be provided");
        if (onErrorPause.isNegative()) {
            throw new IllegalArgumentException("On error pause must not be negative");
        }
        Objects.requireNonNull(threadTerminationTimeout, "Thread termination timeout must be provided");
        if (threadTerminationTimeout.isNegative()) {
            throw new IllegalArgumentException("Thread termination timeout must not be negative");
        }
    }

    public static PostgresNotificationBackendConfiguration createDefault() {
        return new PostgresNotificationBackendConfiguration(
            DEFAULT_CHANNEL_NAME,
            DEFAULT_POLL_TIMEOUT,
            DEFAULT_ON_ERROR_PAUSE,
            DEFAULT_THREAD_TERMINATION_TIMEOUT
        );
    }
}
