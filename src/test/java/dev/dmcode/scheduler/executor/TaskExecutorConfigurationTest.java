package dev.dmcode.scheduler.executor;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskExecutorConfigurationTest {

    @Test
    void shouldProvideDefaults() {
        var configuration = TaskExecutorConfiguration.createDefault();

        assertThat(configuration.threadName()).isEqualTo("task-executor");
        assertThat(configuration.threadTerminationTimeout()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void shouldRejectInvalidValues() {
        var configuration = TaskExecutorConfiguration.createDefault();

        assertThatThrownBy(() -> configuration.withThreadName(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Thread name must not be blank");
        assertThatThrownBy(() -> configuration.withThreadTerminationTimeout(Duration.ofSeconds(-1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Thread termination timeout must not be negative");
        assertThatThrownBy(() -> configuration.withThreadTerminationTimeout(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessage("Thread termination timeout must be provided");
    }
}
