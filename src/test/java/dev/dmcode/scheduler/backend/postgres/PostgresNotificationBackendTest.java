package dev.dmcode.scheduler.backend.postgres;

import dev.dmcode.scheduler.TaskExecutionException;
import dev.dmcode.scheduler.TaskId;
import dev.dmcode.scheduler.backend.ExecutorHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.postgresql.PGNotification;
import org.postgresql.jdbc.PgConnection;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PostgresNotificationBackendTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final PostgresNotificationBackendConfiguration CONFIGURATION =
        PostgresNotificationBackendConfiguration.createDefault()
            .withChannelName("test_channel")
            .withPollTimeout(Duration.ofMillis(10))
            .withOnErrorPause(Duration.ofMillis(10))
            .withThreadTerminationTimeout(TIMEOUT);

    @Mock
    private DataSource dataSource;
    @Mock
    private Connection connection;
    @Mock
    private PgConnection pgConnection;
    @Mock
    private Statement statement;
    @Mock
    private PGNotification notification;

    private final AtomicInteger pollCount = new AtomicInteger();
    private final AtomicInteger runCount = new AtomicInteger();

    private PostgresNotificationBackend backend;

    @BeforeEach
    void setUp() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.unwrap(PgConnection.class)).thenReturn(pgConnection);
        when(pgConnection.createStatement()).thenReturn(statement);
        backend = new PostgresNotificationBackend(dataSource, CONFIGURATION);
    }

    @AfterEach
    void tearDown() {
        backend.unregister();
    }

    @Test
    void shouldRunNextOncePerNotification() throws Exception {
        when(pgConnection.getNotifications(anyInt())).thenAnswer(invocation -> {
            if (pollCount.getAndIncrement() == 0) {
                return new PGNotification[] {notification, notification};
            }
            return idle();
        });

        backend.register(() -> runCount.incrementAndGet() > 0);

        await().atMost(TIMEOUT).until(() -> pollCount.get() > 2);
        assertThat(runCount).hasValue(2);
        assertThat(backend.isRegistered()).isTrue();

        backend.unregister();

        assertThat(backend.isRegistered()).isFalse();
        verify(statement).executeUpdate("LISTEN \"test_channel\"");
        verify(statement).executeUpdate("UNLISTEN \"test_channel\"");
        verify(pgConnection).close();
    }

    @Test
    void shouldReconnectAfterConnectionFailure() throws Exception {
        when(dataSource.getConnection())
            .thenThrow(new SQLException("connection refused"))
            .thenReturn(connection);
        when(pgConnection.getNotifications(anyInt())).thenAnswer(invocation -> {
            if (pollCount.getAndIncrement() == 0) {
                return new PGNotification[] {notification};
            }
            return idle();
        });

        backend.register(() -> runCount.incrementAndGet() > 0);

        await().atMost(TIMEOUT).untilAsserted(() -> assertThat(runCount).hasValue(1));
        verify(dataSource, atLeast(2)).getConnection();
    }

    @Test
    void shouldReopenConnectionAfterPollFailure() throws Exception {
        when(pgConnection.getNotifications(anyInt())).thenAnswer(invocation -> {
            int poll = pollCount.getAndIncrement();
            if (poll == 0) {
                throw new SQLException("connection reset");
            }
            if (poll == 1) {
                return new PGNotification[] {notification};
            }
            return idle();
        });

        backend.register(() -> runCount.incrementAndGet() > 0);

        await().atMost(TIMEOUT).untilAsserted(() -> assertThat(runCount).hasValue(1));
        verify(pgConnection, timeout(TIMEOUT.toMillis()).atLeast(1)).close();
        verify(dataSource, atLeast(2)).getConnection();
    }

    @Test
    void shouldKeepListeningWhenTaskFails() throws Exception {
        when(pgConnection.getNotifications(anyInt())).thenAnswer(invocation -> {
            pollCount.incrementAndGet();
            return new PGNotification[] {notification};
        });
        ExecutorHandle failingHandle = () -> {
            if (runCount.incrementAndGet() == 1) {
                throw new TaskExecutionException(new TaskId(1), new IllegalStateException("boom"));
            }
            return true;
        };

        backend.register(failingHandle);

        await().atMost(TIMEOUT).untilAsserted(() -> assertThat(runCount).hasValueGreaterThanOrEqualTo(3));
    }

    @Test
    void shouldRejectSecondRegistration() throws Exception {
        when(pgConnection.getNotifications(anyInt())).thenAnswer(invocation -> idle());
        backend.register(() -> false);

        assertThatThrownBy(() -> backend.register(() -> false))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("Backend already registered");
    }

    @Test
    void shouldIgnoreUnregisterWhenNotRegistered() {
        backend.unregister();

        assertThat(backend.isRegistered()).isFalse();
    }

    private static PGNotification[] idle() {
        try {
            Thread.sleep(5);
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
        }
        return new PGNotification[0];
    }
}
