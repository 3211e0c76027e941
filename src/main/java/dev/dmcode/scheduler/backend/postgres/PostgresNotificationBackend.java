package dev.dmcode.scheduler.backend.postgres;

import dev.dmcode.scheduler.TaskExecutionException;
import dev.dmcode.scheduler.backend.Backend;
import dev.dmcode.scheduler.backend.ExecutorHandle;
import org.postgresql.jdbc.PgConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs scheduled work when a PostgreSQL {@code NOTIFY} arrives on the configured channel.
 * <p>
 * A listener thread holds a dedicated connection in {@code LISTEN} mode and calls
 * {@link ExecutorHandle#justNext()} once per received notification.
 */
public class PostgresNotificationBackend implements Backend {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresNotificationBackend.class);

    private final Lock lock = new ReentrantLock();

    private final DataSource dataSource;
    private final PostgresNotificationBackendConfiguration configuration;

    private Thread thread;
    private PgConnection connection;

    public PostgresNotificationBackend(DataSource dataSource) {
        this(dataSource, PostgresNotificationBackendConfiguration.createDefault());
    }

    public PostgresNotificationBackend(DataSource dataSource, PostgresNotificationBackendConfiguration configuration) {
        this.dataSource = Objects.requireNonNull(dataSource, "Data source must be provided");
        this.configuration = Objects.requireNonNull(configuration, "Backend configuration must be provided");
    }

    @Override
    public void register(ExecutorHandle handle) {
        Objects.requireNonNull(handle, "Executor handle must be provided");
        lock.lock();
        try {
            if (thread != null) {
                throw new IllegalStateException("Backend already registered");
            }
            thread = new Thread(() -> listen(handle), "postgres-notification-backend");
            thread.start();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void unregister() {
        Thread stoppedThread;
        lock.lock();
        try {
            stoppedThread = thread;
            thread = null;
        } finally {
            lock.unlock();
        }
        if (stoppedThread == null) {
            return;
        }
        stoppedThread.interrupt();
        long joinMillis = configuration.threadTerminationTimeout().toMillis();
        if (joinMillis > 0) {
            try {
                stoppedThread.join(joinMillis);
            } catch (InterruptedException exception) {
                Thread.currentThread().interrupt();
                LOGGER.error("Interrupted while awaiting listener thread termination", exception);
            }
        }
    }

    public boolean isRegistered() {
        lock.lock();
        try {
            return thread != null;
        } finally {
            lock.unlock();
        }
    }

    private void listen(ExecutorHandle handle) {
        LOGGER.info("Listening for notifications on channel {}", configuration.channelName());
        while (isListening()) {
            try {
                openListeningConnection();
                int notifications = pollNotifications();
                for (int i = 0; i < notifications && isListening(); i++) {
                    runNext(handle);
                }
            } catch (SQLException exception) {
                LOGGER.error("Lost notification connection on channel {}", configuration.channelName(), exception);
                closeConnectionQuietly();
                awaitReconnect();
            }
        }
        closeConnectionQuietly();
        LOGGER.info("Stopped listening for notifications on channel {}", configuration.channelName());
    }

    private void openListeningConnection() throws SQLException {
        if (connection == null) {
            // a failed LISTEN leaves the connection to closeConnectionQuietly
            connection = dataSource.getConnection().unwrap(PgConnection.class);
            try (var statement = connection.createStatement()) {
                statement.executeUpdate("LISTEN \"" + configuration.channelName() + "\"");
            }
            LOGGER.debug("Connection listening on channel {}", configuration.channelName());
        }
    }

    private int pollNotifications() throws SQLException {
        var notifications = connection.getNotifications((int) configuration.pollTimeout().toMillis());
        return notifications != null ? notifications.length : 0;
    }

    private static void runNext(ExecutorHandle handle) {
        try {
            handle.justNext();
        } catch (TaskExecutionException exception) {
            LOGGER.error("Task {} failed", exception.taskId(), exception);
        }
    }

    private void closeConnection() throws SQLException {
        if (connection == null) {
            return;
        }
        var closedConnection = connection;
        connection = null;
        try (closedConnection; var statement = closedConnection.createStatement()) {
            statement.executeUpdate("UNLISTEN \"" + configuration.channelName() + "\"");
        }
    }

    private void closeConnectionQuietly() {
        try {
            closeConnection();
        } catch (SQLException exception) {
            LOGGER.warn("Could not close notification connection", exception);
        }
    }

    private void awaitReconnect() {
        var pause = configuration.onErrorPause();
        if (pause.isZero() || !isListening()) {
            return;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(pause.toMillis());
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            LOGGER.debug("Reconnect pause interrupted on channel {}", configuration.channelName());
        }
    }

    private static boolean isListening() {
        return !Thread.currentThread().isInterrupted();
    }
}
