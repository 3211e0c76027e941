package dev.dmcode.scheduler.signal;

import dev.dmcode.scheduler.backend.Backend;
import dev.dmcode.scheduler.backend.ExecutorHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded stream of wakeup events. Producers call {@link #trigger()} from any thread,
 * the executor consumes events through {@link #stream()}.
 */
public class WakeupSignal implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WakeupSignal.class);

    private final Lock lock = new ReentrantLock();
    private final Condition eventAvailable = lock.newCondition();
    private final SignalStream stream = new EventStream();
    private final Runnable onClose;

    private long pendingEvents;
    private boolean closed;

    protected WakeupSignal(Runnable onClose) {
        this.onClose = Objects.requireNonNull(onClose, "On close action must be provided");
    }

    public static WakeupSignal manual() {
        return new WakeupSignal(() -> {});
    }

    public static WakeupSignal timer(Duration interval, boolean repeats) {
        Objects.requireNonNull(interval, "Interval must be provided");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Interval must be positive");
        }
        var timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            var thread = new Thread(runnable, "wakeup-signal-timer");
            thread.setDaemon(true);
            return thread;
        });
        var signal = new WakeupSignal(timer::shutdownNow);
        long intervalNanos = interval.toNanos();
        if (repeats) {
            timer.scheduleAtFixedRate(signal::trigger, intervalNanos, intervalNanos, TimeUnit.NANOSECONDS);
        } else {
            timer.schedule(signal::trigger, intervalNanos, TimeUnit.NANOSECONDS);
        }
        return signal;
    }

    /**
     * Registers {@code handle} with {@code backend}; the backend is unregistered when the signal closes.
     */
    public static WakeupSignal backendDriven(Backend backend, ExecutorHandle handle) {
        Objects.requireNonNull(backend, "Backend must be provided");
        Objects.requireNonNull(handle, "Executor handle must be provided");
        backend.register(handle);
        return new WakeupSignal(backend::unregister);
    }

    public SignalStream stream() {
        return stream;
    }

    public void trigger() {
        lock.lock();
        try {
            if (closed) {
                LOGGER.debug("Trigger ignored, signal is closed");
                return;
            }
            pendingEvents++;
            eventAvailable.signal();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            eventAvailable.signalAll();
        } finally {
            lock.unlock();
        }
        onClose.run();
    }

    private static long toNanosSaturated(Duration timeout) {
        try {
            return timeout.toNanos();
        } catch (ArithmeticException exception) {
            return timeout.isNegative() ? 0 : Long.MAX_VALUE;
        }
    }

    private final class EventStream implements SignalStream {

        @Override
        public boolean next() throws InterruptedException {
            lock.lock();
            try {
                while (pendingEvents == 0 && !closed) {
                    eventAvailable.await();
                }
                return consumeEvent();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public boolean next(Duration timeout) throws InterruptedException {
            Objects.requireNonNull(timeout, "Timeout must be provided");
            long remainingNanos = toNanosSaturated(timeout);
            lock.lock();
            try {
                while (pendingEvents == 0 && !closed) {
                    if (remainingNanos <= 0) {
                        return true;
                    }
                    remainingNanos = eventAvailable.awaitNanos(remainingNanos);
                }
                return consumeEvent();
            } finally {
                lock.unlock();
            }
        }

        private boolean consumeEvent() {
            if (closed || pendingEvents == 0) {
                return false;
            }
            pendingEvents--;
            return true;
        }
    }
}
