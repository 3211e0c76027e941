package dev.dmcode.scheduler.signal;

import java.time.Duration;

public interface SignalStream {

    /**
     * Blocks until an event is available and consumes it.
     *
     * @return {@code false} once the signal is closed; undelivered events are dropped
     */
    boolean next() throws InterruptedException;

    /**
     * Like {@link #next()}, but also returns {@code true} when the timeout elapses without an event.
     */
    boolean next(Duration timeout) throws InterruptedException;
}
