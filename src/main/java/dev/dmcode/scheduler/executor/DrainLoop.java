package dev.dmcode.scheduler.executor;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

public final class DrainLoop {

    private final Thread thread;

    DrainLoop(String name, Consumer<DrainLoop> body) {
        this.thread = new Thread(() -> body.accept(this), name);
    }

    void start() {
        thread.start();
    }

    public String name() {
        return thread.getName();
    }

    public boolean isAlive() {
        return thread.isAlive();
    }

    public void await() throws InterruptedException {
        thread.join();
    }

    /**
     * @return {@code true} if the loop has terminated within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "Timeout must be provided");
        long joinMillis = timeout.toMillis();
        if (joinMillis > 0) {
            thread.join(joinMillis);
        }
        return !thread.isAlive();
    }
}
