package dev.dmcode.scheduler.executor;

import dev.dmcode.scheduler.TaskExecutionException;
import dev.dmcode.scheduler.TaskScheduler;
import dev.dmcode.scheduler.backend.ExecutorHandle;
import dev.dmcode.scheduler.concurrent.SharedValue;
import dev.dmcode.scheduler.concurrent.ValueNotFoundException;
import dev.dmcode.scheduler.signal.SignalStream;
import dev.dmcode.scheduler.signal.WakeupSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns wakeup events into scheduler cycles on a background drain loop.
 * <p>
 * Starts {@link ExecutorState#IDLE}; {@link #resume()} moves to {@link ExecutorState#RUNNING}
 * and {@link #pause()} to {@link ExecutorState#PAUSED}. Pausing is cooperative: a task that is
 * already running completes, then the loop exits before taking the next event.
 */
public class TaskExecutor implements ExecutorHandle {

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskExecutor.class);

    private final AtomicInteger loopSequence = new AtomicInteger();

    private final TaskScheduler scheduler;
    private final WakeupSignal signal;
    private final TaskExecutorConfiguration configuration;
    private final SharedValue<ExecutorState> state;

    // guarded by the state cell
    private DrainLoop drainLoop;

    public TaskExecutor(TaskScheduler scheduler, WakeupSignal signal) {
        this(scheduler, signal, TaskExecutorConfiguration.createDefault());
    }

    public TaskExecutor(TaskScheduler scheduler, WakeupSignal signal, TaskExecutorConfiguration configuration) {
        this(scheduler, signal, configuration, new SharedValue<>("executor state", ExecutorState.IDLE));
    }

    TaskExecutor(
        TaskScheduler scheduler,
        WakeupSignal signal,
        TaskExecutorConfiguration configuration,
        SharedValue<ExecutorState> state
    ) {
        this.scheduler = Objects.requireNonNull(scheduler, "Task scheduler must be provided");
        this.signal = Objects.requireNonNull(signal, "Wakeup signal must be provided");
        this.configuration = Objects.requireNonNull(configuration, "Executor configuration must be provided");
        this.state = Objects.requireNonNull(state, "Executor state must be provided");
    }

    public ExecutorState state() {
        return state.read(ExecutorState.IDLE);
    }

    /**
     * Switches to {@link ExecutorState#RUNNING} and makes sure a drain loop is alive.
     *
     * @return the live drain loop, which may have been started by an earlier call
     */
    public DrainLoop resume() {
        return state.access(slot -> {
            slot.set(ExecutorState.RUNNING);
            if (drainLoop == null || !drainLoop.isAlive()) {
                var loop = new DrainLoop(configuration.threadName() + "-" + loopSequence.incrementAndGet(), this::drain);
                drainLoop = loop;
                loop.start();
            }
            return drainLoop;
        });
    }

    /**
     * Resumes and blocks until the started drain loop exits.
     */
    public void resumeAndWait() throws InterruptedException {
        resume().await();
    }

    public void pause() {
        boolean paused = state.access(slot -> {
            if (slot.get().filter(ExecutorState.RUNNING::equals).isPresent()) {
                slot.set(ExecutorState.PAUSED);
                return true;
            }
            return false;
        });
        if (paused) {
            LOGGER.info("Executor paused");
            signal.trigger();
        }
    }

    /**
     * Pauses and waits up to the configured termination timeout for the drain loop to exit.
     *
     * @return {@code true} if no drain loop is alive afterwards
     */
    public boolean pauseAndWait() {
        var loop = state.access(slot -> drainLoop);
        pause();
        if (loop == null) {
            return true;
        }
        try {
            return loop.awaitTermination(configuration.threadTerminationTimeout());
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            LOGGER.error("Interrupted while awaiting drain loop termination", exception);
            return false;
        }
    }

    /**
     * Runs one due entry directly, regardless of the executor state and without the wakeup signal.
     */
    @Override
    public boolean justNext() throws TaskExecutionException {
        return scheduler.runNext();
    }

    private void drain(DrainLoop self) {
        LOGGER.info("Drain loop {} started", self.name());
        var stream = signal.stream();
        Duration idleTimeout = null;
        try {
            while (awaitWakeup(stream, idleTimeout)) {
                if (!continueDraining(self)) {
                    LOGGER.info("Drain loop {} stopped, executor is not running", self.name());
                    return;
                }
                boolean ran = runCycle();
                idleTimeout = null;
                if (scheduler.hasPendingWork()) {
                    if (ran) {
                        signal.trigger();
                    } else {
                        idleTimeout = scheduler.timeUntilNextDue().orElse(null);
                    }
                }
            }
            LOGGER.info("Drain loop {} stopped, wakeup stream ended", self.name());
        } catch (ValueNotFoundException exception) {
            LOGGER.error("Drain loop {} stopped, executor state not found", self.name(), exception);
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Drain loop {} interrupted", self.name());
        } catch (RuntimeException exception) {
            LOGGER.error("Drain loop {} failed", self.name(), exception);
        } finally {
            detach(self);
        }
    }

    private static boolean awaitWakeup(SignalStream stream, Duration timeout) throws InterruptedException {
        return timeout != null ? stream.next(timeout) : stream.next();
    }

    private boolean continueDraining(DrainLoop self) {
        return state.access(slot -> {
            var current = slot.get()
                .orElseThrow(() -> new ValueNotFoundException("Executor state not found"));
            if (current == ExecutorState.RUNNING) {
                return true;
            }
            if (drainLoop == self) {
                drainLoop = null;
            }
            return false;
        });
    }

    private boolean runCycle() {
        try {
            return scheduler.runNext();
        } catch (TaskExecutionException exception) {
            if (exception.getCause() instanceof InterruptedException) {
                // the drain loop is never interrupted from outside, the flag came from the task
                Thread.interrupted();
            }
            LOGGER.error("Task {} failed", exception.taskId(), exception);
            return true;
        }
    }

    private void detach(DrainLoop self) {
        state.access(slot -> {
            if (drainLoop == self) {
                drainLoop = null;
            }
            return null;
        });
    }
}
