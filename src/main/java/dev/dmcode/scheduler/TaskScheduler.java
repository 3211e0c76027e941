package dev.dmcode.scheduler;

import dev.dmcode.scheduler.concurrent.SharedValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Queue;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns scheduled work and decides what is due.
 * <p>
 * Entries live in exactly one of three collections: ready (immediate, FIFO), delayed
 * (single-shot) and periodic (repeating). Every operation is serialized by a single lock
 * which is also held while a task executes, so cycles never interleave. The lock is
 * reentrant: a running task may enqueue, cancel or even run further work on its own thread.
 * <p>
 * When several entries are due, ready work wins, then the earliest-due delayed entry, then
 * the earliest-due periodic entry; equal due times fall back to enqueue order.
 */
public class TaskScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskScheduler.class);

    private static final SharedValue<TaskScheduler> DEFAULT_INSTANCE = new SharedValue<>("default task scheduler");

    private final Lock lock = new ReentrantLock();

    private final Deque<ScheduledEntry> ready = new ArrayDeque<>();
    private final Queue<ScheduledEntry> delayed = new PriorityQueue<>(ScheduledEntry.DUE_ORDER);
    private final Queue<ScheduledEntry> periodic = new PriorityQueue<>(ScheduledEntry.DUE_ORDER);

    private final Clock clock;

    private long nextId = 1;
    private ScheduledEntry executingEntry;
    private boolean executingEntryCancelled;

    public TaskScheduler() {
        this(Clock.systemUTC());
    }

    public TaskScheduler(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must be provided");
    }

    /**
     * Process-wide instance, created on first use. Prefer passing an explicit instance.
     */
    public static TaskScheduler getDefault() {
        return DEFAULT_INSTANCE.access(slot -> slot.get().orElseGet(() -> {
            var scheduler = new TaskScheduler();
            slot.set(scheduler);
            return scheduler;
        }));
    }

    public static void resetDefault() {
        DEFAULT_INSTANCE.clear();
    }

    public TaskId enqueue(Task task, ScheduleMode mode) {
        Objects.requireNonNull(task, "Task must be provided");
        Objects.requireNonNull(mode, "Schedule mode must be provided");
        lock.lock();
        try {
            var id = new TaskId(nextId++);
            var now = clock.instant();
            if (mode instanceof ScheduleMode.Delayed delayedMode) {
                delayed.add(new ScheduledEntry(id, task, mode, dueAfter(now, delayedMode.delay())));
            } else if (mode instanceof ScheduleMode.Periodic periodicMode) {
                periodic.add(new ScheduledEntry(id, task, mode, dueAfter(now, periodicMode.interval())));
            } else {
                ready.addLast(new ScheduledEntry(id, task, mode, null));
            }
            LOGGER.debug("Task {} enqueued: {}", id, mode);
            return id;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs at most one due entry.
     *
     * @return {@code true} if an entry ran, whether or not it failed
     * @throws TaskExecutionException if the executed task failed; the entry has already been
     *                                discarded or, for periodic entries, rescheduled
     */
    public boolean runNext() throws TaskExecutionException {
        lock.lock();
        try {
            var entry = pollDueEntry(clock.instant());
            if (entry == null) {
                return false;
            }
            execute(entry);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean hasPendingWork() {
        lock.lock();
        try {
            return !ready.isEmpty() || !delayed.isEmpty() || !periodic.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return ready.size() + delayed.size() + periodic.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Time left until the next entry becomes due; zero if something is due already and
     * empty if nothing is pending.
     */
    public Optional<Duration> timeUntilNextDue() {
        lock.lock();
        try {
            if (!ready.isEmpty()) {
                return Optional.of(Duration.ZERO);
            }
            Instant earliest = earliestDueAt();
            if (earliest == null) {
                return Optional.empty();
            }
            var remaining = Duration.between(clock.instant(), earliest);
            return Optional.of(remaining.isNegative() ? Duration.ZERO : remaining);
        } finally {
            lock.unlock();
        }
    }

    public boolean cancel(TaskId id) {
        Objects.requireNonNull(id, "Task ID must be provided");
        lock.lock();
        try {
            boolean removed = ready.removeIf(entry -> entry.id().equals(id))
                || delayed.removeIf(entry -> entry.id().equals(id))
                || periodic.removeIf(entry -> entry.id().equals(id));
            if (!removed && executingEntry != null && executingEntry.id().equals(id)
                && executingEntry.mode() instanceof ScheduleMode.Periodic) {
                executingEntryCancelled = true;
                removed = true;
            }
            if (removed) {
                LOGGER.debug("Task {} cancelled", id);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    private ScheduledEntry pollDueEntry(Instant now) {
        if (!ready.isEmpty()) {
            return ready.pollFirst();
        }
        if (isHeadDue(delayed, now)) {
            return delayed.poll();
        }
        if (isHeadDue(periodic, now)) {
            return periodic.poll();
        }
        return null;
    }

    private void execute(ScheduledEntry entry) throws TaskExecutionException {
        var previousEntry = executingEntry;
        boolean previousCancelled = executingEntryCancelled;
        executingEntry = entry;
        executingEntryCancelled = false;
        Exception failure = null;
        try {
            LOGGER.debug("Executing task {}", entry.id());
            entry.task().execute();
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            failure = exception;
        } catch (Exception exception) {
            failure = exception;
        } finally {
            if (entry.mode() instanceof ScheduleMode.Periodic periodicMode && !executingEntryCancelled) {
                entry.reschedule(dueAfter(clock.instant(), periodicMode.interval()));
                periodic.add(entry);
            }
            executingEntry = previousEntry;
            executingEntryCancelled = previousCancelled;
        }
        if (failure != null) {
            throw new TaskExecutionException(entry.id(), failure);
        }
    }

    private Instant earliestDueAt() {
        var delayedHead = delayed.peek();
        var periodicHead = periodic.peek();
        if (delayedHead == null) {
            return periodicHead != null ? periodicHead.dueAt() : null;
        }
        if (periodicHead == null) {
            return delayedHead.dueAt();
        }
        return delayedHead.dueAt().isBefore(periodicHead.dueAt()) ? delayedHead.dueAt() : periodicHead.dueAt();
    }

    // saturates at Instant.MAX
    private static Instant dueAfter(Instant now, Duration duration) {
        if (duration.compareTo(Duration.between(now, Instant.MAX)) >= 0) {
            return Instant.MAX;
        }
        return now.plus(duration);
    }

    private static boolean isHeadDue(Queue<ScheduledEntry> queue, Instant now) {
        var head = queue.peek();
        return head != null && head.isDue(now);
    }
}
