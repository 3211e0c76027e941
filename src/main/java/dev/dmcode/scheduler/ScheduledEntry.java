package dev.dmcode.scheduler;

import java.time.Instant;
import java.util.Comparator;

final class ScheduledEntry {

    static final Comparator<ScheduledEntry> DUE_ORDER = Comparator
        .comparing(ScheduledEntry::dueAt)
        .thenComparingLong(entry -> entry.id().value());

    private final TaskId id;
    private final Task task;
    private final ScheduleMode mode;
    private Instant dueAt;

    ScheduledEntry(TaskId id, Task task, ScheduleMode mode, Instant dueAt) {
        this.id = id;
        this.task = task;
        this.mode = mode;
        this.dueAt = dueAt;
    }

    TaskId id() {
        return id;
    }

    Task task() {
        return task;
    }

    ScheduleMode mode() {
        return mode;
    }

    Instant dueAt() {
        return dueAt;
    }

    boolean isDue(Instant now) {
        return dueAt == null || !dueAt.isAfter(now);
    }

    void reschedule(Instant dueAt) {
        this.dueAt = dueAt;
    }

    @Override
    public String toString() {
        return "ScheduledEntry[id=" + id + ", mode=" + mode + ", dueAt=" + dueAt + "]";
    }
}
