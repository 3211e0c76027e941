package dev.dmcode.scheduler;

import java.time.Duration;
import java.util.Objects;

public sealed interface ScheduleMode {

    static ScheduleMode immediate() {
        return Immediate.INSTANCE;
    }

    static ScheduleMode delayed(Duration delay) {
        return new Delayed(delay);
    }

    static ScheduleMode periodic(Duration interval) {
        return new Periodic(interval);
    }

    record Immediate() implements ScheduleMode {

        private static final Immediate INSTANCE = new Immediate();
    }

    record Delayed(Duration delay) implements ScheduleMode {

        public Delayed {
            Objects.requireNonNull(delay, "Delay must be provided");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("Delay must not be negative");
            }
        }
    }

    /**
     * Runs every {@code interval}, measured from the completion of the previous run.
     * The first run is due one interval after enqueue.
     */
    record Periodic(Duration interval) implements ScheduleMode {

        public Periodic {
            Objects.requireNonNull(interval, "Interval must be provided");
            if (interval.isNegative() || interval.isZero()) {
                throw new IllegalArgumentException("Interval must be positive");
            }
        }
    }
}
