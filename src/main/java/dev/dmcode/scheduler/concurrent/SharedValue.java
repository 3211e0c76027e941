package dev.dmcode.scheduler.concurrent;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Single-slot holder of an optional value that can be shared between threads.
 * <p>
 * All operations are serialized by one lock, so {@link #access(Function)} can be used
 * for read-modify-write sequences that must not interleave with other updates.
 *
 * @param <T> type of the held value
 */
public final class SharedValue<T> {

    private final Lock lock = new ReentrantLock();
    private final String name;

    private T value;

    public SharedValue(String name) {
        this(name, null);
    }

    public SharedValue(String name, T initialValue) {
        this.name = Objects.requireNonNull(name, "Name must be provided");
        this.value = initialValue;
    }

    /**
     * Runs {@code transform} while holding the lock. The {@link Slot} passed in is only
     * valid for the duration of the call.
     */
    public <R> R access(Function<? super Slot<T>, ? extends R> transform) {
        Objects.requireNonNull(transform, "Transform must be provided");
        lock.lock();
        try {
            return transform.apply(new LockedSlot());
        } finally {
            lock.unlock();
        }
    }

    public void override(T newValue) {
        Objects.requireNonNull(newValue, "Value must be provided");
        lock.lock();
        try {
            value = newValue;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            value = null;
        } finally {
            lock.unlock();
        }
    }

    public T read() {
        lock.lock();
        try {
            if (value == null) {
                throw new ValueNotFoundException("Shared value not found: " + name);
            }
            return value;
        } finally {
            lock.unlock();
        }
    }

    public T read(T defaultValue) {
        lock.lock();
        try {
            return value != null ? value : defaultValue;
        } finally {
            lock.unlock();
        }
    }

    public boolean isPresent() {
        lock.lock();
        try {
            return value != null;
        } finally {
            lock.unlock();
        }
    }

    public interface Slot<T> {

        Optional<T> get();

        void set(T value);

        void clear();
    }

    private final class LockedSlot implements Slot<T> {

        @Override
        public Optional<T> get() {
            return Optional.ofNullable(value);
        }

        @Override
        public void set(T newValue) {
            value = Objects.requireNonNull(newValue, "Value must be provided");
        }

        @Override
        public void clear() {
            value = null;
        }
    }
}
