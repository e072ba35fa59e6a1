package io.pactkit.core.handles;

import io.pactkit.core.error.FrozenHandleException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Maps small positive integers to immutable values.
 *
 * <p>Handles are allocated from a monotonically increasing counter and never reused, so a stale
 * handle can only ever miss. Each entry has its own read-write lock: reads of different handles
 * never contend, and updates to one handle are serialised. An update replaces the entry's value
 * with a new immutable snapshot, so readers never see a half-applied change.
 *
 * <p>An entry can be frozen, after which every update is refused.
 *
 * @param <T> the (immutable) value type
 */
public final class HandleRegistry<T> {

    private static final class Entry<T> {
        final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        T value;
        boolean frozen;

        Entry(T value) {
            this.value = value;
        }
    }

    private final AtomicInteger next = new AtomicInteger(1);
    private final Map<Integer, Entry<T>> entries = new ConcurrentHashMap<>();

    /** Registers {@code value} and returns its new handle (always {@code > 0}). */
    public int allocate(T value) {
        if (value == null) {
            throw new NullPointerException("value must not be null");
        }
        int handle = next.getAndIncrement();
        entries.put(handle, new Entry<>(value));
        return handle;
    }

    /** Current snapshot of the value, or empty if the handle is unknown or released. */
    public Optional<T> get(int handle) {
        Entry<T> entry = entries.get(handle);
        if (entry == null) {
            return Optional.empty();
        }
        entry.lock.readLock().lock();
        try {
            return Optional.of(entry.value);
        } finally {
            entry.lock.readLock().unlock();
        }
    }

    /** Applies {@code reader} to the current snapshot. */
    public <R> Optional<R> read(int handle, Function<T, R> reader) {
        return get(handle).map(reader);
    }

    /**
     * Replaces the value through {@code update}.
     *
     * @return {@code false} if the handle is unknown, released or frozen
     */
    public boolean withMutable(int handle, UnaryOperator<T> update) {
        try {
            update(handle, update);
            return true;
        } catch (FrozenHandleException e) {
            return false;
        }
    }

    /**
     * Replaces the value through {@code update}, reporting why an update was refused.
     *
     * @return {@code false} if the handle is unknown or released
     * @throws FrozenHandleException if the handle is frozen
     */
    public boolean update(int handle, UnaryOperator<T> update) {
        Entry<T> entry = entries.get(handle);
        if (entry == null) {
            return false;
        }
        entry.lock.writeLock().lock();
        try {
            if (entry.frozen) {
                throw new FrozenHandleException(handle);
            }
            T updated = update.apply(entry.value);
            if (updated == null) {
                throw new NullPointerException("update must not produce null for handle " + handle);
            }
            entry.value = updated;
            return true;
        } finally {
            entry.lock.writeLock().unlock();
        }
    }

    /** Freezes the handle. Returns {@code false} if it is unknown. */
    public boolean freeze(int handle) {
        Entry<T> entry = entries.get(handle);
        if (entry == null) {
            return false;
        }
        entry.lock.writeLock().lock();
        try {
            entry.frozen = true;
            return true;
        } finally {
            entry.lock.writeLock().unlock();
        }
    }

    public boolean isFrozen(int handle) {
        Entry<T> entry = entries.get(handle);
        if (entry == null) {
            return false;
        }
        entry.lock.readLock().lock();
        try {
            return entry.frozen;
        } finally {
            entry.lock.readLock().unlock();
        }
    }

    /** Drops the handle. Returns {@code false} if it was already gone. */
    public boolean release(int handle) {
        return entries.remove(handle) != null;
    }

    public boolean contains(int handle) {
        return entries.containsKey(handle);
    }

    /** Handles whose current value satisfies {@code filter}, in allocation order. */
    public List<Integer> handles(Predicate<T> filter) {
        List<Integer> result = new ArrayList<>();
        for (Map.Entry<Integer, Entry<T>> entry : new TreeMap<>(entries).entrySet()) {
            if (get(entry.getKey()).filter(filter).isPresent()) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    public int size() {
        return entries.size();
    }
}
