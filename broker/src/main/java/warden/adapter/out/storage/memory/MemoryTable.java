package warden.adapter.out.storage.memory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import warden.core.exception.StorageAlreadyExistsException;
import warden.core.exception.StorageNotFoundException;

/**
 * One entity table of the in-memory backend.
 *
 * <p>Reads go straight to the map. Every write runs under the table lock, so an update's
 * read-apply-write cannot interleave with another write to the same table.
 */
final class MemoryTable<T> {

    private final String entity;
    private final Map<String, T> rows = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    MemoryTable(String entity) {
        this.entity = entity;
    }

    void create(String key, T value) {
        lock.lock();
        try {
            if (rows.containsKey(key)) {
                throw new StorageAlreadyExistsException(entity, key);
            }
            rows.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    T get(String key) {
        final var value = rows.get(key);
        if (value == null) {
            throw new StorageNotFoundException(entity, key);
        }
        return value;
    }

    List<T> list() {
        return List.copyOf(rows.values());
    }

    void delete(String key) {
        lock.lock();
        try {
            if (rows.remove(key) == null) {
                throw new StorageNotFoundException(entity, key);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Apply the updater to the current row. If it throws, the row is left untouched.
     */
    T update(String key, UnaryOperator<T> updater) {
        lock.lock();
        try {
            final var current = rows.get(key);
            if (current == null) {
                throw new StorageNotFoundException(entity, key);
            }
            final var updated = updater.apply(current);
            rows.put(key, updated);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #update} but starts from {@code initial} when the row is absent.
     */
    T upsert(String key, T initial, UnaryOperator<T> updater) {
        lock.lock();
        try {
            final var current = rows.getOrDefault(key, initial);
            final var updated = updater.apply(current);
            rows.put(key, updated);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    long removeIf(Predicate<T> condition) {
        lock.lock();
        try {
            long removed = 0;
            final var iterator = rows.values().iterator();
            while (iterator.hasNext()) {
                if (condition.test(iterator.next())) {
                    iterator.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    void clear() {
        lock.lock();
        try {
            rows.clear();
        } finally {
            lock.unlock();
        }
    }
}
