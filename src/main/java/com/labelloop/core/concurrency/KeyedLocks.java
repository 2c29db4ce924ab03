package com.labelloop.core.concurrency;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One exclusive {@link ReentrantLock} per entity key.
 * <p>
 * The engine keeps one instance for tasks and one for annotators and always acquires a
 * task lock before an annotator lock, never the reverse. Locks of finished entities can be
 * {@link #discard discarded}; a caller that acquired a lock which was discarded meanwhile
 * retries with the current one, so each key is only ever guarded by one lock at a time.
 */
public final class KeyedLocks {

    private final String name;
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public KeyedLocks(String name) {
        this.name = name;
    }

    public <T> T withLock(String key, Supplier<T> action) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
            lock.lock();
            try {
                if (locks.get(key) == lock) {
                    return action.get();
                }
            } finally {
                lock.unlock();
            }
        }
    }

    public void withLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Forgets the lock of a key nobody holds. A held lock is kept.
     *
     * @return true if the key no longer has a lock
     */
    public boolean discard(String key) {
        return locks.computeIfPresent(key, (k, lock) -> lock.isLocked() ? lock : null) == null;
    }

    public boolean isHeldByCurrentThread(String key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isHeldByCurrentThread();
    }

    public int size() {
        return locks.size();
    }

    @Override
    public String toString() {
        return "KeyedLocks[" + name + ", " + locks.size() + " keys]";
    }
}
