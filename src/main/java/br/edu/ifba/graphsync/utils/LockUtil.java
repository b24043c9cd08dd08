package br.edu.ifba.graphsync.utils;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide named locks.
 * Exports hold the lock named after their sync scope so two runs never write the same
 * scope at once.
 */
public final class LockUtil {

    private static final ConcurrentHashMap<String, ReentrantLock> LOCK_POOL = new ConcurrentHashMap<>();

    private LockUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Gets the lock for a given key.
     * The same key always returns the same lock instance.
     *
     * @param key The lock key
     * @return ReentrantLock for the key
     */
    @NotNull
    public static ReentrantLock getLock(@NotNull String key) {
        return LOCK_POOL.computeIfAbsent(key, k -> new ReentrantLock(true)); // fair lock
    }

    /**
     * Tries to acquire the lock for a key, waiting at most {@code timeout}.
     *
     * <p>The lock is not reentrant for this purpose: a thread that already holds it is
     * refused, so a nested export of the same scope fails instead of interleaving.</p>
     *
     * @param key The lock key
     * @param timeout Maximum time to wait
     * @return true if the lock was acquired
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    public static boolean tryAcquire(@NotNull String key, @NotNull Duration timeout) throws InterruptedException {
        ReentrantLock lock = getLock(key);
        if (lock.isHeldByCurrentThread()) {
            return false;
        }
        return lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Releases the lock for a key if the current thread holds it.
     *
     * @param key The lock key
     */
    public static void release(@NotNull String key) {
        ReentrantLock lock = LOCK_POOL.get(key);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
        }
    }

    /**
     * Returns whether any thread currently holds the lock for a key.
     */
    public static boolean isLocked(@NotNull String key) {
        ReentrantLock lock = LOCK_POOL.get(key);
        return lock != null && lock.isLocked();
    }

    /**
     * Clears the lock pool (useful for testing).
     */
    public static void clearLockPool() {
        LOCK_POOL.clear();
    }
}
