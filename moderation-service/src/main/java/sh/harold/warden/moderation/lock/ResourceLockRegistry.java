package sh.harold.warden.moderation.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.api.moderation.ModerationException;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Hands out one reentrant lock per {@link ResourceKey}. Locks are created on first use and kept
 * for the lifetime of the process; the key space is bounded by guild and member counts.
 */
public final class ResourceLockRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceLockRegistry.class);

    private final Map<ResourceKey, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration acquireTimeout;

    public ResourceLockRegistry(Duration acquireTimeout) {
        this.acquireTimeout = Objects.requireNonNull(acquireTimeout, "acquireTimeout");
        if (acquireTimeout.isNegative() || acquireTimeout.isZero()) {
            throw new IllegalArgumentException("acquireTimeout must be positive");
        }
    }

    /**
     * Runs the action while holding the key's lock, waiting at most the configured timeout.
     *
     * @throws ResourceLockTimeoutException if the lock could not be acquired in time
     */
    public <T> T withLock(ResourceKey key, Supplier<T> action) {
        ReentrantLock lock = lockFor(key);
        acquire(key, lock);
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(ResourceKey key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Runs the action only if the lock is free right now.
     *
     * @return false if another task holds the lock and the action was skipped
     */
    public boolean tryWithLock(ResourceKey key, Runnable action) {
        ReentrantLock lock = lockFor(key);
        if (!lock.tryLock()) {
            return false;
        }
        try {
            action.run();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeldByCurrentThread(ResourceKey key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isHeldByCurrentThread();
    }

    public int size() {
        return locks.size();
    }

    ReentrantLock lockFor(ResourceKey key) {
        Objects.requireNonNull(key, "key");
        return locks.computeIfAbsent(key, ignored -> new ReentrantLock());
    }

    private void acquire(ResourceKey key, ReentrantLock lock) {
        try {
            if (!lock.tryLock(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Timed out after {} ms waiting for lock on {}", acquireTimeout.toMillis(), key);
                throw new ResourceLockTimeoutException(key, "Timed out waiting for lock on " + key);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModerationException("Interrupted while waiting for lock on " + key, e);
        }
    }
}
