package sh.harold.warden.moderation.detection;

import sh.harold.warden.moderation.lock.ResourceKey;
import sh.harold.warden.moderation.lock.ResourceLockRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sliding window of recent message timestamps per member. Each window is only touched while
 * the member's lock is held.
 */
public final class SpamTracker {

    private final Map<ResourceKey.UserKey, Deque<Instant>> windows = new ConcurrentHashMap<>();
    private final ResourceLockRegistry locks;

    public SpamTracker(ResourceLockRegistry locks) {
        this.locks = Objects.requireNonNull(locks, "locks");
    }

    /**
     * Records a message and returns how many messages (including this one) fall inside the window.
     */
    public int record(long guildId, long userId, Instant sentAt, Duration window) {
        ResourceKey.UserKey key = ResourceKey.user(guildId, userId);
        return locks.withLock(key, () -> {
            Deque<Instant> timestamps = windows.computeIfAbsent(key, ignored -> new ArrayDeque<>());
            prune(timestamps, sentAt, window);
            timestamps.addLast(sentAt);
            return timestamps.size();
        });
    }

    /**
     * Drops windows whose newest entry is older than {@code maxIdle}. Busy members are skipped.
     *
     * @return the number of windows removed
     */
    public int evictIdle(Instant now, Duration maxIdle) {
        AtomicInteger removed = new AtomicInteger();
        for (ResourceKey.UserKey key : windows.keySet()) {
            locks.tryWithLock(key, () -> {
                Deque<Instant> timestamps = windows.get(key);
                if (timestamps == null) {
                    return;
                }
                prune(timestamps, now, maxIdle);
                if (timestamps.isEmpty()) {
                    windows.remove(key);
                    removed.incrementAndGet();
                }
            });
        }
        return removed.get();
    }

    public int trackedMembers() {
        return windows.size();
    }

    private static void prune(Deque<Instant> timestamps, Instant now, Duration window) {
        while (!timestamps.isEmpty() && Duration.between(timestamps.peekFirst(), now).compareTo(window) >= 0) {
            timestamps.removeFirst();
        }
    }
}
