package sh.harold.warden.moderation.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.api.messagebus.ChannelConstants;
import sh.harold.warden.api.messagebus.MessageBus;
import sh.harold.warden.api.messagebus.messages.SanctionReversedMessage;
import sh.harold.warden.api.moderation.ModerationException;
import sh.harold.warden.api.moderation.TemporarySanction;
import sh.harold.warden.api.platform.ChatPlatform;
import sh.harold.warden.api.platform.PlatformException;
import sh.harold.warden.api.platform.PlatformFailure;
import sh.harold.warden.moderation.lock.ResourceKey;
import sh.harold.warden.moderation.lock.ResourceLockRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Reverses expired temporary bans and role grants. Each expired record gets exactly one
 * reversal attempt and is deleted afterwards whether or not the platform call succeeded.
 */
public class TemporalSanctionScheduler implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TemporalSanctionScheduler.class);

    private final TemporarySanctionRegistry registry;
    private final ChatPlatform platform;
    private final ResourceLockRegistry locks;
    private final MessageBus messageBus;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Duration interval;

    private ScheduledFuture<?> sweepTask;

    public TemporalSanctionScheduler(TemporarySanctionRegistry registry,
                                     ChatPlatform platform,
                                     ResourceLockRegistry locks,
                                     MessageBus messageBus,
                                     ScheduledExecutorService scheduler,
                                     Clock clock,
                                     Duration interval) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.platform = Objects.requireNonNull(platform, "platform");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.messageBus = Objects.requireNonNull(messageBus, "messageBus");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.interval = Objects.requireNonNull(interval, "interval");
    }

    public synchronized void start() {
        if (sweepTask != null) {
            return;
        }
        long periodMs = interval.toMillis();
        sweepTask = scheduler.scheduleWithFixedDelay(this::safeRun, periodMs, periodMs, TimeUnit.MILLISECONDS);
        LOGGER.info("Temporary sanction scheduler started (interval: {}s, pending: {})",
                interval.toSeconds(), registry.size());
    }

    public synchronized void stop() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
            LOGGER.info("Temporary sanction scheduler stopped");
        }
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Processes every sanction expired as of now.
     *
     * @return the number of records removed
     */
    public int runOnce() {
        Instant now = clock.instant();
        List<TemporarySanction> expired = registry.expired(now);
        int removed = 0;
        for (TemporarySanction candidate : expired) {
            try {
                if (process(candidate.key(), now)) {
                    removed++;
                }
            } catch (ModerationException e) {
                LOGGER.warn("Skipping temporary sanction {} this round: {}", candidate.key(), e.getMessage());
            }
        }
        if (removed > 0) {
            LOGGER.info("Reversed {} expired temporary sanction(s)", removed);
        }
        return removed;
    }

    private void safeRun() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            LOGGER.error("Temporary sanction sweep failed", e);
        }
    }

    private boolean process(String key, Instant now) {
        return locks.withLock(ResourceKey.sanction(key), () -> {
            TemporarySanction sanction = registry.find(key).orElse(null);
            if (sanction == null || !sanction.isExpired(now)) {
                // Removed or re-issued with a later expiry since the scan.
                return false;
            }

            String failure = reverse(sanction);
            registry.remove(key);
            publishReversed(sanction, failure, now);
            return true;
        });
    }

    /**
     * @return null on success, otherwise a short description of why the reversal did not happen
     */
    private String reverse(TemporarySanction sanction) {
        long guildId = sanction.guildId();
        if (!platform.isGuildAvailable(guildId)) {
            LOGGER.warn("Guild {} is gone; dropping temporary sanction {}", guildId, sanction.key());
            return "guild unavailable";
        }

        try {
            switch (sanction.type()) {
                case BAN -> platform.unbanMember(guildId, sanction.userId(), "Temporary ban expired");
                case ROLE -> platform.removeRole(guildId, sanction.userId(), sanction.roleId(), "Temporary role expired");
            }
            LOGGER.info("Reversed temporary {} for {} in guild {}", sanction.type().getId(), sanction.userId(), guildId);
            return null;
        } catch (PlatformException e) {
            if (e.getFailure() == PlatformFailure.NOT_FOUND) {
                LOGGER.info("Temporary {} for {} in guild {} had nothing left to reverse: {}",
                        sanction.type().getId(), sanction.userId(), guildId, e.getMessage());
            } else {
                LOGGER.warn("Failed to reverse temporary {} for {} in guild {}: {}",
                        sanction.type().getId(), sanction.userId(), guildId, e.getMessage());
            }
            return e.getFailure().name();
        } catch (ModerationException e) {
            LOGGER.warn("Failed to reverse temporary {} for {} in guild {}: {}",
                    sanction.type().getId(), sanction.userId(), guildId, e.getMessage());
            return e.getMessage();
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected error reversing temporary {} for {} in guild {}",
                    sanction.type().getId(), sanction.userId(), guildId, e);
            return "unexpected error: " + e.getClass().getSimpleName();
        }
    }

    private void publishReversed(TemporarySanction sanction, String failure, Instant now) {
        SanctionReversedMessage message = new SanctionReversedMessage();
        message.setSanctionKey(sanction.key());
        message.setType(sanction.type());
        message.setGuildId(sanction.guildId());
        message.setUserId(sanction.userId());
        message.setRoleId(sanction.roleId());
        message.setReverted(failure == null);
        message.setFailure(failure);
        message.setReversedAt(now);
        messageBus.broadcast(ChannelConstants.SANCTION_REVERSED, message);
    }
}
