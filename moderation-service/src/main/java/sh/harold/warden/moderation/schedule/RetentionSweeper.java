package sh.harold.warden.moderation.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.moderation.detection.SpamTracker;
import sh.harold.warden.moderation.ledger.ViolationLedger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically drops violation records past the retention window and idle spam windows.
 * Busy members are skipped rather than waited for.
 */
public class RetentionSweeper implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetentionSweeper.class);
    private static final Duration SPAM_WINDOW_IDLE = Duration.ofHours(1);

    private final ViolationLedger violationLedger;
    private final SpamTracker spamTracker;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Duration interval;

    private ScheduledFuture<?> sweepTask;

    public RetentionSweeper(ViolationLedger violationLedger,
                            SpamTracker spamTracker,
                            ScheduledExecutorService scheduler,
                            Clock clock,
                            Duration interval) {
        this.violationLedger = Objects.requireNonNull(violationLedger, "violationLedger");
        this.spamTracker = Objects.requireNonNull(spamTracker, "spamTracker");
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
        LOGGER.info("Retention sweeper started (interval: {}m, retention: {}d)",
                interval.toMinutes(), violationLedger.getRetention().toDays());
    }

    public synchronized void stop() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
            LOGGER.info("Retention sweeper stopped");
        }
    }

    @Override
    public void close() {
        stop();
    }

    public SweepResult runOnce() {
        Instant now = clock.instant();
        int prunedViolations = violationLedger.pruneExpired(now);
        int evictedWindows = spamTracker.evictIdle(now, SPAM_WINDOW_IDLE);
        if (prunedViolations > 0 || evictedWindows > 0) {
            LOGGER.info("Retention sweep removed {} violation(s) and {} idle spam window(s)", prunedViolations, evictedWindows);
        }
        return new SweepResult(prunedViolations, evictedWindows);
    }

    private void safeRun() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            LOGGER.error("Retention sweep failed", e);
        }
    }

    public record SweepResult(int prunedViolations, int evictedSpamWindows) {
    }
}
