package sh.harold.warden.moderation.schedule;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import sh.harold.warden.api.moderation.ViolationType;
import sh.harold.warden.moderation.detection.SpamTracker;
import sh.harold.warden.moderation.testing.ModerationFixture;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

class RetentionSweeperTest {

    @Test
    void sweepsExpiredViolationsAndIdleSpamWindows() {
        ModerationFixture fixture = new ModerationFixture();
        SpamTracker spamTracker = new SpamTracker(fixture.locks);
        RetentionSweeper sweeper = new RetentionSweeper(fixture.violationLedger, spamTracker,
                Mockito.mock(ScheduledExecutorService.class), fixture.clock, Duration.ofMinutes(60));

        fixture.violationLedger.record(1L, 42L, ViolationType.SPAM, 2, ModerationFixture.START);
        spamTracker.record(1L, 42L, ModerationFixture.START, Duration.ofSeconds(5));
        fixture.clock.advance(Duration.ofDays(10));
        fixture.violationLedger.record(1L, 42L, ViolationType.SPAM, 2, fixture.clock.instant());

        RetentionSweeper.SweepResult early = sweeper.runOnce();
        assertThat(early.prunedViolations()).isZero();
        assertThat(early.evictedSpamWindows()).isEqualTo(1);

        fixture.clock.advance(Duration.ofDays(25));
        RetentionSweeper.SweepResult later = sweeper.runOnce();

        assertThat(later.prunedViolations()).isEqualTo(1);
        assertThat(later.evictedSpamWindows()).isZero();
        assertThat(fixture.violationLedger.history(1L, 42L)).hasSize(1);
        assertThat(spamTracker.trackedMembers()).isZero();
    }
}
