package sh.harold.warden.moderation.schedule;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import sh.harold.warden.api.messagebus.MessageEnvelope;
import sh.harold.warden.api.moderation.TemporarySanction;
import sh.harold.warden.api.platform.PlatformFailure;
import sh.harold.warden.moderation.testing.ModerationFixture;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

@ExtendWith(MockitoExtension.class)
class TemporalSanctionSchedulerTest {

    private static final long GUILD = 1L;
    private static final long USER = 42L;
    private static final long ROLE = 500L;

    @Mock
    private ScheduledExecutorService executor;

    @Mock
    private ScheduledFuture<?> future;

    private ModerationFixture fixture;
    private TemporalSanctionScheduler scheduler;

    @BeforeEach
    void setUp() {
        fixture = new ModerationFixture();
        fixture.platform.withGuild(GUILD);
        fixture.platform.addMember(GUILD, USER, 1);
        scheduler = new TemporalSanctionScheduler(fixture.temporarySanctions, fixture.platform, fixture.locks,
                fixture.bus, executor, fixture.clock, Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("An expired role is removed and its record deleted even when the member already left")
    void expiredRoleOfDepartedMemberIsDropped() {
        fixture.temporarySanctions.register(TemporarySanction.role(GUILD, USER, ROLE, at(Duration.ofMinutes(10)), "trial"));
        fixture.platform.removeMember(GUILD, USER);
        fixture.platform.failOn("removeRole", PlatformFailure.NOT_FOUND);
        fixture.clock.advance(Duration.ofMinutes(11));

        assertThat(scheduler.runOnce()).isEqualTo(1);

        assertThat(fixture.temporarySanctions.size()).isZero();
        MessageEnvelope reversed = fixture.reversed().get(0);
        assertThat(reversed.getPayload().get("reverted").asBoolean()).isFalse();
        assertThat(reversed.getPayload().get("failure").asText()).isEqualTo("NOT_FOUND");
    }

    @Test
    void expiredBanIsLifted() {
        fixture.temporarySanctions.register(TemporarySanction.ban(GUILD, USER, at(Duration.ofDays(1)), "spam"));
        fixture.clock.advance(Duration.ofDays(1));

        assertThat(scheduler.runOnce()).isEqualTo(1);

        assertThat(fixture.platform.calls()).containsExactly("unban:1:42");
        assertThat(fixture.reversed()).singleElement()
                .satisfies(envelope -> assertThat(envelope.getPayload().get("reverted").asBoolean()).isTrue());
    }

    @Test
    void pendingSanctionsAreLeftAlone() {
        fixture.temporarySanctions.register(TemporarySanction.role(GUILD, USER, ROLE, at(Duration.ofHours(1)), "trial"));
        fixture.clock.advance(Duration.ofMinutes(59));

        assertThat(scheduler.runOnce()).isZero();
        assertThat(fixture.platform.calls()).isEmpty();
        assertThat(fixture.temporarySanctions.size()).isEqualTo(1);
    }

    @Test
    void secondRunDoesNothing() {
        fixture.temporarySanctions.register(TemporarySanction.role(GUILD, USER, ROLE, at(Duration.ofMinutes(1)), "trial"));
        fixture.clock.advance(Duration.ofMinutes(5));

        assertThat(scheduler.runOnce()).isEqualTo(1);
        assertThat(scheduler.runOnce()).isZero();
        assertThat(fixture.platform.calls("removeRole")).hasSize(1);
        assertThat(fixture.reversed()).hasSize(1);
    }

    @Test
    void unavailableGuildStillDropsTheRecord() {
        fixture.temporarySanctions.register(TemporarySanction.ban(GUILD, USER, at(Duration.ofMinutes(1)), "spam"));
        fixture.platform.setGuildAvailable(GUILD, false);
        fixture.clock.advance(Duration.ofMinutes(2));

        assertThat(scheduler.runOnce()).isEqualTo(1);

        assertThat(fixture.platform.calls()).isEmpty();
        assertThat(fixture.temporarySanctions.find("1:42")).isEmpty();
        assertThat(fixture.reversed().get(0).getPayload().get("failure").asText()).isEqualTo("guild unavailable");
    }

    @Test
    @DisplayName("An unexpected reversal error is reported once and never retried")
    void unexpectedReversalErrorStillDropsTheRecord() {
        fixture.temporarySanctions.register(TemporarySanction.role(GUILD, USER, ROLE, at(Duration.ofMinutes(1)), "trial"));
        fixture.platform.failOn("removeRole", new IllegalStateException("Missing permission: MANAGE_ROLES"));
        fixture.clock.advance(Duration.ofMinutes(2));

        assertThat(scheduler.runOnce()).isEqualTo(1);
        assertThat(scheduler.runOnce()).isZero();

        assertThat(fixture.temporarySanctions.size()).isZero();
        assertThat(fixture.reversed()).singleElement().satisfies(envelope -> {
            assertThat(envelope.getPayload().get("reverted").asBoolean()).isFalse();
            assertThat(envelope.getPayload().get("failure").asText()).isEqualTo("unexpected error: IllegalStateException");
        });
    }

    @Test
    void reissuedSanctionWithLaterExpiryReplacesTheOldOne() {
        fixture.temporarySanctions.register(TemporarySanction.ban(GUILD, USER, at(Duration.ofMinutes(1)), "spam"));
        fixture.temporarySanctions.register(TemporarySanction.ban(GUILD, USER, at(Duration.ofHours(1)), "again"));
        fixture.clock.advance(Duration.ofMinutes(2));

        assertThat(scheduler.runOnce()).isZero();
        assertThat(fixture.temporarySanctions.find("1:42")).map(TemporarySanction::reason).contains("again");
    }

    @Test
    void processesInExpiryOrderAcrossGuilds() {
        fixture.platform.withGuild(2L);
        fixture.temporarySanctions.register(TemporarySanction.ban(2L, USER, at(Duration.ofMinutes(3)), "later"));
        fixture.temporarySanctions.register(TemporarySanction.ban(GUILD, USER, at(Duration.ofMinutes(1)), "first"));
        fixture.clock.advance(Duration.ofMinutes(5));

        assertThat(scheduler.runOnce()).isEqualTo(2);
        assertThat(fixture.platform.calls()).containsExactly("unban:1:42", "unban:2:42");
    }

    @Test
    void registryRestoresPendingSanctionsFromStore() {
        fixture.temporarySanctions.register(TemporarySanction.role(GUILD, USER, ROLE, at(Duration.ofHours(1)), "trial"));

        TemporarySanctionRegistry reloaded = new TemporarySanctionRegistry(fixture.store, fixture.locks);
        reloaded.load();

        assertThat(reloaded.all()).singleElement().satisfies(sanction -> {
            assertThat(sanction.key()).isEqualTo("1:42:500");
            assertThat(sanction.roleId()).isEqualTo(ROLE);
        });
    }

    @Test
    void startSchedulesAtTheConfiguredIntervalOnce() {
        doReturn(future).when(executor).scheduleWithFixedDelay(any(Runnable.class), eq(60_000L), eq(60_000L), eq(TimeUnit.MILLISECONDS));

        scheduler.start();
        scheduler.start();
        scheduler.stop();

        verify(executor).scheduleWithFixedDelay(any(Runnable.class), eq(60_000L), eq(60_000L), eq(TimeUnit.MILLISECONDS));
        verify(future).cancel(false);
        verifyNoMoreInteractions(executor);
    }

    private static Instant at(Duration offset) {
        return ModerationFixture.START.plus(offset);
    }
}
