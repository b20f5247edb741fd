package sh.harold.warden.moderation.sanction;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sh.harold.warden.api.messagebus.MessageEnvelope;
import sh.harold.warden.api.moderation.EscalationOutcome;
import sh.harold.warden.api.moderation.SanctionAction;
import sh.harold.warden.api.moderation.ViolationType;
import sh.harold.warden.api.platform.CapabilityException;
import sh.harold.warden.api.platform.MemberSnapshot;
import sh.harold.warden.api.platform.PlatformCapability;
import sh.harold.warden.api.platform.PlatformException;
import sh.harold.warden.api.platform.PlatformFailure;
import sh.harold.warden.moderation.testing.ModerationFixture;
import sh.harold.warden.moderation.testing.RecordingChatPlatform;

import java.time.Duration;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SanctionExecutorTest {

    private static final long GUILD = 1L;
    private static final long USER = 42L;

    private ModerationFixture fixture;
    private MemberSnapshot member;
    private Actor auto;

    @BeforeEach
    void setUp() {
        fixture = new ModerationFixture();
        fixture.platform.withGuild(GUILD);
        member = fixture.platform.addMember(GUILD, USER, 1);
        auto = Actor.automatic(RecordingChatPlatform.SERVICE_ID);
    }

    @Test
    @DisplayName("Five violations walk the default ladder from warn to ban")
    void escalatesThroughDefaultTiers() {
        SanctionAction[] expected = {
                SanctionAction.WARN, SanctionAction.TIMEOUT, SanctionAction.TIMEOUT, SanctionAction.TIMEOUT, SanctionAction.BAN
        };
        for (int i = 0; i < expected.length; i++) {
            EscalationOutcome outcome = fixture.executor.applyEscalation(member, ViolationType.SPAM, 2, auto);
            assertThat(outcome.tier()).isEqualTo(i + 1);
            assertThat(outcome.action()).isEqualTo(expected[i]);
            fixture.clock.advance(Duration.ofMinutes(1));
        }

        assertThat(fixture.platform.calls()).containsExactly(
                "timeout:1:42:PT30M",
                "timeout:1:42:PT2H",
                "timeout:1:42:PT24H",
                "ban:1:42");
        assertThat(fixture.warningLedger.warnings(GUILD, USER)).singleElement().satisfies(warning -> {
            assertThat(warning.moderatorId()).isEqualTo(RecordingChatPlatform.SERVICE_ID);
            assertThat(warning.reason()).isEqualTo("Auto-escalation: spam (Violation tier 1)");
        });
    }

    @Test
    void sixthViolationStaysOnTheTopTier() {
        for (int i = 0; i < 5; i++) {
            fixture.executor.applyEscalation(member, ViolationType.SPAM, 2, auto);
        }

        EscalationOutcome sixth = fixture.executor.applyEscalation(member, ViolationType.BLOCKED_WORDS, 3, auto);

        assertThat(sixth.activeViolations()).isEqualTo(6);
        assertThat(sixth.tier()).isEqualTo(5);
        assertThat(sixth.action()).isEqualTo(SanctionAction.BAN);
        assertThat(fixture.platform.calls("ban")).hasSize(2);
    }

    @Test
    void expiredViolationsDoNotEscalate() {
        fixture.executor.applyEscalation(member, ViolationType.SPAM, 2, auto);
        fixture.clock.advance(Duration.ofDays(31));

        EscalationOutcome outcome = fixture.executor.applyEscalation(member, ViolationType.SPAM, 2, auto);

        assertThat(outcome.tier()).isEqualTo(1);
        assertThat(fixture.platform.calls("timeout")).isEmpty();
    }

    @Test
    void missingCapabilityFailsClosedAndKeepsTheViolation() {
        fixture.platform.withGuild(GUILD, EnumSet.of(PlatformCapability.MANAGE_MESSAGES));
        fixture.executor.applyEscalation(member, ViolationType.SPAM, 2, auto);

        assertThatThrownBy(() -> fixture.executor.applyEscalation(member, ViolationType.SPAM, 2, auto))
                .isInstanceOfSatisfying(CapabilityException.class,
                        e -> assertThat(e.getCapability()).isEqualTo(PlatformCapability.MODERATE_MEMBERS));

        assertThat(fixture.platform.calls()).isEmpty();
        assertThat(fixture.violationLedger.history(GUILD, USER)).hasSize(2);
        assertThat(fixture.applied()).hasSize(1);
    }

    @Test
    void platformFailurePropagatesAndKeepsTheViolation() {
        fixture.executor.applyEscalation(member, ViolationType.SPAM, 2, auto);
        fixture.platform.failOn("timeout", PlatformFailure.FORBIDDEN);

        assertThatThrownBy(() -> fixture.executor.applyEscalation(member, ViolationType.SPAM, 2, auto))
                .isInstanceOfSatisfying(PlatformException.class,
                        e -> assertThat(e.getFailure()).isEqualTo(PlatformFailure.FORBIDDEN));

        assertThat(fixture.violationLedger.activeViolations(GUILD, USER, fixture.clock.instant())).hasSize(2);
    }

    @Test
    void publishesAppliedSanctionAfterSuccess() {
        fixture.executor.applyEscalation(member, ViolationType.SPAM, 2, auto);
        fixture.executor.applyEscalation(member, ViolationType.MENTION_SPAM, 2, auto);

        assertThat(fixture.applied()).hasSize(2);
        MessageEnvelope second = fixture.applied().get(1);
        assertThat(second.getPayload().get("action").asText()).isEqualTo("timeout");
        assertThat(second.getPayload().get("violationType").asText()).isEqualTo("mention_spam");
        assertThat(second.getPayload().get("tier").asInt()).isEqualTo(2);
        assertThat(second.getPayload().get("automatic").asBoolean()).isTrue();
    }

    @Test
    void outOfRangeSeverityIsNormalizedBeforePublishing() {
        EscalationOutcome outcome = fixture.executor.applyEscalation(member, ViolationType.MANUAL_WARNING, 9, auto);

        assertThat(outcome.violation().severity()).isEqualTo(1);
        assertThat(fixture.applied().get(0).getPayload().get("severity").asInt()).isEqualTo(1);
    }
}
