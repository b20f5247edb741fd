package sh.harold.warden.moderation.effects;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sh.harold.warden.api.messagebus.ChannelConstants;
import sh.harold.warden.api.messagebus.MessageEnvelope;
import sh.harold.warden.api.moderation.ViolationType;
import sh.harold.warden.api.platform.MemberSnapshot;
import sh.harold.warden.api.platform.PlatformCapability;
import sh.harold.warden.moderation.sanction.Actor;
import sh.harold.warden.moderation.testing.ModerationFixture;
import sh.harold.warden.moderation.testing.RecordingChatPlatform;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReputationSubscriberTest {

    private static final long GUILD = 1L;
    private static final long USER = 42L;

    private ModerationFixture fixture;
    private ReputationLedger ledger;
    private MemberSnapshot member;

    @BeforeEach
    void setUp() {
        fixture = new ModerationFixture();
        fixture.platform.withGuild(GUILD);
        member = fixture.platform.addMember(GUILD, USER, 1);
        ledger = new ReputationLedger(fixture.store);
        new ReputationSubscriber(ledger, fixture.mapper, 10).register(fixture.bus);
    }

    @Test
    void deductsPenaltyTimesSeverity() {
        fixture.executor.applyEscalation(member, ViolationType.SPAM, 2, Actor.automatic(RecordingChatPlatform.SERVICE_ID));
        fixture.executor.applyEscalation(member, ViolationType.BLOCKED_WORDS, 3, Actor.automatic(RecordingChatPlatform.SERVICE_ID));

        assertThat(ledger.points(GUILD, USER)).isEqualTo(-50);

        ReputationLedger reloaded = new ReputationLedger(fixture.store);
        reloaded.load();
        assertThat(reloaded.points(GUILD, USER)).isEqualTo(-50);
    }

    @Test
    void sanctionsWithoutViolationLeaveReputationAlone() {
        MemberSnapshot moderator = fixture.platform.addMember(GUILD, 10L, 50, PlatformCapability.KICK_MEMBERS);

        fixture.actions.kick(moderator, USER, "bye");

        assertThat(ledger.points(GUILD, USER)).isZero();
    }

    @Test
    void malformedPayloadIsIgnored() {
        ReputationSubscriber subscriber = new ReputationSubscriber(ledger, fixture.mapper, 10);
        MessageEnvelope envelope = new MessageEnvelope(ChannelConstants.SANCTION_APPLIED, "test", UUID.randomUUID(),
                0L, 1, fixture.mapper.createObjectNode().put("severity", "high"));

        subscriber.handle(envelope);

        assertThat(ledger.points(GUILD, USER)).isZero();
    }

    @Test
    void negativePenaltyIsRejected() {
        assertThatThrownBy(() -> new ReputationSubscriber(ledger, fixture.mapper, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
