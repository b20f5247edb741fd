package sh.harold.warden.moderation.sanction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.api.messagebus.ChannelConstants;
import sh.harold.warden.api.messagebus.MessageBus;
import sh.harold.warden.api.messagebus.messages.SanctionAppliedMessage;
import sh.harold.warden.api.moderation.EscalationOutcome;
import sh.harold.warden.api.moderation.EscalationTable;
import sh.harold.warden.api.moderation.PunishmentSpec;
import sh.harold.warden.api.moderation.SanctionAction;
import sh.harold.warden.api.moderation.ViolationRecord;
import sh.harold.warden.api.moderation.ViolationType;
import sh.harold.warden.api.moderation.WarningRecord;
import sh.harold.warden.api.platform.CapabilityException;
import sh.harold.warden.api.platform.ChatPlatform;
import sh.harold.warden.api.platform.MemberSnapshot;
import sh.harold.warden.api.platform.PlatformCapability;
import sh.harold.warden.api.platform.PlatformException;
import sh.harold.warden.api.platform.PlatformFailure;
import sh.harold.warden.moderation.ledger.ViolationLedger;
import sh.harold.warden.moderation.ledger.WarningLedger;
import sh.harold.warden.moderation.lock.ResourceKey;
import sh.harold.warden.moderation.lock.ResourceLockRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Records a violation and applies the punishment for the tier it produces. The whole
 * record, evaluate, act, persist sequence runs under the member's lock.
 */
public final class SanctionExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(SanctionExecutor.class);

    private final ChatPlatform platform;
    private final ViolationLedger violationLedger;
    private final WarningLedger warningLedger;
    private final EscalationTable escalationTable;
    private final ResourceLockRegistry locks;
    private final MessageBus messageBus;
    private final Clock clock;

    public SanctionExecutor(ChatPlatform platform,
                            ViolationLedger violationLedger,
                            WarningLedger warningLedger,
                            EscalationTable escalationTable,
                            ResourceLockRegistry locks,
                            MessageBus messageBus,
                            Clock clock) {
        this.platform = Objects.requireNonNull(platform, "platform");
        this.violationLedger = Objects.requireNonNull(violationLedger, "violationLedger");
        this.warningLedger = Objects.requireNonNull(warningLedger, "warningLedger");
        this.escalationTable = Objects.requireNonNull(escalationTable, "escalationTable");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.messageBus = Objects.requireNonNull(messageBus, "messageBus");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Records the violation, then applies the punishment mapped to the member's new tier.
     * Hierarchy is not checked here; callers acting for a human moderator check it first.
     *
     * @throws CapabilityException if the service identity lacks the capability the punishment needs.
     *                             The violation stays recorded.
     * @throws PlatformException   if the platform rejected the punishment. The violation stays recorded.
     */
    public EscalationOutcome applyEscalation(MemberSnapshot member, ViolationType type, int severity, Actor actor) {
        Objects.requireNonNull(member, "member");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(actor, "actor");

        long guildId = member.guildId();
        long userId = member.userId();
        return locks.withLock(ResourceKey.user(guildId, userId), () -> {
            Instant now = clock.instant();
            ViolationRecord violation = violationLedger.record(guildId, userId, type, severity, now);
            int active = violationLedger.activeViolations(guildId, userId, now).size();
            int tier = escalationTable.tierFor(active);
            PunishmentSpec punishment = escalationTable.punishmentFor(tier);
            String reason = "Auto-escalation: " + type.getId() + " (Violation tier " + tier + ")";

            try {
                execute(member, punishment, actor, reason, now);
            } catch (CapabilityException | PlatformException e) {
                LOGGER.warn("Escalation to tier {} ({}) for {} in guild {} failed: {}",
                        tier, punishment.action().getId(), userId, guildId, e.getMessage());
                throw e;
            } finally {
                violationLedger.persist();
                if (punishment.action() == SanctionAction.WARN) {
                    warningLedger.persist();
                }
            }

            EscalationOutcome outcome = new EscalationOutcome(violation, active, tier, punishment);
            LOGGER.info("Applied {} (tier {}) to {} in guild {} for {}",
                    punishment.action().getId(), tier, userId, guildId, type.getId());
            publishApplied(member, violation, outcome, actor, reason, now);
            return outcome;
        });
    }

    private void execute(MemberSnapshot member, PunishmentSpec punishment, Actor actor, String reason, Instant now) {
        long guildId = member.guildId();
        long userId = member.userId();
        switch (punishment.action()) {
            case WARN -> {
                // escalation warnings are issued by the service identity, never the moderator
                long issuer = platform.self(guildId).map(MemberSnapshot::userId).orElse(actor.userId());
                warningLedger.append(new WarningRecord(guildId, userId, reason, issuer, now));
            }
            case TIMEOUT -> {
                requireServiceCapability(guildId, PlatformCapability.MODERATE_MEMBERS);
                platform.timeoutMember(guildId, userId, punishment.duration(), reason);
            }
            case KICK -> {
                requireServiceCapability(guildId, PlatformCapability.KICK_MEMBERS);
                platform.kickMember(guildId, userId, reason);
            }
            case BAN -> {
                requireServiceCapability(guildId, PlatformCapability.BAN_MEMBERS);
                platform.banMember(guildId, userId, reason);
            }
        }
    }

    private void requireServiceCapability(long guildId, PlatformCapability capability) {
        MemberSnapshot self = platform.self(guildId)
                .orElseThrow(() -> new PlatformException(PlatformFailure.NOT_FOUND, "Guild " + guildId + " is not available"));
        if (!self.hasCapability(capability)) {
            throw new CapabilityException(capability, "Service identity lacks " + capability + " in guild " + guildId);
        }
    }

    private void publishApplied(MemberSnapshot member, ViolationRecord violation, EscalationOutcome outcome,
                                Actor actor, String reason, Instant now) {
        SanctionAppliedMessage message = new SanctionAppliedMessage();
        message.setGuildId(member.guildId());
        message.setUserId(member.userId());
        message.setModeratorId(actor.userId());
        message.setAutomatic(actor.automatic());
        message.setViolationType(violation.type());
        message.setSeverity(violation.severity());
        message.setTier(outcome.tier());
        message.setAction(outcome.action());
        Duration duration = outcome.punishment().duration();
        message.setDuration(duration);
        message.setReason(reason);
        message.setIssuedAt(now);
        messageBus.broadcast(ChannelConstants.SANCTION_APPLIED, message);
    }
}
