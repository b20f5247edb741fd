package sh.harold.warden.moderation.sanction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.api.messagebus.ChannelConstants;
import sh.harold.warden.api.messagebus.MessageBus;
import sh.harold.warden.api.messagebus.messages.SanctionAppliedMessage;
import sh.harold.warden.api.moderation.EscalationOutcome;
import sh.harold.warden.api.moderation.SanctionAction;
import sh.harold.warden.api.moderation.TemporarySanction;
import sh.harold.warden.api.moderation.ValidationException;
import sh.harold.warden.api.moderation.ViolationRecord;
import sh.harold.warden.api.moderation.ViolationType;
import sh.harold.warden.api.moderation.WarningRecord;
import sh.harold.warden.api.platform.CapabilityException;
import sh.harold.warden.api.platform.ChatPlatform;
import sh.harold.warden.api.platform.HierarchyException;
import sh.harold.warden.api.platform.MemberSnapshot;
import sh.harold.warden.api.platform.PlatformCapability;
import sh.harold.warden.api.platform.PlatformException;
import sh.harold.warden.api.platform.PlatformFailure;
import sh.harold.warden.api.util.Durations;
import sh.harold.warden.moderation.ledger.ViolationLedger;
import sh.harold.warden.moderation.ledger.WarningLedger;
import sh.harold.warden.moderation.lock.ResourceKey;
import sh.harold.warden.moderation.lock.ResourceLockRegistry;
import sh.harold.warden.moderation.schedule.TemporarySanctionRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Moderator-issued commands. Every command checks the moderator's capability and role
 * hierarchy, then the service identity's, before touching the platform. Failures propagate
 * to the caller so they can be reported to the requester.
 */
public final class ModerationActions {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModerationActions.class);
    private static final String NO_REASON = "No reason provided";

    private final ChatPlatform platform;
    private final SanctionExecutor executor;
    private final ViolationLedger violationLedger;
    private final WarningLedger warningLedger;
    private final TemporarySanctionRegistry temporarySanctions;
    private final ResourceLockRegistry locks;
    private final MessageBus messageBus;
    private final Clock clock;

    public ModerationActions(ChatPlatform platform,
                             SanctionExecutor executor,
                             ViolationLedger violationLedger,
                             WarningLedger warningLedger,
                             TemporarySanctionRegistry temporarySanctions,
                             ResourceLockRegistry locks,
                             MessageBus messageBus,
                             Clock clock) {
        this.platform = Objects.requireNonNull(platform, "platform");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.violationLedger = Objects.requireNonNull(violationLedger, "violationLedger");
        this.warningLedger = Objects.requireNonNull(warningLedger, "warningLedger");
        this.temporarySanctions = Objects.requireNonNull(temporarySanctions, "temporarySanctions");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.messageBus = Objects.requireNonNull(messageBus, "messageBus");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Records the moderator's warning and feeds one {@code manual_warning} violation into the escalation ladder.
     */
    public WarnResult warn(MemberSnapshot moderator, long targetId, String reason) {
        String normalizedReason = normalizeReason(reason);
        MemberSnapshot target = requireMember(moderator.guildId(), targetId);
        if (target.bot()) {
            throw new ValidationException("You cannot warn bots!");
        }
        requireCapability(moderator, PlatformCapability.MANAGE_MESSAGES, "You need Manage Messages to warn members");
        requireOutranks(moderator, target, "You cannot warn someone with a higher or equal role!");

        return locks.withLock(ResourceKey.user(target.guildId(), target.userId()), () -> {
            WarningRecord warning = new WarningRecord(target.guildId(), target.userId(), normalizedReason,
                    moderator.userId(), clock.instant());
            warningLedger.append(warning);
            warningLedger.persist();
            EscalationOutcome outcome = executor.applyEscalation(target, ViolationType.MANUAL_WARNING, 1,
                    Actor.moderator(moderator.userId(), moderator.displayName()));
            int count = warningLedger.warnings(target.guildId(), target.userId()).size();
            LOGGER.info("{} warned {} in guild {} ({} warning(s), tier {})",
                    moderator.userId(), target.userId(), target.guildId(), count, outcome.tier());
            return new WarnResult(warning, count, outcome);
        });
    }

    public void kick(MemberSnapshot moderator, long targetId, String reason) {
        String normalizedReason = normalizeReason(reason);
        MemberSnapshot self = requireSelf(moderator.guildId());
        MemberSnapshot target = requireMember(moderator.guildId(), targetId);
        rejectProtectedTarget(self, target, "kick");

        requireCapability(moderator, PlatformCapability.KICK_MEMBERS, "You need Kick Members to kick members");
        requireServiceCapability(self, PlatformCapability.KICK_MEMBERS);
        requireOutranks(moderator, target, "You cannot kick someone with a higher or equal role!");
        requireOutranks(self, target, "My role is not high enough to kick this member");

        platform.kickMember(target.guildId(), target.userId(), normalizedReason);
        LOGGER.info("{} kicked {} from guild {}", moderator.userId(), target.userId(), target.guildId());
        publish(moderator, target.guildId(), target.userId(), SanctionAction.KICK, null, normalizedReason);
    }

    /**
     * Bans the member. With a duration the ban is registered for automatic reversal.
     *
     * @param duration compact duration such as {@code 7d}, or null for a permanent ban
     * @return the temporary sanction registered, or null for a permanent ban
     */
    public TemporarySanction ban(MemberSnapshot moderator, long targetId, String reason, String duration) {
        Duration banLength = duration == null || duration.isBlank() ? null : Durations.parse(duration);
        String normalizedReason = normalizeReason(reason);
        MemberSnapshot self = requireSelf(moderator.guildId());
        MemberSnapshot target = requireMember(moderator.guildId(), targetId);
        rejectProtectedTarget(self, target, "ban");

        requireCapability(moderator, PlatformCapability.BAN_MEMBERS, "You need Ban Members to ban members");
        requireServiceCapability(self, PlatformCapability.BAN_MEMBERS);
        requireOutranks(moderator, target, "You cannot ban someone with a higher or equal role!");
        requireOutranks(self, target, "My role is not high enough to ban this member");

        platform.banMember(target.guildId(), target.userId(), normalizedReason);
        TemporarySanction sanction = null;
        if (banLength != null) {
            Instant expiresAt = clock.instant().plus(banLength);
            sanction = TemporarySanction.ban(target.guildId(), target.userId(), expiresAt, normalizedReason);
            temporarySanctions.register(sanction);
        }
        LOGGER.info("{} banned {} from guild {} ({})", moderator.userId(), target.userId(), target.guildId(),
                banLength == null ? "permanent" : Durations.format(banLength));
        publish(moderator, target.guildId(), target.userId(), SanctionAction.BAN, banLength, normalizedReason);
        return sanction;
    }

    /**
     * Grants a role that is removed again once the duration has passed.
     */
    public TemporarySanction tempRole(MemberSnapshot moderator, long targetId, long roleId, String duration) {
        Duration length = Durations.parse(duration);
        long guildId = moderator.guildId();
        MemberSnapshot self = requireSelf(guildId);
        MemberSnapshot target = requireMember(guildId, targetId);
        int rolePosition = platform.rolePosition(guildId, roleId)
                .orElseThrow(() -> new ValidationException("Role " + roleId + " does not exist"));

        requireCapability(moderator, PlatformCapability.MANAGE_ROLES, "You need Manage Roles to assign roles");
        requireServiceCapability(self, PlatformCapability.MANAGE_ROLES);
        if (!moderator.owner() && rolePosition >= moderator.topRolePosition()) {
            throw new HierarchyException("You cannot assign a role higher than or equal to your highest role!");
        }
        if (rolePosition >= self.topRolePosition()) {
            throw new HierarchyException("That role is higher than or equal to my highest role");
        }

        platform.addRole(guildId, target.userId(), roleId, "Temporary role: " + Durations.format(length));
        TemporarySanction sanction = TemporarySanction.role(guildId, target.userId(), roleId,
                clock.instant().plus(length), "Temporary role granted by " + moderator.userId());
        temporarySanctions.register(sanction);
        LOGGER.info("{} granted role {} to {} in guild {} for {}",
                moderator.userId(), roleId, target.userId(), guildId, Durations.format(length));
        publish(moderator, guildId, target.userId(), null, length, sanction.reason());
        return sanction;
    }

    /**
     * Wipes the member's violation history, dropping them back to a clean tier.
     *
     * @return the number of records removed
     */
    public int clearViolations(MemberSnapshot moderator, long targetId) {
        requireCapability(moderator, PlatformCapability.ADMINISTRATOR, "You need Administrator to clear violations");
        int removed = violationLedger.clear(moderator.guildId(), targetId);
        LOGGER.info("{} cleared {} violation(s) of {} in guild {}", moderator.userId(), removed, targetId, moderator.guildId());
        return removed;
    }

    public ViolationReport violations(long guildId, long targetId) {
        Instant now = clock.instant();
        List<ViolationRecord> active = violationLedger.activeViolations(guildId, targetId, now);
        int total = violationLedger.history(guildId, targetId).size();
        return new ViolationReport(guildId, targetId, active, total, violationLedger.tierFor(guildId, targetId, now));
    }

    public List<WarningRecord> warnings(long guildId, long targetId) {
        return warningLedger.warnings(guildId, targetId);
    }

    private MemberSnapshot requireMember(long guildId, long userId) {
        return platform.member(guildId, userId)
                .orElseThrow(() -> new ValidationException("Member " + userId + " is not in this guild"));
    }

    private MemberSnapshot requireSelf(long guildId) {
        return platform.self(guildId)
                .orElseThrow(() -> new PlatformException(PlatformFailure.NOT_FOUND, "Guild " + guildId + " is not available"));
    }

    private static void rejectProtectedTarget(MemberSnapshot self, MemberSnapshot target, String verb) {
        if (target.userId() == self.userId()) {
            throw new ValidationException("I cannot " + verb + " myself!");
        }
        if (target.owner()) {
            throw new ValidationException("You cannot " + verb + " the server owner!");
        }
    }

    private static void requireCapability(MemberSnapshot actor, PlatformCapability capability, String message) {
        if (!actor.hasCapability(capability)) {
            throw new CapabilityException(capability, message);
        }
    }

    private static void requireServiceCapability(MemberSnapshot self, PlatformCapability capability) {
        requireCapability(self, capability, "I need the " + capability + " permission to do that");
    }

    private static void requireOutranks(MemberSnapshot actor, MemberSnapshot target, String message) {
        if (!actor.outranks(target)) {
            throw new HierarchyException(message);
        }
    }

    private static String normalizeReason(String reason) {
        if (reason == null || reason.isBlank()) {
            return NO_REASON;
        }
        String trimmed = reason.trim();
        if (trimmed.length() > WarningRecord.MAX_REASON_LENGTH) {
            throw new ValidationException("Reason must be " + WarningRecord.MAX_REASON_LENGTH + " characters or fewer!");
        }
        return trimmed;
    }

    private void publish(MemberSnapshot moderator, long guildId, long userId, SanctionAction action,
                         Duration duration, String reason) {
        SanctionAppliedMessage message = new SanctionAppliedMessage();
        message.setGuildId(guildId);
        message.setUserId(userId);
        message.setModeratorId(moderator.userId());
        message.setAutomatic(false);
        message.setAction(action);
        message.setDuration(duration);
        message.setReason(reason);
        message.setIssuedAt(clock.instant());
        messageBus.broadcast(ChannelConstants.SANCTION_APPLIED, message);
    }
}
