package sh.harold.warden.moderation.automod;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.api.moderation.EscalationOutcome;
import sh.harold.warden.api.moderation.GuildConfig;
import sh.harold.warden.api.moderation.ModerationException;
import sh.harold.warden.api.platform.ChatPlatform;
import sh.harold.warden.api.platform.InboundMessage;
import sh.harold.warden.api.platform.MemberSnapshot;
import sh.harold.warden.api.platform.PlatformException;
import sh.harold.warden.moderation.detection.Finding;
import sh.harold.warden.moderation.detection.RoleWhitelist;
import sh.harold.warden.moderation.detection.RuleDetector;
import sh.harold.warden.moderation.guild.GuildConfigStore;
import sh.harold.warden.moderation.sanction.Actor;
import sh.harold.warden.moderation.sanction.SanctionExecutor;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Gateway entry point for automatic moderation: inspect, delete, escalate.
 */
public final class AutoModerationPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(AutoModerationPipeline.class);

    private final GuildConfigStore configStore;
    private final RoleWhitelist roleWhitelist;
    private final RuleDetector detector;
    private final SanctionExecutor executor;
    private final ChatPlatform platform;

    public AutoModerationPipeline(GuildConfigStore configStore,
                                  RoleWhitelist roleWhitelist,
                                  RuleDetector detector,
                                  SanctionExecutor executor,
                                  ChatPlatform platform) {
        this.configStore = Objects.requireNonNull(configStore, "configStore");
        this.roleWhitelist = Objects.requireNonNull(roleWhitelist, "roleWhitelist");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.platform = Objects.requireNonNull(platform, "platform");
    }

    /**
     * Runs the rule checks for one message and escalates the most severe finding.
     *
     * @return the escalation applied, or empty when the message was clean, authored by a bot,
     * or the escalation could not be completed
     */
    public Optional<EscalationOutcome> onMessage(InboundMessage message) {
        if (message.authorBot()) {
            return Optional.empty();
        }

        GuildConfig config = configStore.get(message.guildId());
        List<Finding> findings;
        try {
            findings = detector.inspect(message, config, roleWhitelist.roles(message.guildId()));
        } catch (ModerationException e) {
            LOGGER.warn("Could not inspect message {} from {} in guild {}: {}",
                    message.messageId(), message.authorId(), message.guildId(), e.getMessage());
            return Optional.empty();
        }
        Optional<Finding> worst = Finding.mostSevere(findings);
        if (worst.isEmpty()) {
            return Optional.empty();
        }
        Finding finding = worst.get();
        LOGGER.debug("Message {} from {} in guild {} flagged: {}",
                message.messageId(), message.authorId(), message.guildId(), findings);

        try {
            platform.deleteMessage(message.guildId(), message.channelId(), message.messageId());
        } catch (PlatformException e) {
            LOGGER.warn("Could not delete message {} in guild {}: {}", message.messageId(), message.guildId(), e.getMessage());
        }

        try {
            MemberSnapshot member = lookupAuthor(message);
            return Optional.of(executor.applyEscalation(member, finding.type(), finding.severity(), serviceActor(message.guildId())));
        } catch (ModerationException e) {
            LOGGER.warn("Auto-moderation of {} in guild {} for {} did not complete: {}",
                    message.authorId(), message.guildId(), finding.type().getId(), e.getMessage());
            return Optional.empty();
        }
    }

    public GuildConfig onGuildJoin(long guildId) {
        GuildConfig config = configStore.initialize(guildId);
        LOGGER.info("Joined guild {}; auto-moderation configuration ready", guildId);
        return config;
    }

    private MemberSnapshot lookupAuthor(InboundMessage message) {
        try {
            return platform.member(message.guildId(), message.authorId()).orElseGet(() -> fallbackSnapshot(message));
        } catch (PlatformException e) {
            LOGGER.warn("Member lookup for {} in guild {} failed ({}); escalating from the message snapshot",
                    message.authorId(), message.guildId(), e.getMessage());
            return fallbackSnapshot(message);
        }
    }

    private Actor serviceActor(long guildId) {
        try {
            return platform.self(guildId).map(self -> Actor.automatic(self.userId())).orElse(Actor.automatic(0L));
        } catch (PlatformException e) {
            LOGGER.debug("Service identity lookup in guild {} failed: {}", guildId, e.getMessage());
            return Actor.automatic(0L);
        }
    }

    private static MemberSnapshot fallbackSnapshot(InboundMessage message) {
        return new MemberSnapshot(message.guildId(), message.authorId(), null, message.authorRoleIds(),
                0, null, message.authorBot(), false);
    }
}
