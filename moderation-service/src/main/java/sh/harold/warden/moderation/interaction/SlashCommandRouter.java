package sh.harold.warden.moderation.interaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.api.moderation.AppealRecord;
import sh.harold.warden.api.moderation.ModerationException;
import sh.harold.warden.api.moderation.TemporarySanction;
import sh.harold.warden.api.moderation.ValidationException;
import sh.harold.warden.api.moderation.ViolationRecord;
import sh.harold.warden.api.platform.ChatPlatform;
import sh.harold.warden.api.platform.MemberSnapshot;
import sh.harold.warden.api.util.Durations;
import sh.harold.warden.moderation.appeal.AppealStore;
import sh.harold.warden.moderation.sanction.ModerationActions;
import sh.harold.warden.moderation.sanction.ViolationReport;
import sh.harold.warden.moderation.sanction.WarnResult;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Runs slash commands against the moderation actions and renders the ephemeral reply text.
 * Rejections are returned as the reply; nothing thrown by an action escapes.
 */
public final class SlashCommandRouter {

    private static final Logger LOGGER = LoggerFactory.getLogger(SlashCommandRouter.class);

    private final ModerationActions actions;
    private final AppealStore appealStore;
    private final ChatPlatform platform;

    public SlashCommandRouter(ModerationActions actions, AppealStore appealStore, ChatPlatform platform) {
        this.actions = Objects.requireNonNull(actions, "actions");
        this.appealStore = Objects.requireNonNull(appealStore, "appealStore");
        this.platform = Objects.requireNonNull(platform, "platform");
    }

    public String handle(SlashRequest request) {
        try {
            return switch (request.command()) {
                case SlashCommands.WARN -> warn(request);
                case SlashCommands.KICK -> kick(request);
                case SlashCommands.BAN -> ban(request);
                case SlashCommands.TEMP_ROLE -> tempRole(request);
                case SlashCommands.VIOLATIONS -> violations(request);
                case SlashCommands.CLEAR_VIOLATIONS -> clearViolations(request);
                case SlashCommands.APPEAL -> appeal(request);
                default -> "Unknown command: " + request.command();
            };
        } catch (ModerationException e) {
            LOGGER.debug("/{} from {} in guild {} rejected: {}", request.command(), request.invokerId(), request.guildId(), e.getMessage());
            return e.getMessage();
        }
    }

    private String warn(SlashRequest request) {
        long target = targetId(request);
        WarnResult result = actions.warn(invoker(request), target, request.option(SlashCommands.OPTION_REASON).orElse(null));
        return "Warned <@" + target + ">. They now have " + result.warningCount() + " warning(s) (tier "
                + result.escalation().tier() + ": " + result.escalation().action().getId() + ").";
    }

    private String kick(SlashRequest request) {
        long target = targetId(request);
        actions.kick(invoker(request), target, request.option(SlashCommands.OPTION_REASON).orElse(null));
        return "Kicked <@" + target + ">.";
    }

    private String ban(SlashRequest request) {
        long target = targetId(request);
        TemporarySanction sanction = actions.ban(invoker(request), target,
                request.option(SlashCommands.OPTION_REASON).orElse(null),
                request.option(SlashCommands.OPTION_DURATION).orElse(null));
        if (sanction == null) {
            return "Banned <@" + target + "> permanently.";
        }
        return "Banned <@" + target + "> until <t:" + sanction.expiresAt().getEpochSecond() + ">.";
    }

    private String tempRole(SlashRequest request) {
        long target = targetId(request);
        long roleId = parseId(request.option(SlashCommands.OPTION_ROLE).orElseThrow(() -> new ValidationException("A role is required")));
        String duration = request.option(SlashCommands.OPTION_DURATION)
                .orElseThrow(() -> new ValidationException("A duration is required"));
        TemporarySanction sanction = actions.tempRole(invoker(request), target, roleId, duration);
        return "Gave <@&" + roleId + "> to <@" + target + "> for " + Durations.format(Durations.parse(duration))
                + " (until <t:" + sanction.expiresAt().getEpochSecond() + ">).";
    }

    private String violations(SlashRequest request) {
        long target = targetId(request);
        ViolationReport report = actions.violations(request.guildId(), target);
        if (report.active().isEmpty()) {
            return "<@" + target + "> has no active violations.";
        }
        String lines = report.active().stream()
                .map(SlashCommandRouter::describe)
                .collect(Collectors.joining("\n"));
        return "<@" + target + "> has " + report.active().size() + " active violation(s), tier " + report.tier() + ":\n" + lines;
    }

    private String clearViolations(SlashRequest request) {
        long target = targetId(request);
        int removed = actions.clearViolations(invoker(request), target);
        return "Cleared " + removed + " violation(s) for <@" + target + ">.";
    }

    private String appeal(SlashRequest request) {
        String reason = request.option(SlashCommands.OPTION_REASON)
                .orElseThrow(() -> new ValidationException("Please explain why your sanction should be lifted"));
        AppealRecord appeal = appealStore.submit(request.guildId(), request.invokerId(), reason);
        return "Your appeal was submitted on <t:" + appeal.submittedAt().getEpochSecond() + "> and is pending review.";
    }

    private MemberSnapshot invoker(SlashRequest request) {
        return platform.member(request.guildId(), request.invokerId())
                .orElseThrow(() -> new ValidationException("Could not resolve your membership in this server"));
    }

    private static long targetId(SlashRequest request) {
        return parseId(request.option(SlashCommands.OPTION_USER).orElseThrow(() -> new ValidationException("A user is required")));
    }

    private static long parseId(String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid id: " + raw);
        }
    }

    private static String describe(ViolationRecord violation) {
        return "- " + violation.type().getDisplayName() + " (severity " + violation.severity() + ") <t:"
                + violation.timestamp().getEpochSecond() + ":R>";
    }
}
