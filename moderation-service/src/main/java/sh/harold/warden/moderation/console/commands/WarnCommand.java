package sh.harold.warden.moderation.console.commands;

import sh.harold.warden.api.moderation.ModerationException;
import sh.harold.warden.api.platform.ChatPlatform;
import sh.harold.warden.api.platform.MemberSnapshot;
import sh.harold.warden.moderation.console.CommandHandler;
import sh.harold.warden.moderation.console.ConsoleArguments;
import sh.harold.warden.moderation.sanction.ModerationActions;
import sh.harold.warden.moderation.sanction.WarnResult;

import java.util.Objects;

public record WarnCommand(ModerationActions actions, ChatPlatform platform) implements CommandHandler {

    public WarnCommand {
        Objects.requireNonNull(actions, "actions");
        Objects.requireNonNull(platform, "platform");
    }

    @Override
    public boolean execute(String[] args) {
        if (args.length < 4) {
            System.out.println("Usage: " + getUsage());
            return false;
        }
        try {
            long guildId = ConsoleArguments.id(args, 1, "guild id");
            long userId = ConsoleArguments.id(args, 2, "user id");
            MemberSnapshot moderator = ConsoleArguments.serviceIdentity(platform, guildId);
            WarnResult result = actions.warn(moderator, userId, ConsoleArguments.remainder(args, 3));
            System.out.println("Warned " + userId + " (" + result.warningCount() + " warning(s), tier "
                    + result.escalation().tier() + " -> " + result.escalation().action().getId() + ")");
            return true;
        } catch (ModerationException ex) {
            ConsoleArguments.printError(ex.getMessage());
            return false;
        }
    }

    @Override
    public String getName() {
        return "warn";
    }

    @Override
    public String[] getAliases() {
        return new String[0];
    }

    @Override
    public String getDescription() {
        return "Warn a member and escalate";
    }

    @Override
    public String getUsage() {
        return "warn <guildId> <userId> <reason...>";
    }
}
