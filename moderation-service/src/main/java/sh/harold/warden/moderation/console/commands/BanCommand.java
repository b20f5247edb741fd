package sh.harold.warden.moderation.console.commands;

import sh.harold.warden.api.moderation.ModerationException;
import sh.harold.warden.api.moderation.TemporarySanction;
import sh.harold.warden.api.platform.ChatPlatform;
import sh.harold.warden.api.util.Durations;
import sh.harold.warden.moderation.console.CommandHandler;
import sh.harold.warden.moderation.console.ConsoleArguments;
import sh.harold.warden.moderation.sanction.ModerationActions;

import java.util.Objects;

/**
 * The argument after the user id is read as a duration when it parses as one; otherwise it starts the reason.
 */
public record BanCommand(ModerationActions actions, ChatPlatform platform) implements CommandHandler {

    public BanCommand {
        Objects.requireNonNull(actions, "actions");
        Objects.requireNonNull(platform, "platform");
    }

    @Override
    public boolean execute(String[] args) {
        if (args.length < 3) {
            System.out.println("Usage: " + getUsage());
            return false;
        }
        try {
            long guildId = ConsoleArguments.id(args, 1, "guild id");
            long userId = ConsoleArguments.id(args, 2, "user id");
            String duration = null;
            int reasonIndex = 3;
            if (args.length > 3 && Durations.isValid(args[3])) {
                duration = args[3];
                reasonIndex = 4;
            }
            TemporarySanction sanction = actions.ban(ConsoleArguments.serviceIdentity(platform, guildId), userId,
                    ConsoleArguments.remainder(args, reasonIndex), duration);
            System.out.println(sanction == null
                    ? "Permanently banned " + userId + " from " + guildId
                    : "Banned " + userId + " from " + guildId + " until " + sanction.expiresAt());
            return true;
        } catch (ModerationException ex) {
            ConsoleArguments.printError(ex.getMessage());
            return false;
        }
    }

    @Override
    public String getName() {
        return "ban";
    }

    @Override
    public String[] getAliases() {
        return new String[0];
    }

    @Override
    public String getDescription() {
        return "Ban a member, optionally for a limited time";
    }

    @Override
    public String getUsage() {
        return "ban <guildId> <userId> [duration] [reason...]";
    }
}
