package sh.harold.warden.moderation.console.commands;

import sh.harold.warden.api.moderation.ModerationException;
import sh.harold.warden.api.platform.ChatPlatform;
import sh.harold.warden.moderation.console.CommandHandler;
import sh.harold.warden.moderation.console.ConsoleArguments;
import sh.harold.warden.moderation.sanction.ModerationActions;

import java.util.Objects;

public record KickCommand(ModerationActions actions, ChatPlatform platform) implements CommandHandler {

    public KickCommand {
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
            actions.kick(ConsoleArguments.serviceIdentity(platform, guildId), userId, ConsoleArguments.remainder(args, 3));
            System.out.println("Kicked " + userId + " from " + guildId);
            return true;
        } catch (ModerationException ex) {
            ConsoleArguments.printError(ex.getMessage());
            return false;
        }
    }

    @Override
    public String getName() {
        return "kick";
    }

    @Override
    public String[] getAliases() {
        return new String[0];
    }

    @Override
    public String getDescription() {
        return "Kick a member from a guild";
    }

    @Override
    public String getUsage() {
        return "kick <guildId> <userId> [reason...]";
    }
}
