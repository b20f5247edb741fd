package sh.harold.warden.moderation.console.commands;

import sh.harold.warden.api.moderation.ModerationException;
import sh.harold.warden.api.moderation.TemporarySanction;
import sh.harold.warden.api.platform.ChatPlatform;
import sh.harold.warden.moderation.console.CommandHandler;
import sh.harold.warden.moderation.console.ConsoleArguments;
import sh.harold.warden.moderation.sanction.ModerationActions;

import java.util.Objects;

public record TempRoleCommand(ModerationActions actions, ChatPlatform platform) implements CommandHandler {

    public TempRoleCommand {
        Objects.requireNonNull(actions, "actions");
        Objects.requireNonNull(platform, "platform");
    }

    @Override
    public boolean execute(String[] args) {
        if (args.length < 5) {
            System.out.println("Usage: " + getUsage());
            return false;
        }
        try {
            long guildId = ConsoleArguments.id(args, 1, "guild id");
            long userId = ConsoleArguments.id(args, 2, "user id");
            long roleId = ConsoleArguments.id(args, 3, "role id");
            TemporarySanction sanction = actions.tempRole(ConsoleArguments.serviceIdentity(platform, guildId),
                    userId, roleId, args[4]);
            System.out.println("Granted role " + roleId + " to " + userId + " until " + sanction.expiresAt());
            return true;
        } catch (ModerationException ex) {
            ConsoleArguments.printError(ex.getMessage());
            return false;
        }
    }

    @Override
    public String getName() {
        return "temprole";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"tr"};
    }

    @Override
    public String getDescription() {
        return "Grant a role that is removed after a duration";
    }

    @Override
    public String getUsage() {
        return "temprole <guildId> <userId> <roleId> <duration>";
    }
}
