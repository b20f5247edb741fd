package sh.harold.warden.moderation.console.commands;

import sh.harold.warden.api.moderation.ModerationException;
import sh.harold.warden.api.platform.ChatPlatform;
import sh.harold.warden.moderation.console.CommandHandler;
import sh.harold.warden.moderation.console.ConsoleArguments;
import sh.harold.warden.moderation.sanction.ModerationActions;

import java.util.Objects;

public record ClearViolationsCommand(ModerationActions actions, ChatPlatform platform) implements CommandHandler {

    public ClearViolationsCommand {
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
            int removed = actions.clearViolations(ConsoleArguments.serviceIdentity(platform, guildId), userId);
            System.out.println("Cleared " + removed + " violation(s) for " + userId);
            return true;
        } catch (ModerationException ex) {
            ConsoleArguments.printError(ex.getMessage());
            return false;
        }
    }

    @Override
    public String getName() {
        return "clearviolations";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"cv"};
    }

    @Override
    public String getDescription() {
        return "Erase a member's violation history";
    }

    @Override
    public String getUsage() {
        return "clearviolations <guildId> <userId>";
    }
}
