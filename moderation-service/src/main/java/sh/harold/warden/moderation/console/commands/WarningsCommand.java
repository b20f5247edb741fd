package sh.harold.warden.moderation.console.commands;

import sh.harold.warden.api.moderation.ModerationException;
import sh.harold.warden.api.moderation.WarningRecord;
import sh.harold.warden.moderation.console.CommandHandler;
import sh.harold.warden.moderation.console.ConsoleArguments;
import sh.harold.warden.moderation.console.TableFormatter;
import sh.harold.warden.moderation.sanction.ModerationActions;

import java.util.List;
import java.util.Objects;

public record WarningsCommand(ModerationActions actions) implements CommandHandler {

    public WarningsCommand {
        Objects.requireNonNull(actions, "actions");
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
            List<WarningRecord> warnings = actions.warnings(guildId, userId);
            if (warnings.isEmpty()) {
                System.out.println("No warnings recorded for " + userId);
                return true;
            }
            TableFormatter table = new TableFormatter().addHeaders("#", "Moderator", "Issued", "Reason");
            for (int i = 0; i < warnings.size(); i++) {
                WarningRecord warning = warnings.get(i);
                table.addRow(Integer.toString(i + 1), Long.toString(warning.moderatorId()),
                        warning.timestamp().toString(), warning.reason());
            }
            System.out.println(table.build());
            return true;
        } catch (ModerationException ex) {
            ConsoleArguments.printError(ex.getMessage());
            return false;
        }
    }

    @Override
    public String getName() {
        return "warnings";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"warns"};
    }

    @Override
    public String getDescription() {
        return "List a member's warnings";
    }

    @Override
    public String getUsage() {
        return "warnings <guildId> <userId>";
    }
}
