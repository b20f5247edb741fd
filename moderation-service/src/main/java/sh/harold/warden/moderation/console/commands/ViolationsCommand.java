package sh.harold.warden.moderation.console.commands;

import sh.harold.warden.api.moderation.ModerationException;
import sh.harold.warden.api.moderation.ViolationRecord;
import sh.harold.warden.moderation.console.CommandHandler;
import sh.harold.warden.moderation.console.ConsoleArguments;
import sh.harold.warden.moderation.console.TableFormatter;
import sh.harold.warden.moderation.sanction.ModerationActions;
import sh.harold.warden.moderation.sanction.ViolationReport;

import java.util.Objects;

public record ViolationsCommand(ModerationActions actions) implements CommandHandler {

    public ViolationsCommand {
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
            ViolationReport report = actions.violations(guildId, userId);
            System.out.println("Active violations: " + report.active().size()
                    + " (stored: " + report.totalRecorded() + ", tier " + report.tier() + ")");
            if (report.active().isEmpty()) {
                return true;
            }
            TableFormatter table = new TableFormatter().addHeaders("Type", "Severity", "Recorded");
            for (ViolationRecord violation : report.active()) {
                table.addRow(violation.type().getDisplayName(), Integer.toString(violation.severity()),
                        violation.timestamp().toString());
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
        return "violations";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"v"};
    }

    @Override
    public String getDescription() {
        return "Show a member's active violations and tier";
    }

    @Override
    public String getUsage() {
        return "violations <guildId> <userId>";
    }
}
