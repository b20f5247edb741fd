package sh.harold.warden.moderation.console.commands;

import sh.harold.warden.api.moderation.AppealRecord;
import sh.harold.warden.api.moderation.AppealStatus;
import sh.harold.warden.api.moderation.ModerationException;
import sh.harold.warden.api.moderation.ValidationException;
import sh.harold.warden.moderation.appeal.AppealStore;
import sh.harold.warden.moderation.console.CommandHandler;
import sh.harold.warden.moderation.console.ConsoleArguments;
import sh.harold.warden.moderation.console.TableFormatter;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

public record AppealsCommand(AppealStore appealStore) implements CommandHandler {

    public AppealsCommand {
        Objects.requireNonNull(appealStore, "appealStore");
    }

    @Override
    public boolean execute(String[] args) {
        if (args.length < 2) {
            System.out.println("Usage: " + getUsage());
            return false;
        }
        try {
            long guildId = ConsoleArguments.id(args, 1, "guild id");
            String action = args.length > 2 ? args[2].toLowerCase(Locale.ROOT) : "list";
            return switch (action) {
                case "list" -> list(guildId, args.length > 3 ? parseStatus(args[3]) : null);
                case "approve" -> update(guildId, ConsoleArguments.id(args, 3, "user id"), AppealStatus.APPROVED);
                case "deny" -> update(guildId, ConsoleArguments.id(args, 3, "user id"), AppealStatus.DENIED);
                default -> {
                    System.out.println("Unknown action: " + action);
                    System.out.println("Usage: " + getUsage());
                    yield false;
                }
            };
        } catch (ModerationException ex) {
            ConsoleArguments.printError(ex.getMessage());
            return false;
        }
    }

    private boolean list(long guildId, AppealStatus status) {
        List<AppealRecord> appeals = appealStore.list(guildId, status);
        if (appeals.isEmpty()) {
            System.out.println("No appeals found");
            return true;
        }
        TableFormatter table = new TableFormatter().addHeaders("User", "Status", "Submitted", "Reason");
        for (AppealRecord appeal : appeals) {
            table.addRow(Long.toString(appeal.userId()), appeal.status().name(), appeal.submittedAt().toString(), appeal.reason());
        }
        System.out.println(table.build());
        return true;
    }

    private boolean update(long guildId, long userId, AppealStatus status) {
        Optional<AppealRecord> updated = appealStore.updateStatus(guildId, userId, status);
        if (updated.isEmpty()) {
            System.out.println("No appeal found for " + userId);
            return false;
        }
        System.out.println("Appeal from " + userId + " marked " + status.name().toLowerCase(Locale.ROOT));
        return true;
    }

    private static AppealStatus parseStatus(String raw) {
        try {
            return AppealStatus.valueOf(raw.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("Unknown appeal status: " + raw);
        }
    }

    @Override
    public String getName() {
        return "appeals";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"appeal"};
    }

    @Override
    public String getDescription() {
        return "List appeals or record a decision";
    }

    @Override
    public String getUsage() {
        return "appeals <guildId> [list [pending|approved|denied]|approve <userId>|deny <userId>]";
    }
}
