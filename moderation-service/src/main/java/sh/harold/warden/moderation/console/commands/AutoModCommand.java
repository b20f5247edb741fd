package sh.harold.warden.moderation.console.commands;

import sh.harold.warden.api.moderation.GuildConfig;
import sh.harold.warden.api.moderation.ModerationException;
import sh.harold.warden.api.moderation.ValidationException;
import sh.harold.warden.moderation.console.CommandHandler;
import sh.harold.warden.moderation.console.ConsoleArguments;
import sh.harold.warden.moderation.console.TableFormatter;
import sh.harold.warden.moderation.guild.AutoModSetting;
import sh.harold.warden.moderation.guild.GuildConfigStore;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

public record AutoModCommand(GuildConfigStore configStore) implements CommandHandler {

    public AutoModCommand {
        Objects.requireNonNull(configStore, "configStore");
    }

    @Override
    public boolean execute(String[] args) {
        if (args.length < 3) {
            System.out.println("Usage: " + getUsage());
            return false;
        }
        try {
            long guildId = ConsoleArguments.id(args, 1, "guild id");
            String action = args[2].toLowerCase(Locale.ROOT);
            GuildConfig updated;
            switch (action) {
                case "show" -> {
                    print(configStore.get(guildId));
                    return true;
                }
                case "set" -> {
                    if (args.length < 5) {
                        System.out.println("Usage: automod <guildId> set <setting> <value>");
                        return false;
                    }
                    AutoModSetting setting = AutoModSetting.fromId(args[3]).orElse(null);
                    if (setting == null) {
                        ConsoleArguments.printError("Unknown setting " + args[3] + "; expected one of "
                                + Arrays.stream(AutoModSetting.values()).map(AutoModSetting::getId).collect(Collectors.joining(", ")));
                        return false;
                    }
                    updated = configStore.updateSetting(guildId, setting, args[4]);
                }
                case "addword" -> updated = configStore.addBlockedWord(guildId, requireValue(args));
                case "removeword" -> updated = configStore.removeBlockedWord(guildId, requireValue(args));
                case "addlink" -> updated = configStore.addWhitelistedLink(guildId, requireValue(args));
                case "removelink" -> updated = configStore.removeWhitelistedLink(guildId, requireValue(args));
                default -> {
                    System.out.println("Unknown action: " + action);
                    System.out.println("Usage: " + getUsage());
                    return false;
                }
            }
            System.out.println(TableFormatter.color("Auto-moderation settings updated", TableFormatter.GREEN));
            print(updated);
            return true;
        } catch (ModerationException ex) {
            ConsoleArguments.printError(ex.getMessage());
            return false;
        }
    }

    private static String requireValue(String[] args) {
        String value = ConsoleArguments.remainder(args, 3);
        if (value == null || value.isBlank()) {
            throw new ValidationException("A value is required");
        }
        return value;
    }

    private static void print(GuildConfig config) {
        TableFormatter table = new TableFormatter().addHeaders("Setting", "Value")
                .addRow("max_mentions", Integer.toString(config.maxMentions()))
                .addRow("max_messages", Integer.toString(config.maxMessages()))
                .addRow("timeframe", config.timeframeSeconds() + "s")
                .addRow("max_lines", Integer.toString(config.maxLines()))
                .addRow("max_emojis", Integer.toString(config.maxEmojis()))
                .addRow("caps_threshold", Double.toString(config.capsThreshold()))
                .addRow("blocked_words", config.blockedWords().isEmpty() ? "(none)" : String.join(", ", config.blockedWords()))
                .addRow("link_whitelist", config.linkWhitelist().isEmpty() ? "(none)" : String.join(", ", config.linkWhitelist()));
        System.out.println(table.build());
    }

    @Override
    public String getName() {
        return "automod";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"am"};
    }

    @Override
    public String getDescription() {
        return "Show or change a guild's auto-moderation settings";
    }

    @Override
    public String getUsage() {
        return "automod <guildId> <show|set|addword|removeword|addlink|removelink> [setting|value] [value]";
    }
}
