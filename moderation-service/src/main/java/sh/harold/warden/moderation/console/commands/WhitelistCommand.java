package sh.harold.warden.moderation.console.commands;

import sh.harold.warden.api.moderation.ModerationException;
import sh.harold.warden.moderation.console.CommandHandler;
import sh.harold.warden.moderation.console.ConsoleArguments;
import sh.harold.warden.moderation.detection.RoleWhitelist;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Manages the roles exempt from auto-moderation.
 */
public record WhitelistCommand(RoleWhitelist roleWhitelist) implements CommandHandler {

    public WhitelistCommand {
        Objects.requireNonNull(roleWhitelist, "roleWhitelist");
    }

    @Override
    public boolean execute(String[] args) {
        if (args.length < 3) {
            System.out.println("Usage: " + getUsage());
            return false;
        }
        String action = args[1].toLowerCase(Locale.ROOT);
        try {
            long guildId = ConsoleArguments.id(args, 2, "guild id");
            return switch (action) {
                case "list" -> {
                    Set<Long> roles = roleWhitelist.roles(guildId);
                    System.out.println(roles.isEmpty() ? "No whitelisted roles" : "Whitelisted roles: " + roles);
                    yield true;
                }
                case "add" -> {
                    long roleId = ConsoleArguments.id(args, 3, "role id");
                    boolean added = roleWhitelist.add(guildId, roleId);
                    System.out.println(added ? "Role " + roleId + " is now exempt" : "Role " + roleId + " was already whitelisted");
                    yield added;
                }
                case "remove" -> {
                    long roleId = ConsoleArguments.id(args, 3, "role id");
                    boolean removed = roleWhitelist.remove(guildId, roleId);
                    System.out.println(removed ? "Role " + roleId + " removed from the whitelist" : "Role " + roleId + " was not whitelisted");
                    yield removed;
                }
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

    @Override
    public String getName() {
        return "whitelist";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"wl"};
    }

    @Override
    public String getDescription() {
        return "List, add or remove auto-moderation exempt roles";
    }

    @Override
    public String getUsage() {
        return "whitelist <list|add|remove> <guildId> [roleId]";
    }
}
