package sh.harold.warden.moderation.console.commands;

import sh.harold.warden.moderation.console.CommandHandler;
import sh.harold.warden.moderation.console.CommandRegistry;

import java.util.Comparator;
import java.util.Objects;

public record HelpCommand(CommandRegistry registry) implements CommandHandler {

    public HelpCommand {
        Objects.requireNonNull(registry, "registry");
    }

    @Override
    public boolean execute(String[] args) {
        if (args.length > 1) {
            CommandHandler handler = registry.getCommand(args[1]);
            if (handler == null) {
                System.out.println("Unknown command: " + args[1]);
                return false;
            }
            System.out.println("Command: " + handler.getName());
            System.out.println("Description: " + handler.getDescription());
            System.out.println("Usage: " + handler.getUsage());
            if (handler.getAliases().length > 0) {
                System.out.println("Aliases: " + String.join(", ", handler.getAliases()));
            }
            return true;
        }

        System.out.println("Available commands:");
        registry.getAllCommands().stream()
                .sorted(Comparator.comparing(CommandHandler::getName))
                .forEach(handler -> {
                    String aliases = handler.getAliases().length > 0
                            ? " [" + String.join(", ", handler.getAliases()) + "]"
                            : "";
                    System.out.printf("  %-16s %s%s%n", handler.getName(), handler.getDescription(), aliases);
                });
        System.out.println();
        System.out.println("Type 'help <command>' for usage details");
        return true;
    }

    @Override
    public String getName() {
        return "help";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"?", "h"};
    }

    @Override
    public String getDescription() {
        return "Show available commands";
    }

    @Override
    public String getUsage() {
        return "help [command]";
    }
}
