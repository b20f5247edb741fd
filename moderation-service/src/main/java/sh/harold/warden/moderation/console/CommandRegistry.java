package sh.harold.warden.moderation.console;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name and alias lookup for console commands.
 */
public class CommandRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(CommandRegistry.class);

    private final Map<String, CommandHandler> commands = new ConcurrentHashMap<>();
    private final Map<String, String> aliases = new ConcurrentHashMap<>();

    public void register(CommandHandler handler) {
        String name = handler.getName().toLowerCase(Locale.ROOT);
        commands.put(name, handler);
        for (String alias : handler.getAliases()) {
            aliases.put(alias.toLowerCase(Locale.ROOT), name);
        }
        LOGGER.debug("Registered console command {} with {} alias(es)", name, handler.getAliases().length);
    }

    /**
     * Splits the input line on whitespace and runs the matching command.
     *
     * @return true if a command ran and completed
     */
    public boolean executeCommand(String input) {
        if (input == null || input.isBlank()) {
            return false;
        }

        String[] parts = input.trim().split("\\s+");
        CommandHandler handler = getCommand(parts[0]);
        if (handler == null) {
            System.out.println("Unknown command: " + parts[0]);
            System.out.println("Type 'help' for available commands");
            return false;
        }

        try {
            return handler.execute(parts);
        } catch (Exception e) {
            LOGGER.error("Error executing console command {}", handler.getName(), e);
            System.out.println("Error executing command: " + e.getMessage());
            return false;
        }
    }

    public Collection<CommandHandler> getAllCommands() {
        return commands.values();
    }

    /**
     * @return the handler registered under the name or alias, or null
     */
    public CommandHandler getCommand(String name) {
        String key = name.toLowerCase(Locale.ROOT);
        return commands.get(aliases.getOrDefault(key, key));
    }
}
