package sh.harold.warden.moderation.console;

/**
 * A single operator console command.
 */
public interface CommandHandler {
    /**
     * @param args command arguments; the first element is the command name as typed
     * @return true if the command completed
     */
    boolean execute(String[] args);

    String getName();

    String[] getAliases();

    String getDescription();

    String getUsage();
}
