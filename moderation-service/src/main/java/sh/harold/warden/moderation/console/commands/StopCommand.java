package sh.harold.warden.moderation.console.commands;

import sh.harold.warden.moderation.console.CommandHandler;

import java.util.Objects;

/**
 * Hands shutdown to a separate thread so the console thread can finish printing.
 */
public record StopCommand(Runnable shutdown) implements CommandHandler {

    public StopCommand {
        Objects.requireNonNull(shutdown, "shutdown");
    }

    @Override
    public boolean execute(String[] args) {
        System.out.println("Initiating graceful shutdown...");
        Thread thread = new Thread(shutdown, "Warden-Shutdown");
        thread.start();
        return true;
    }

    @Override
    public String getName() {
        return "stop";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"exit", "quit"};
    }

    @Override
    public String getDescription() {
        return "Gracefully shut down the moderation service";
    }

    @Override
    public String getUsage() {
        return "stop";
    }
}
