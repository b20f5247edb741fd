package sh.harold.warden.moderation.console;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Operator console. Each line is one command; lines starting with {@code #} are ignored so
 * a file of commands can be piped in. End of input leaves the service running without a console.
 */
public class InteractiveConsole implements Runnable {

    private static final Logger LOGGER = LoggerFactory.getLogger(InteractiveConsole.class);
    private static final String PROMPT = "warden> ";

    private final CommandRegistry commandRegistry;
    private final BufferedReader input;
    private final PrintStream output;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread consoleThread;

    public InteractiveConsole(CommandRegistry commandRegistry) {
        this(commandRegistry, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public InteractiveConsole(CommandRegistry commandRegistry, BufferedReader input, PrintStream output) {
        this.commandRegistry = Objects.requireNonNull(commandRegistry, "commandRegistry");
        this.input = Objects.requireNonNull(input, "input");
        this.output = Objects.requireNonNull(output, "output");
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            consoleThread = new Thread(this, "Warden-Console");
            consoleThread.setDaemon(true);
            consoleThread.start();
            LOGGER.info("Operator console started ({} commands)", commandRegistry.getAllCommands().size());
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false) && consoleThread != null) {
            consoleThread.interrupt();
            LOGGER.info("Operator console stopped");
        }
    }

    @Override
    public void run() {
        running.set(true);
        output.println("warden moderation console. Type 'help' for commands.");
        int executed = 0;
        while (running.get()) {
            output.print(PROMPT);
            output.flush();
            String line;
            try {
                line = input.readLine();
            } catch (IOException e) {
                if (running.get()) {
                    LOGGER.error("Console input failed; continuing without a console", e);
                }
                break;
            }
            if (line == null) {
                LOGGER.info("Console input closed after {} command(s); service keeps running", executed);
                break;
            }
            String command = line.strip();
            if (command.isEmpty() || command.startsWith("#")) {
                continue;
            }
            try {
                commandRegistry.executeCommand(command);
            } catch (RuntimeException e) {
                LOGGER.error("Console command '{}' failed", command, e);
                output.println("Error: " + e.getMessage());
            }
            executed++;
        }
        running.set(false);
    }

    public boolean isRunning() {
        return running.get();
    }
}
