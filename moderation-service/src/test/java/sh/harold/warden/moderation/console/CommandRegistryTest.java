package sh.harold.warden.moderation.console;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sh.harold.warden.moderation.console.commands.HelpCommand;
import sh.harold.warden.moderation.console.commands.StopCommand;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CommandRegistryTest {

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private CommandRegistry registry;

    @BeforeEach
    void setUp() {
        originalOut = System.out;
        System.setOut(new PrintStream(output, true, StandardCharsets.UTF_8));
        registry = new CommandRegistry();
        registry.register(new HelpCommand(registry));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    void aliasesResolveToTheCommand() {
        assertThat(registry.getCommand("?")).isSameAs(registry.getCommand("help"));
        assertThat(registry.getCommand("HELP")).isNotNull();
        assertThat(registry.getCommand("missing")).isNull();
    }

    @Test
    void unknownCommandPrintsHint() {
        assertThat(registry.executeCommand("frobnicate now")).isFalse();

        assertThat(printed()).contains("Unknown command: frobnicate").contains("Type 'help'");
    }

    @Test
    void blankInputIsIgnored() {
        assertThat(registry.executeCommand("   ")).isFalse();
        assertThat(printed()).isEmpty();
    }

    @Test
    void failingCommandIsReportedNotThrown() {
        registry.register(new CommandHandler() {
            @Override
            public boolean execute(String[] args) {
                throw new IllegalStateException("kaput");
            }

            @Override
            public String getName() {
                return "boom";
            }

            @Override
            public String[] getAliases() {
                return new String[0];
            }

            @Override
            public String getDescription() {
                return "Always fails";
            }

            @Override
            public String getUsage() {
                return "boom";
            }
        });

        assertThat(registry.executeCommand("boom")).isFalse();
        assertThat(printed()).contains("Error executing command: kaput");
    }

    @Test
    void helpListsEveryCommandAndDetails() throws Exception {
        CountDownLatch stopped = new CountDownLatch(1);
        registry.register(new StopCommand(stopped::countDown));

        assertThat(registry.executeCommand("help")).isTrue();
        assertThat(printed()).contains("help").contains("stop").contains("[exit, quit]");

        assertThat(registry.executeCommand("h stop")).isTrue();
        assertThat(printed()).contains("Usage: stop");

        assertThat(registry.executeCommand("quit")).isTrue();
        assertThat(stopped.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void tableAlignsColumns() {
        String table = new TableFormatter()
                .addHeaders("Name", "Value")
                .addRow("guilds", "12")
                .addRow("pending sanctions", "3")
                .build();

        String[] lines = table.split("\n");
        assertThat(lines).hasSize(6);
        assertThat(lines).extracting(String::length).containsOnly(lines[0].length());
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }
}
