package sh.harold.warden.moderation.console.commands;

import sh.harold.warden.moderation.console.CommandHandler;
import sh.harold.warden.moderation.console.TableFormatter;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Prints uptime, component counters and JVM memory.
 */
public class StatusCommand implements CommandHandler {

    private final Supplier<Map<String, Object>> counters;
    private final Clock clock;
    private final Instant startedAt;

    /**
     * @param counters ordered label to value pairs describing the running components
     */
    public StatusCommand(Supplier<Map<String, Object>> counters, Clock clock) {
        this.counters = Objects.requireNonNull(counters, "counters");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startedAt = clock.instant();
    }

    @Override
    public boolean execute(String[] args) {
        System.out.println(TableFormatter.color("=== Warden Status ===", TableFormatter.CYAN));
        System.out.println("Uptime: " + TableFormatter.color(formatUptime(Duration.between(startedAt, clock.instant())), TableFormatter.GREEN));
        System.out.println("Started: " + startedAt);
        System.out.println();

        TableFormatter table = new TableFormatter().addHeaders("Component", "Value");
        counters.get().forEach((label, value) -> table.addRow(label, String.valueOf(value)));
        System.out.println(table.build());
        System.out.println();

        Runtime runtime = Runtime.getRuntime();
        long used = runtime.totalMemory() - runtime.freeMemory();
        System.out.println(TableFormatter.color("JVM Memory:", TableFormatter.YELLOW));
        System.out.println("  Used: " + formatBytes(used) + " / " + formatBytes(runtime.maxMemory()));
        System.out.println("  Threads: " + ManagementFactory.getThreadMXBean().getThreadCount());
        return true;
    }

    private static String formatUptime(Duration uptime) {
        long seconds = uptime.getSeconds();
        return String.format("%dd %dh %dm %ds", seconds / 86400, (seconds % 86400) / 3600, (seconds % 3600) / 60, seconds % 60);
    }

    private static String formatBytes(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        int exp = (int) (Math.log(bytes) / Math.log(1024));
        char unit = "KMGTPE".charAt(exp - 1);
        return String.format("%.1f %cB", bytes / Math.pow(1024, exp), unit);
    }

    @Override
    public String getName() {
        return "status";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"stats", "info"};
    }

    @Override
    public String getDescription() {
        return "Show service status";
    }

    @Override
    public String getUsage() {
        return "status";
    }
}
