package sh.harold.warden.moderation.console;

import sh.harold.warden.api.moderation.ValidationException;
import sh.harold.warden.api.platform.ChatPlatform;
import sh.harold.warden.api.platform.MemberSnapshot;
import sh.harold.warden.api.platform.PlatformException;
import sh.harold.warden.api.platform.PlatformFailure;

import java.util.Arrays;

/**
 * Argument parsing shared by the console commands.
 */
public final class ConsoleArguments {

    private ConsoleArguments() {
    }

    /**
     * @throws ValidationException when the argument is missing or not a snowflake id
     */
    public static long id(String[] args, int index, String label) {
        if (args.length <= index) {
            throw new ValidationException("Missing " + label);
        }
        String raw = args[index].replaceAll("[<@!&#>]", "");
        try {
            long value = Long.parseLong(raw);
            if (value <= 0) {
                throw new NumberFormatException();
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid " + label + ": " + args[index]);
        }
    }

    /**
     * Joins every argument from {@code index} on, or returns null when there are none.
     */
    public static String remainder(String[] args, int index) {
        if (args.length <= index) {
            return null;
        }
        return String.join(" ", Arrays.copyOfRange(args, index, args.length));
    }

    /**
     * Console commands act as the service's own member in the target guild.
     */
    public static MemberSnapshot serviceIdentity(ChatPlatform platform, long guildId) {
        return platform.self(guildId)
                .orElseThrow(() -> new PlatformException(PlatformFailure.NOT_FOUND,
                        "Guild " + guildId + " is not available to the service"));
    }

    public static void printError(String message) {
        System.out.println(TableFormatter.color(message, TableFormatter.RED));
    }
}
