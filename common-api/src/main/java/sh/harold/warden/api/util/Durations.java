package sh.harold.warden.api.util;

import sh.harold.warden.api.moderation.ValidationException;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and renders the compact duration syntax used by moderator commands ({@code 30m}, {@code 2h}, {@code 1w}).
 */
public final class Durations {

    private static final Pattern DURATION_PATTERN = Pattern.compile("(\\d+)([smhdw])");

    private Durations() {
    }

    /**
     * Parses the leading {@code <amount><unit>} token of the input. Trailing text is ignored.
     *
     * @throws ValidationException when the input does not start with a valid, positive duration
     */
    public static Duration parse(String input) {
        if (input == null) {
            throw new ValidationException("Invalid duration format! Use a number followed by s, m, h, d or w");
        }
        Matcher matcher = DURATION_PATTERN.matcher(input.trim().toLowerCase(Locale.ROOT));
        if (!matcher.lookingAt()) {
            throw new ValidationException("Invalid duration format! Use a number followed by s, m, h, d or w");
        }

        long amount;
        try {
            amount = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException ex) {
            throw new ValidationException("Duration amount is too large: " + matcher.group(1));
        }
        if (amount <= 0) {
            throw new ValidationException("Duration must be positive");
        }

        try {
            return switch (matcher.group(2).charAt(0)) {
                case 's' -> Duration.ofSeconds(amount);
                case 'm' -> Duration.ofMinutes(amount);
                case 'h' -> Duration.ofHours(amount);
                case 'd' -> Duration.ofDays(amount);
                case 'w' -> Duration.ofDays(Math.multiplyExact(amount, 7L));
                default -> throw new ValidationException("Invalid duration unit: " + matcher.group(2));
            };
        } catch (ArithmeticException ex) {
            throw new ValidationException("Duration amount is too large: " + matcher.group(1));
        }
    }

    public static boolean isValid(String input) {
        try {
            parse(input);
            return true;
        } catch (ValidationException ex) {
            return false;
        }
    }

    /**
     * Renders {@code 1d 2h 3m 4s}, leaving out zero components. A zero or null duration renders as "0s".
     */
    public static String format(Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            return "0s";
        }
        long seconds = duration.getSeconds();
        long days = seconds / 86400;
        long hours = (seconds % 86400) / 3600;
        long minutes = (seconds % 3600) / 60;
        seconds %= 60;

        StringBuilder builder = new StringBuilder();
        if (days > 0) {
            builder.append(days).append("d ");
        }
        if (hours > 0) {
            builder.append(hours).append("h ");
        }
        if (minutes > 0) {
            builder.append(minutes).append("m ");
        }
        if (seconds > 0) {
            builder.append(seconds).append("s");
        }
        String rendered = builder.toString().trim();
        return rendered.isEmpty() ? "0s" : rendered;
    }
}
