package sh.harold.warden.moderation.guild;

import sh.harold.warden.api.moderation.GuildConfig;
import sh.harold.warden.api.moderation.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Numeric thresholds an administrator may change. String values are parsed here; range
 * checks happen when the resulting config is validated.
 */
public enum AutoModSetting {
    MAX_MENTIONS("max_mentions", (builder, value) -> builder.maxMentions(parseInt(value))),
    MAX_MESSAGES("max_messages", (builder, value) -> builder.maxMessages(parseInt(value))),
    TIMEFRAME("timeframe", (builder, value) -> builder.timeframeSeconds(parseInt(value))),
    MAX_LINES("max_lines", (builder, value) -> builder.maxLines(parseInt(value))),
    MAX_EMOJIS("max_emojis", (builder, value) -> builder.maxEmojis(parseInt(value))),
    CAPS_THRESHOLD("caps_threshold", (builder, value) -> builder.capsThreshold(parseDouble(value)));

    private final String id;
    private final BiConsumer<GuildConfig.Builder, String> applier;

    AutoModSetting(String id, BiConsumer<GuildConfig.Builder, String> applier) {
        this.id = id;
        this.applier = applier;
    }

    public static Optional<AutoModSetting> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(setting -> setting.id.equals(normalized))
                .findFirst();
    }

    public String getId() {
        return id;
    }

    GuildConfig apply(GuildConfig config, String rawValue) {
        GuildConfig.Builder builder = config.toBuilder();
        applier.accept(builder, rawValue == null ? "" : rawValue.trim());
        return builder.build();
    }

    private static int parseInt(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ValidationException("Expected a whole number but got '" + value + "'");
        }
    }

    private static double parseDouble(String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ValidationException("Expected a decimal number but got '" + value + "'");
        }
    }
}
