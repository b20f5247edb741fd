package sh.harold.warden.moderation.interaction;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A slash command invocation with its options flattened to strings. User and role options
 * carry the snowflake id.
 */
public record SlashRequest(String command, long guildId, long invokerId, Map<String, String> options) {

    public SlashRequest {
        Objects.requireNonNull(command, "command");
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public Optional<String> option(String name) {
        return Optional.ofNullable(options.get(name)).filter(value -> !value.isBlank());
    }
}
