package sh.harold.warden.moderation.guild;

import sh.harold.warden.api.moderation.ValidationException;

import java.util.List;

public final class GuildConfigValidationException extends ValidationException {
    private final long guildId;

    public GuildConfigValidationException(long guildId, List<String> errors) {
        super("Guild config for %d failed validation".formatted(guildId), errors);
        this.guildId = guildId;
    }

    public long getGuildId() {
        return guildId;
    }
}
