package sh.harold.warden.api.moderation;

import java.time.Instant;
import java.util.Objects;

/**
 * A time-bounded ban or role grant that must be reversed once {@link #expiresAt()} has passed.
 * Keys are unique per guild: {@code guild:user} for bans, {@code guild:user:role} for role grants.
 */
public record TemporarySanction(String key,
                                TemporarySanctionType type,
                                long guildId,
                                long userId,
                                Long roleId,
                                Instant expiresAt,
                                String reason) {

    public TemporarySanction {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(expiresAt, "expiresAt");
        if (type == TemporarySanctionType.ROLE && roleId == null) {
            throw new IllegalArgumentException("role sanctions require a role id");
        }
    }

    public static TemporarySanction ban(long guildId, long userId, Instant expiresAt, String reason) {
        return new TemporarySanction(banKey(guildId, userId), TemporarySanctionType.BAN, guildId, userId, null, expiresAt, reason);
    }

    public static TemporarySanction role(long guildId, long userId, long roleId, Instant expiresAt, String reason) {
        return new TemporarySanction(roleKey(guildId, userId, roleId), TemporarySanctionType.ROLE, guildId, userId, roleId, expiresAt, reason);
    }

    public static String banKey(long guildId, long userId) {
        return guildId + ":" + userId;
    }

    public static String roleKey(long guildId, long userId, long roleId) {
        return guildId + ":" + userId + ":" + roleId;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
