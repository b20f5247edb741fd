package sh.harold.warden.api.moderation;

import java.time.Instant;
import java.util.Objects;

/**
 * Audit trail entry for a warning issued by a moderator (or the service identity).
 */
public record WarningRecord(long guildId, long userId, String reason, long moderatorId, Instant timestamp) {

    public static final int MAX_REASON_LENGTH = 1000;

    public WarningRecord {
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
