package sh.harold.warden.api.moderation;

import java.time.Instant;
import java.util.Objects;

public record AppealRecord(long guildId, long userId, String reason, AppealStatus status, Instant submittedAt, Instant updatedAt) {

    public AppealRecord {
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(submittedAt, "submittedAt");
        updatedAt = updatedAt == null ? submittedAt : updatedAt;
    }

    public AppealRecord withStatus(AppealStatus newStatus, Instant when) {
        return new AppealRecord(guildId, userId, reason, newStatus, submittedAt, when);
    }
}
