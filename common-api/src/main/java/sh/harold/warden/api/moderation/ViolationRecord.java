package sh.harold.warden.api.moderation;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable entry of a user's violation history within one guild.
 */
public record ViolationRecord(long guildId, long userId, ViolationType type, int severity, Instant timestamp) {

    public static final int MIN_SEVERITY = 1;
    public static final int MAX_SEVERITY = 5;

    public ViolationRecord {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    /**
     * Out-of-range severities are not rejected; they fall back to the minimum.
     */
    public static int normalizeSeverity(int severity) {
        if (severity < MIN_SEVERITY || severity > MAX_SEVERITY) {
            return MIN_SEVERITY;
        }
        return severity;
    }

    public boolean isActive(Instant now, Duration window) {
        return Duration.between(timestamp, now).compareTo(window) < 0;
    }
}
