package sh.harold.warden.moderation.config;

import sh.harold.warden.api.data.impl.redis.RedisConfiguration;
import sh.harold.warden.api.moderation.EscalationTable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Bound and validated service configuration. Instances come from {@link ServiceSettingsLoader}.
 */
public record ServiceSettings(DiscordSettings discord,
                              StorageSettings storage,
                              ModerationSettings moderation,
                              boolean consoleEnabled) {

    public ServiceSettings {
        Objects.requireNonNull(discord, "discord");
        Objects.requireNonNull(storage, "storage");
        Objects.requireNonNull(moderation, "moderation");
    }

    /**
     * @param token bot token; the service refuses to start without one
     */
    public record DiscordSettings(String token) {

        public DiscordSettings {
            token = token == null ? "" : token.trim();
        }

        public boolean hasToken() {
            return !token.isEmpty();
        }
    }

    /**
     * @param redis only present when {@code type} is {@link StorageType#REDIS}
     */
    public record StorageSettings(StorageType type, Path jsonDirectory, RedisConfiguration redis) {

        public StorageSettings {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(jsonDirectory, "jsonDirectory");
        }
    }

    public record ModerationSettings(Duration retention,
                                     Duration schedulerInterval,
                                     Duration retentionSweepInterval,
                                     Duration lockTimeout,
                                     int reputationPenaltyPerSeverity,
                                     String auditChannel,
                                     EscalationTable escalation) {

        public ModerationSettings {
            Objects.requireNonNull(retention, "retention");
            Objects.requireNonNull(schedulerInterval, "schedulerInterval");
            Objects.requireNonNull(retentionSweepInterval, "retentionSweepInterval");
            Objects.requireNonNull(lockTimeout, "lockTimeout");
            Objects.requireNonNull(auditChannel, "auditChannel");
            Objects.requireNonNull(escalation, "escalation");
        }
    }
}
