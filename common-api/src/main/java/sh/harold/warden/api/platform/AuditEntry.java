package sh.harold.warden.api.platform;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured audit log line, rendered by the platform as an embed.
 */
public record AuditEntry(long guildId, String title, Map<String, String> fields, Instant timestamp) {

    public AuditEntry {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(timestamp, "timestamp");
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
