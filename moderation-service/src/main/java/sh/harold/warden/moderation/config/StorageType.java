package sh.harold.warden.moderation.config;

import java.util.Locale;
import java.util.Optional;

public enum StorageType {
    JSON("json"),
    REDIS("redis"),
    MEMORY("memory");

    private final String id;

    StorageType(String id) {
        this.id = id;
    }

    public static Optional<StorageType> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (StorageType type : values()) {
            if (type.id.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public String getId() {
        return id;
    }
}
