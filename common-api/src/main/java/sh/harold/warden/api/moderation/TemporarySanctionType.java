package sh.harold.warden.api.moderation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TemporarySanctionType {
    BAN("ban"),
    ROLE("role");

    private final String id;

    TemporarySanctionType(String id) {
        this.id = id;
    }

    @JsonCreator
    public static TemporarySanctionType fromId(String id) {
        String normalized = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
        for (TemporarySanctionType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown temporary sanction type: " + id);
    }

    @JsonValue
    public String getId() {
        return id;
    }
}
