package sh.harold.warden.api.moderation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import sh.harold.warden.api.platform.PlatformCapability;

import java.util.Locale;
import java.util.Optional;

public enum SanctionAction {
    WARN("warn", null),
    TIMEOUT("timeout", PlatformCapability.MODERATE_MEMBERS),
    KICK("kick", PlatformCapability.KICK_MEMBERS),
    BAN("ban", PlatformCapability.BAN_MEMBERS);

    private final String id;
    private final PlatformCapability requiredCapability;

    SanctionAction(String id, PlatformCapability requiredCapability) {
        this.id = id;
        this.requiredCapability = requiredCapability;
    }

    @JsonCreator
    public static SanctionAction fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Sanction action must not be null");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (SanctionAction action : values()) {
            if (action.id.equals(normalized)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown sanction action: " + id);
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * Capability the acting identity must hold on the platform before this action is attempted.
     */
    public Optional<PlatformCapability> requiredCapability() {
        return Optional.ofNullable(requiredCapability);
    }
}
