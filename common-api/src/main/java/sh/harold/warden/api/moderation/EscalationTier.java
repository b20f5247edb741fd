package sh.harold.warden.api.moderation;

import java.util.Objects;

public record EscalationTier(int tier, PunishmentSpec punishment) {

    public EscalationTier {
        if (tier <= 0) {
            throw new IllegalArgumentException("tier must be positive");
        }
        Objects.requireNonNull(punishment, "punishment");
    }
}
