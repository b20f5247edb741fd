package sh.harold.warden.api.moderation;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.util.Objects;

/**
 * Describes the punishment applied when an escalation tier is reached.
 * Duration is only meaningful for timeouts; a ban without duration is permanent.
 */
public record PunishmentSpec(SanctionAction action, Duration duration) {

    public PunishmentSpec {
        Objects.requireNonNull(action, "action");
        if (action == SanctionAction.TIMEOUT && (duration == null || duration.isZero() || duration.isNegative())) {
            throw new IllegalArgumentException("timeout requires a positive duration");
        }
        if (action == SanctionAction.WARN && duration != null) {
            throw new IllegalArgumentException("warn does not take a duration");
        }
    }

    public static PunishmentSpec warn() {
        return new PunishmentSpec(SanctionAction.WARN, null);
    }

    public static PunishmentSpec timeout(Duration duration) {
        return new PunishmentSpec(SanctionAction.TIMEOUT, duration);
    }

    public static PunishmentSpec banPermanent() {
        return new PunishmentSpec(SanctionAction.BAN, null);
    }

    @JsonIgnore
    public boolean isPermanent() {
        return duration == null;
    }
}
