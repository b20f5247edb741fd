package sh.harold.warden.api.moderation;

import java.util.Objects;

/**
 * Result of one escalation: the violation that was recorded, the tier it produced and the
 * punishment that was applied for that tier.
 */
public record EscalationOutcome(ViolationRecord violation, int activeViolations, int tier, PunishmentSpec punishment) {

    public EscalationOutcome {
        Objects.requireNonNull(violation, "violation");
        Objects.requireNonNull(punishment, "punishment");
    }

    public SanctionAction action() {
        return punishment.action();
    }
}
