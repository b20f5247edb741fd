package sh.harold.warden.api.moderation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered mapping from escalation tier to punishment. The highest tier caps escalation:
 * a user with more active violations than there are tiers stays on the last one.
 */
public final class EscalationTable {

    private static final EscalationTable DEFAULTS = new EscalationTable(List.of(
            new EscalationTier(1, PunishmentSpec.warn()),
            new EscalationTier(2, PunishmentSpec.timeout(Duration.ofMinutes(30))),
            new EscalationTier(3, PunishmentSpec.timeout(Duration.ofHours(2))),
            new EscalationTier(4, PunishmentSpec.timeout(Duration.ofDays(1))),
            new EscalationTier(5, PunishmentSpec.banPermanent())
    ));

    private final List<EscalationTier> tiers;

    private EscalationTable(List<EscalationTier> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalArgumentException("escalation table must contain at least one tier");
        }
        List<EscalationTier> sorted = new ArrayList<>(tiers);
        sorted.sort(Comparator.comparingInt(EscalationTier::tier));
        for (int i = 0; i < sorted.size(); i++) {
            if (sorted.get(i).tier() != i + 1) {
                throw new IllegalArgumentException("escalation tiers must be numbered 1.." + sorted.size()
                        + " without gaps, found tier " + sorted.get(i).tier());
            }
        }
        this.tiers = List.copyOf(sorted);
    }

    public static EscalationTable defaults() {
        return DEFAULTS;
    }

    public static EscalationTable of(List<EscalationTier> tiers) {
        Objects.requireNonNull(tiers, "tiers");
        return new EscalationTable(tiers);
    }

    public List<EscalationTier> getTiers() {
        return tiers;
    }

    public int maxTier() {
        return tiers.size();
    }

    /**
     * Tier reached with the given number of active violations; zero when there are none.
     */
    public int tierFor(int activeViolations) {
        if (activeViolations <= 0) {
            return 0;
        }
        return Math.min(maxTier(), activeViolations);
    }

    public PunishmentSpec punishmentFor(int tier) {
        if (tier <= 0) {
            throw new IllegalArgumentException("tier must be positive, got " + tier);
        }
        return tiers.get(Math.min(tier, maxTier()) - 1).punishment();
    }
}
