package sh.harold.warden.api.messagebus.messages;

import sh.harold.warden.api.moderation.SanctionAction;
import sh.harold.warden.api.moderation.ViolationType;

import java.time.Duration;
import java.time.Instant;

/**
 * Published after a sanction has been applied on the platform and persisted.
 * {@code severity} and {@code violationType} are absent for sanctions that did not come from
 * a recorded violation (kicks, bans and temp roles issued directly by a moderator).
 */
public final class SanctionAppliedMessage {

    private long guildId;
    private long userId;
    private long moderatorId;
    private boolean automatic;
    private ViolationType violationType;
    private int severity;
    private int tier;
    private SanctionAction action;
    private Duration duration;
    private String reason;
    private Instant issuedAt;

    public long getGuildId() {
        return guildId;
    }

    public void setGuildId(long guildId) {
        this.guildId = guildId;
    }

    public long getUserId() {
        return userId;
    }

    public void setUserId(long userId) {
        this.userId = userId;
    }

    public long getModeratorId() {
        return moderatorId;
    }

    public void setModeratorId(long moderatorId) {
        this.moderatorId = moderatorId;
    }

    public boolean isAutomatic() {
        return automatic;
    }

    public void setAutomatic(boolean automatic) {
        this.automatic = automatic;
    }

    public ViolationType getViolationType() {
        return violationType;
    }

    public void setViolationType(ViolationType violationType) {
        this.violationType = violationType;
    }

    public int getSeverity() {
        return severity;
    }

    public void setSeverity(int severity) {
        this.severity = severity;
    }

    public int getTier() {
        return tier;
    }

    public void setTier(int tier) {
        this.tier = tier;
    }

    public SanctionAction getAction() {
        return action;
    }

    public void setAction(SanctionAction action) {
        this.action = action;
    }

    public Duration getDuration() {
        return duration;
    }

    public void setDuration(Duration duration) {
        this.duration = duration;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    public void setIssuedAt(Instant issuedAt) {
        this.issuedAt = issuedAt;
    }
}
