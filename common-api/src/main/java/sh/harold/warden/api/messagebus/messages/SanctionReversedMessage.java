package sh.harold.warden.api.messagebus.messages;

import sh.harold.warden.api.moderation.TemporarySanctionType;

import java.time.Instant;

public final class SanctionReversedMessage {

    private String sanctionKey;
    private TemporarySanctionType type;
    private long guildId;
    private long userId;
    private Long roleId;
    private boolean reverted;
    private String failure;
    private Instant reversedAt;

    public String getSanctionKey() {
        return sanctionKey;
    }

    public void setSanctionKey(String sanctionKey) {
        this.sanctionKey = sanctionKey;
    }

    public TemporarySanctionType getType() {
        return type;
    }

    public void setType(TemporarySanctionType type) {
        this.type = type;
    }

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

    public Long getRoleId() {
        return roleId;
    }

    public void setRoleId(Long roleId) {
        this.roleId = roleId;
    }

    /**
     * @return false when the platform call failed and the record was dropped anyway
     */
    public boolean isReverted() {
        return reverted;
    }

    public void setReverted(boolean reverted) {
        this.reverted = reverted;
    }

    public String getFailure() {
        return failure;
    }

    public void setFailure(String failure) {
        this.failure = failure;
    }

    public Instant getReversedAt() {
        return reversedAt;
    }

    public void setReversedAt(Instant reversedAt) {
        this.reversedAt = reversedAt;
    }
}
