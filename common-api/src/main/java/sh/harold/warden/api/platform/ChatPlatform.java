package sh.harold.warden.api.platform;

import java.time.Duration;
import java.util.Optional;

/**
 * Outbound operations against the chat platform. Every mutating call either completes or
 * throws {@link PlatformException}; implementations bound each call with their own timeout.
 */
public interface ChatPlatform {

    /**
     * Identity the service acts as inside the guild, if the guild is reachable.
     */
    Optional<MemberSnapshot> self(long guildId);

    Optional<MemberSnapshot> member(long guildId, long userId);

    Optional<Integer> rolePosition(long guildId, long roleId);

    boolean isGuildAvailable(long guildId);

    void deleteMessage(long guildId, long channelId, long messageId);

    void timeoutMember(long guildId, long userId, Duration duration, String reason);

    void kickMember(long guildId, long userId, String reason);

    void banMember(long guildId, long userId, String reason);

    void unbanMember(long guildId, long userId, String reason);

    void addRole(long guildId, long userId, long roleId, String reason);

    void removeRole(long guildId, long userId, long roleId, String reason);

    void sendAuditEntry(AuditEntry entry);
}
