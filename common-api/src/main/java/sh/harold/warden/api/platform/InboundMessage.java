package sh.harold.warden.api.platform;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A member-authored message delivered by the gateway.
 */
public record InboundMessage(long guildId,
                             long channelId,
                             long messageId,
                             long authorId,
                             boolean authorBot,
                             Set<Long> authorRoleIds,
                             String content,
                             List<Long> mentionedUserIds,
                             Instant createdAt) {

    public InboundMessage {
        Objects.requireNonNull(createdAt, "createdAt");
        content = content == null ? "" : content;
        authorRoleIds = authorRoleIds == null ? Set.of() : Set.copyOf(authorRoleIds);
        mentionedUserIds = mentionedUserIds == null ? List.of() : List.copyOf(mentionedUserIds);
    }
}
