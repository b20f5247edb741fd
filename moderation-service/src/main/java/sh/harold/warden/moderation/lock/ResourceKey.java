package sh.harold.warden.moderation.lock;

/**
 * Identifies a resource whose read-modify-write sequences must be serialized.
 * Distinct key types never collide even when their ids do.
 */
public sealed interface ResourceKey permits ResourceKey.UserKey, ResourceKey.GuildKey, ResourceKey.SanctionKey, ResourceKey.DocumentKey {

    static UserKey user(long guildId, long userId) {
        return new UserKey(guildId, userId);
    }

    static GuildKey guild(long guildId) {
        return new GuildKey(guildId);
    }

    static SanctionKey sanction(String sanctionKey) {
        return new SanctionKey(sanctionKey);
    }

    static DocumentKey document(String documentId) {
        return new DocumentKey(documentId);
    }

    /** Violation history, warnings, spam window and appeals of one member. */
    record UserKey(long guildId, long userId) implements ResourceKey {
    }

    /** Guild configuration and role whitelist. */
    record GuildKey(long guildId) implements ResourceKey {
    }

    /** One temporary sanction record. */
    record SanctionKey(String key) implements ResourceKey {
        public SanctionKey {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("sanction key must not be blank");
            }
        }
    }

    /**
     * The persisted copy of one document. Held from snapshot to write, always innermost:
     * never acquire another key while holding it.
     */
    record DocumentKey(String documentId) implements ResourceKey {
        public DocumentKey {
            if (documentId == null || documentId.isBlank()) {
                throw new IllegalArgumentException("document id must not be blank");
            }
        }
    }
}
