package sh.harold.warden.moderation.effects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.api.data.DocumentStore;
import sh.harold.warden.api.data.DocumentStoreException;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reputation points per guild member.
 */
public final class ReputationLedger {

    public static final String DOCUMENT_ID = "reputation";

    private static final Logger LOGGER = LoggerFactory.getLogger(ReputationLedger.class);

    private final DocumentStore documentStore;
    private final Map<Long, Map<Long, ReputationEntry>> entries = new ConcurrentHashMap<>();

    public ReputationLedger(DocumentStore documentStore) {
        this.documentStore = Objects.requireNonNull(documentStore, "documentStore");
    }

    public void load() {
        entries.clear();
        try {
            documentStore.load(DOCUMENT_ID, ReputationDocument.class).ifPresent(document ->
                    document.guilds().forEach((guildId, users) -> entries.put(guildId, new ConcurrentHashMap<>(users))));
        } catch (DocumentStoreException e) {
            LOGGER.error("Failed to read {}, starting empty", DOCUMENT_ID, e);
        }
    }

    public int points(long guildId, long userId) {
        ReputationEntry entry = entries.getOrDefault(guildId, Map.of()).get(userId);
        return entry == null ? 0 : entry.points();
    }

    /**
     * Adds {@code delta} (which may be negative) to the member's points and persists.
     *
     * @return the new point total
     */
    public synchronized int adjust(long guildId, long userId, int delta, Instant at) {
        Map<Long, ReputationEntry> guild = entries.computeIfAbsent(guildId, ignored -> new ConcurrentHashMap<>());
        ReputationEntry current = guild.getOrDefault(userId, new ReputationEntry(0, at));
        ReputationEntry updated = new ReputationEntry(current.points() + delta, at);
        guild.put(userId, updated);
        persist();
        return updated.points();
    }

    private void persist() {
        Map<Long, Map<Long, ReputationEntry>> snapshot = new TreeMap<>();
        entries.forEach((guildId, users) -> snapshot.put(guildId, new TreeMap<>(users)));
        try {
            documentStore.replace(DOCUMENT_ID, new ReputationDocument(snapshot));
        } catch (DocumentStoreException e) {
            LOGGER.error("Failed to persist {}", DOCUMENT_ID, e);
        }
    }

    public record ReputationEntry(int points, Instant updatedAt) {
    }

    public record ReputationDocument(Map<Long, Map<Long, ReputationEntry>> guilds) {
        public ReputationDocument {
            guilds = guilds == null ? Map.of() : guilds;
        }
    }
}
