package sh.harold.warden.moderation.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.api.data.DocumentStore;
import sh.harold.warden.api.data.DocumentStoreException;
import sh.harold.warden.api.moderation.WarningRecord;
import sh.harold.warden.moderation.lock.ResourceKey;
import sh.harold.warden.moderation.lock.ResourceLockRegistry;
import sh.harold.warden.moderation.lock.ResourceLockTimeoutException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Audit trail of issued warnings. Nothing is ever removed.
 */
public final class WarningLedger {

    public static final String DOCUMENT_ID = "warnings";

    private static final Logger LOGGER = LoggerFactory.getLogger(WarningLedger.class);

    private final DocumentStore documentStore;
    private final ResourceLockRegistry locks;
    private final Map<ResourceKey.UserKey, List<WarningRecord>> warnings = new ConcurrentHashMap<>();

    public WarningLedger(DocumentStore documentStore, ResourceLockRegistry locks) {
        this.documentStore = Objects.requireNonNull(documentStore, "documentStore");
        this.locks = Objects.requireNonNull(locks, "locks");
    }

    public void load() {
        warnings.clear();
        try {
            documentStore.load(DOCUMENT_ID, WarningLedgerDocument.class).ifPresent(document ->
                    document.guilds().forEach((guildId, users) -> users.forEach((userId, records) -> {
                        if (records != null && !records.isEmpty()) {
                            warnings.put(ResourceKey.user(guildId, userId), new CopyOnWriteArrayList<>(records));
                        }
                    })));
        } catch (DocumentStoreException e) {
            LOGGER.error("Failed to read {}, starting empty", DOCUMENT_ID, e);
        }
    }

    /**
     * Appends a warning without persisting; callers persist as the last step of their locked sequence.
     *
     * @return the member's warning count after the append
     */
    public int append(WarningRecord record) {
        Objects.requireNonNull(record, "record");
        ResourceKey.UserKey key = ResourceKey.user(record.guildId(), record.userId());
        return locks.withLock(key, () -> {
            List<WarningRecord> list = warnings.computeIfAbsent(key, ignored -> new CopyOnWriteArrayList<>());
            list.add(record);
            return list.size();
        });
    }

    public List<WarningRecord> warnings(long guildId, long userId) {
        List<WarningRecord> list = warnings.get(ResourceKey.user(guildId, userId));
        return list == null ? List.of() : List.copyOf(list);
    }

    public boolean persist() {
        try {
            return locks.withLock(ResourceKey.document(DOCUMENT_ID), () -> {
                documentStore.replace(DOCUMENT_ID, snapshot());
                return true;
            });
        } catch (DocumentStoreException | ResourceLockTimeoutException e) {
            LOGGER.error("Failed to persist {}", DOCUMENT_ID, e);
            return false;
        }
    }

    WarningLedgerDocument snapshot() {
        Map<Long, Map<Long, List<WarningRecord>>> guilds = new TreeMap<>();
        warnings.forEach((key, records) ->
                guilds.computeIfAbsent(key.guildId(), ignored -> new TreeMap<>()).put(key.userId(), List.copyOf(records)));
        return new WarningLedgerDocument(guilds);
    }

    public record WarningLedgerDocument(Map<Long, Map<Long, List<WarningRecord>>> guilds) {
        public WarningLedgerDocument {
            guilds = guilds == null ? Map.of() : guilds;
        }
    }
}
