package sh.harold.warden.moderation.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.api.data.DocumentStore;
import sh.harold.warden.api.data.DocumentStoreException;
import sh.harold.warden.api.moderation.EscalationTable;
import sh.harold.warden.api.moderation.ViolationRecord;
import sh.harold.warden.api.moderation.ViolationType;
import sh.harold.warden.moderation.lock.ResourceKey;
import sh.harold.warden.moderation.lock.ResourceLockRegistry;
import sh.harold.warden.moderation.lock.ResourceLockTimeoutException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Append-only violation history per guild member. Records outside the retention window stop
 * counting immediately but are only removed by {@link #pruneExpired(Instant)}.
 */
public final class ViolationLedger {

    public static final String DOCUMENT_ID = "violations";
    public static final Duration DEFAULT_RETENTION = Duration.ofDays(30);

    private static final Logger LOGGER = LoggerFactory.getLogger(ViolationLedger.class);

    private final DocumentStore documentStore;
    private final ResourceLockRegistry locks;
    private final EscalationTable escalationTable;
    private final Duration retention;
    private final Map<ResourceKey.UserKey, List<ViolationRecord>> histories = new ConcurrentHashMap<>();

    public ViolationLedger(DocumentStore documentStore, ResourceLockRegistry locks,
                           EscalationTable escalationTable, Duration retention) {
        this.documentStore = Objects.requireNonNull(documentStore, "documentStore");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.escalationTable = Objects.requireNonNull(escalationTable, "escalationTable");
        this.retention = Objects.requireNonNull(retention, "retention");
    }

    public void load() {
        histories.clear();
        try {
            documentStore.load(DOCUMENT_ID, ViolationLedgerDocument.class).ifPresent(document ->
                    document.guilds().forEach((guildId, users) -> users.forEach((userId, records) -> {
                        if (records != null && !records.isEmpty()) {
                            histories.put(ResourceKey.user(guildId, userId), new CopyOnWriteArrayList<>(records));
                        }
                    })));
        } catch (DocumentStoreException e) {
            LOGGER.error("Failed to read {}, starting with an empty ledger", DOCUMENT_ID, e);
        }
        LOGGER.info("Loaded violation history for {} member(s)", histories.size());
    }

    /**
     * Appends a violation. Severities outside 1..5 are recorded as 1.
     */
    public ViolationRecord record(long guildId, long userId, ViolationType type, int severity, Instant at) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(at, "at");
        ResourceKey.UserKey key = ResourceKey.user(guildId, userId);
        return locks.withLock(key, () -> {
            int normalized = ViolationRecord.normalizeSeverity(severity);
            if (normalized != severity) {
                LOGGER.debug("Severity {} for {} in guild {} is out of range, recording {}", severity, userId, guildId, normalized);
            }
            ViolationRecord record = new ViolationRecord(guildId, userId, type, normalized, at);
            histories.computeIfAbsent(key, ignored -> new CopyOnWriteArrayList<>()).add(record);
            return record;
        });
    }

    public List<ViolationRecord> activeViolations(long guildId, long userId, Instant now) {
        List<ViolationRecord> history = histories.get(ResourceKey.user(guildId, userId));
        if (history == null) {
            return List.of();
        }
        List<ViolationRecord> active = new ArrayList<>();
        for (ViolationRecord record : history) {
            if (record.isActive(now, retention)) {
                active.add(record);
            }
        }
        return List.copyOf(active);
    }

    public int tierFor(long guildId, long userId, Instant now) {
        return escalationTable.tierFor(activeViolations(guildId, userId, now).size());
    }

    public List<ViolationRecord> history(long guildId, long userId) {
        List<ViolationRecord> history = histories.get(ResourceKey.user(guildId, userId));
        return history == null ? List.of() : List.copyOf(history);
    }

    /**
     * Drops the member's whole history and persists the result.
     *
     * @return the number of records removed
     */
    public int clear(long guildId, long userId) {
        ResourceKey.UserKey key = ResourceKey.user(guildId, userId);
        return locks.withLock(key, () -> {
            List<ViolationRecord> removed = histories.remove(key);
            if (removed == null) {
                return 0;
            }
            persist();
            return removed.size();
        });
    }

    /**
     * Removes records older than the retention window. Members whose lock is held are skipped
     * and picked up on a later sweep.
     *
     * @return the number of records removed
     */
    public int pruneExpired(Instant now) {
        AtomicInteger removed = new AtomicInteger();
        int skipped = 0;
        for (ResourceKey.UserKey key : histories.keySet()) {
            boolean ran = locks.tryWithLock(key, () -> {
                List<ViolationRecord> history = histories.get(key);
                if (history == null) {
                    return;
                }
                List<ViolationRecord> expired = new ArrayList<>();
                for (ViolationRecord record : history) {
                    if (!record.isActive(now, retention)) {
                        expired.add(record);
                    }
                }
                if (!expired.isEmpty()) {
                    history.removeAll(expired);
                    removed.addAndGet(expired.size());
                }
                if (history.isEmpty()) {
                    histories.remove(key);
                }
            });
            if (!ran) {
                skipped++;
            }
        }
        if (skipped > 0) {
            LOGGER.debug("Retention sweep skipped {} busy member(s)", skipped);
        }
        if (removed.get() > 0) {
            persist();
        }
        return removed.get();
    }

    public Duration getRetention() {
        return retention;
    }

    /**
     * Writes the current ledger. Failures are logged; the in-memory ledger stays authoritative.
     *
     * @return false if the write failed
     */
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

    ViolationLedgerDocument snapshot() {
        Map<Long, Map<Long, List<ViolationRecord>>> guilds = new TreeMap<>();
        histories.forEach((key, records) -> {
            if (!records.isEmpty()) {
                guilds.computeIfAbsent(key.guildId(), ignored -> new TreeMap<>()).put(key.userId(), List.copyOf(records));
            }
        });
        return new ViolationLedgerDocument(guilds);
    }

    public record ViolationLedgerDocument(Map<Long, Map<Long, List<ViolationRecord>>> guilds) {
        public ViolationLedgerDocument {
            guilds = guilds == null ? Map.of() : guilds;
        }
    }
}
