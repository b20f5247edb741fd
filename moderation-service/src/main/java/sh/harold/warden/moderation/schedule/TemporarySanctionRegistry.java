package sh.harold.warden.moderation.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.api.data.DocumentStore;
import sh.harold.warden.api.data.DocumentStoreException;
import sh.harold.warden.api.moderation.TemporarySanction;
import sh.harold.warden.moderation.lock.ResourceKey;
import sh.harold.warden.moderation.lock.ResourceLockRegistry;
import sh.harold.warden.moderation.lock.ResourceLockTimeoutException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Every time-bounded sanction still waiting to be reversed, keyed by {@link TemporarySanction#key()}.
 */
public final class TemporarySanctionRegistry {

    public static final String DOCUMENT_ID = "temporary-sanctions";

    private static final Logger LOGGER = LoggerFactory.getLogger(TemporarySanctionRegistry.class);

    private final DocumentStore documentStore;
    private final ResourceLockRegistry locks;
    private final Map<String, TemporarySanction> sanctions = new ConcurrentHashMap<>();

    public TemporarySanctionRegistry(DocumentStore documentStore, ResourceLockRegistry locks) {
        this.documentStore = Objects.requireNonNull(documentStore, "documentStore");
        this.locks = Objects.requireNonNull(locks, "locks");
    }

    public void load() {
        sanctions.clear();
        try {
            documentStore.load(DOCUMENT_ID, TemporarySanctionDocument.class).ifPresent(document ->
                    document.sanctions().forEach((key, sanction) -> {
                        if (sanction != null && key.equals(sanction.key())) {
                            sanctions.put(key, sanction);
                        } else {
                            LOGGER.warn("Dropping temporary sanction with inconsistent key {}", key);
                        }
                    }));
        } catch (DocumentStoreException e) {
            LOGGER.error("Failed to read {}, starting empty", DOCUMENT_ID, e);
        }
        LOGGER.info("Loaded {} pending temporary sanction(s)", sanctions.size());
    }

    /**
     * Stores the sanction, replacing any existing one with the same key, and persists.
     */
    public void register(TemporarySanction sanction) {
        Objects.requireNonNull(sanction, "sanction");
        locks.withLock(ResourceKey.sanction(sanction.key()), () -> {
            TemporarySanction previous = sanctions.put(sanction.key(), sanction);
            if (previous != null) {
                LOGGER.info("Replaced temporary sanction {} (expiry {} -> {})", sanction.key(), previous.expiresAt(), sanction.expiresAt());
            }
            persist();
        });
    }

    /**
     * Removes and persists. Callers reversing a sanction hold its lock already.
     *
     * @return the removed sanction, or empty if it was already gone
     */
    public Optional<TemporarySanction> remove(String key) {
        return locks.withLock(ResourceKey.sanction(key), () -> {
            TemporarySanction removed = sanctions.remove(key);
            if (removed != null) {
                persist();
            }
            return Optional.ofNullable(removed);
        });
    }

    public Optional<TemporarySanction> find(String key) {
        return Optional.ofNullable(sanctions.get(key));
    }

    public List<TemporarySanction> expired(Instant now) {
        List<TemporarySanction> expired = new ArrayList<>();
        for (TemporarySanction sanction : sanctions.values()) {
            if (sanction.isExpired(now)) {
                expired.add(sanction);
            }
        }
        expired.sort(Comparator.comparing(TemporarySanction::expiresAt));
        return expired;
    }

    public List<TemporarySanction> all() {
        List<TemporarySanction> all = new ArrayList<>(sanctions.values());
        all.sort(Comparator.comparing(TemporarySanction::expiresAt));
        return all;
    }

    public int size() {
        return sanctions.size();
    }

    private void persist() {
        try {
            locks.withLock(ResourceKey.document(DOCUMENT_ID),
                    () -> documentStore.replace(DOCUMENT_ID, new TemporarySanctionDocument(new TreeMap<>(sanctions))));
        } catch (DocumentStoreException | ResourceLockTimeoutException e) {
            LOGGER.error("Failed to persist {}", DOCUMENT_ID, e);
        }
    }

    public record TemporarySanctionDocument(Map<String, TemporarySanction> sanctions) {
        public TemporarySanctionDocument {
            sanctions = sanctions == null ? Map.of() : sanctions;
        }
    }
}
