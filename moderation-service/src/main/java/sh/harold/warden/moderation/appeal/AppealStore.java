package sh.harold.warden.moderation.appeal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.api.data.DocumentStore;
import sh.harold.warden.api.data.DocumentStoreException;
import sh.harold.warden.api.moderation.AppealRecord;
import sh.harold.warden.api.moderation.AppealStatus;
import sh.harold.warden.api.moderation.ValidationException;
import sh.harold.warden.moderation.lock.ResourceKey;
import sh.harold.warden.moderation.lock.ResourceLockRegistry;
import sh.harold.warden.moderation.lock.ResourceLockTimeoutException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Storage for ban appeals. One appeal per member per guild; a decided appeal may be replaced by a new one.
 */
public final class AppealStore {

    public static final String DOCUMENT_ID = "appeals";
    public static final int MAX_REASON_LENGTH = 1000;

    private static final Logger LOGGER = LoggerFactory.getLogger(AppealStore.class);

    private final DocumentStore documentStore;
    private final ResourceLockRegistry locks;
    private final Clock clock;
    private final Map<ResourceKey.UserKey, AppealRecord> appeals = new ConcurrentHashMap<>();

    public AppealStore(DocumentStore documentStore, ResourceLockRegistry locks, Clock clock) {
        this.documentStore = Objects.requireNonNull(documentStore, "documentStore");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void load() {
        appeals.clear();
        try {
            documentStore.load(DOCUMENT_ID, AppealDocument.class).ifPresent(document ->
                    document.guilds().forEach((guildId, users) -> users.forEach((userId, appeal) ->
                            appeals.put(ResourceKey.user(guildId, userId), appeal))));
        } catch (DocumentStoreException e) {
            LOGGER.error("Failed to read {}, starting empty", DOCUMENT_ID, e);
        }
    }

    /**
     * @throws ValidationException if the reason is blank or too long, or a pending appeal already exists
     */
    public AppealRecord submit(long guildId, long userId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("Appeal reason must not be blank");
        }
        if (reason.length() > MAX_REASON_LENGTH) {
            throw new ValidationException("Appeal reason must be at most " + MAX_REASON_LENGTH + " characters");
        }
        ResourceKey.UserKey key = ResourceKey.user(guildId, userId);
        return locks.withLock(key, () -> {
            AppealRecord existing = appeals.get(key);
            if (existing != null && existing.status() == AppealStatus.PENDING) {
                throw new ValidationException("You already have a pending appeal!");
            }
            AppealRecord appeal = new AppealRecord(guildId, userId, reason.trim(), AppealStatus.PENDING, clock.instant(), null);
            appeals.put(key, appeal);
            persist();
            LOGGER.info("Stored appeal from {} in guild {}", userId, guildId);
            return appeal;
        });
    }

    public Optional<AppealRecord> find(long guildId, long userId) {
        return Optional.ofNullable(appeals.get(ResourceKey.user(guildId, userId)));
    }

    public List<AppealRecord> list(long guildId, AppealStatus status) {
        List<AppealRecord> result = new ArrayList<>();
        for (AppealRecord appeal : appeals.values()) {
            if (appeal.guildId() == guildId && (status == null || appeal.status() == status)) {
                result.add(appeal);
            }
        }
        result.sort(Comparator.comparing(AppealRecord::submittedAt));
        return result;
    }

    public Optional<AppealRecord> updateStatus(long guildId, long userId, AppealStatus status) {
        Objects.requireNonNull(status, "status");
        ResourceKey.UserKey key = ResourceKey.user(guildId, userId);
        return locks.withLock(key, () -> {
            AppealRecord existing = appeals.get(key);
            if (existing == null) {
                return Optional.<AppealRecord>empty();
            }
            AppealRecord updated = existing.withStatus(status, clock.instant());
            appeals.put(key, updated);
            persist();
            return Optional.of(updated);
        });
    }

    private void persist() {
        try {
            locks.withLock(ResourceKey.document(DOCUMENT_ID), () -> documentStore.replace(DOCUMENT_ID, snapshot()));
        } catch (DocumentStoreException | ResourceLockTimeoutException e) {
            LOGGER.error("Failed to persist {}", DOCUMENT_ID, e);
        }
    }

    private AppealDocument snapshot() {
        Map<Long, Map<Long, AppealRecord>> guilds = new TreeMap<>();
        appeals.forEach((key, appeal) ->
                guilds.computeIfAbsent(key.guildId(), ignored -> new TreeMap<>()).put(key.userId(), appeal));
        return new AppealDocument(guilds);
    }

    public record AppealDocument(Map<Long, Map<Long, AppealRecord>> guilds) {
        public AppealDocument {
            guilds = guilds == null ? Map.of() : guilds;
        }
    }
}
