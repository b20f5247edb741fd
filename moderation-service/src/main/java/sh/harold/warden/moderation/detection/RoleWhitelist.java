package sh.harold.warden.moderation.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.api.data.DocumentStore;
import sh.harold.warden.api.data.DocumentStoreException;
import sh.harold.warden.moderation.lock.ResourceKey;
import sh.harold.warden.moderation.lock.ResourceLockRegistry;
import sh.harold.warden.moderation.lock.ResourceLockTimeoutException;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Roles whose holders bypass automatic detection, per guild.
 */
public final class RoleWhitelist {

    public static final String DOCUMENT_ID = "role-whitelist";

    private static final Logger LOGGER = LoggerFactory.getLogger(RoleWhitelist.class);

    private final DocumentStore documentStore;
    private final ResourceLockRegistry locks;
    private final Map<Long, Set<Long>> roles = new ConcurrentHashMap<>();

    public RoleWhitelist(DocumentStore documentStore, ResourceLockRegistry locks) {
        this.documentStore = Objects.requireNonNull(documentStore, "documentStore");
        this.locks = Objects.requireNonNull(locks, "locks");
    }

    public void load() {
        roles.clear();
        try {
            documentStore.load(DOCUMENT_ID, RoleWhitelistDocument.class).ifPresent(document ->
                    document.guilds().forEach((guildId, roleIds) -> roles.put(guildId, Set.copyOf(roleIds))));
        } catch (DocumentStoreException e) {
            LOGGER.error("Failed to read {}, starting empty", DOCUMENT_ID, e);
        }
    }

    public Set<Long> roles(long guildId) {
        return roles.getOrDefault(guildId, Set.of());
    }

    /**
     * @return false if the role was already whitelisted
     */
    public boolean add(long guildId, long roleId) {
        return locks.withLock(ResourceKey.guild(guildId), () -> {
            Set<Long> current = roles(guildId);
            if (current.contains(roleId)) {
                return false;
            }
            Set<Long> updated = new LinkedHashSet<>(current);
            updated.add(roleId);
            roles.put(guildId, Set.copyOf(updated));
            persist();
            LOGGER.info("Whitelisted role {} in guild {}", roleId, guildId);
            return true;
        });
    }

    /**
     * @return false if the role was not whitelisted
     */
    public boolean remove(long guildId, long roleId) {
        return locks.withLock(ResourceKey.guild(guildId), () -> {
            Set<Long> current = roles(guildId);
            if (!current.contains(roleId)) {
                return false;
            }
            Set<Long> updated = new LinkedHashSet<>(current);
            updated.remove(roleId);
            if (updated.isEmpty()) {
                roles.remove(guildId);
            } else {
                roles.put(guildId, Set.copyOf(updated));
            }
            persist();
            LOGGER.info("Removed role {} from whitelist in guild {}", roleId, guildId);
            return true;
        });
    }

    private void persist() {
        try {
            locks.withLock(ResourceKey.document(DOCUMENT_ID),
                    () -> documentStore.replace(DOCUMENT_ID, new RoleWhitelistDocument(new TreeMap<>(roles))));
        } catch (DocumentStoreException | ResourceLockTimeoutException e) {
            LOGGER.error("Failed to persist {}", DOCUMENT_ID, e);
        }
    }

    public record RoleWhitelistDocument(Map<Long, Set<Long>> guilds) {
        public RoleWhitelistDocument {
            guilds = guilds == null ? Map.of() : guilds;
        }
    }
}
