package sh.harold.warden.moderation.guild;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.api.data.DocumentStore;
import sh.harold.warden.api.data.DocumentStoreException;
import sh.harold.warden.api.moderation.GuildConfig;
import sh.harold.warden.api.moderation.ValidationException;
import sh.harold.warden.moderation.lock.ResourceKey;
import sh.harold.warden.moderation.lock.ResourceLockRegistry;
import sh.harold.warden.moderation.lock.ResourceLockTimeoutException;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Owns every guild's detection thresholds. Records are read one by one on load so that a
 * single malformed guild is repaired to defaults without discarding the others.
 */
public final class GuildConfigStore {

    public static final String DOCUMENT_ID = "guild-config";

    private static final Logger LOGGER = LoggerFactory.getLogger(GuildConfigStore.class);
    private static final List<String> REQUIRED_FIELDS = List.of(
            "guild_id", "max_mentions", "max_messages", "timeframe",
            "max_lines", "max_emojis", "caps_threshold", "blocked_words", "link_whitelist");

    private final DocumentStore documentStore;
    private final ObjectMapper objectMapper;
    private final ResourceLockRegistry locks;
    private final Map<Long, GuildConfig> configs = new ConcurrentHashMap<>();

    public GuildConfigStore(DocumentStore documentStore, ObjectMapper objectMapper, ResourceLockRegistry locks) {
        this.documentStore = Objects.requireNonNull(documentStore, "documentStore");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.locks = Objects.requireNonNull(locks, "locks");
    }

    public void load() {
        configs.clear();
        Optional<JsonNode> document;
        try {
            document = documentStore.load(DOCUMENT_ID, JsonNode.class);
        } catch (DocumentStoreException e) {
            LOGGER.error("Failed to read {}, starting with defaults", DOCUMENT_ID, e);
            return;
        }

        JsonNode guilds = document.map(node -> node.path("guilds")).orElse(null);
        if (guilds == null || !guilds.isObject()) {
            return;
        }

        int repaired = 0;
        Iterator<Map.Entry<String, JsonNode>> fields = guilds.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            long guildId;
            try {
                guildId = Long.parseLong(entry.getKey());
            } catch (NumberFormatException e) {
                LOGGER.warn("Dropping guild config with non-numeric id '{}'", entry.getKey());
                continue;
            }
            GuildConfig parsed = readQuietly(entry.getValue());
            GuildConfig accepted = acceptOrRepair(guildId, parsed);
            if (accepted != parsed) {
                repaired++;
            }
            configs.put(guildId, accepted);
        }

        if (repaired > 0) {
            LOGGER.warn("Repaired {} malformed guild config record(s)", repaired);
            persist();
        }
        LOGGER.info("Loaded guild config for {} guild(s)", configs.size());
    }

    /**
     * Returns the guild's config, creating and persisting defaults on first use.
     */
    public GuildConfig get(long guildId) {
        GuildConfig existing = configs.get(guildId);
        if (existing != null) {
            return existing;
        }
        return initialize(guildId);
    }

    public Optional<GuildConfig> find(long guildId) {
        return Optional.ofNullable(configs.get(guildId));
    }

    /**
     * Creates the default record for a newly joined guild. Existing records are left alone.
     */
    public GuildConfig initialize(long guildId) {
        return locks.withLock(ResourceKey.guild(guildId), () -> {
            GuildConfig existing = configs.get(guildId);
            if (existing != null) {
                return existing;
            }
            GuildConfig defaults = GuildConfig.defaults(guildId);
            configs.put(guildId, defaults);
            persist();
            LOGGER.info("Initialized default guild config for {}", guildId);
            return defaults;
        });
    }

    /**
     * Applies an administrative change. The result is validated before it replaces the stored record.
     *
     * @throws GuildConfigValidationException if the updated record is invalid
     */
    public GuildConfig update(long guildId, UnaryOperator<GuildConfig> change) {
        Objects.requireNonNull(change, "change");
        return locks.withLock(ResourceKey.guild(guildId), () -> {
            GuildConfig current = configs.getOrDefault(guildId, GuildConfig.defaults(guildId));
            GuildConfig updated = Objects.requireNonNull(change.apply(current), "updated config");
            if (updated.guildId() != guildId) {
                throw new ValidationException("Config update must not change the guild id");
            }
            GuildConfigValidator.validate(updated);
            configs.put(guildId, updated);
            persist();
            return updated;
        });
    }

    public GuildConfig updateSetting(long guildId, AutoModSetting setting, String rawValue) {
        Objects.requireNonNull(setting, "setting");
        return update(guildId, config -> setting.apply(config, rawValue));
    }

    public GuildConfig addBlockedWord(long guildId, String word) {
        requireText(word, "blocked word");
        return update(guildId, config -> config.toBuilder().addBlockedWord(word).build());
    }

    public GuildConfig removeBlockedWord(long guildId, String word) {
        requireText(word, "blocked word");
        return update(guildId, config -> config.toBuilder().removeBlockedWord(word).build());
    }

    public GuildConfig addWhitelistedLink(long guildId, String domain) {
        requireText(domain, "domain");
        return update(guildId, config -> config.toBuilder().addWhitelistedLink(domain).build());
    }

    public GuildConfig removeWhitelistedLink(long guildId, String domain) {
        requireText(domain, "domain");
        return update(guildId, config -> config.toBuilder().removeWhitelistedLink(domain).build());
    }

    public int size() {
        return configs.size();
    }

    private GuildConfig acceptOrRepair(long guildId, GuildConfig parsed) {
        if (parsed == null) {
            LOGGER.warn("Guild config for {} is unreadable, replacing with defaults", guildId);
            return GuildConfig.defaults(guildId);
        }
        if (parsed.guildId() != guildId) {
            LOGGER.warn("Guild config for {} carries mismatched id {}, replacing with defaults", guildId, parsed.guildId());
            return GuildConfig.defaults(guildId);
        }
        try {
            GuildConfigValidator.validate(parsed);
            return parsed;
        } catch (GuildConfigValidationException e) {
            LOGGER.warn("Guild config for {} is invalid {}, replacing with defaults", guildId, e.getErrors());
            return GuildConfig.defaults(guildId);
        }
    }

    private GuildConfig readQuietly(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String required : REQUIRED_FIELDS) {
            if (!node.has(required) || node.get(required).isNull()) {
                return null;
            }
        }
        try {
            return objectMapper.treeToValue(node, GuildConfig.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOGGER.debug("Guild config record failed to bind: {}", e.getMessage());
            return null;
        }
    }

    private void persist() {
        try {
            locks.withLock(ResourceKey.document(DOCUMENT_ID),
                    () -> documentStore.replace(DOCUMENT_ID, new GuildConfigDocument(new TreeMap<>(configs))));
        } catch (DocumentStoreException | ResourceLockTimeoutException e) {
            LOGGER.error("Failed to persist {}", DOCUMENT_ID, e);
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name + " must not be blank");
        }
    }

    public record GuildConfigDocument(Map<Long, GuildConfig> guilds) {
    }
}
