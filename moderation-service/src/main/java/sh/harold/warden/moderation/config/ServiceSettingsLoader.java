package sh.harold.warden.moderation.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import sh.harold.warden.api.data.impl.redis.RedisConfiguration;
import sh.harold.warden.api.moderation.EscalationTable;
import sh.harold.warden.api.moderation.EscalationTier;
import sh.harold.warden.api.moderation.PunishmentSpec;
import sh.harold.warden.api.moderation.SanctionAction;
import sh.harold.warden.api.moderation.ValidationException;
import sh.harold.warden.api.util.Durations;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Reads {@code application.yml}, substitutes {@code ${ENV:default}} placeholders and binds the
 * result onto {@link ServiceSettings}. Every invalid value is collected before failing.
 */
public final class ServiceSettingsLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServiceSettingsLoader.class);
    private static final String CLASSPATH_RESOURCE = "/application.yml";

    static final String DEFAULT_JSON_DIRECTORY = "data";
    static final String DEFAULT_AUDIT_CHANNEL = "mod-logs";
    static final int DEFAULT_RETENTION_DAYS = 30;
    static final int DEFAULT_SCHEDULER_INTERVAL_SECONDS = 60;
    static final int DEFAULT_SWEEP_INTERVAL_MINUTES = 60;
    static final int DEFAULT_LOCK_TIMEOUT_SECONDS = 30;
    static final int DEFAULT_REPUTATION_PENALTY = 10;

    private final Function<String, String> environment;

    public ServiceSettingsLoader() {
        this(System::getenv);
    }

    ServiceSettingsLoader(Function<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    /**
     * Loads settings from the given file, or from the classpath when {@code file} is null.
     *
     * @throws ValidationException if the configuration contains invalid values
     */
    public ServiceSettings load(Path file) {
        if (file == null) {
            return loadClasspath();
        }
        if (!Files.isRegularFile(file)) {
            LOGGER.warn("Configuration file {} not found, using default configuration", file);
            return bind(Map.of());
        }
        try (InputStream inputStream = Files.newInputStream(file)) {
            return load(inputStream);
        } catch (IOException e) {
            LOGGER.warn("Failed to read configuration file {}, using default configuration", file, e);
            return bind(Map.of());
        }
    }

    public ServiceSettings load(InputStream inputStream) {
        Map<String, Object> raw;
        try {
            Object parsed = new Yaml().load(inputStream);
            raw = parsed instanceof Map<?, ?> map ? castMap(map) : Map.of();
        } catch (YAMLException e) {
            LOGGER.warn("Configuration is not valid YAML, using default configuration: {}", e.getMessage());
            raw = Map.of();
        }
        return bind(substitute(raw));
    }

    private ServiceSettings loadClasspath() {
        try (InputStream inputStream = ServiceSettingsLoader.class.getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (inputStream == null) {
                LOGGER.warn("application.yml not found, using default configuration");
                return bind(Map.of());
            }
            return load(inputStream);
        } catch (IOException e) {
            LOGGER.warn("Failed to read application.yml, using default configuration", e);
            return bind(Map.of());
        }
    }

    ServiceSettings bind(Map<String, Object> raw) {
        List<String> errors = new ArrayList<>();

        Map<String, Object> discord = section(raw, "discord");
        String token = string(discord, "token", "");

        Map<String, Object> storage = section(raw, "storage");
        String typeId = string(storage, "type", StorageType.JSON.getId());
        StorageType storageType = StorageType.fromId(typeId).orElse(null);
        if (storageType == null) {
            errors.add("storage.type must be one of json, redis, memory (was '" + typeId + "')");
        }
        Path jsonDirectory = Path.of(string(section(storage, "json"), "directory", DEFAULT_JSON_DIRECTORY));
        RedisConfiguration redis = storageType == StorageType.REDIS ? bindRedis(section(storage, "redis"), errors) : null;

        Map<String, Object> moderation = section(raw, "moderation");
        int retentionDays = positiveInt(moderation, "retention-days", DEFAULT_RETENTION_DAYS, errors);
        int schedulerSeconds = positiveInt(moderation, "scheduler-interval-seconds", DEFAULT_SCHEDULER_INTERVAL_SECONDS, errors);
        int sweepMinutes = positiveInt(moderation, "retention-sweep-interval-minutes", DEFAULT_SWEEP_INTERVAL_MINUTES, errors);
        int lockSeconds = positiveInt(moderation, "lock-timeout-seconds", DEFAULT_LOCK_TIMEOUT_SECONDS, errors);
        int penalty = integer(moderation, "reputation-penalty-per-severity", DEFAULT_REPUTATION_PENALTY, errors);
        if (penalty < 0) {
            errors.add("moderation.reputation-penalty-per-severity must not be negative");
        }
        String auditChannel = string(moderation, "audit-channel", DEFAULT_AUDIT_CHANNEL);
        if (auditChannel.isBlank()) {
            errors.add("moderation.audit-channel must not be blank");
        }
        EscalationTable escalation = bindEscalation(moderation.get("escalation"), errors);

        boolean consoleEnabled = bool(section(raw, "console"), "enabled", true);

        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid service configuration", errors);
        }

        return new ServiceSettings(
                new ServiceSettings.DiscordSettings(token),
                new ServiceSettings.StorageSettings(storageType, jsonDirectory, redis),
                new ServiceSettings.ModerationSettings(
                        Duration.ofDays(retentionDays),
                        Duration.ofSeconds(schedulerSeconds),
                        Duration.ofMinutes(sweepMinutes),
                        Duration.ofSeconds(lockSeconds),
                        penalty,
                        auditChannel.trim(),
                        escalation),
                consoleEnabled);
    }

    private RedisConfiguration bindRedis(Map<String, Object> redis, List<String> errors) {
        String host = string(redis, "host", "localhost");
        int port = integer(redis, "port", 6379, errors);
        String password = string(redis, "password", "");
        int database = integer(redis, "database", 0, errors);
        String keyPrefix = string(redis, "key-prefix", null);
        try {
            return new RedisConfiguration(host, port, password, database, keyPrefix);
        } catch (IllegalArgumentException | NullPointerException e) {
            errors.add("storage.redis: " + e.getMessage());
            return null;
        }
    }

    private EscalationTable bindEscalation(Object raw, List<String> errors) {
        if (raw == null) {
            return EscalationTable.defaults();
        }
        if (!(raw instanceof List<?> rows) || rows.isEmpty()) {
            errors.add("moderation.escalation must be a non-empty list of tiers");
            return EscalationTable.defaults();
        }

        List<EscalationTier> tiers = new ArrayList<>();
        int before = errors.size();
        for (int i = 0; i < rows.size(); i++) {
            String path = "moderation.escalation[" + i + "]";
            if (!(rows.get(i) instanceof Map<?, ?> row)) {
                errors.add(path + " must be a mapping with tier, action and optional duration");
                continue;
            }
            Map<String, Object> entry = castMap(row);
            int tier = integer(entry, "tier", i + 1, errors);
            SanctionAction action;
            try {
                action = SanctionAction.fromId(string(entry, "action", null));
            } catch (IllegalArgumentException e) {
                errors.add(path + ".action: " + e.getMessage());
                continue;
            }
            String durationText = string(entry, "duration", null);
            Duration duration = null;
            if (action == SanctionAction.TIMEOUT) {
                if (durationText == null) {
                    errors.add(path + ": timeout tiers need a positive duration");
                    continue;
                }
                try {
                    duration = Durations.parse(durationText);
                } catch (ValidationException e) {
                    errors.add(path + ".duration: " + e.getMessage());
                    continue;
                }
            } else if (durationText != null) {
                errors.add(path + ": only timeout tiers take a duration");
                continue;
            }
            tiers.add(new EscalationTier(tier, new PunishmentSpec(action, duration)));
        }
        if (errors.size() > before) {
            return EscalationTable.defaults();
        }
        try {
            return EscalationTable.of(tiers);
        } catch (IllegalArgumentException e) {
            errors.add("moderation.escalation: " + e.getMessage());
            return EscalationTable.defaults();
        }
    }

    Map<String, Object> substitute(Map<String, Object> raw) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            resolved.put(entry.getKey(), substituteValue(entry.getValue()));
        }
        return resolved;
    }

    private Object substituteValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return substitute(castMap(map));
        }
        if (value instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            for (Object element : list) {
                resolved.add(substituteValue(element));
            }
            return resolved;
        }
        if (value instanceof String text && text.startsWith("${") && text.endsWith("}")) {
            String[] parts = text.substring(2, text.length() - 1).split(":", 2);
            String fromEnvironment = environment.apply(parts[0]);
            return fromEnvironment != null ? fromEnvironment : parts.length > 1 ? parts[1] : "";
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        ((Map<Object, Object>) map).forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }

    private static Map<String, Object> section(Map<String, Object> parent, String key) {
        Object value = parent.get(key);
        return value instanceof Map<?, ?> map ? castMap(map) : Map.of();
    }

    private static String string(Map<String, Object> section, String key, String fallback) {
        Object value = section.get(key);
        return value == null ? fallback : value.toString();
    }

    private static boolean bool(Map<String, Object> section, String key, boolean fallback) {
        Object value = section.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value == null ? fallback : Boolean.parseBoolean(value.toString().trim());
    }

    private static int integer(Map<String, Object> section, String key, int fallback, List<String> errors) {
        Object value = section.get(key);
        if (value == null || value.toString().isBlank()) {
            return fallback;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            errors.add(key + " must be a whole number (was '" + value + "')");
            return fallback;
        }
    }

    private static int positiveInt(Map<String, Object> section, String key, int fallback, List<String> errors) {
        int value = integer(section, key, fallback, errors);
        if (value <= 0) {
            errors.add("moderation." + key + " must be positive (was " + value + ")");
        }
        return value;
    }
}
