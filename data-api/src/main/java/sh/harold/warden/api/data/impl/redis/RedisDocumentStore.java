package sh.harold.warden.api.data.impl.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.api.data.DocumentStore;
import sh.harold.warden.api.data.DocumentStoreException;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores each document as a single Redis string. {@code SET} replaces the value atomically;
 * an unparseable value is renamed to {@code <key>:bak:<epochSeconds>}.
 */
public class RedisDocumentStore implements DocumentStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(RedisDocumentStore.class);

    private final RedisClient redisClient;
    private final StatefulRedisConnection<String, String> connection;
    private final String keyPrefix;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RedisDocumentStore(RedisConfiguration configuration, ObjectMapper objectMapper, Clock clock) {
        Objects.requireNonNull(configuration, "configuration");
        this.redisClient = RedisClient.create(buildUri(configuration));
        this.connection = redisClient.connect();
        this.keyPrefix = configuration.keyPrefix();
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.clock = Objects.requireNonNull(clock, "clock");
        LOGGER.info("Connected document store to Redis at {}:{}", configuration.host(), configuration.port());
    }

    RedisDocumentStore(StatefulRedisConnection<String, String> connection, String keyPrefix,
                       ObjectMapper objectMapper, Clock clock) {
        this.redisClient = null;
        this.connection = Objects.requireNonNull(connection, "connection");
        this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    private static RedisURI buildUri(RedisConfiguration configuration) {
        RedisURI.Builder builder = RedisURI.builder()
                .withHost(configuration.host())
                .withPort(configuration.port())
                .withDatabase(configuration.database());

        if (configuration.hasPassword()) {
            builder.withPassword(configuration.password().toCharArray());
        }

        return builder.build();
    }

    @Override
    public <T> Optional<T> load(String documentId, Class<T> type) {
        String key = keyFor(documentId);
        String json;
        try {
            json = sync().get(key);
        } catch (RedisException e) {
            throw new DocumentStoreException(documentId, "Failed to read document: " + documentId, e);
        }
        if (json == null) {
            return Optional.empty();
        }

        try {
            return Optional.ofNullable(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            String backupKey = key + ":bak:" + clock.instant().getEpochSecond();
            try {
                sync().rename(key, backupKey);
                LOGGER.warn("Document {} is corrupted ({}); moved to {} and continuing with an empty default",
                        documentId, e.getOriginalMessage(), backupKey);
            } catch (RedisException renameFailure) {
                LOGGER.error("Document {} is corrupted and could not be moved aside", documentId, renameFailure);
            }
            return Optional.empty();
        }
    }

    @Override
    public void replace(String documentId, Object document) {
        String key = keyFor(documentId);
        Objects.requireNonNull(document, "document");
        try {
            sync().set(key, objectMapper.writeValueAsString(document));
        } catch (JsonProcessingException | RedisException e) {
            throw new DocumentStoreException(documentId, "Failed to save document: " + documentId, e);
        }
    }

    @Override
    public boolean exists(String documentId) {
        try {
            Long count = sync().exists(keyFor(documentId));
            return count != null && count > 0;
        } catch (RedisException e) {
            throw new DocumentStoreException(documentId, "Failed to query document: " + documentId, e);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (Exception ex) {
            LOGGER.warn("Failed to close Redis connection cleanly", ex);
        }
        if (redisClient != null) {
            try {
                redisClient.shutdown(Duration.ofSeconds(1), Duration.ofSeconds(5));
            } catch (Exception ex) {
                LOGGER.warn("Failed to shutdown Redis client cleanly", ex);
            }
        }
    }

    private RedisCommands<String, String> sync() {
        return connection.sync();
    }

    private String keyFor(String documentId) {
        return keyPrefix + DocumentStore.requireValidId(documentId);
    }
}
