package sh.harold.warden.api.data.impl.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.api.data.DocumentStore;
import sh.harold.warden.api.data.DocumentStoreException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Stores each document as {@code <id>.json} in a base directory.
 * Features:
 * - Writes go to {@code <id>.json.tmp} and are renamed into place
 * - A file that fails to parse is renamed to {@code <id>.json.bak.<epochSeconds>}
 * - Per-document read/write locking
 */
public class JsonFileDocumentStore implements DocumentStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileDocumentStore.class);

    private final Path basePath;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, ReadWriteLock> documentLocks = new ConcurrentHashMap<>();

    public JsonFileDocumentStore(Path basePath, ObjectMapper objectMapper, Clock clock) {
        this.basePath = Objects.requireNonNull(basePath, "basePath");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.clock = Objects.requireNonNull(clock, "clock");

        try {
            Files.createDirectories(basePath);
        } catch (IOException e) {
            throw new DocumentStoreException(null, "Failed to create storage directory: " + basePath, e);
        }
    }

    @Override
    public <T> Optional<T> load(String documentId, Class<T> type) {
        DocumentStore.requireValidId(documentId);
        Objects.requireNonNull(type, "type");

        ReadWriteLock lock = getDocumentLock(documentId);
        // Quarantine moves the file, so loading takes the write lock.
        lock.writeLock().lock();
        try {
            Path documentPath = getDocumentPath(documentId);
            if (!Files.exists(documentPath)) {
                return Optional.empty();
            }

            String json = Files.readString(documentPath, StandardCharsets.UTF_8);
            try {
                T value = objectMapper.readValue(json, type);
                return Optional.ofNullable(value);
            } catch (JsonProcessingException e) {
                quarantine(documentId, documentPath, e);
                return Optional.empty();
            }
        } catch (IOException e) {
            throw new DocumentStoreException(documentId, "Failed to read document: " + documentId, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void replace(String documentId, Object document) {
        DocumentStore.requireValidId(documentId);
        Objects.requireNonNull(document, "document");

        ReadWriteLock lock = getDocumentLock(documentId);
        lock.writeLock().lock();
        try {
            Path documentPath = getDocumentPath(documentId);
            Path tempPath = documentPath.resolveSibling(documentId + ".json.tmp");

            String json = objectMapper.writeValueAsString(document);
            Files.writeString(tempPath, json, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);

            try {
                Files.move(tempPath, documentPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                LOGGER.warn("Atomic move not supported for {}, falling back to plain replace", documentPath);
                Files.move(tempPath, documentPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new DocumentStoreException(documentId, "Failed to save document: " + documentId, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean exists(String documentId) {
        DocumentStore.requireValidId(documentId);
        ReadWriteLock lock = getDocumentLock(documentId);
        lock.readLock().lock();
        try {
            return Files.exists(getDocumentPath(documentId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Path getBasePath() {
        return basePath;
    }

    private void quarantine(String documentId, Path documentPath, JsonProcessingException cause) throws IOException {
        Path backupPath = documentPath.resolveSibling(documentId + ".json.bak." + clock.instant().getEpochSecond());
        Files.move(documentPath, backupPath, StandardCopyOption.REPLACE_EXISTING);
        LOGGER.warn("Document {} is corrupted ({}); moved to {} and continuing with an empty default",
                documentId, cause.getOriginalMessage(), backupPath.getFileName());
    }

    private Path getDocumentPath(String documentId) {
        return basePath.resolve(documentId + ".json");
    }

    private ReadWriteLock getDocumentLock(String documentId) {
        return documentLocks.computeIfAbsent(documentId, k -> new ReentrantReadWriteLock());
    }
}
