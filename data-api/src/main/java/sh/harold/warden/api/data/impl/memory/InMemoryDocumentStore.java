package sh.harold.warden.api.data.impl.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import sh.harold.warden.api.data.DocumentStore;
import sh.harold.warden.api.data.DocumentStoreException;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps documents as JSON trees in memory. Values go through the same Jackson mapping as the
 * file store, so callers never share mutable state with the store.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, JsonNode> documents = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public InMemoryDocumentStore(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public <T> Optional<T> load(String documentId, Class<T> type) {
        DocumentStore.requireValidId(documentId);
        JsonNode node = documents.get(documentId);
        if (node == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.treeToValue(node, type));
        } catch (JsonProcessingException e) {
            throw new DocumentStoreException(documentId, "Stored document cannot be read as " + type.getSimpleName(), e);
        }
    }

    @Override
    public void replace(String documentId, Object document) {
        DocumentStore.requireValidId(documentId);
        Objects.requireNonNull(document, "document");
        try {
            documents.put(documentId, objectMapper.valueToTree(document));
        } catch (IllegalArgumentException e) {
            throw new DocumentStoreException(documentId, "Failed to serialize document: " + documentId, e);
        }
    }

    @Override
    public boolean exists(String documentId) {
        return documents.containsKey(DocumentStore.requireValidId(documentId));
    }
}
