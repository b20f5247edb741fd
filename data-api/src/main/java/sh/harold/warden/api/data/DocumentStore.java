package sh.harold.warden.api.data;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Key-addressed store of whole documents. A document is always read in full and replaced
 * in full; there are no partial updates.
 */
public interface DocumentStore extends AutoCloseable {

    Pattern DOCUMENT_ID_PATTERN = Pattern.compile("[a-z0-9][a-z0-9._-]*");

    /**
     * Loads a document.
     *
     * @return the document, or empty when it does not exist. A stored document that cannot be
     * parsed is moved aside as a timestamped backup and reported as empty.
     * @throws DocumentStoreException if the backing storage cannot be read
     */
    <T> Optional<T> load(String documentId, Class<T> type);

    /**
     * Atomically replaces the stored document. Readers observe either the previous or the new
     * document, never a partial write.
     *
     * @throws DocumentStoreException if the document could not be written
     */
    void replace(String documentId, Object document);

    boolean exists(String documentId);

    @Override
    default void close() {
    }

    static String requireValidId(String documentId) {
        if (documentId == null || !DOCUMENT_ID_PATTERN.matcher(documentId).matches()) {
            throw new IllegalArgumentException("Invalid document id: " + documentId);
        }
        return documentId;
    }
}
