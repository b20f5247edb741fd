package sh.harold.warden.api.data;

public class DocumentStoreException extends RuntimeException {
    private final String documentId;

    public DocumentStoreException(String documentId, String message, Throwable cause) {
        super(message, cause);
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}
