package dev.pekelund.finsight.documents;

/**
 * The requested document does not exist or belongs to another owner.
 */
public class DocumentNotFoundException extends DocumentProcessingException {

    private final String documentId;

    public DocumentNotFoundException(String documentId) {
        super("Document not found: " + documentId);
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}
