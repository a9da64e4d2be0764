package dev.pekelund.finsight.documents;

/**
 * Base type for unrecoverable failures while ingesting or extracting a document.
 */
public class DocumentProcessingException extends RuntimeException {

    public DocumentProcessingException(String message) {
        super(message);
    }

    public DocumentProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
