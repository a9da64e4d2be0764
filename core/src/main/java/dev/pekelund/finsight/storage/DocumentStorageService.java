package dev.pekelund.finsight.storage;

/**
 * Opaque upload/download-by-path store for the raw bytes of uploaded source files.
 */
public interface DocumentStorageService {

    boolean isEnabled();

    /**
     * Store {@code content} under a unique object name derived from {@code filename}.
     */
    StoredDocumentReference upload(String filename, byte[] content, String contentType, DocumentOwner owner);

    byte[] download(String objectName);

    /**
     * Remove one stored object. Removing an object that does not exist is not an error.
     */
    void delete(String objectName);

    void deleteDocumentsForOwner(DocumentOwner owner);
}
