package dev.pekelund.finsight.documents;

/**
 * Where an error surfaced, used to pick user-facing wording.
 */
public enum ErrorContext {
    DOCUMENT_UPLOAD,
    DOCUMENT_PROCESSING,
    CSV_IMPORT,
    GENERAL
}
