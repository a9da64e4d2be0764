package dev.pekelund.finsight.documents.upload;

/**
 * How an uploaded file is processed: parsed as rows and columns, or sent to the extraction oracle as pages.
 */
public enum MediaKind {
    TABULAR,
    PAGE_IMAGE
}
