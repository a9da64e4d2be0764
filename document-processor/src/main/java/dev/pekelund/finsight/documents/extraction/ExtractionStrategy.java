package dev.pekelund.finsight.documents.extraction;

/**
 * How the document reached the oracle.
 */
public enum ExtractionStrategy {
    TEXT,
    IMAGE
}
