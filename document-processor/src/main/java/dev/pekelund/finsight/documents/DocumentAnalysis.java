package dev.pekelund.finsight.documents;

import dev.pekelund.finsight.documents.extraction.ExtractionResult;
import dev.pekelund.finsight.documents.summary.SmartSummary;
import dev.pekelund.finsight.storage.StoredDocumentReference;
import java.util.List;

/**
 * Outcome of extracting a PDF upload.
 */
public record DocumentAnalysis(
    String documentId,
    ExtractionResult extraction,
    SmartSummary summary,
    List<String> suggestedQuestions,
    StoredDocumentReference storedDocument
) {
}
