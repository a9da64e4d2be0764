package dev.pekelund.finsight.documents;

import dev.pekelund.finsight.documents.summary.SmartSummary;
import dev.pekelund.finsight.documents.tabular.AutoMappingResult;
import dev.pekelund.finsight.documents.tabular.DetectedType;
import dev.pekelund.finsight.documents.tabular.TabularParseResult;
import dev.pekelund.finsight.storage.StoredDocumentReference;
import java.util.List;

/**
 * Outcome of analysing a spreadsheet upload. {@code preview} holds at most the configured number of rows.
 */
public record TabularAnalysis(
    String documentId,
    TabularParseResult preview,
    DetectedType detectedType,
    AutoMappingResult mapping,
    SmartSummary summary,
    List<String> suggestedQuestions,
    StoredDocumentReference storedDocument
) {
}
