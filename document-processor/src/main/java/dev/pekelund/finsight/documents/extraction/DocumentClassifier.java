package dev.pekelund.finsight.documents.extraction;

import java.util.Locale;

/**
 * Guesses a document's extraction schema from its filename alone.
 */
public class DocumentClassifier {

    public ExtractionSchema classify(String filename) {
        if (filename == null || filename.isBlank()) {
            return ExtractionSchema.GENERIC;
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        for (ExtractionSchema schema : ExtractionSchema.values()) {
            for (String keyword : schema.filenameKeywords()) {
                if (lower.contains(keyword)) {
                    return schema;
                }
            }
        }
        return ExtractionSchema.GENERIC;
    }
}
