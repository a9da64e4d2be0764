package dev.pekelund.finsight.documents;

import dev.pekelund.finsight.documents.tabular.TabularDocumentType;
import dev.pekelund.finsight.documents.upload.MediaKind;
import java.util.Map;
import java.util.Optional;

/**
 * One entry of the document registry.
 *
 * @param storagePath object name of the stored original, {@code null} when the upload was not archived
 * @param extractedData spreadsheet headers and preview rows, or the extracted payload of a PDF
 */
public record DocumentRecord(
    String id,
    String ownerId,
    String filename,
    MediaKind mediaKind,
    long fileSize,
    String mimeType,
    String storagePath,
    ProcessingStatus status,
    String detectedType,
    Integer rowCount,
    Map<String, Object> extractedData,
    Map<String, String> columnMappings,
    String errorMessage,
    String createdAt,
    String processedAt
) {

    public DocumentRecord {
        extractedData = extractedData == null ? Map.of() : extractedData;
        columnMappings = columnMappings == null ? Map.of() : Map.copyOf(columnMappings);
    }

    public String fileType() {
        return mediaKind == MediaKind.TABULAR ? "csv" : "pdf";
    }

    public boolean isStored() {
        return storagePath != null && !storagePath.isBlank();
    }

    public Optional<TabularDocumentType> tabularType() {
        return TabularDocumentType.fromCode(detectedType);
    }
}
