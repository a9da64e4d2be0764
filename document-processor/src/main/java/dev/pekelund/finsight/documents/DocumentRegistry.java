package dev.pekelund.finsight.documents;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.finsight.documents.extraction.ExtractionResult;
import dev.pekelund.finsight.documents.tabular.ColumnMapping;
import dev.pekelund.finsight.documents.tabular.DetectedType;
import dev.pekelund.finsight.documents.tabular.ImportOutcome;
import dev.pekelund.finsight.documents.tabular.TabularDocumentType;
import dev.pekelund.finsight.documents.tabular.TabularParseResult;
import dev.pekelund.finsight.documents.upload.MediaKind;
import dev.pekelund.finsight.documents.upload.SourceFile;
import dev.pekelund.finsight.records.RecordStore;
import dev.pekelund.finsight.records.StoredRecord;
import dev.pekelund.finsight.storage.DocumentOwner;
import dev.pekelund.finsight.storage.StoredDocumentReference;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one record per upload in the {@code documents} table, tracking its processing status, where the original is
 * stored and what was extracted from it.
 */
public class DocumentRegistry {

    public static final String TABLE = "documents";

    static final String FILENAME = "filename";
    static final String FILE_TYPE = "file_type";
    static final String FILE_SIZE = "file_size";
    static final String MIME_TYPE = "mime_type";
    static final String STORAGE_PATH = "storage_path";
    static final String PROCESSING_STATUS = "processing_status";
    static final String CSV_TYPE = "csv_type";
    static final String ROW_COUNT = "row_count";
    static final String EXTRACTED_DATA = "extracted_data";
    static final String COLUMN_MAPPINGS = "column_mappings";
    static final String ERROR_MESSAGE = "error_message";
    static final String PROCESSED_AT = "processed_at";

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentRegistry.class);
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };
    private static final int STORED_PREVIEW_ROWS = 10;

    private final RecordStore recordStore;
    private final ObjectMapper objectMapper;

    public DocumentRegistry(RecordStore recordStore, ObjectMapper objectMapper) {
        this.recordStore = Objects.requireNonNull(recordStore, "recordStore");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Registers {@code file} as {@link ProcessingStatus#PENDING}.
     *
     * @return the generated document identifier
     */
    public String register(SourceFile file, DocumentOwner owner) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(FILENAME, file.filename());
        record.put(FILE_TYPE, file.mediaKind() == MediaKind.TABULAR ? "csv" : "pdf");
        record.put(FILE_SIZE, file.content().length);
        record.put(MIME_TYPE, file.contentType());
        record.put(PROCESSING_STATUS, ProcessingStatus.PENDING.code());
        String id = recordStore.insert(TABLE, owner, record);
        LOGGER.debug("Registered {} as document {}", file.filename(), id);
        return id;
    }

    public void markProcessing(String documentId) {
        recordStore.update(TABLE, documentId, Map.of(PROCESSING_STATUS, ProcessingStatus.PROCESSING.code()));
    }

    public void markTabularCompleted(String documentId, TabularParseResult parsed, DetectedType detected,
        StoredDocumentReference stored) {
        Map<String, Object> extracted = new LinkedHashMap<>();
        extracted.put("headers", parsed.headers());
        extracted.put("preview", parsed.preview(STORED_PREVIEW_ROWS).rows());

        Map<String, Object> changes = completed(stored);
        changes.put(CSV_TYPE, detected.type().code());
        changes.put(ROW_COUNT, parsed.totalRowCount());
        changes.put(EXTRACTED_DATA, toJson(extracted));
        recordStore.update(TABLE, documentId, changes);
    }

    public void markExtractionCompleted(String documentId, ExtractionResult result, StoredDocumentReference stored) {
        Map<String, Object> changes = completed(stored);
        changes.put(EXTRACTED_DATA, toJson(result.payload()));
        recordStore.update(TABLE, documentId, changes);
    }

    public void markFailed(String documentId, String message) {
        Map<String, Object> changes = new HashMap<>();
        changes.put(PROCESSING_STATUS, ProcessingStatus.ERROR.code());
        changes.put(ERROR_MESSAGE, message);
        recordStore.update(TABLE, documentId, changes);
    }

    /**
     * Stores the confirmed type and mapping. A partial import still completes; an import without any success is
     * recorded as {@link ProcessingStatus#ERROR}.
     */
    public void recordImport(String documentId, TabularDocumentType type, ColumnMapping mapping,
        ImportOutcome outcome) {
        Map<String, Object> changes = new HashMap<>();
        changes.put(CSV_TYPE, type.code());
        changes.put(COLUMN_MAPPINGS, new LinkedHashMap<>(mapping.assignments()));
        changes.put(PROCESSING_STATUS, (outcome.success() ? ProcessingStatus.COMPLETED : ProcessingStatus.ERROR)
            .code());
        changes.put(ERROR_MESSAGE, outcome.success() ? null : String.join("; ", outcome.errors()));
        recordStore.update(TABLE, documentId, changes);
    }

    /**
     * @return the owner's documents, newest first
     */
    public List<DocumentRecord> list(DocumentOwner owner) {
        return recordStore.findByOwner(TABLE, owner).stream()
            .map(this::toDocument)
            .sorted(Comparator.comparing(DocumentRecord::createdAt,
                Comparator.nullsLast(Comparator.<String>reverseOrder())))
            .toList();
    }

    /**
     * @return the document, or empty when it does not exist or is owned by someone else
     */
    public Optional<DocumentRecord> find(String documentId, DocumentOwner owner) {
        if (documentId == null || documentId.isBlank() || owner == null || owner.id() == null) {
            return Optional.empty();
        }
        return recordStore.findById(TABLE, documentId)
            .map(this::toDocument)
            .filter(document -> owner.id().equals(document.ownerId()));
    }

    public boolean remove(String documentId) {
        return recordStore.delete(TABLE, documentId);
    }

    public int removeAll(DocumentOwner owner) {
        return recordStore.deleteByOwner(TABLE, owner);
    }

    private static Map<String, Object> completed(StoredDocumentReference stored) {
        Map<String, Object> changes = new HashMap<>();
        changes.put(PROCESSING_STATUS, ProcessingStatus.COMPLETED.code());
        changes.put(ERROR_MESSAGE, null);
        changes.put(PROCESSED_AT, Instant.now().toString());
        if (stored != null) {
            changes.put(STORAGE_PATH, stored.objectName());
        }
        return changes;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new DocumentProcessingException("Unable to serialise extracted data", ex);
        }
    }

    private Map<String, Object> fromJson(String documentId, Object json) {
        if (!(json instanceof String text) || text.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(text, JSON_OBJECT);
        } catch (JsonProcessingException ex) {
            LOGGER.warn("Ignoring unreadable extracted data of document {}: {}", documentId, ex.getOriginalMessage());
            return Map.of();
        }
    }

    private DocumentRecord toDocument(StoredRecord record) {
        Map<String, Object> fields = record.fields();
        MediaKind kind = "csv".equals(fields.get(FILE_TYPE)) ? MediaKind.TABULAR : MediaKind.PAGE_IMAGE;
        return new DocumentRecord(
            record.id(),
            text(fields.get(RecordStore.OWNER_FIELD)),
            text(fields.get(FILENAME)),
            kind,
            fields.get(FILE_SIZE) instanceof Number size ? size.longValue() : 0L,
            text(fields.get(MIME_TYPE)),
            text(fields.get(STORAGE_PATH)),
            ProcessingStatus.fromCode(fields.get(PROCESSING_STATUS)).orElse(ProcessingStatus.PENDING),
            text(fields.get(CSV_TYPE)),
            fields.get(ROW_COUNT) instanceof Number rows ? rows.intValue() : null,
            fromJson(record.id(), fields.get(EXTRACTED_DATA)),
            mappings(fields.get(COLUMN_MAPPINGS)),
            text(fields.get(ERROR_MESSAGE)),
            text(fields.get(RecordStore.CREATED_AT_FIELD)),
            text(fields.get(PROCESSED_AT)));
    }

    private static Map<String, String> mappings(Object value) {
        Map<String, String> mappings = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((header, field) -> {
                if (header != null && field != null) {
                    mappings.put(header.toString(), field.toString());
                }
            });
        }
        return mappings;
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
