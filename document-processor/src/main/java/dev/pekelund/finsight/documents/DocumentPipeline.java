package dev.pekelund.finsight.documents;

import dev.pekelund.finsight.documents.extraction.ExtractionEngine;
import dev.pekelund.finsight.documents.extraction.ExtractionOutcome;
import dev.pekelund.finsight.documents.extraction.ExtractionRequest;
import dev.pekelund.finsight.documents.extraction.ExtractionResult;
import dev.pekelund.finsight.documents.extraction.ExtractionSchema;
import dev.pekelund.finsight.documents.summary.SmartSummary;
import dev.pekelund.finsight.documents.summary.SuggestedQuestions;
import dev.pekelund.finsight.documents.summary.SummaryGenerator;
import dev.pekelund.finsight.documents.tabular.AutoMappingResult;
import dev.pekelund.finsight.documents.tabular.ColumnMapper;
import dev.pekelund.finsight.documents.tabular.ColumnMapping;
import dev.pekelund.finsight.documents.tabular.DetectedType;
import dev.pekelund.finsight.documents.tabular.ImportOutcome;
import dev.pekelund.finsight.documents.tabular.RowImporter;
import dev.pekelund.finsight.documents.tabular.TabularDocumentType;
import dev.pekelund.finsight.documents.tabular.TabularParseResult;
import dev.pekelund.finsight.documents.tabular.TabularParser;
import dev.pekelund.finsight.documents.tabular.TypeDetector;
import dev.pekelund.finsight.documents.upload.MediaKind;
import dev.pekelund.finsight.documents.upload.SourceFile;
import dev.pekelund.finsight.records.RecordStoreException;
import dev.pekelund.finsight.storage.DocumentOwner;
import dev.pekelund.finsight.storage.DocumentStorageException;
import dev.pekelund.finsight.storage.DocumentStorageService;
import dev.pekelund.finsight.storage.StoredDocumentReference;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs uploads through the ingestion stages: spreadsheets are parsed, typed, auto-mapped and summarised; PDFs are
 * extracted and summarised. Imports apply a confirmed mapping to the full row set.
 *
 * <p>Uploads with an owner are registered in the {@link DocumentRegistry}, so they can be listed, viewed, imported
 * from the stored original and deleted later. Registry writes never fail an analysis.</p>
 */
public class DocumentPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentPipeline.class);
    private static final int DOCUMENT_DATA_ROW_LIMIT = 500;

    private final TabularParser tabularParser;
    private final TypeDetector typeDetector;
    private final ColumnMapper columnMapper;
    private final RowImporter rowImporter;
    private final ExtractionEngine extractionEngine;
    private final SummaryGenerator summaryGenerator;
    private final DocumentStorageService storageService;
    private final DocumentRegistry registry;
    private final int previewRowLimit;
    private final boolean archiveUploads;

    public DocumentPipeline(TabularParser tabularParser, TypeDetector typeDetector, ColumnMapper columnMapper,
        RowImporter rowImporter, ExtractionEngine extractionEngine, SummaryGenerator summaryGenerator,
        DocumentStorageService storageService, DocumentRegistry registry, int previewRowLimit,
        boolean archiveUploads) {
        this.tabularParser = Objects.requireNonNull(tabularParser, "tabularParser");
        this.typeDetector = Objects.requireNonNull(typeDetector, "typeDetector");
        this.columnMapper = Objects.requireNonNull(columnMapper, "columnMapper");
        this.rowImporter = Objects.requireNonNull(rowImporter, "rowImporter");
        this.extractionEngine = Objects.requireNonNull(extractionEngine, "extractionEngine");
        this.summaryGenerator = Objects.requireNonNull(summaryGenerator, "summaryGenerator");
        this.storageService = storageService;
        this.registry = Objects.requireNonNull(registry, "registry");
        this.previewRowLimit = previewRowLimit;
        this.archiveUploads = archiveUploads;
    }

    public TabularAnalysis analyzeTabular(SourceFile file, DocumentOwner owner) {
        requireKind(file, MediaKind.TABULAR);
        String registeredId = register(file, owner);
        String documentId = registeredId != null ? registeredId : UUID.randomUUID().toString();
        try (DocumentProcessingMdc.Context ignored = DocumentProcessingMdc.open(documentId, file.filename(), owner)) {
            try {
                return analyzeTabular(file, owner, documentId, registeredId != null);
            } catch (RuntimeException ex) {
                if (registeredId != null) {
                    track(documentId, () -> registry.markFailed(documentId, messageOf(ex)));
                }
                throw ex;
            }
        }
    }

    private TabularAnalysis analyzeTabular(SourceFile file, DocumentOwner owner, String documentId,
        boolean registered) {
        DocumentProcessingMdc.setStage("parse");
        TabularParseResult parsed = tabularParser.parse(file.content());

        DocumentProcessingMdc.setStage("detect");
        DetectedType detected = typeDetector.detect(parsed.headers());

        DocumentProcessingMdc.setStage("map");
        AutoMappingResult mapping = columnMapper.map(parsed.headers(), detected.type());
        LOGGER.info("Detected {} ({}) for {} rows; mapping confidence {} ({}), auto-apply {}",
            detected.type(), detected.confidence(), parsed.totalRowCount(), mapping.confidence(),
            mapping.confidenceLabel(), mapping.shouldAutoApply());

        DocumentProcessingMdc.setStage("summarize");
        TabularParseResult preview = parsed.preview(previewRowLimit);
        SmartSummary summary = summaryGenerator.summarizeTabular(file.filename(), detected.type(), preview);
        StoredDocumentReference stored = archive(file, owner);
        if (registered) {
            track(documentId, () -> registry.markTabularCompleted(documentId, parsed, detected, stored));
        }
        return new TabularAnalysis(documentId, preview, detected, mapping, summary,
            SuggestedQuestions.forSummary(summary), stored);
    }

    /**
     * Imports {@code rows} with a confirmed type and mapping. Nothing is written while a required field of the type
     * is unmapped.
     */
    public ImportOutcome importTabular(TabularDocumentType type, ColumnMapping mapping, List<Map<String, String>> rows,
        DocumentOwner owner) {
        Objects.requireNonNull(mapping, "mapping");
        List<Map<String, String>> batch = rows == null ? List.of() : rows;
        try (DocumentProcessingMdc.Context ignored = DocumentProcessingMdc.open(null, null, owner)) {
            DocumentProcessingMdc.setStage("import");
            if (type != null && type.targetTable().isPresent()) {
                List<String> unmapped = type.requiredFields().stream()
                    .filter(field -> !mapping.isMapped(field))
                    .toList();
                if (!unmapped.isEmpty()) {
                    LOGGER.warn("Blocked import of {} rows as {}: required fields {} are not mapped", batch.size(),
                        type, unmapped);
                    return ImportOutcome.rejected(batch.size(),
                        "Required fields are not mapped: " + String.join(", ", unmapped));
                }
            }
            ImportOutcome outcome = rowImporter.importRows(type, mapping, batch, owner);
            LOGGER.info("Imported {} of {} rows as {} ({} skipped)", outcome.rowsImported(),
                outcome.totalRowsAttempted(), type, outcome.rowsSkipped());
            return outcome;
        }
    }

    /**
     * Extracts a PDF. {@code forcedSchema} may be {@code null} to classify by filename.
     *
     * @throws DocumentProcessingException when every extraction attempt failed
     */
    public DocumentAnalysis analyzeDocument(SourceFile file, ExtractionSchema forcedSchema, DocumentOwner owner) {
        requireKind(file, MediaKind.PAGE_IMAGE);
        String registeredId = register(file, owner);
        String documentId = registeredId != null ? registeredId : UUID.randomUUID().toString();
        try (DocumentProcessingMdc.Context ignored = DocumentProcessingMdc.open(documentId, file.filename(), owner)) {
            try {
                DocumentProcessingMdc.setStage("extract");
                ExtractionRequest request = new ExtractionRequest(file.content(), file.filename(),
                    ExtractionRequest.PDF_MEDIA_TYPE, forcedSchema);
                ExtractionOutcome outcome = extractionEngine.extract(request);
                ExtractionResult result = outcome.orElseThrow();

                DocumentProcessingMdc.setStage("summarize");
                SmartSummary summary = summaryGenerator.summarizeExtraction(file.filename(), result);
                StoredDocumentReference stored = archive(file, owner);
                if (registeredId != null) {
                    track(documentId, () -> registry.markExtractionCompleted(documentId, result, stored));
                }
                return new DocumentAnalysis(documentId, result, summary, SuggestedQuestions.forSummary(summary),
                    stored);
            } catch (RuntimeException ex) {
                if (registeredId != null) {
                    track(documentId, () -> registry.markFailed(documentId, messageOf(ex)));
                }
                throw ex;
            }
        }
    }

    /**
     * @return the owner's registered documents, newest first
     */
    public List<DocumentRecord> listDocuments(DocumentOwner owner) {
        return registry.list(requireOwner(owner));
    }

    /**
     * @throws DocumentNotFoundException when the document does not exist or belongs to another owner
     */
    public DocumentRecord getDocument(String documentId, DocumentOwner owner) {
        return registry.find(documentId, requireOwner(owner))
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
    }

    /**
     * Tabular view of a registered document. Spreadsheets are re-parsed from the stored original and truncated to
     * {@value #DOCUMENT_DATA_ROW_LIMIT} rows; PDFs show their extracted line items, or one row per extracted field
     * when there are none.
     */
    public DocumentData getDocumentData(String documentId, DocumentOwner owner) {
        DocumentRecord document = getDocument(documentId, owner);
        try (DocumentProcessingMdc.Context ignored = DocumentProcessingMdc.open(documentId, document.filename(),
            owner)) {
            DocumentProcessingMdc.setStage("view");
            if (document.mediaKind() == MediaKind.PAGE_IMAGE) {
                return extractedDataView(document);
            }
            TabularParseResult parsed = tabularParser.parse(downloadOriginal(document));
            List<Map<String, Object>> rows = parsed.rows().stream()
                .limit(DOCUMENT_DATA_ROW_LIMIT)
                .<Map<String, Object>>map(row -> new LinkedHashMap<>(row))
                .toList();
            LOGGER.info("Returning {} of {} rows of {}", rows.size(), parsed.totalRowCount(), document.filename());
            return new DocumentData(parsed.headers(), rows, parsed.totalRowCount());
        }
    }

    /**
     * Imports every row of a stored spreadsheet with a confirmed mapping. {@code type} may be {@code null} to use the
     * detected type. The registry keeps the confirmed type, the mapping and whether the import succeeded.
     */
    public ImportOutcome confirmImport(String documentId, TabularDocumentType type, ColumnMapping mapping,
        DocumentOwner owner) {
        Objects.requireNonNull(mapping, "mapping");
        DocumentRecord document = getDocument(documentId, owner);
        if (document.mediaKind() != MediaKind.TABULAR) {
            throw new IllegalArgumentException("Document " + documentId + " is not a spreadsheet");
        }
        TabularDocumentType finalType = type != null
            ? type
            : document.tabularType().orElse(TabularDocumentType.UNKNOWN);

        TabularParseResult parsed;
        try (DocumentProcessingMdc.Context ignored = DocumentProcessingMdc.open(documentId, document.filename(),
            owner)) {
            DocumentProcessingMdc.setStage("parse");
            parsed = tabularParser.parse(downloadOriginal(document));
        }
        ImportOutcome outcome = importTabular(finalType, mapping, parsed.rows(), owner);
        track(documentId, () -> registry.recordImport(documentId, finalType, mapping, outcome));
        return outcome;
    }

    /**
     * Removes the stored original, when there is one, and the registry entry. A storage failure is logged and does
     * not keep the entry.
     */
    public void deleteDocument(String documentId, DocumentOwner owner) {
        DocumentRecord document = getDocument(documentId, owner);
        try (DocumentProcessingMdc.Context ignored = DocumentProcessingMdc.open(documentId, document.filename(),
            owner)) {
            DocumentProcessingMdc.setStage("delete");
            if (document.isStored() && storageEnabled()) {
                try {
                    storageService.delete(document.storagePath());
                } catch (DocumentStorageException ex) {
                    LOGGER.warn("Failed to delete stored original {} of document {}", document.storagePath(),
                        documentId, ex);
                }
            }
            registry.remove(documentId);
            LOGGER.info("Deleted document {}", documentId);
        }
    }

    /**
     * Removes every stored original and registry entry of {@code owner}.
     *
     * @return the number of removed registry entries
     */
    public int deleteAllDocuments(DocumentOwner owner) {
        DocumentOwner required = requireOwner(owner);
        try (DocumentProcessingMdc.Context ignored = DocumentProcessingMdc.open(null, null, required)) {
            DocumentProcessingMdc.setStage("delete");
            if (storageEnabled()) {
                storageService.deleteDocumentsForOwner(required);
            }
            int removed = registry.removeAll(required);
            LOGGER.info("Deleted {} documents", removed);
            return removed;
        }
    }

    private DocumentData extractedDataView(DocumentRecord document) {
        Map<String, Object> extracted = document.extractedData();
        if (extracted.isEmpty()) {
            throw new DocumentProcessingException("No extracted data available for document " + document.id());
        }
        Object items = extracted.containsKey("lineItems") ? extracted.get("lineItems") : extracted.get("line_items");
        List<Map<String, Object>> lineItems = new ArrayList<>();
        if (items instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> map) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    map.forEach((key, value) -> row.put(String.valueOf(key), value));
                    lineItems.add(row);
                }
            }
        }
        if (!lineItems.isEmpty()) {
            return new DocumentData(new ArrayList<>(lineItems.get(0).keySet()), lineItems, lineItems.size());
        }

        List<Map<String, Object>> fields = new ArrayList<>();
        extracted.forEach((key, value) -> {
            if (!"documentType".equals(key)) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("Field", key);
                row.put("Value", value);
                fields.add(row);
            }
        });
        return new DocumentData(List.of("Field", "Value"), fields, fields.size());
    }

    private byte[] downloadOriginal(DocumentRecord document) {
        if (!document.isStored() || !storageEnabled()) {
            throw new DocumentProcessingException("The original file of document " + document.id()
                + " is not stored");
        }
        DocumentProcessingMdc.setStage("download");
        try {
            return storageService.download(document.storagePath());
        } catch (DocumentStorageException ex) {
            throw new DocumentProcessingException("Failed to download file for document " + document.id(), ex);
        }
    }

    private String register(SourceFile file, DocumentOwner owner) {
        if (owner == null || owner.id() == null) {
            return null;
        }
        try {
            String documentId = registry.register(file, owner);
            registry.markProcessing(documentId);
            return documentId;
        } catch (RecordStoreException ex) {
            LOGGER.warn("Failed to register {}; continuing without tracking it", file.filename(), ex);
            return null;
        }
    }

    private static void track(String documentId, Runnable update) {
        try {
            update.run();
        } catch (RecordStoreException ex) {
            LOGGER.warn("Failed to update the status of document {}", documentId, ex);
        }
    }

    private boolean storageEnabled() {
        return storageService != null && storageService.isEnabled();
    }

    private static DocumentOwner requireOwner(DocumentOwner owner) {
        if (owner == null || owner.id() == null) {
            throw new IllegalArgumentException("An owner id is required");
        }
        return owner;
    }

    private static String messageOf(Throwable failure) {
        return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
    }

    private StoredDocumentReference archive(SourceFile file, DocumentOwner owner) {
        if (!archiveUploads || !storageEnabled()) {
            return null;
        }
        DocumentProcessingMdc.setStage("archive");
        try {
            return storageService.upload(file.filename(), file.content(), file.contentType(), owner);
        } catch (DocumentStorageException ex) {
            LOGGER.warn("Failed to archive {}; continuing without a stored copy", file.filename(), ex);
            return null;
        }
    }

    private static void requireKind(SourceFile file, MediaKind expected) {
        Objects.requireNonNull(file, "file");
        if (file.mediaKind() != expected) {
            throw new IllegalArgumentException("Expected a " + expected + " file but got " + file.mediaKind());
        }
    }
}
