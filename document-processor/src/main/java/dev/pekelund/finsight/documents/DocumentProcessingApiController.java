package dev.pekelund.finsight.documents;

import dev.pekelund.finsight.documents.extraction.ExtractionPayload;
import dev.pekelund.finsight.documents.extraction.ExtractionResult;
import dev.pekelund.finsight.documents.extraction.ExtractionSchema;
import dev.pekelund.finsight.documents.extraction.ExtractionStrategy;
import dev.pekelund.finsight.documents.summary.SmartSummary;
import dev.pekelund.finsight.documents.tabular.AutoMappingResult;
import dev.pekelund.finsight.documents.tabular.ColumnMapping;
import dev.pekelund.finsight.documents.tabular.DetectedType;
import dev.pekelund.finsight.documents.tabular.ImportOutcome;
import dev.pekelund.finsight.documents.tabular.TabularDocumentType;
import dev.pekelund.finsight.documents.tabular.TabularParseResult;
import dev.pekelund.finsight.documents.upload.MediaKind;
import dev.pekelund.finsight.documents.upload.SourceFile;
import dev.pekelund.finsight.documents.upload.UploadValidator;
import dev.pekelund.finsight.storage.DocumentOwner;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for analysing uploads, importing confirmed spreadsheet mappings and managing registered documents.
 */
@RestController
@RequestMapping(path = "/api/documents")
public class DocumentProcessingApiController {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentProcessingApiController.class);

    private final UploadValidator uploadValidator;
    private final DocumentPipeline pipeline;

    public DocumentProcessingApiController(UploadValidator uploadValidator, DocumentPipeline pipeline) {
        this.uploadValidator = uploadValidator;
        this.pipeline = pipeline;
    }

    @GetMapping(path = "/schemas", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<SchemaDescriptor> listSchemas() {
        return Arrays.stream(ExtractionSchema.values())
            .map(schema -> new SchemaDescriptor(schema.code(), schema.name(), schema.label(),
                schema.requiredSections()))
            .toList();
    }

    @PostMapping(path = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public AnalysisResponse analyze(@RequestPart(name = "file", required = false) MultipartFile file,
        @RequestParam(name = "schema", required = false) String schema,
        @RequestParam(name = "ownerId", required = false) String ownerId) throws IOException {

        SourceFile source = uploadValidator.validate(
            file != null ? file.getOriginalFilename() : null,
            file != null ? file.getContentType() : null,
            file != null ? file.getBytes() : null);
        DocumentOwner owner = StringUtils.hasText(ownerId) ? DocumentOwner.ofId(ownerId) : null;
        LOGGER.info("Analysing upload '{}' ({} bytes, {})", source.filename(), source.declaredSize(),
            source.mediaKind());

        if (source.mediaKind() == MediaKind.TABULAR) {
            TabularAnalysis analysis = pipeline.analyzeTabular(source, owner);
            return AnalysisResponse.tabular(analysis);
        }
        ExtractionSchema forced = resolveSchema(schema);
        DocumentAnalysis analysis = pipeline.analyzeDocument(source, forced, owner);
        return AnalysisResponse.document(analysis);
    }

    @PostMapping(path = "/import", consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ImportOutcome importRows(@RequestBody ImportRequest request) {
        if (request == null || !StringUtils.hasText(request.ownerId())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "ownerId is required");
        }
        if (request.mappings() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "mappings are required");
        }
        TabularDocumentType type = TabularDocumentType.fromCode(request.type()).orElse(TabularDocumentType.UNKNOWN);
        ColumnMapping mapping = new ColumnMapping(request.mappings());
        return pipeline.importTabular(type, mapping, request.rows(), DocumentOwner.ofId(request.ownerId()));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<DocumentRecord> listDocuments(@RequestParam(name = "ownerId", required = false) String ownerId) {
        return pipeline.listDocuments(requireOwner(ownerId));
    }

    @GetMapping(path = "/{documentId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public DocumentRecord getDocument(@PathVariable("documentId") String documentId,
        @RequestParam(name = "ownerId", required = false) String ownerId) {
        return pipeline.getDocument(documentId, requireOwner(ownerId));
    }

    @GetMapping(path = "/{documentId}/data", produces = MediaType.APPLICATION_JSON_VALUE)
    public DocumentData getDocumentData(@PathVariable("documentId") String documentId,
        @RequestParam(name = "ownerId", required = false) String ownerId) {
        return pipeline.getDocumentData(documentId, requireOwner(ownerId));
    }

    @PostMapping(path = "/{documentId}/import", consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ImportOutcome confirmImport(@PathVariable("documentId") String documentId,
        @RequestBody ConfirmImportRequest request) {
        if (request == null || request.mappings() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "mappings are required");
        }
        TabularDocumentType type = StringUtils.hasText(request.type())
            ? TabularDocumentType.fromCode(request.type()).orElse(TabularDocumentType.UNKNOWN)
            : null;
        return pipeline.confirmImport(documentId, type, new ColumnMapping(request.mappings()),
            requireOwner(request.ownerId()));
    }

    @DeleteMapping(path = "/{documentId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> deleteDocument(@PathVariable("documentId") String documentId,
        @RequestParam(name = "ownerId", required = false) String ownerId) {
        pipeline.deleteDocument(documentId, requireOwner(ownerId));
        return Map.of("deleted", true);
    }

    @DeleteMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> deleteAllDocuments(@RequestParam(name = "ownerId", required = false) String ownerId) {
        return Map.of("deleted", pipeline.deleteAllDocuments(requireOwner(ownerId)));
    }

    private static DocumentOwner requireOwner(String ownerId) {
        if (!StringUtils.hasText(ownerId)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "ownerId is required");
        }
        return DocumentOwner.ofId(ownerId);
    }

    private static ExtractionSchema resolveSchema(String schema) {
        if (!StringUtils.hasText(schema)) {
            return null;
        }
        return ExtractionSchema.fromCode(schema)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown schema: " + schema));
    }

    public record SchemaDescriptor(String code, String name, String label, List<String> requiredSections) {
    }

    public record ImportRequest(String ownerId, String type, Map<String, String> mappings,
        List<Map<String, String>> rows) {
    }

    public record ConfirmImportRequest(String ownerId, String type, Map<String, String> mappings) {
    }

    public record ExtractionView(ExtractionSchema schema, ExtractionStrategy strategy, long processingTimeMs,
        boolean tabularText, ExtractionPayload data) {

        static ExtractionView of(ExtractionResult result) {
            return new ExtractionView(result.schema(), result.strategy(), result.processingTime().toMillis(),
                result.tabularText(), result.payload());
        }
    }

    public record AnalysisResponse(
        String documentId,
        MediaKind kind,
        DetectedType detectedType,
        AutoMappingResult mapping,
        TabularParseResult preview,
        ExtractionView extraction,
        SmartSummary summary,
        List<String> suggestedQuestions,
        String storedPath
    ) {

        static AnalysisResponse tabular(TabularAnalysis analysis) {
            return new AnalysisResponse(analysis.documentId(), MediaKind.TABULAR, analysis.detectedType(),
                analysis.mapping(), analysis.preview(), null, analysis.summary(), analysis.suggestedQuestions(),
                analysis.storedDocument() != null ? analysis.storedDocument().path() : null);
        }

        static AnalysisResponse document(DocumentAnalysis analysis) {
            return new AnalysisResponse(analysis.documentId(), MediaKind.PAGE_IMAGE, null, null, null,
                ExtractionView.of(analysis.extraction()), analysis.summary(), analysis.suggestedQuestions(),
                analysis.storedDocument() != null ? analysis.storedDocument().path() : null);
        }
    }
}
