package dev.pekelund.finsight.documents;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.finsight.documents.extraction.ExtractionEngine;
import dev.pekelund.finsight.documents.extraction.ExtractionExhaustedException;
import dev.pekelund.finsight.documents.extraction.ExtractionOutcome;
import dev.pekelund.finsight.documents.extraction.ExtractionPayload;
import dev.pekelund.finsight.documents.extraction.ExtractionRequest;
import dev.pekelund.finsight.documents.extraction.ExtractionResult;
import dev.pekelund.finsight.documents.extraction.ExtractionSchema;
import dev.pekelund.finsight.documents.extraction.ExtractionStrategy;
import dev.pekelund.finsight.documents.summary.SummaryDocumentType;
import dev.pekelund.finsight.documents.summary.SummaryGenerator;
import dev.pekelund.finsight.documents.summary.SummaryWeights;
import dev.pekelund.finsight.documents.tabular.ColumnMapper;
import dev.pekelund.finsight.documents.tabular.ColumnMapping;
import dev.pekelund.finsight.documents.tabular.DetectionWeights;
import dev.pekelund.finsight.documents.tabular.ImportOutcome;
import dev.pekelund.finsight.documents.tabular.MappingWeights;
import dev.pekelund.finsight.documents.tabular.RowImporter;
import dev.pekelund.finsight.documents.tabular.TabularDocumentType;
import dev.pekelund.finsight.documents.tabular.TabularParser;
import dev.pekelund.finsight.documents.tabular.TypeDetector;
import dev.pekelund.finsight.documents.upload.MediaKind;
import dev.pekelund.finsight.documents.upload.SourceFile;
import dev.pekelund.finsight.records.InMemoryRecordStore;
import dev.pekelund.finsight.storage.DocumentOwner;
import dev.pekelund.finsight.storage.DocumentStorageException;
import dev.pekelund.finsight.storage.DocumentStorageService;
import dev.pekelund.finsight.storage.StoredDocumentReference;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class DocumentPipelineTest {

    private static final DocumentOwner OWNER = DocumentOwner.ofId("user-1");
    private static final String ROSTER_CSV = """
        Employee Name,Job Title,Annual Salary
        John Smith,Developer,100000
        Jane Doe,Designer,90000
        Ann Lee,Developer,80000
        """;

    private InMemoryRecordStore recordStore;
    private ExtractionEngine extractionEngine;
    private DocumentStorageService storageService;
    private DocumentPipeline pipeline;

    @BeforeEach
    void setUp() {
        recordStore = new InMemoryRecordStore();
        extractionEngine = mock(ExtractionEngine.class);
        storageService = mock(DocumentStorageService.class);
        pipeline = pipeline(100);
    }

    @Test
    void analysesSpreadsheetUploads() {
        TabularAnalysis analysis = pipeline.analyzeTabular(csv("roster.csv", ROSTER_CSV), OWNER);

        assertThat(analysis.documentId()).isNotBlank();
        assertThat(analysis.detectedType().type()).isEqualTo(TabularDocumentType.EMPLOYEE_ROSTER);
        assertThat(analysis.mapping().shouldAutoApply()).isTrue();
        assertThat(analysis.mapping().mapping().targetFor("Job Title")).isEqualTo("role");
        assertThat(analysis.summary().documentType()).isEqualTo(SummaryDocumentType.EMPLOYEES);
        assertThat(analysis.suggestedQuestions()).contains("What's my total payroll cost?");
        assertThat(analysis.storedDocument()).isNull();
        assertThat(MDC.get("document.id")).isNull();
    }

    @Test
    void previewIsTruncatedButCountsEveryRow() {
        TabularAnalysis analysis = pipeline(2).analyzeTabular(csv("roster.csv", ROSTER_CSV), OWNER);

        assertThat(analysis.preview().rows()).hasSize(2);
        assertThat(analysis.preview().totalRowCount()).isEqualTo(3);
        assertThat(analysis.summary().itemCount()).isEqualTo(3);
    }

    @Test
    void archivesUploadsWhenStorageIsEnabled() {
        StoredDocumentReference reference = new StoredDocumentReference("bucket", "uploads/roster.csv", OWNER);
        when(storageService.isEnabled()).thenReturn(true);
        when(storageService.upload(eq("roster.csv"), any(), eq("text/csv"), eq(OWNER))).thenReturn(reference);

        TabularAnalysis analysis = pipeline.analyzeTabular(csv("roster.csv", ROSTER_CSV), OWNER);

        assertThat(analysis.storedDocument()).isEqualTo(reference);
    }

    @Test
    void archiveFailuresDoNotFailTheAnalysis() {
        when(storageService.isEnabled()).thenReturn(true);
        when(storageService.upload(anyString(), any(), any(), any()))
            .thenThrow(new DocumentStorageException("bucket unavailable"));

        TabularAnalysis analysis = pipeline.analyzeTabular(csv("roster.csv", ROSTER_CSV), OWNER);

        assertThat(analysis.storedDocument()).isNull();
        assertThat(analysis.summary()).isNotNull();
    }

    @Test
    void importIsBlockedWhileRequiredFieldsAreUnmapped() {
        ColumnMapping mapping = new ColumnMapping(Map.of("Employee Name", "name"));

        ImportOutcome outcome = pipeline.importTabular(TabularDocumentType.EMPLOYEE_ROSTER, mapping,
            List.of(Map.of("Employee Name", "John"), Map.of("Employee Name", "Jane")), OWNER);

        assertThat(outcome.rowsImported()).isZero();
        assertThat(outcome.rowsSkipped()).isEqualTo(2);
        assertThat(outcome.errors()).containsExactly("Required fields are not mapped: role");
        assertThat(recordStore.size("employees")).isZero();
    }

    @Test
    void importsRowsWithConfirmedMapping() {
        ColumnMapping mapping = new ColumnMapping(Map.of("Employee Name", "name", "Job Title", "role"));

        ImportOutcome outcome = pipeline.importTabular(TabularDocumentType.EMPLOYEE_ROSTER, mapping, List.of(
            Map.of("Employee Name", "John", "Job Title", "Dev"),
            Map.of("Employee Name", "", "Job Title", "Dev")), OWNER);

        assertThat(outcome.rowsImported()).isEqualTo(1);
        assertThat(outcome.rowsSkipped()).isEqualTo(1);
        assertThat(outcome.errors()).singleElement().asString().startsWith("Row 2");
        assertThat(recordStore.findByOwner("employees", OWNER)).hasSize(1);
    }

    @Test
    void importOfUnknownTypeIsRejected() {
        ImportOutcome outcome = pipeline.importTabular(TabularDocumentType.UNKNOWN, new ColumnMapping(Map.of()),
            List.of(Map.of("A", "1")), OWNER);

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.errors()).containsExactly("Unknown document type - cannot import");
    }

    @Test
    void analysesPdfUploadsThroughTheExtractionEngine() {
        ExtractionPayload.Payroll payroll = new ExtractionPayload.Payroll("payroll", null, List.of(
            new ExtractionPayload.Payroll.EmployeePay("John", "Dev", null, null, null, null, null)), null, null);
        ExtractionResult result = new ExtractionResult(ExtractionSchema.PAYROLL, payroll, ExtractionStrategy.TEXT,
            Duration.ofMillis(1200), false);
        when(extractionEngine.extract(any(ExtractionRequest.class)))
            .thenReturn(new ExtractionOutcome.Ok(result, Duration.ofMillis(1200)));

        DocumentAnalysis analysis = pipeline.analyzeDocument(pdf("payroll_jan.pdf"), ExtractionSchema.PAYROLL, OWNER);

        assertThat(analysis.extraction()).isSameAs(result);
        assertThat(analysis.summary().documentType()).isEqualTo(SummaryDocumentType.PAYROLL);
        assertThat(analysis.suggestedQuestions()).contains("What's my average employee cost?");
        verify(extractionEngine).extract(any(ExtractionRequest.class));
    }

    @Test
    void exhaustedExtractionSurfacesAsException() {
        when(extractionEngine.extract(any(ExtractionRequest.class)))
            .thenReturn(new ExtractionOutcome.Exhausted(List.of("first", "second"), Duration.ofSeconds(3)));

        assertThatThrownBy(() -> pipeline.analyzeDocument(pdf("scan.pdf"), null, OWNER))
            .isInstanceOf(ExtractionExhaustedException.class)
            .hasMessage("Document extraction failed: first; second");
        verify(storageService, never()).upload(any(), any(), any(), any());
    }

    @Test
    void rejectsFilesOfTheWrongKind() {
        assertThatThrownBy(() -> pipeline.analyzeDocument(csv("roster.csv", ROSTER_CSV), null, OWNER))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void analysedUploadsAreRegisteredAsCompleted() {
        storeUploadsAs("uploads/roster.csv");

        TabularAnalysis analysis = pipeline.analyzeTabular(csv("roster.csv", ROSTER_CSV), OWNER);

        DocumentRecord document = pipeline.getDocument(analysis.documentId(), OWNER);
        assertThat(document.status()).isEqualTo(ProcessingStatus.COMPLETED);
        assertThat(document.fileType()).isEqualTo("csv");
        assertThat(document.storagePath()).isEqualTo("uploads/roster.csv");
        assertThat(document.detectedType()).isEqualTo("employees");
        assertThat(document.rowCount()).isEqualTo(3);
        assertThat(document.extractedData()).containsKeys("headers", "preview");
        assertThat(document.processedAt()).isNotNull();
        assertThat(pipeline.listDocuments(OWNER)).extracting(DocumentRecord::id)
            .containsExactly(analysis.documentId());
    }

    @Test
    void uploadsWithoutOwnerAreNotRegistered() {
        pipeline.analyzeTabular(csv("roster.csv", ROSTER_CSV), null);

        assertThat(recordStore.size(DocumentRegistry.TABLE)).isZero();
    }

    @Test
    void failedExtractionMarksTheDocumentAsFailed() {
        when(extractionEngine.extract(any(ExtractionRequest.class)))
            .thenReturn(new ExtractionOutcome.Exhausted(List.of("first", "second"), Duration.ofSeconds(3)));

        assertThatThrownBy(() -> pipeline.analyzeDocument(pdf("scan.pdf"), null, OWNER))
            .isInstanceOf(ExtractionExhaustedException.class);

        assertThat(pipeline.listDocuments(OWNER)).singleElement().satisfies(document -> {
            assertThat(document.status()).isEqualTo(ProcessingStatus.ERROR);
            assertThat(document.errorMessage()).isEqualTo("Document extraction failed: first; second");
            assertThat(document.fileType()).isEqualTo("pdf");
        });
    }

    @Test
    void confirmImportReparsesTheStoredOriginal() {
        storeUploadsAs("uploads/roster.csv");
        when(storageService.download("uploads/roster.csv")).thenReturn(ROSTER_CSV.getBytes(StandardCharsets.UTF_8));
        String documentId = pipeline.analyzeTabular(csv("roster.csv", ROSTER_CSV), OWNER).documentId();
        ColumnMapping mapping = new ColumnMapping(Map.of("Employee Name", "name", "Job Title", "role"));

        ImportOutcome outcome = pipeline.confirmImport(documentId, null, mapping, OWNER);

        assertThat(outcome.rowsImported()).isEqualTo(3);
        assertThat(recordStore.findByOwner("employees", OWNER)).hasSize(3);
        DocumentRecord document = pipeline.getDocument(documentId, OWNER);
        assertThat(document.status()).isEqualTo(ProcessingStatus.COMPLETED);
        assertThat(document.columnMappings()).containsEntry("Job Title", "role");
        assertThat(document.errorMessage()).isNull();
    }

    @Test
    void importWithoutAnySuccessMarksTheDocumentAsFailed() {
        storeUploadsAs("uploads/roster.csv");
        when(storageService.download("uploads/roster.csv")).thenReturn(ROSTER_CSV.getBytes(StandardCharsets.UTF_8));
        String documentId = pipeline.analyzeTabular(csv("roster.csv", ROSTER_CSV), OWNER).documentId();

        ImportOutcome outcome = pipeline.confirmImport(documentId, TabularDocumentType.UNKNOWN,
            new ColumnMapping(Map.of()), OWNER);

        assertThat(outcome.success()).isFalse();
        DocumentRecord document = pipeline.getDocument(documentId, OWNER);
        assertThat(document.status()).isEqualTo(ProcessingStatus.ERROR);
        assertThat(document.detectedType()).isEqualTo("unknown");
        assertThat(document.errorMessage()).isEqualTo("Unknown document type - cannot import");
    }

    @Test
    void confirmImportNeedsTheStoredOriginal() {
        String documentId = pipeline.analyzeTabular(csv("roster.csv", ROSTER_CSV), OWNER).documentId();

        assertThatThrownBy(() -> pipeline.confirmImport(documentId, null,
            new ColumnMapping(Map.of("Employee Name", "name", "Job Title", "role")), OWNER))
            .isInstanceOf(DocumentProcessingException.class)
            .hasMessageContaining("is not stored");
    }

    @Test
    void spreadsheetDataIsReadFromTheStoredOriginal() {
        storeUploadsAs("uploads/roster.csv");
        when(storageService.download("uploads/roster.csv")).thenReturn(ROSTER_CSV.getBytes(StandardCharsets.UTF_8));
        String documentId = pipeline(1).analyzeTabular(csv("roster.csv", ROSTER_CSV), OWNER).documentId();

        DocumentData data = pipeline.getDocumentData(documentId, OWNER);

        assertThat(data.headers()).containsExactly("Employee Name", "Job Title", "Annual Salary");
        assertThat(data.rows()).hasSize(3);
        assertThat(data.totalRows()).isEqualTo(3);
        assertThat(data.rows().get(1)).containsEntry("Employee Name", "Jane Doe");
    }

    @Test
    void pdfDataShowsOneRowPerExtractedField() {
        ExtractionPayload.Payroll payroll = new ExtractionPayload.Payroll("payroll", null, List.of(
            new ExtractionPayload.Payroll.EmployeePay("John", "Dev", null, null, null, null, null)), null, null);
        ExtractionResult result = new ExtractionResult(ExtractionSchema.PAYROLL, payroll, ExtractionStrategy.IMAGE,
            Duration.ofMillis(900), false);
        when(extractionEngine.extract(any(ExtractionRequest.class)))
            .thenReturn(new ExtractionOutcome.Ok(result, Duration.ofMillis(900)));
        String documentId = pipeline.analyzeDocument(pdf("payroll_jan.pdf"), null, OWNER).documentId();

        DocumentData data = pipeline.getDocumentData(documentId, OWNER);

        assertThat(data.headers()).containsExactly("Field", "Value");
        assertThat(data.rows()).extracting(row -> row.get("Field")).contains("employees")
            .doesNotContain("documentType");
        verify(storageService, never()).download(anyString());
    }

    @Test
    void documentsOfOtherOwnersAreNotFound() {
        String documentId = pipeline.analyzeTabular(csv("roster.csv", ROSTER_CSV), OWNER).documentId();
        DocumentOwner stranger = DocumentOwner.ofId("user-2");

        assertThatThrownBy(() -> pipeline.getDocument(documentId, stranger))
            .isInstanceOf(DocumentNotFoundException.class);
        assertThatThrownBy(() -> pipeline.deleteDocument(documentId, stranger))
            .isInstanceOf(DocumentNotFoundException.class);
        assertThat(pipeline.listDocuments(stranger)).isEmpty();
        assertThat(pipeline.listDocuments(OWNER)).hasSize(1);
    }

    @Test
    void deleteRemovesStoredOriginalAndRecord() {
        storeUploadsAs("uploads/roster.csv");
        String documentId = pipeline.analyzeTabular(csv("roster.csv", ROSTER_CSV), OWNER).documentId();

        pipeline.deleteDocument(documentId, OWNER);

        verify(storageService).delete("uploads/roster.csv");
        assertThat(pipeline.listDocuments(OWNER)).isEmpty();
    }

    @Test
    void storageFailureDoesNotKeepTheDeletedRecord() {
        storeUploadsAs("uploads/roster.csv");
        String documentId = pipeline.analyzeTabular(csv("roster.csv", ROSTER_CSV), OWNER).documentId();
        doThrow(new DocumentStorageException("bucket unavailable"))
            .when(storageService).delete("uploads/roster.csv");

        pipeline.deleteDocument(documentId, OWNER);

        assertThat(pipeline.listDocuments(OWNER)).isEmpty();
    }

    @Test
    void deleteAllRemovesEveryDocumentOfTheOwner() {
        when(storageService.isEnabled()).thenReturn(true);
        pipeline.analyzeTabular(csv("roster.csv", ROSTER_CSV), OWNER);
        pipeline.analyzeTabular(csv("team.csv", ROSTER_CSV), OWNER);
        pipeline.analyzeTabular(csv("other.csv", ROSTER_CSV), DocumentOwner.ofId("user-2"));

        int deleted = pipeline.deleteAllDocuments(OWNER);

        assertThat(deleted).isEqualTo(2);
        verify(storageService).deleteDocumentsForOwner(OWNER);
        assertThat(pipeline.listDocuments(OWNER)).isEmpty();
        assertThat(pipeline.listDocuments(DocumentOwner.ofId("user-2"))).hasSize(1);
    }

    @Test
    void lifecycleOperationsRequireAnOwner() {
        assertThatThrownBy(() -> pipeline.listDocuments(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> pipeline.deleteAllDocuments(DocumentOwner.ofId(" ")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private void storeUploadsAs(String objectName) {
        when(storageService.isEnabled()).thenReturn(true);
        when(storageService.upload(anyString(), any(), any(), any()))
            .thenAnswer(invocation -> new StoredDocumentReference("bucket", objectName, invocation.getArgument(3)));
    }

    private DocumentPipeline pipeline(int previewRowLimit) {
        return new DocumentPipeline(new TabularParser(), new TypeDetector(DetectionWeights.defaults()),
            new ColumnMapper(MappingWeights.defaults()), new RowImporter(recordStore, 10), extractionEngine,
            new SummaryGenerator(SummaryWeights.defaults()), storageService,
            new DocumentRegistry(recordStore, new ObjectMapper()), previewRowLimit, true);
    }

    private static SourceFile csv(String filename, String content) {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        return new SourceFile(filename, bytes, bytes.length, MediaKind.TABULAR, "text/csv");
    }

    private static SourceFile pdf(String filename) {
        byte[] bytes = {37, 80, 68, 70};
        return new SourceFile(filename, bytes, bytes.length, MediaKind.PAGE_IMAGE, "application/pdf");
    }
}
