package dev.pekelund.finsight.documents;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.pekelund.finsight.documents.extraction.ExtractionBusyException;
import dev.pekelund.finsight.documents.extraction.ExtractionExhaustedException;
import dev.pekelund.finsight.documents.extraction.ExtractionPayload;
import dev.pekelund.finsight.documents.extraction.ExtractionResult;
import dev.pekelund.finsight.documents.extraction.ExtractionSchema;
import dev.pekelund.finsight.documents.extraction.ExtractionStrategy;
import dev.pekelund.finsight.documents.extraction.ExtractionTimeoutException;
import dev.pekelund.finsight.documents.summary.SmartSummary;
import dev.pekelund.finsight.documents.summary.SuggestedQuestions;
import dev.pekelund.finsight.documents.summary.SummaryDocumentType;
import dev.pekelund.finsight.documents.tabular.ColumnMapper;
import dev.pekelund.finsight.documents.tabular.ColumnMapping;
import dev.pekelund.finsight.documents.tabular.DetectedType;
import dev.pekelund.finsight.documents.tabular.ImportOutcome;
import dev.pekelund.finsight.documents.tabular.MappingWeights;
import dev.pekelund.finsight.documents.tabular.TabularDocumentType;
import dev.pekelund.finsight.documents.tabular.TabularParseResult;
import dev.pekelund.finsight.documents.upload.MediaKind;
import dev.pekelund.finsight.documents.upload.SourceFile;
import dev.pekelund.finsight.documents.upload.UploadValidator;
import dev.pekelund.finsight.storage.DocumentOwner;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.util.unit.DataSize;

@ExtendWith(MockitoExtension.class)
class DocumentProcessingApiControllerTest {

    private static final DocumentOwner OWNER = DocumentOwner.ofId("user-1");

    private MockMvc mockMvc;

    @Mock
    private DocumentPipeline pipeline;

    @BeforeEach
    void setUp() {
        UploadValidator validator = new UploadValidator(DataSize.ofMegabytes(10), Set.of("csv", "pdf"));
        DocumentProcessingApiController controller = new DocumentProcessingApiController(validator, pipeline);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new DocumentProcessingExceptionHandler())
            .build();
    }

    @Test
    void listsExtractionSchemas() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.get("/api/documents/schemas").accept(MediaType.APPLICATION_JSON))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].name").value("FINANCIAL_STATEMENT"))
            .andExpect(jsonPath("$[0].code").value("pl"))
            .andExpect(jsonPath("$[0].requiredSections[0]").value("revenue"))
            .andExpect(jsonPath("$[3].name").value("GENERIC"));
    }

    @Test
    void analysesSpreadsheetUploads() throws Exception {
        List<String> headers = List.of("Employee Name", "Job Title");
        TabularParseResult preview = TabularParseResult.of(headers,
            List.of(Map.of("Employee Name", "John Smith", "Job Title", "Developer")));
        SmartSummary summary = new SmartSummary("Team", SummaryDocumentType.EMPLOYEES, List.of(), 1, null, 0.9);
        TabularAnalysis analysis = new TabularAnalysis("doc-1", preview,
            new DetectedType(TabularDocumentType.EMPLOYEE_ROSTER, 1.0, headers),
            new ColumnMapper(MappingWeights.defaults()).map(headers, TabularDocumentType.EMPLOYEE_ROSTER),
            summary, SuggestedQuestions.forSummary(summary), null);
        when(pipeline.analyzeTabular(any(SourceFile.class), isNull())).thenReturn(analysis);

        MockMultipartFile file = new MockMultipartFile("file", "team.csv", "text/csv",
            "Employee Name,Job Title\nJohn Smith,Developer\n".getBytes());

        mockMvc.perform(MockMvcRequestBuilders.multipart("/api/documents/analyze").file(file))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.documentId").value("doc-1"))
            .andExpect(jsonPath("$.kind").value("TABULAR"))
            .andExpect(jsonPath("$.detectedType.type").value("EMPLOYEE_ROSTER"))
            .andExpect(jsonPath("$.mapping.mapping.assignments['Job Title']").value("role"))
            .andExpect(jsonPath("$.mapping.shouldAutoApply").value(true))
            .andExpect(jsonPath("$.preview.rows[0]['Employee Name']").value("John Smith"))
            .andExpect(jsonPath("$.summary.documentType").value("employees"))
            .andExpect(jsonPath("$.suggestedQuestions[0]").value("What's my total payroll cost?"));
    }

    @Test
    void analysesPdfUploadsWithRequestedSchema() throws Exception {
        ExtractionPayload.Payroll payroll = new ExtractionPayload.Payroll("payroll", null, List.of(
            new ExtractionPayload.Payroll.EmployeePay("John", "Dev", null, null, null, null, null)), null, null);
        ExtractionResult result = new ExtractionResult(ExtractionSchema.PAYROLL, payroll, ExtractionStrategy.TEXT,
            Duration.ofMillis(1500), false);
        SmartSummary summary = new SmartSummary("Payroll", SummaryDocumentType.PAYROLL, List.of(), 1, null, 0.5);
        when(pipeline.analyzeDocument(any(SourceFile.class), eq(ExtractionSchema.PAYROLL), eq(OWNER)))
            .thenReturn(new DocumentAnalysis("doc-2", result, summary, SuggestedQuestions.forSummary(summary), null));

        MockMultipartFile file = new MockMultipartFile("file", "january.pdf", "application/pdf", "%PDF".getBytes());

        mockMvc.perform(MockMvcRequestBuilders.multipart("/api/documents/analyze")
                .file(file)
                .param("schema", "payroll")
                .param("ownerId", "user-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.kind").value("PAGE_IMAGE"))
            .andExpect(jsonPath("$.extraction.schema").value("PAYROLL"))
            .andExpect(jsonPath("$.extraction.strategy").value("TEXT"))
            .andExpect(jsonPath("$.extraction.processingTimeMs").value(1500))
            .andExpect(jsonPath("$.extraction.data.employees[0].name").value("John"))
            .andExpect(jsonPath("$.summary.documentType").value("payroll"));
    }

    @Test
    void rejectsUnsupportedFileTypes() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "ledger.xlsx", "application/octet-stream",
            new byte[] {1, 2, 3});

        mockMvc.perform(MockMvcRequestBuilders.multipart("/api/documents/analyze").file(file))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("UNSUPPORTED_EXTENSION"))
            .andExpect(jsonPath("$.message").value("Unsupported file type: only CSV and PDF files are accepted"))
            .andExpect(jsonPath("$.friendlyMessage").value("We couldn't read this file."))
            .andExpect(jsonPath("$.retryable").value(false));
        verifyNoInteractions(pipeline);
    }

    @Test
    void rejectsRequestsWithoutFile() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.multipart("/api/documents/analyze").param("ownerId", "user-1"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("MISSING_FILE"));
    }

    @Test
    void rejectsUnknownSchemas() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "scan.pdf", "application/pdf", "%PDF".getBytes());

        mockMvc.perform(MockMvcRequestBuilders.multipart("/api/documents/analyze")
                .file(file)
                .param("schema", "balance-sheet"))
            .andExpect(status().isBadRequest());
        verifyNoInteractions(pipeline);
    }

    @Test
    void reportsExtractionTimeouts() throws Exception {
        when(pipeline.analyzeDocument(any(SourceFile.class), isNull(), isNull()))
            .thenThrow(new ExtractionTimeoutException(Duration.ofSeconds(90)));
        MockMultipartFile file = new MockMultipartFile("file", "scan.pdf", "application/pdf", "%PDF".getBytes());

        mockMvc.perform(MockMvcRequestBuilders.multipart("/api/documents/analyze").file(file))
            .andExpect(status().isGatewayTimeout())
            .andExpect(jsonPath("$.error").value("EXTRACTION_TIMEOUT"))
            .andExpect(jsonPath("$.friendlyMessage").value("This document is taking longer than expected to process."))
            .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    void reportsSaturatedExtractionAsUnavailable() throws Exception {
        when(pipeline.analyzeDocument(any(SourceFile.class), isNull(), isNull()))
            .thenThrow(new ExtractionBusyException(Duration.ofSeconds(30)));
        MockMultipartFile file = new MockMultipartFile("file", "scan.pdf", "application/pdf", "%PDF".getBytes());

        mockMvc.perform(MockMvcRequestBuilders.multipart("/api/documents/analyze").file(file))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("EXTRACTION_BUSY"))
            .andExpect(jsonPath("$.friendlyMessage").value("We're getting a lot of requests right now."))
            .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    void reportsExhaustedExtraction() throws Exception {
        when(pipeline.analyzeDocument(any(SourceFile.class), isNull(), isNull()))
            .thenThrow(new ExtractionExhaustedException(List.of("schema mismatch", "generic retry failed")));
        MockMultipartFile file = new MockMultipartFile("file", "scan.pdf", "application/pdf", "%PDF".getBytes());

        mockMvc.perform(MockMvcRequestBuilders.multipart("/api/documents/analyze").file(file))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("EXTRACTION_FAILED"))
            .andExpect(jsonPath("$.message")
                .value("Document extraction failed: schema mismatch; generic retry failed"));
    }

    @Test
    void importsRowsWithConfirmedMapping() throws Exception {
        when(pipeline.importTabular(eq(TabularDocumentType.EMPLOYEE_ROSTER), any(ColumnMapping.class), anyList(),
            eq(OWNER))).thenReturn(new ImportOutcome(1, 1, List.of("Row 2: Missing required field (name or role)"),
                false));

        String body = """
            {
              "ownerId": "user-1",
              "type": "employees",
              "mappings": { "Employee Name": "name", "Job Title": "role" },
              "rows": [
                { "Employee Name": "John", "Job Title": "Dev" },
                { "Employee Name": "", "Job Title": "Dev" }
              ]
            }
            """;

        mockMvc.perform(MockMvcRequestBuilders.post("/api/documents/import")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rowsImported").value(1))
            .andExpect(jsonPath("$.rowsSkipped").value(1))
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.errors[0]").value("Row 2: Missing required field (name or role)"));
        verify(pipeline).importTabular(eq(TabularDocumentType.EMPLOYEE_ROSTER), any(ColumnMapping.class), anyList(),
            eq(OWNER));
    }

    @Test
    void importRequiresOwner() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/api/documents/import")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"employees\",\"mappings\":{},\"rows\":[]}"))
            .andExpect(status().isBadRequest());
        verifyNoInteractions(pipeline);
    }

    @Test
    void conflictingMappingsAreRejected() throws Exception {
        String body = """
            {"ownerId":"user-1","type":"employees","mappings":{"A":"name","B":"name"},"rows":[]}
            """;

        mockMvc.perform(MockMvcRequestBuilders.post("/api/documents/import")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
    }

    @Test
    void listsDocumentsOfTheOwner() throws Exception {
        when(pipeline.listDocuments(OWNER)).thenReturn(List.of(document("doc-1", ProcessingStatus.COMPLETED)));

        mockMvc.perform(MockMvcRequestBuilders.get("/api/documents").param("ownerId", "user-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value("doc-1"))
            .andExpect(jsonPath("$[0].status").value("completed"))
            .andExpect(jsonPath("$[0].filename").value("roster.csv"));
    }

    @Test
    void documentEndpointsRequireOwner() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.get("/api/documents"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(MockMvcRequestBuilders.delete("/api/documents/doc-1"))
            .andExpect(status().isBadRequest());
        verifyNoInteractions(pipeline);
    }

    @Test
    void unknownDocumentsAreNotFound() throws Exception {
        when(pipeline.getDocument("missing", OWNER)).thenThrow(new DocumentNotFoundException("missing"));

        mockMvc.perform(MockMvcRequestBuilders.get("/api/documents/missing").param("ownerId", "user-1"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("DOCUMENT_NOT_FOUND"))
            .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    void returnsDocumentData() throws Exception {
        when(pipeline.getDocumentData("doc-1", OWNER)).thenReturn(new DocumentData(List.of("Field", "Value"),
            List.of(Map.of("Field", "employees", "Value", "2")), 1));

        mockMvc.perform(MockMvcRequestBuilders.get("/api/documents/doc-1/data").param("ownerId", "user-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.headers[0]").value("Field"))
            .andExpect(jsonPath("$.rows[0].Field").value("employees"))
            .andExpect(jsonPath("$.totalRows").value(1));
    }

    @Test
    void confirmsImportOfStoredDocument() throws Exception {
        when(pipeline.confirmImport(eq("doc-1"), isNull(), any(ColumnMapping.class), eq(OWNER)))
            .thenReturn(new ImportOutcome(3, 0, List.of(), true));

        mockMvc.perform(MockMvcRequestBuilders.post("/api/documents/doc-1/import")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ownerId\":\"user-1\",\"mappings\":{\"Employee Name\":\"name\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rowsImported").value(3))
            .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    void deletesOneOrAllDocuments() throws Exception {
        when(pipeline.deleteAllDocuments(OWNER)).thenReturn(4);

        mockMvc.perform(MockMvcRequestBuilders.delete("/api/documents/doc-1").param("ownerId", "user-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.deleted").value(true));
        mockMvc.perform(MockMvcRequestBuilders.delete("/api/documents").param("ownerId", "user-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.deleted").value(4));
        verify(pipeline).deleteDocument("doc-1", OWNER);
    }

    private static DocumentRecord document(String id, ProcessingStatus status) {
        return new DocumentRecord(id, "user-1", "roster.csv", MediaKind.TABULAR, 120, "text/csv",
            "uploads/roster.csv", status, "employees", 3, Map.of(), Map.of(), null, "2024-01-01T00:00:00Z",
            null);
    }
}
