package dev.pekelund.finsight.documents;

import dev.pekelund.finsight.documents.extraction.ExtractionBusyException;
import dev.pekelund.finsight.documents.extraction.ExtractionExhaustedException;
import dev.pekelund.finsight.documents.extraction.ExtractionTimeoutException;
import dev.pekelund.finsight.documents.tabular.TabularParseException;
import dev.pekelund.finsight.documents.upload.UploadRejectedException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps pipeline failures to HTTP responses carrying both the technical message and friendly wording.
 */
@RestControllerAdvice(assignableTypes = DocumentProcessingApiController.class)
public class DocumentProcessingExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentProcessingExceptionHandler.class);

    @ExceptionHandler(UploadRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleRejectedUpload(UploadRejectedException exception) {
        return respond(HttpStatus.BAD_REQUEST, exception.getReason().name(), exception, ErrorContext.DOCUMENT_UPLOAD);
    }

    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(DocumentNotFoundException exception) {
        return respond(HttpStatus.NOT_FOUND, "DOCUMENT_NOT_FOUND", exception, ErrorContext.DOCUMENT_PROCESSING);
    }

    @ExceptionHandler(TabularParseException.class)
    public ResponseEntity<Map<String, Object>> handleParseFailure(TabularParseException exception) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "PARSE_FAILED", exception, ErrorContext.CSV_IMPORT);
    }

    @ExceptionHandler(ExtractionTimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleTimeout(ExtractionTimeoutException exception) {
        return respond(HttpStatus.GATEWAY_TIMEOUT, "EXTRACTION_TIMEOUT", exception, ErrorContext.DOCUMENT_PROCESSING);
    }

    @ExceptionHandler(ExtractionBusyException.class)
    public ResponseEntity<Map<String, Object>> handleBusy(ExtractionBusyException exception) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "EXTRACTION_BUSY", exception, ErrorContext.DOCUMENT_PROCESSING);
    }

    @ExceptionHandler(ExtractionExhaustedException.class)
    public ResponseEntity<Map<String, Object>> handleExhausted(ExtractionExhaustedException exception) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "EXTRACTION_FAILED", exception,
            ErrorContext.DOCUMENT_PROCESSING);
    }

    @ExceptionHandler(DocumentProcessingException.class)
    public ResponseEntity<Map<String, Object>> handleProcessingFailure(DocumentProcessingException exception) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "PROCESSING_FAILED", exception,
            ErrorContext.DOCUMENT_PROCESSING);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(IllegalArgumentException exception) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", exception, ErrorContext.CSV_IMPORT);
    }

    private ResponseEntity<Map<String, Object>> respond(HttpStatus status, String error, Exception exception,
        ErrorContext context) {
        LOGGER.warn("Request failed with {} ({}): {}", status.value(), error, exception.getMessage());
        FriendlyError friendly = FriendlyErrors.describe(exception, context);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", exception.getMessage());
        body.put("suggestion", friendly.suggestion());
        body.put("friendlyMessage", friendly.message());
        body.put("retryable", friendly.retryable());
        return ResponseEntity.status(status).body(body);
    }
}
