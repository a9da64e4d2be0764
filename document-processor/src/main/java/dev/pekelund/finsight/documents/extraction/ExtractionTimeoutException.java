package dev.pekelund.finsight.documents.extraction;

import dev.pekelund.finsight.documents.DocumentProcessingException;
import java.time.Duration;

public class ExtractionTimeoutException extends DocumentProcessingException {

    private final Duration timeout;

    public ExtractionTimeoutException(Duration timeout) {
        super("Document processing timed out after " + ExtractionEngine.describe(timeout)
            + ". Complex documents may require alternative processing methods.");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
