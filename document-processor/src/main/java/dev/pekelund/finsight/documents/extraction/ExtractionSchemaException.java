package dev.pekelund.finsight.documents.extraction;

import dev.pekelund.finsight.documents.DocumentProcessingException;

/**
 * Raised when an oracle response cannot be read as the requested contract.
 */
public class ExtractionSchemaException extends DocumentProcessingException {

    private final ExtractionSchema schema;

    public ExtractionSchemaException(ExtractionSchema schema, String message) {
        super(message);
        this.schema = schema;
    }

    public ExtractionSchemaException(ExtractionSchema schema, String message, Throwable cause) {
        super(message, cause);
        this.schema = schema;
    }

    public ExtractionSchema getSchema() {
        return schema;
    }
}
