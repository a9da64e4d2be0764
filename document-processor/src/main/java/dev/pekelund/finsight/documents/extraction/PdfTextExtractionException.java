package dev.pekelund.finsight.documents.extraction;

import dev.pekelund.finsight.documents.DocumentProcessingException;

public class PdfTextExtractionException extends DocumentProcessingException {

    public PdfTextExtractionException(String message) {
        super(message);
    }

    public PdfTextExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
