package dev.pekelund.finsight.documents.tabular;

import dev.pekelund.finsight.documents.DocumentProcessingException;

public class TabularParseException extends DocumentProcessingException {

    public TabularParseException(String message) {
        super(message);
    }

    public TabularParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
