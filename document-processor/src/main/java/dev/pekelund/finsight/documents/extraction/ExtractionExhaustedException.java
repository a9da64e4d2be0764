package dev.pekelund.finsight.documents.extraction;

import dev.pekelund.finsight.documents.DocumentProcessingException;
import java.util.List;

/**
 * Every attempted extraction strategy failed. The message names each cause in the order they happened.
 */
public class ExtractionExhaustedException extends DocumentProcessingException {

    private final List<String> causes;

    public ExtractionExhaustedException(List<String> causes) {
        super("Document extraction failed: " + String.join("; ", causes));
        this.causes = List.copyOf(causes);
    }

    public List<String> getCauses() {
        return causes;
    }
}
