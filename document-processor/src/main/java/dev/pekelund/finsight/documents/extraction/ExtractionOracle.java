package dev.pekelund.finsight.documents.extraction;

/**
 * Remote model that turns a document into JSON matching an extraction contract. Implementations must react to
 * thread interruption so a timed-out call can be cancelled.
 */
public interface ExtractionOracle {

    /**
     * Sends the raw document alongside {@code instruction}.
     */
    String extractFromDocument(String instruction, byte[] document, String mediaType);

    /**
     * Sends an instruction that already embeds the document text.
     */
    String extractFromText(String instruction);
}
