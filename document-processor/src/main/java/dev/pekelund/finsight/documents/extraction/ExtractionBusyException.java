package dev.pekelund.finsight.documents.extraction;

import dev.pekelund.finsight.documents.DocumentProcessingException;
import java.time.Duration;

/**
 * Every oracle worker stayed occupied for longer than the queue timeout.
 */
public class ExtractionBusyException extends DocumentProcessingException {

    private final Duration queueTimeout;

    public ExtractionBusyException(Duration queueTimeout) {
        super("Document extraction is busy: too many requests are in progress, no worker became available within "
            + ExtractionEngine.describe(queueTimeout));
        this.queueTimeout = queueTimeout;
    }

    public Duration getQueueTimeout() {
        return queueTimeout;
    }
}
