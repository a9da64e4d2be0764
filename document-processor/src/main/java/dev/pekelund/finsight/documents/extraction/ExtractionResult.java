package dev.pekelund.finsight.documents.extraction;

import java.time.Duration;
import java.util.Objects;

/**
 * Successful extraction. {@code schema} is the contract actually satisfied, which is {@link ExtractionSchema#GENERIC}
 * when the classified schema failed and the generic retry succeeded.
 */
public record ExtractionResult(
    ExtractionSchema schema,
    ExtractionPayload payload,
    ExtractionStrategy strategy,
    Duration processingTime,
    boolean tabularText
) {

    public ExtractionResult {
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(processingTime, "processingTime");
    }

    public boolean success() {
        return true;
    }

    public ExtractionResult withProcessingTime(Duration elapsed) {
        return new ExtractionResult(schema, payload, strategy, elapsed, tabularText);
    }
}
