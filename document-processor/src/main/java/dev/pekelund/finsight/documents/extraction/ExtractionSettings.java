package dev.pekelund.finsight.documents.extraction;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning for {@link ExtractionEngine}.
 *
 * @param smallFileThresholdBytes documents smaller than this try the text-first path
 * @param minimumTextLength extracted text shorter than this is not sent to the oracle
 * @param oracleTimeout upper bound for a single oracle call, measured from the moment a worker starts it
 * @param textFallbackOnTimeout whether an image-based timeout falls back to text-based extraction
 * @param queueTimeout how long a call may wait for a free worker before the run is reported as busy
 */
public record ExtractionSettings(
    long smallFileThresholdBytes,
    int minimumTextLength,
    Duration oracleTimeout,
    boolean textFallbackOnTimeout,
    Duration queueTimeout
) {

    public ExtractionSettings {
        Objects.requireNonNull(oracleTimeout, "oracleTimeout");
        Objects.requireNonNull(queueTimeout, "queueTimeout");
        if (smallFileThresholdBytes < 0) {
            throw new IllegalArgumentException("smallFileThresholdBytes must not be negative");
        }
        if (minimumTextLength < 0) {
            throw new IllegalArgumentException("minimumTextLength must not be negative");
        }
        if (oracleTimeout.isZero() || oracleTimeout.isNegative()) {
            throw new IllegalArgumentException("oracleTimeout must be positive");
        }
        if (queueTimeout.isZero() || queueTimeout.isNegative()) {
            throw new IllegalArgumentException("queueTimeout must be positive");
        }
    }

    public ExtractionSettings(long smallFileThresholdBytes, int minimumTextLength, Duration oracleTimeout,
        boolean textFallbackOnTimeout) {
        this(smallFileThresholdBytes, minimumTextLength, oracleTimeout, textFallbackOnTimeout, oracleTimeout);
    }

    public static ExtractionSettings defaults() {
        return new ExtractionSettings(100 * 1024, 100, Duration.ofSeconds(90), true, Duration.ofSeconds(30));
    }
}
