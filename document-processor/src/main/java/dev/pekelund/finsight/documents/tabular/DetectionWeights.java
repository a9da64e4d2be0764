package dev.pekelund.finsight.documents.tabular;

/**
 * Tunables for {@link TypeDetector}.
 *
 * @param minimumScore lowest winning score; anything below yields {@link TabularDocumentType#UNKNOWN}
 * @param minimumLead points the winner must lead the runner-up by; 0 lets the declaration order break ties
 * @param uniquePatternWeight points added for each header that hits a type's unique fingerprint
 */
public record DetectionWeights(int minimumScore, int minimumLead, int uniquePatternWeight) {

    public DetectionWeights {
        if (minimumScore < 0 || minimumLead < 0 || uniquePatternWeight < 0) {
            throw new IllegalArgumentException("Detection weights must not be negative");
        }
    }

    public static DetectionWeights defaults() {
        return new DetectionWeights(2, 0, 2);
    }
}
