package dev.pekelund.finsight.documents.summary;

import java.math.BigDecimal;

/**
 * Confidence and display tuning for {@link SummaryGenerator}.
 *
 * @param pdfBaseConfidence starting confidence for typed PDF extractions
 * @param csvBaseConfidence starting confidence for recognised spreadsheets
 * @param genericBaseConfidence starting confidence for unrecognised data
 * @param metricBoost added per extracted headline metric
 * @param metadataBoost added per period or date found
 * @param maxConfidence upper bound of every confidence
 * @param maxDisplayMetrics metrics kept for generic PDF summaries
 * @param currencyThreshold values above this are presented as amounts
 * @param numericSampleSize rows inspected when looking for numeric columns
 * @param numericColumnThreshold share of rows that must be numeric for a column to count as numeric
 */
public record SummaryWeights(
    double pdfBaseConfidence,
    double csvBaseConfidence,
    double genericBaseConfidence,
    double metricBoost,
    double metadataBoost,
    double maxConfidence,
    int maxDisplayMetrics,
    BigDecimal currencyThreshold,
    int numericSampleSize,
    double numericColumnThreshold
) {

    public SummaryWeights {
        if (maxConfidence <= 0.0 || maxConfidence > 1.0) {
            throw new IllegalArgumentException("maxConfidence must be within (0, 1]");
        }
        if (maxDisplayMetrics < 1) {
            throw new IllegalArgumentException("maxDisplayMetrics must be positive");
        }
        if (numericSampleSize < 1) {
            throw new IllegalArgumentException("numericSampleSize must be positive");
        }
        currencyThreshold = currencyThreshold != null ? currencyThreshold : BigDecimal.valueOf(100);
    }

    public static SummaryWeights defaults() {
        return new SummaryWeights(0.8, 0.7, 0.5, 0.05, 0.02, 1.0, 3, BigDecimal.valueOf(100), 100, 0.5);
    }
}
