package dev.pekelund.finsight.documents.summary;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Objects;

/**
 * Human-readable digest of a processed document. Regenerated on demand from the parsed or extracted data and never
 * stored on its own.
 *
 * @param itemCount line items, employees or rows when known
 * @param confidence how much of the expected data was found, in [0, 1]
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SmartSummary(
    String title,
    SummaryDocumentType documentType,
    List<KeyMetric> metrics,
    Integer itemCount,
    DateRange dateRange,
    double confidence
) {

    public SmartSummary {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(documentType, "documentType");
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]");
        }
    }
}
