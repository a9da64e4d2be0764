package dev.pekelund.finsight.documents.tabular;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record AutoMappingResult(
    ColumnMapping mapping,
    Map<String, Double> columnConfidences,
    double confidence,
    int requiredFieldsMapped,
    int totalRequiredFields,
    boolean shouldAutoApply,
    List<String> warnings
) {

    public AutoMappingResult {
        Objects.requireNonNull(mapping, "mapping");
        columnConfidences = columnConfidences == null ? Map.of() : Map.copyOf(columnConfidences);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasAllRequiredFields() {
        return requiredFieldsMapped >= totalRequiredFields;
    }

    public String confidenceLabel() {
        if (confidence >= 0.9) {
            return "High confidence";
        }
        if (confidence >= 0.8) {
            return "Good confidence";
        }
        if (confidence >= 0.6) {
            return "Moderate confidence";
        }
        if (confidence >= 0.4) {
            return "Low confidence";
        }
        return "Very low confidence";
    }
}
