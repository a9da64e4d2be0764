package dev.pekelund.finsight.documents.tabular;

import java.util.List;
import java.util.Objects;

public record DetectedType(TabularDocumentType type, double confidence, List<String> matchedColumns) {

    public DetectedType {
        Objects.requireNonNull(type, "type");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        matchedColumns = matchedColumns == null ? List.of() : List.copyOf(matchedColumns);
    }

    public static DetectedType unknown() {
        return new DetectedType(TabularDocumentType.UNKNOWN, 0.0, List.of());
    }

    public boolean isKnown() {
        return type != TabularDocumentType.UNKNOWN;
    }
}
