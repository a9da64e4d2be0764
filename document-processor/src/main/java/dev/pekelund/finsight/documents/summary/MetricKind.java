package dev.pekelund.finsight.documents.summary;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum MetricKind {
    CURRENCY,
    NUMBER,
    PERCENTAGE,
    TEXT,
    DATE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
