package dev.pekelund.finsight.documents.summary;

import dev.pekelund.finsight.documents.support.Amounts;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * One headline figure of a {@link SmartSummary}, already formatted for display.
 */
public record KeyMetric(String label, String value, MetricKind kind) {

    public KeyMetric {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(kind, "kind");
    }

    static KeyMetric currency(String label, BigDecimal amount) {
        return new KeyMetric(label, Amounts.formatCurrency(amount), MetricKind.CURRENCY);
    }

    static KeyMetric number(String label, long value) {
        return new KeyMetric(label, Amounts.formatNumber(value), MetricKind.NUMBER);
    }

    static KeyMetric text(String label, String value) {
        return new KeyMetric(label, value, MetricKind.TEXT);
    }

    static KeyMetric date(String label, String value) {
        return new KeyMetric(label, value, MetricKind.DATE);
    }
}
