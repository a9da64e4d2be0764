package dev.pekelund.finsight.documents.summary;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Document categories a {@link SmartSummary} can describe.
 */
public enum SummaryDocumentType {

    PL("pl", "P&L Statement"),
    PAYROLL("payroll", "Payroll Report"),
    EXPENSE("expense", "Expense Report"),
    EMPLOYEES("employees", "Employee Data"),
    CSV("csv", null),
    PDF("pdf", null),
    UNKNOWN("unknown", null);

    private final String code;
    private final String fallbackTitle;

    SummaryDocumentType(String code, String fallbackTitle) {
        this.code = code;
        this.fallbackTitle = fallbackTitle;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Title used when a filename carries no usable words; {@code null} for types without a dedicated label.
     */
    String fallbackTitle() {
        return fallbackTitle;
    }
}
