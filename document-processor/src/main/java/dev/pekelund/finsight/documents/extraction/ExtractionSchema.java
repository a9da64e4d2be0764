package dev.pekelund.finsight.documents.extraction;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Field-shape contracts requested from the extraction oracle. Declaration order is the filename classification
 * priority; {@link #GENERIC} has no keywords and is the fallback.
 */
public enum ExtractionSchema {

    FINANCIAL_STATEMENT("pl", "P&L Statement",
        List.of("p&l", "pl_", "_pl", "profit", "loss", "income_statement", "income-statement"),
        List.of("revenue", "expenses"),
        """
        This appears to be a Profit & Loss (P&L) or Income Statement.

        Focus on extracting:
        - Revenue/Income totals and line items
        - Expense categories and amounts
        - Net income/profit
        - Reporting period dates
        - Company name if visible

        Set documentType to 'pl', 'income_statement', or 'profit_loss' based on the document title.
        """,
        """
        {
          "documentType": "pl" | "income_statement" | "profit_loss",
          "period": { "startDate": string, "endDate": string },
          "revenue": { "total": number, "lineItems": [ { "description": string, "amount": number } ] },
          "expenses": {
            "total": number,
            "categories": [ { "category": string, "amount": number,
              "lineItems": [ { "description": string, "amount": number } ] } ]
          },
          "netIncome": number,
          "metadata": { "companyName": string, "preparedBy": string, "pageCount": number }
        }
        """),

    PAYROLL("payroll", "Payroll Report",
        List.of("payroll", "pay_", "_pay", "salary", "wages", "compensation"),
        List.of("employees"),
        """
        This appears to be a Payroll document.

        Focus on extracting:
        - Pay period dates
        - Employee names and roles
        - Gross pay, taxes, benefits, net pay
        - Total payroll amounts
        - Employee count

        Set documentType to 'payroll', 'payroll_summary', or 'payroll_report' based on the document.
        """,
        """
        {
          "documentType": "payroll" | "payroll_summary" | "payroll_report",
          "payPeriod": { "startDate": string, "endDate": string },
          "employees": [ { "name": string, "role": string, "hoursWorked": number, "grossPay": number,
            "taxes": number, "benefits": number, "netPay": number } ],
          "totals": { "totalGrossPay": number, "totalTaxes": number, "totalBenefits": number,
            "totalNetPay": number, "employeeCount": number },
          "metadata": { "companyName": string, "payrollProvider": string }
        }
        """),

    EXPENSE("expense", "Expense Report",
        List.of("expense", "spend", "receipt", "reimburse"),
        List.of("lineItems"),
        """
        This appears to be an Expense Report.

        Focus on extracting:
        - Individual expense line items with date, description, category and amount
        - Total expenses
        - Totals per expense category
        - Reporting period dates

        Set documentType to 'expense'.
        """,
        """
        {
          "documentType": "expense",
          "period": { "startDate": string, "endDate": string },
          "lineItems": [ { "date": string, "description": string, "category": string, "amount": number } ],
          "summary": { "totalExpenses": number, "categories": [ { "category": string, "currentPeriod": number } ] }
        }
        """),

    GENERIC("unknown", "Document",
        List.of(),
        List.of(),
        """
        The document type is unknown.

        Extract:
        - Any raw text content
        - Tables as arrays of strings
        - Any numeric values with their labels

        Set documentType to 'unknown'.
        """,
        """
        {
          "documentType": "unknown",
          "rawContent": string,
          "tables": [ [ string ] ],
          "numbers": [ { "label": string, "value": number } ]
        }
        """);

    private final String code;
    private final String label;
    private final List<String> filenameKeywords;
    private final List<String> requiredSections;
    private final String focus;
    private final String shape;

    ExtractionSchema(String code, String label, List<String> filenameKeywords, List<String> requiredSections,
        String focus, String shape) {
        this.code = code;
        this.label = label;
        this.filenameKeywords = filenameKeywords;
        this.requiredSections = requiredSections;
        this.focus = focus;
        this.shape = shape;
    }

    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    public List<String> filenameKeywords() {
        return filenameKeywords;
    }

    /**
     * Top-level sections a response must contain to satisfy this contract.
     */
    public List<String> requiredSections() {
        return requiredSections;
    }

    String focus() {
        return focus;
    }

    /**
     * JSON outline of the contract included in every oracle instruction.
     */
    public String shape() {
        return shape;
    }

    public static Optional<ExtractionSchema> fromCode(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalised = value.trim().toLowerCase(Locale.ROOT);
        for (ExtractionSchema schema : values()) {
            if (schema.code.equals(normalised) || schema.name().equalsIgnoreCase(normalised)) {
                return Optional.of(schema);
            }
        }
        if (normalised.equals("generic")) {
            return Optional.of(GENERIC);
        }
        return Optional.empty();
    }
}
