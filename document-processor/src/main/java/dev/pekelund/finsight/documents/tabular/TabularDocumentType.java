package dev.pekelund.finsight.documents.tabular;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Semantic kinds of tabular upload. Each kind carries its canonical field vocabulary, the header fingerprints the
 * {@link TypeDetector} scores against, and the table its rows are imported into. Declaration order is the detection
 * tie-break priority.
 */
public enum TabularDocumentType {

    PROFIT_AND_LOSS("pl", "Profit & Loss Statement", "financial_entries",
        List.of(
            TargetField.optional("revenue", "revenue", "income", "sales", "total_income", "total_revenue"),
            TargetField.optional("expense_category", "category", "expense_category", "account", "account_name",
                "type", "expense_type", "cost_center"),
            TargetField.required("expense_amount", "amount", "expense_amount", "value", "total", "cost", "expense",
                "debit", "credit"),
            TargetField.optional("date", "date", "transaction_date", "period", "month", "year", "posting_date"),
            TargetField.required("description", "description", "memo", "notes", "details", "line_item", "item",
                "name"),
            TargetField.optional("transaction_type", "type", "transaction_type", "entry_type", "income_expense",
                "dr_cr")),
        patterns("revenue", "income", "sales", "expense", "cost", "spending", "net\\s?(income|profit)", "total",
            "gross", "margin", "operating", "overhead"),
        patterns("revenue", "expense", "net\\s?(income|profit)", "ebitda", "gross\\s?margin",
            "operating\\s?(income|expense)")),

    PAYROLL("payroll", "Payroll Report", "payroll_entries",
        List.of(
            TargetField.required("employee_name", "name", "employee_name", "employee", "full_name", "staff_name",
                "worker"),
            TargetField.optional("employee_id", "id", "employee_id", "emp_id", "staff_id", "employee_number",
                "emp_no"),
            TargetField.optional("hours_worked", "hours", "hours_worked", "total_hours", "work_hours",
                "regular_hours"),
            TargetField.optional("hourly_rate", "rate", "hourly_rate", "pay_rate", "hour_rate"),
            TargetField.required("gross_pay", "gross", "gross_pay", "gross_wages", "gross_earnings", "total_pay",
                "total_earnings"),
            TargetField.optional("net_pay", "net", "net_pay", "net_wages", "take_home", "net_earnings"),
            TargetField.optional("pay_date", "date", "pay_date", "payment_date", "check_date", "period_end")),
        patterns("employee", "name", "staff", "hours", "rate", "wage", "gross", "net", "pay", "deduction", "tax",
            "period", "check", "deposit"),
        patterns("hours\\s?(worked)?", "hourly\\s?rate", "gross\\s?pay", "net\\s?pay", "deduction", "withholding",
            "overtime", "pay\\s?(period|date)")),

    EMPLOYEE_ROSTER("employees", "Employee Roster", "employees",
        List.of(
            TargetField.required("name", "name", "full_name", "employee_name", "employee", "staff_name",
                "first_last"),
            TargetField.optional("employee_id", "id", "employee_id", "emp_id", "staff_id", "employee_number"),
            TargetField.required("role", "role", "title", "job_title", "position", "job", "designation"),
            TargetField.optional("department", "department", "dept", "team", "division", "group", "unit"),
            TargetField.optional("annual_salary", "salary", "annual_salary", "yearly_salary", "base_salary",
                "compensation"),
            TargetField.optional("annual_benefits", "benefits", "annual_benefits", "total_benefits",
                "benefit_cost"),
            TargetField.optional("employment_type", "type", "employment_type", "emp_type", "status",
                "full_part_time", "ft_pt")),
        patterns("employee", "name", "staff", "role", "title", "position", "department", "team", "salary",
            "compensation", "benefits", "hire", "start", "email", "phone"),
        patterns("annual\\s?salary", "annual\\s?benefits", "employment\\s?type", "hire\\s?date", "department",
            "job\\s?title", "start\\s?date")),

    UNKNOWN("unknown", "Unknown Format", null, List.of(), List.of(), List.of());

    public static final String IGNORE = "ignore";

    private final String code;
    private final String label;
    private final String targetTable;
    private final List<TargetField> targetFields;
    private final List<Pattern> detectionPatterns;
    private final List<Pattern> uniquePatterns;

    TabularDocumentType(String code, String label, String targetTable, List<TargetField> targetFields,
        List<Pattern> detectionPatterns, List<Pattern> uniquePatterns) {
        this.code = code;
        this.label = label;
        this.targetTable = targetTable;
        this.targetFields = targetFields;
        this.detectionPatterns = detectionPatterns;
        this.uniquePatterns = uniquePatterns;
    }

    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    /**
     * @return the record store table rows of this kind are imported into, or empty when import is unsupported
     */
    public Optional<String> targetTable() {
        return Optional.ofNullable(targetTable);
    }

    public List<TargetField> targetFields() {
        return targetFields;
    }

    /**
     * Mapping vocabulary including the {@value #IGNORE} sentinel.
     */
    public List<String> vocabulary() {
        List<String> names = new ArrayList<>(targetFields.stream().map(TargetField::name).toList());
        names.add(IGNORE);
        return List.copyOf(names);
    }

    public List<String> requiredFields() {
        return targetFields.stream().filter(TargetField::required).map(TargetField::name).toList();
    }

    public boolean isRequired(String field) {
        return requiredFields().contains(field);
    }

    List<Pattern> detectionPatterns() {
        return detectionPatterns;
    }

    List<Pattern> uniquePatterns() {
        return uniquePatterns;
    }

    public static Optional<TabularDocumentType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalised = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(type -> type.code.equals(normalised) || type.name().equalsIgnoreCase(normalised))
            .findFirst();
    }

    private static List<Pattern> patterns(String... expressions) {
        return Arrays.stream(expressions)
            .map(expression -> Pattern.compile(expression, Pattern.CASE_INSENSITIVE))
            .toList();
    }
}
