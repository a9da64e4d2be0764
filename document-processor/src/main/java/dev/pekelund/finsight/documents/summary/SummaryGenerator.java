package dev.pekelund.finsight.documents.summary;

import dev.pekelund.finsight.documents.extraction.ExtractionPayload;
import dev.pekelund.finsight.documents.extraction.ExtractionResult;
import dev.pekelund.finsight.documents.support.Amounts;
import dev.pekelund.finsight.documents.tabular.TabularDocumentType;
import dev.pekelund.finsight.documents.tabular.TabularParseResult;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Builds {@link SmartSummary} digests from parsed spreadsheets and oracle extractions.
 */
public class SummaryGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(SummaryGenerator.class);

    private static final Pattern EXTENSION = Pattern.compile("\\.[^.]+$");
    private static final Pattern SEPARATORS = Pattern.compile("[-_]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern BARE_DATE = Pattern.compile("^\\d{4}[-\\s]\\d{2}([-\\s]\\d{2})?$");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([A-Z])");
    private static final Pattern ISO_DATE_PREFIX = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}");

    private static final DateTimeFormatter PERIOD_FORMAT = DateTimeFormatter.ofPattern("MMM yyyy", Locale.US);
    private static final DateTimeFormatter US_DATE = DateTimeFormatter.ofPattern("M/d/yyyy", Locale.US);

    private static final List<String> SALARY_HEADERS = List.of("annual_salary", "salary", "annualsalary", "pay",
        "compensation");
    private static final List<String> ROLE_HEADERS = List.of("role", "title", "position", "job_title");
    private static final List<String> CURRENCY_KEYS = List.of("total", "amount", "revenue", "expense", "income",
        "cost", "price", "balance");
    private static final List<String> DATE_KEYS = List.of("date", "period", "month", "year");
    private static final List<String> LINE_ITEM_DATE_FIELDS = List.of("date", "pay_date", "payDate",
        "transaction_date", "transactionDate", "period");

    private final SummaryWeights weights;

    public SummaryGenerator(SummaryWeights weights) {
        this.weights = weights != null ? weights : SummaryWeights.defaults();
    }

    /**
     * Summarises a parsed spreadsheet. Metrics are computed over the rows held by {@code data}, which may be a
     * preview; the item count reports the full row count.
     */
    public SmartSummary summarizeTabular(String filename, TabularDocumentType type, TabularParseResult data) {
        Objects.requireNonNull(data, "data");
        Draft draft = type == TabularDocumentType.EMPLOYEE_ROSTER
            ? summarizeEmployees(data)
            : summarizeGenericTabular(data, type);
        if (data.totalRowCount() > 0) {
            draft.itemCount = data.totalRowCount();
        }
        return finish(filename, draft);
    }

    public SmartSummary summarizeExtraction(String filename, ExtractionResult result) {
        Objects.requireNonNull(result, "result");
        ExtractionPayload payload = result.payload();
        Draft draft;
        if (payload instanceof ExtractionPayload.FinancialStatement statement) {
            draft = summarizeStatement(statement);
        } else if (payload instanceof ExtractionPayload.Payroll payroll) {
            draft = summarizePayroll(payroll);
        } else if (payload instanceof ExtractionPayload.Expense expense) {
            draft = summarizeExpense(expense);
        } else {
            draft = summarizeGenericDocument((ExtractionPayload.Generic) payload);
        }
        return finish(filename, draft);
    }

    private Draft summarizeStatement(ExtractionPayload.FinancialStatement data) {
        Draft draft = new Draft(SummaryDocumentType.PL, weights.pdfBaseConfidence());
        BigDecimal revenue = data.revenue() != null ? data.revenue().total() : null;
        BigDecimal expenses = data.expenses() != null ? data.expenses().total() : null;

        if (isNonZero(revenue)) {
            draft.add(KeyMetric.currency("Revenue", revenue), weights.metricBoost());
        }
        if (isNonZero(expenses)) {
            draft.add(KeyMetric.currency("Expenses", expenses), weights.metricBoost());
        }
        if (isNonZero(data.netIncome())) {
            draft.add(KeyMetric.currency("Net Income", data.netIncome()), weights.metricBoost());
        } else if (draft.metrics.size() >= 2) {
            BigDecimal net = revenue.subtract(expenses);
            if (net.signum() != 0) {
                draft.add(KeyMetric.currency("Net Income", net), 0.0);
            }
        }

        int lineItems = data.revenue() != null ? data.revenue().lineItems().size() : 0;
        int categories = data.expenses() != null ? data.expenses().categories().size() : 0;
        if (lineItems + categories > 0) {
            draft.itemCount = lineItems + categories;
        }
        draft.dateRange = periodRange(data.period());
        return draft;
    }

    private Draft summarizePayroll(ExtractionPayload.Payroll data) {
        Draft draft = new Draft(SummaryDocumentType.PAYROLL, weights.pdfBaseConfidence());
        int employees = (int) data.employees().stream().filter(Objects::nonNull).count();
        if (employees > 0) {
            draft.add(KeyMetric.number("Employees", employees), weights.metricBoost());
        }

        BigDecimal totalGross = BigDecimal.ZERO;
        BigDecimal totalNet = BigDecimal.ZERO;
        for (ExtractionPayload.Payroll.EmployeePay employee : data.employees()) {
            if (employee == null) {
                continue;
            }
            if (employee.grossPay() != null) {
                totalGross = totalGross.add(employee.grossPay());
            }
            if (employee.netPay() != null) {
                totalNet = totalNet.add(employee.netPay());
            }
        }
        if (totalGross.signum() > 0) {
            draft.add(KeyMetric.currency("Total Gross", totalGross), weights.metricBoost());
        }
        if (totalNet.signum() > 0) {
            draft.add(KeyMetric.currency("Total Net", totalNet), weights.metricBoost());
        }

        DateRange range = periodRange(data.payPeriod());
        if (range != null) {
            draft.add(KeyMetric.text("Period", range.start() + " - " + range.end()), weights.metadataBoost());
        }
        if (employees > 0) {
            draft.itemCount = employees;
        }
        draft.dateRange = range;
        return draft;
    }

    private Draft summarizeExpense(ExtractionPayload.Expense data) {
        Draft draft = new Draft(SummaryDocumentType.EXPENSE, weights.pdfBaseConfidence());
        List<ExpenseLineView> lines = data.lineItems().stream()
            .filter(Objects::nonNull)
            .map(line -> new ExpenseLineView(line.date(), line.category(), line.amount()))
            .toList();

        BigDecimal summaryTotal = data.summary() != null ? data.summary().totalExpenses() : null;
        if (summaryTotal != null && summaryTotal.signum() > 0) {
            draft.add(KeyMetric.currency("Total", summaryTotal), weights.metricBoost() * 2);
        } else if (!lines.isEmpty()) {
            BigDecimal total = lines.stream()
                .map(ExpenseLineView::amount)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
            if (total.signum() > 0) {
                draft.add(KeyMetric.currency("Total", total), weights.metricBoost());
            }
        }

        List<ExtractionPayload.Expense.CategoryTotal> categoryTotals = data.summary() != null
            ? data.summary().categories().stream()
                .filter(category -> category != null && category.currentPeriod() != null)
                .toList()
            : List.of();
        if (!categoryTotals.isEmpty()) {
            ExtractionPayload.Expense.CategoryTotal top = categoryTotals.stream()
                .max(Comparator.comparing(ExtractionPayload.Expense.CategoryTotal::currentPeriod))
                .orElseThrow();
            draft.add(KeyMetric.currency("Top: " + top.category(), top.currentPeriod()), 0.0);
        } else if (!lines.isEmpty()) {
            Map<String, BigDecimal> byCategory = new LinkedHashMap<>();
            for (ExpenseLineView line : lines) {
                if (line.amount() != null) {
                    String category = StringUtils.hasText(line.category()) ? line.category() : "Other";
                    byCategory.merge(category, line.amount(), BigDecimal::add);
                }
            }
            byCategory.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .ifPresent(top -> draft.add(KeyMetric.currency("Top: " + top.getKey(), top.getValue()), 0.0));
        }

        draft.itemCount = data.lineItems().size();
        DateRange period = periodRange(data.period());
        draft.dateRange = period != null
            ? period
            : dateRange(lines.stream().map(ExpenseLineView::date).toList());
        return draft;
    }

    private Draft summarizeGenericDocument(ExtractionPayload.Generic data) {
        Draft draft = new Draft(SummaryDocumentType.PDF, weights.genericBaseConfidence());
        for (ExtractionPayload.Generic.LabelledNumber number : data.numbers()) {
            if (number != null && StringUtils.hasText(number.label())) {
                addGenericField(draft, number.label(), number.value());
            }
        }
        for (Map.Entry<String, Object> attribute : data.attributes().entrySet()) {
            String key = attribute.getKey();
            if (!key.equals("lineItems") && !key.equals("line_items")) {
                addGenericField(draft, key, attribute.getValue());
            }
        }

        Object lineItems = data.attributes().getOrDefault("lineItems", data.attributes().get("line_items"));
        if (lineItems instanceof List<?> items) {
            draft.itemCount = items.size();
            List<String> dates = new ArrayList<>();
            for (Object item : items) {
                if (item instanceof Map<?, ?> fields) {
                    for (String field : LINE_ITEM_DATE_FIELDS) {
                        if (fields.get(field) instanceof String value) {
                            dates.add(value);
                        }
                    }
                }
            }
            draft.dateRange = dateRange(dates);
        }

        if (draft.metrics.size() > weights.maxDisplayMetrics()) {
            draft.metrics.subList(weights.maxDisplayMetrics(), draft.metrics.size()).clear();
        }
        return draft;
    }

    private void addGenericField(Draft draft, String key, Object value) {
        String lowerKey = key.toLowerCase(Locale.ROOT);
        Optional<BigDecimal> number = value instanceof String || value instanceof Number
            ? Amounts.parse(value)
            : Optional.empty();
        String label = CAMEL_BOUNDARY.matcher(key).replaceAll(" $1").trim();

        if (number.isPresent() && containsAny(lowerKey, CURRENCY_KEYS)) {
            draft.add(KeyMetric.currency(label, number.get()), weights.metricBoost());
        } else if (value instanceof String text && containsAny(lowerKey, DATE_KEYS)) {
            draft.add(KeyMetric.date(label, text), weights.metadataBoost());
        } else if (number.isPresent() && number.get().abs().compareTo(weights.currencyThreshold()) > 0) {
            draft.add(KeyMetric.currency(label, number.get()), weights.metadataBoost());
        }
    }

    private Draft summarizeEmployees(TabularParseResult data) {
        Draft draft = new Draft(SummaryDocumentType.EMPLOYEES, weights.csvBaseConfidence());
        List<Map<String, String>> rows = data.rows();
        draft.add(KeyMetric.number("Employees", rows.size()), weights.metricBoost() * 2);

        findHeader(data.headers(), SALARY_HEADERS).ifPresent(salaryHeader -> {
            BigDecimal total = rows.stream()
                .map(row -> Amounts.parse(row.get(salaryHeader)))
                .flatMap(Optional::stream)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
            if (total.signum() > 0) {
                draft.add(KeyMetric.currency("Total Salaries", total), 0.0);
                BigDecimal average = total.divide(BigDecimal.valueOf(rows.size()), 2, RoundingMode.HALF_UP);
                draft.add(KeyMetric.currency("Avg Salary", average), weights.metricBoost() * 2);
            }
        });

        findHeader(data.headers(), ROLE_HEADERS).ifPresent(roleHeader -> {
            Set<String> roles = new LinkedHashSet<>();
            for (Map<String, String> row : rows) {
                String role = row.get(roleHeader);
                if (StringUtils.hasText(role)) {
                    roles.add(role);
                }
            }
            draft.add(KeyMetric.number("Roles", roles.size()), 0.0);
        });

        draft.itemCount = rows.size();
        return draft;
    }

    private Draft summarizeGenericTabular(TabularParseResult data, TabularDocumentType type) {
        SummaryDocumentType documentType;
        if (type == TabularDocumentType.PROFIT_AND_LOSS) {
            documentType = SummaryDocumentType.PL;
        } else if (type == TabularDocumentType.PAYROLL) {
            documentType = SummaryDocumentType.PAYROLL;
        } else {
            documentType = SummaryDocumentType.CSV;
        }
        Draft draft = new Draft(documentType, weights.genericBaseConfidence());
        List<Map<String, String>> rows = data.rows();
        draft.add(KeyMetric.number("Rows", rows.size()), 0.0);
        draft.add(KeyMetric.number("Columns", data.headers().size()), 0.0);

        List<Map<String, String>> sample = rows.subList(0, Math.min(rows.size(), weights.numericSampleSize()));
        String topField = null;
        BigDecimal topTotal = null;
        for (String header : data.headers()) {
            BigDecimal total = BigDecimal.ZERO;
            int numericCount = 0;
            for (Map<String, String> row : sample) {
                Optional<BigDecimal> value = Amounts.parse(row.get(header));
                if (value.isPresent()) {
                    total = total.add(value.get());
                    numericCount++;
                }
            }
            boolean numericColumn = numericCount > rows.size() * weights.numericColumnThreshold();
            if (numericColumn && (topTotal == null || total.compareTo(topTotal) > 0)) {
                topField = header;
                topTotal = total;
            }
        }
        if (topField != null && topTotal.compareTo(weights.currencyThreshold()) > 0) {
            draft.add(KeyMetric.currency("Total " + topField, topTotal), weights.metricBoost() * 2);
        }

        draft.itemCount = rows.size();
        return draft;
    }

    private SmartSummary finish(String filename, Draft draft) {
        double capped = Math.min(draft.confidence, weights.maxConfidence());
        double confidence = BigDecimal.valueOf(capped).setScale(2, RoundingMode.HALF_UP).doubleValue();
        SmartSummary summary = new SmartSummary(title(filename, draft.documentType), draft.documentType,
            draft.metrics, draft.itemCount, draft.dateRange, Math.min(confidence, weights.maxConfidence()));
        LOGGER.info("Summarised {} as {} with {} metric(s), confidence {}", filename, summary.documentType(),
            summary.metrics().size(), summary.confidence());
        return summary;
    }

    /**
     * Derives a display title from a filename: extension stripped, separators turned into spaces and words title
     * cased. Falls back to a label for the document type when the name is too short or only a date.
     */
    static String title(String filename, SummaryDocumentType documentType) {
        String baseName = EXTENSION.matcher(filename != null ? filename : "").replaceAll("");
        String cleaned = WHITESPACE.matcher(SEPARATORS.matcher(baseName).replaceAll(" ")).replaceAll(" ").trim();

        if (cleaned.length() < 3 || BARE_DATE.matcher(cleaned).matches()) {
            if (documentType != null && documentType.fallbackTitle() != null) {
                return documentType.fallbackTitle();
            }
            return cleaned.isEmpty() ? "Document" : cleaned;
        }

        StringBuilder title = new StringBuilder();
        for (String word : cleaned.split(" ")) {
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(word.substring(0, 1).toUpperCase(Locale.ROOT))
                .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return title.toString();
    }

    private static DateRange periodRange(ExtractionPayload.Period period) {
        if (period == null || !StringUtils.hasText(period.startDate()) || !StringUtils.hasText(period.endDate())) {
            return null;
        }
        return new DateRange(formatPeriod(period.startDate()), formatPeriod(period.endDate()));
    }

    private static DateRange dateRange(List<String> values) {
        List<LocalDate> dates = values.stream()
            .map(SummaryGenerator::parseDate)
            .flatMap(Optional::stream)
            .sorted()
            .toList();
        if (dates.isEmpty()) {
            return null;
        }
        return new DateRange(PERIOD_FORMAT.format(dates.get(0)), PERIOD_FORMAT.format(dates.get(dates.size() - 1)));
    }

    static String formatPeriod(String value) {
        return parseDate(value).map(PERIOD_FORMAT::format).orElse(value);
    }

    private static Optional<LocalDate> parseDate(String value) {
        if (!StringUtils.hasText(value)) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (ISO_DATE_PREFIX.matcher(trimmed).find()) {
            try {
                return Optional.of(LocalDate.parse(trimmed.substring(0, 10)));
            } catch (DateTimeParseException ex) {
                return Optional.empty();
            }
        }
        try {
            return Optional.of(YearMonth.parse(trimmed).atDay(1));
        } catch (DateTimeParseException ex) {
            LOGGER.trace("{} is not a year-month", trimmed);
        }
        try {
            return Optional.of(LocalDate.parse(trimmed, US_DATE));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private static boolean isNonZero(BigDecimal value) {
        return value != null && value.signum() != 0;
    }

    private static boolean containsAny(String value, List<String> keywords) {
        return keywords.stream().anyMatch(value::contains);
    }

    private static Optional<String> findHeader(List<String> headers, List<String> candidates) {
        return headers.stream()
            .filter(header -> containsAny(header.toLowerCase(Locale.ROOT), candidates))
            .findFirst();
    }

    private record ExpenseLineView(String date, String category, BigDecimal amount) {
    }

    private static final class Draft {

        private final SummaryDocumentType documentType;
        private final List<KeyMetric> metrics = new ArrayList<>();
        private double confidence;
        private Integer itemCount;
        private DateRange dateRange;

        private Draft(SummaryDocumentType documentType, double baseConfidence) {
            this.documentType = documentType;
            this.confidence = baseConfidence;
        }

        private void add(KeyMetric metric, double boost) {
            metrics.add(metric);
            confidence += boost;
        }
    }
}
