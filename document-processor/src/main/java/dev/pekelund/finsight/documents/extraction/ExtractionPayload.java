package dev.pekelund.finsight.documents.extraction;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Structured data returned by the extraction oracle, one variant per {@link ExtractionSchema}. Absent sections are
 * {@code null}; lists are never {@code null} once read.
 */
public sealed interface ExtractionPayload {

    String documentType();

    record Period(String startDate, String endDate) {
    }

    record LineItem(String description, BigDecimal amount) {
    }

    record FinancialStatement(
        String documentType,
        Period period,
        Revenue revenue,
        Expenses expenses,
        BigDecimal netIncome,
        StatementMetadata metadata
    ) implements ExtractionPayload {

        public record Revenue(BigDecimal total, List<LineItem> lineItems) {

            public Revenue {
                lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
            }
        }

        public record Expenses(BigDecimal total, List<ExpenseCategory> categories) {

            public Expenses {
                categories = categories == null ? List.of() : List.copyOf(categories);
            }
        }

        public record ExpenseCategory(String category, BigDecimal amount, List<LineItem> lineItems) {

            public ExpenseCategory {
                lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
            }
        }

        public record StatementMetadata(String companyName, String preparedBy, Integer pageCount) {
        }
    }

    record Payroll(
        String documentType,
        Period payPeriod,
        List<EmployeePay> employees,
        Totals totals,
        PayrollMetadata metadata
    ) implements ExtractionPayload {

        public Payroll {
            employees = employees == null ? List.of() : List.copyOf(employees);
        }

        public record EmployeePay(
            String name,
            String role,
            BigDecimal hoursWorked,
            BigDecimal grossPay,
            BigDecimal taxes,
            BigDecimal benefits,
            BigDecimal netPay
        ) {
        }

        public record Totals(
            BigDecimal totalGrossPay,
            BigDecimal totalTaxes,
            BigDecimal totalBenefits,
            BigDecimal totalNetPay,
            Integer employeeCount
        ) {
        }

        public record PayrollMetadata(String companyName, String payrollProvider) {
        }
    }

    record Expense(
        String documentType,
        Period period,
        List<ExpenseLine> lineItems,
        Summary summary
    ) implements ExtractionPayload {

        public Expense {
            lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
        }

        public record ExpenseLine(String date, String description, String category, BigDecimal amount) {
        }

        public record Summary(BigDecimal totalExpenses, List<CategoryTotal> categories) {

            public Summary {
                categories = categories == null ? List.of() : List.copyOf(categories);
            }
        }

        public record CategoryTotal(String category, BigDecimal currentPeriod) {
        }
    }

    /**
     * Free-form payload. Top-level fields outside the declared ones are kept in {@code attributes}.
     */
    record Generic(
        String documentType,
        String rawContent,
        List<List<String>> tables,
        List<LabelledNumber> numbers,
        Map<String, Object> attributes
    ) implements ExtractionPayload {

        public Generic {
            tables = tables == null ? List.of() : List.copyOf(tables);
            numbers = numbers == null ? List.of() : List.copyOf(numbers);
            attributes = attributes == null ? Map.of() : attributes;
        }

        public record LabelledNumber(String label, BigDecimal value) {
        }
    }
}
