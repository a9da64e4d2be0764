package dev.pekelund.finsight.documents.tabular;

import dev.pekelund.finsight.documents.support.Amounts;
import dev.pekelund.finsight.records.RecordStore;
import dev.pekelund.finsight.records.RecordStoreException;
import dev.pekelund.finsight.storage.DocumentOwner;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Converts mapped spreadsheet rows into typed records and writes them one at a time. Invalid rows and rejected
 * writes are recorded as skips; earlier successful writes stay committed.
 */
public class RowImporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(RowImporter.class);

    private final RecordStore recordStore;
    private final int maxReportedErrors;

    public RowImporter(RecordStore recordStore, int maxReportedErrors) {
        this.recordStore = Objects.requireNonNull(recordStore, "recordStore");
        if (maxReportedErrors < 1) {
            throw new IllegalArgumentException("maxReportedErrors must be positive");
        }
        this.maxReportedErrors = maxReportedErrors;
    }

    public ImportOutcome importRows(TabularDocumentType type, ColumnMapping mapping, List<Map<String, String>> rows,
        DocumentOwner owner) {

        Objects.requireNonNull(mapping, "mapping");
        List<Map<String, String>> batch = rows == null ? List.of() : rows;
        Optional<String> table = type == null ? Optional.empty() : type.targetTable();
        if (table.isEmpty()) {
            LOGGER.warn("Rejected import of {} rows with unsupported type {}", batch.size(), type);
            return ImportOutcome.rejected(batch.size(), "Unknown document type - cannot import");
        }

        List<String> errors = new ArrayList<>();
        int imported = 0;
        int skipped = 0;
        for (int index = 0; index < batch.size(); index++) {
            int rowNumber = index + 1;
            Map<String, String> values = batch.get(index);
            MappedRow row = new MappedRow(mapping, values == null ? Map.of() : values);
            try {
                Map<String, Object> record = switch (type) {
                    case EMPLOYEE_ROSTER -> toEmployee(row);
                    case PAYROLL -> toPayrollEntry(row);
                    case PROFIT_AND_LOSS -> toFinancialEntry(row, rowNumber);
                    case UNKNOWN -> throw new IllegalStateException("Unknown rows have no target table");
                };
                recordStore.insert(table.get(), owner, record);
                imported++;
            } catch (InvalidRowException ex) {
                errors.add("Row %d: %s".formatted(rowNumber, ex.getMessage()));
                skipped++;
            } catch (RecordStoreException ex) {
                LOGGER.warn("Row {} rejected by the record store: {}", rowNumber, ex.getMessage());
                errors.add("Row %d: %s".formatted(rowNumber, ex.getMessage()));
                skipped++;
            } catch (RuntimeException ex) {
                LOGGER.warn("Row {} could not be imported", rowNumber, ex);
                String reason = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
                errors.add("Row %d: %s".formatted(rowNumber, reason));
                skipped++;
            }
        }

        LOGGER.info("Imported {} {} rows into {} ({} skipped, {} errors)", imported, type, table.get(), skipped,
            errors.size());
        List<String> reported = errors.size() > maxReportedErrors ? errors.subList(0, maxReportedErrors) : errors;
        return new ImportOutcome(imported, skipped, reported, errors.isEmpty());
    }

    private Map<String, Object> toEmployee(MappedRow row) {
        String name = row.text("name");
        String role = row.text("role");
        if (name == null || role == null) {
            throw new InvalidRowException("Missing required field (name or role)");
        }

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("name", name);
        record.put("role", role);
        record.put("department", row.text("department"));
        record.put("annual_salary", Amounts.parseOrZero(row.text("annual_salary")));
        record.put("annual_benefits", Amounts.parseOrZero(row.text("annual_benefits")));
        record.put("employment_type", EmploymentType.fromText(row.text("employment_type")).code());
        record.put("employee_id", row.text("employee_id"));
        return record;
    }

    private Map<String, Object> toPayrollEntry(MappedRow row) {
        String employeeName = row.text("employee_name");
        String grossPay = row.text("gross_pay");
        if (employeeName == null || grossPay == null) {
            throw new InvalidRowException("Missing required field (employee_name or gross_pay)");
        }
        BigDecimal gross = Amounts.parse(grossPay)
            .orElseThrow(() -> new InvalidRowException("Invalid gross pay '%s'".formatted(grossPay)));

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("employee_name", employeeName);
        record.put("employee_id", row.text("employee_id"));
        record.put("hours_worked", Amounts.parseOrZero(row.text("hours_worked")));
        record.put("hourly_rate", Amounts.parseOrZero(row.text("hourly_rate")));
        record.put("gross_pay", gross.doubleValue());
        record.put("net_pay", Amounts.parseOrZero(row.text("net_pay")));
        record.put("pay_date", row.text("pay_date"));
        return record;
    }

    private Map<String, Object> toFinancialEntry(MappedRow row, int rowNumber) {
        String description = row.text("description");
        String category = row.text("expense_category");
        String amount = row.text("expense_amount");
        String revenue = row.text("revenue");
        if (description == null && category == null) {
            throw new InvalidRowException("Missing description or category");
        }
        if (amount == null && revenue == null) {
            throw new InvalidRowException("Missing amount");
        }
        String rawAmount = amount != null ? amount : revenue;
        BigDecimal value = Amounts.parse(rawAmount)
            .orElseThrow(() -> new InvalidRowException("Invalid amount '%s'".formatted(rawAmount)));

        String transactionType = Optional.ofNullable(row.text("transaction_type")).orElse("")
            .toLowerCase(Locale.ROOT);
        boolean income = transactionType.contains("income") || transactionType.contains("revenue")
            || transactionType.equals("credit") || revenue != null;

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("date", row.text("date"));
        record.put("description", description != null ? description : category);
        record.put("category", category != null ? category : "");
        record.put("amount", value.doubleValue());
        record.put("entry_type", income ? "income" : "expense");
        record.put("source_row", rowNumber);
        return record;
    }

    private record MappedRow(ColumnMapping mapping, Map<String, String> values) {

        /**
         * @return the trimmed value of the column mapped onto {@code field}, or {@code null} when unmapped or blank
         */
        String text(String field) {
            return mapping.columnFor(field)
                .map(values::get)
                .filter(StringUtils::hasText)
                .map(String::trim)
                .orElse(null);
        }
    }

    private static final class InvalidRowException extends RuntimeException {

        InvalidRowException(String message) {
            super(message);
        }
    }
}
