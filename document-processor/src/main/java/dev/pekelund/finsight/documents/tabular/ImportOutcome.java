package dev.pekelund.finsight.documents.tabular;

import java.util.List;

/**
 * Result of one import batch. Row failures never abort the batch; {@code success} is false as soon as any row failed.
 * Only the first few error messages are kept.
 */
public record ImportOutcome(int rowsImported, int rowsSkipped, List<String> errors, boolean success) {

    public ImportOutcome {
        if (rowsImported < 0 || rowsSkipped < 0) {
            throw new IllegalArgumentException("Row counts must not be negative");
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ImportOutcome rejected(int rowCount, String error) {
        return new ImportOutcome(0, rowCount, List.of(error), false);
    }

    public int totalRowsAttempted() {
        return rowsImported + rowsSkipped;
    }
}
