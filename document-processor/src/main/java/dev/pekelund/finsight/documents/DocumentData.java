package dev.pekelund.finsight.documents;

import java.util.List;
import java.util.Map;

/**
 * Tabular view of a stored document. {@code rows} may be truncated; {@code totalRows} counts every row.
 */
public record DocumentData(List<String> headers, List<Map<String, Object>> rows, int totalRows) {

    public DocumentData {
        headers = headers == null ? List.of() : List.copyOf(headers);
        rows = rows == null ? List.of() : List.copyOf(rows);
    }
}
