package dev.pekelund.finsight.documents.tabular;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Parsed spreadsheet: unique ordered headers and the rows keyed by header. {@code totalRowCount} counts every data
 * row in the source even when {@code rows} holds a truncated preview.
 */
public record TabularParseResult(List<String> headers, List<Map<String, String>> rows, int totalRowCount) {

    public TabularParseResult {
        Objects.requireNonNull(headers, "headers");
        Objects.requireNonNull(rows, "rows");
        headers = List.copyOf(headers);
        Set<String> seen = new HashSet<>();
        for (String header : headers) {
            if (!seen.add(header)) {
                throw new IllegalArgumentException("Duplicate header: " + header);
            }
        }
        rows = rows.stream()
            .map(row -> Collections.unmodifiableMap(new LinkedHashMap<>(row)))
            .toList();
        if (totalRowCount < rows.size()) {
            throw new IllegalArgumentException("totalRowCount must be at least the number of rows");
        }
    }

    public static TabularParseResult of(List<String> headers, List<Map<String, String>> rows) {
        return new TabularParseResult(headers, rows, rows.size());
    }

    /**
     * @return a copy holding at most {@code limit} rows, keeping the total row count
     */
    public TabularParseResult preview(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        if (rows.size() <= limit) {
            return this;
        }
        return new TabularParseResult(headers, rows.subList(0, limit), totalRowCount);
    }

    public boolean isTruncated() {
        return rows.size() < totalRowCount;
    }
}
