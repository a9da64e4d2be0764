package dev.pekelund.finsight.documents.tabular;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Source header to canonical field assignment. No two headers may claim the same field other than
 * {@link TabularDocumentType#IGNORE}.
 */
public record ColumnMapping(Map<String, String> assignments) {

    public ColumnMapping {
        Objects.requireNonNull(assignments, "assignments");
        Map<String, String> claimedBy = new HashMap<>();
        Map<String, String> copy = new LinkedHashMap<>();
        assignments.forEach((header, field) -> {
            String target = field == null || field.isBlank() ? TabularDocumentType.IGNORE : field.trim();
            if (!TabularDocumentType.IGNORE.equals(target)) {
                String previous = claimedBy.putIfAbsent(target, header);
                if (previous != null) {
                    throw new IllegalArgumentException("Field '%s' is mapped from both '%s' and '%s'"
                        .formatted(target, previous, header));
                }
            }
            copy.put(header, target);
        });
        assignments = Collections.unmodifiableMap(copy);
    }

    public String targetFor(String header) {
        return assignments.getOrDefault(header, TabularDocumentType.IGNORE);
    }

    /**
     * @return the header mapped onto {@code field}, if any
     */
    public Optional<String> columnFor(String field) {
        return assignments.entrySet().stream()
            .filter(entry -> entry.getValue().equals(field))
            .map(Map.Entry::getKey)
            .findFirst();
    }

    public boolean isMapped(String field) {
        return columnFor(field).isPresent();
    }
}
