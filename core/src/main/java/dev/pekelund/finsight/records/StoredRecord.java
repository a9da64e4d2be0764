package dev.pekelund.finsight.records;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of one stored record. Field values may be {@code null}.
 */
public record StoredRecord(String table, String id, Map<String, Object> fields) {

    public StoredRecord {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(id, "id");
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object get(String field) {
        return fields.get(field);
    }
}
