package dev.pekelund.finsight.records;

import dev.pekelund.finsight.storage.DocumentOwner;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.util.Assert;

/**
 * Process-local record store used by the local profile and tests.
 */
public class InMemoryRecordStore implements RecordStore {

    private final Map<String, Map<String, Map<String, Object>>> tables = new ConcurrentHashMap<>();

    @Override
    public String insert(String table, DocumentOwner owner, Map<String, Object> record) {
        Assert.hasText(table, "table must not be empty");
        Assert.notNull(record, "record must not be null");
        if (owner == null || owner.id() == null) {
            throw new RecordStoreException("Cannot insert into '%s' without an owner id".formatted(table));
        }

        String id = UUID.randomUUID().toString();
        Map<String, Object> stored = new LinkedHashMap<>(record);
        stored.put(OWNER_FIELD, owner.id());
        stored.put(CREATED_AT_FIELD, Instant.now().toString());
        rows(table).put(id, stored);
        return id;
    }

    @Override
    public List<StoredRecord> findByOwner(String table, DocumentOwner owner) {
        List<StoredRecord> result = new ArrayList<>();
        if (owner == null || owner.id() == null) {
            return result;
        }
        synchronized (rows(table)) {
            rows(table).forEach((id, fields) -> {
                if (owner.id().equals(fields.get(OWNER_FIELD))) {
                    result.add(new StoredRecord(table, id, fields));
                }
            });
        }
        return result;
    }

    @Override
    public Optional<StoredRecord> findById(String table, String recordId) {
        if (recordId == null) {
            return Optional.empty();
        }
        Map<String, Object> fields = rows(table).get(recordId);
        if (fields == null) {
            return Optional.empty();
        }
        synchronized (fields) {
            return Optional.of(new StoredRecord(table, recordId, fields));
        }
    }

    @Override
    public void update(String table, String recordId, Map<String, Object> changes) {
        Map<String, Object> existing = rows(table).get(recordId);
        if (existing == null) {
            throw new RecordStoreException("Record %s/%s does not exist".formatted(table, recordId));
        }
        synchronized (existing) {
            existing.putAll(changes);
        }
    }

    @Override
    public boolean delete(String table, String recordId) {
        return recordId != null && rows(table).remove(recordId) != null;
    }

    @Override
    public int deleteByOwner(String table, DocumentOwner owner) {
        if (owner == null || owner.id() == null) {
            return 0;
        }
        Map<String, Map<String, Object>> rows = rows(table);
        synchronized (rows) {
            int before = rows.size();
            rows.values().removeIf(fields -> Objects.equals(owner.id(), fields.get(OWNER_FIELD)));
            return before - rows.size();
        }
    }

    public int size(String table) {
        return rows(table).size();
    }

    private Map<String, Map<String, Object>> rows(String table) {
        return tables.computeIfAbsent(table, key -> Collections.synchronizedMap(new LinkedHashMap<>()));
    }
}
