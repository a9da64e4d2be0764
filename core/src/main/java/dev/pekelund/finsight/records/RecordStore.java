package dev.pekelund.finsight.records;

import dev.pekelund.finsight.storage.DocumentOwner;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Row-oriented store addressed by table name and owner identity. Every call is independent; no
 * transaction spans several calls.
 */
public interface RecordStore {

    String OWNER_FIELD = "owner_id";
    String CREATED_AT_FIELD = "created_at";

    /**
     * Insert one record and return its generated identifier.
     *
     * @throws RecordStoreException when the store rejects the write
     */
    String insert(String table, DocumentOwner owner, Map<String, Object> record);

    List<StoredRecord> findByOwner(String table, DocumentOwner owner);

    Optional<StoredRecord> findById(String table, String recordId);

    /**
     * Merge {@code changes} into an existing record. A {@code null} value clears the field.
     *
     * @throws RecordStoreException when the record does not exist or the write fails
     */
    void update(String table, String recordId, Map<String, Object> changes);

    /**
     * @return {@code true} when a record was removed
     */
    boolean delete(String table, String recordId);

    /**
     * @return the number of deleted records
     */
    int deleteByOwner(String table, DocumentOwner owner);
}
