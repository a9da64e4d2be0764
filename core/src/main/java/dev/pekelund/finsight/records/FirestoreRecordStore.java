package dev.pekelund.finsight.records;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.WriteBatch;
import dev.pekelund.finsight.storage.DocumentOwner;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

/**
 * Stores each table as a Firestore collection with one document per record.
 */
public class FirestoreRecordStore implements RecordStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreRecordStore.class);

    private final Firestore firestore;
    private final String collectionPrefix;

    public FirestoreRecordStore(Firestore firestore, String collectionPrefix) {
        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.collectionPrefix = collectionPrefix != null ? collectionPrefix : "";
        LOGGER.info("FirestoreRecordStore initialized with collection prefix '{}'", this.collectionPrefix);
    }

    @Override
    public String insert(String table, DocumentOwner owner, Map<String, Object> record) {
        Assert.notNull(record, "record must not be null");
        if (owner == null || owner.id() == null) {
            throw new RecordStoreException("Cannot insert into '%s' without an owner id".formatted(table));
        }

        Map<String, Object> payload = new HashMap<>(record);
        payload.put(OWNER_FIELD, owner.id());
        payload.put(CREATED_AT_FIELD, Timestamp.now());

        DocumentReference reference = firestore.collection(collection(table)).document();
        try {
            reference.set(payload).get();
            LOGGER.debug("Inserted {}/{}", collection(table), reference.getId());
            return reference.getId();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RecordStoreException("Interrupted while writing to " + collection(table), ex);
        } catch (ExecutionException ex) {
            throw new RecordStoreException(causeMessage(ex, "Failed to insert into " + collection(table)), ex);
        }
    }

    @Override
    public List<StoredRecord> findByOwner(String table, DocumentOwner owner) {
        if (owner == null || owner.id() == null) {
            return List.of();
        }
        try {
            List<StoredRecord> records = new ArrayList<>();
            for (QueryDocumentSnapshot snapshot : queryByOwner(table, owner)) {
                records.add(new StoredRecord(table, snapshot.getId(), snapshot.getData()));
            }
            return records;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RecordStoreException("Interrupted while reading " + collection(table), ex);
        } catch (ExecutionException ex) {
            throw new RecordStoreException(causeMessage(ex, "Failed to read " + collection(table)), ex);
        }
    }

    @Override
    public Optional<StoredRecord> findById(String table, String recordId) {
        Assert.hasText(recordId, "recordId must not be empty");
        try {
            DocumentSnapshot snapshot = firestore.collection(collection(table)).document(recordId).get().get();
            if (!snapshot.exists()) {
                return Optional.empty();
            }
            return Optional.of(new StoredRecord(table, snapshot.getId(), snapshot.getData()));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RecordStoreException("Interrupted while reading " + collection(table), ex);
        } catch (ExecutionException ex) {
            throw new RecordStoreException(causeMessage(ex, "Failed to read %s/%s"
                .formatted(collection(table), recordId)), ex);
        }
    }

    @Override
    public void update(String table, String recordId, Map<String, Object> changes) {
        Assert.hasText(recordId, "recordId must not be empty");
        try {
            firestore.collection(collection(table)).document(recordId).update(changes).get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RecordStoreException("Interrupted while updating " + collection(table), ex);
        } catch (ExecutionException ex) {
            throw new RecordStoreException(causeMessage(ex, "Failed to update %s/%s"
                .formatted(collection(table), recordId)), ex);
        }
    }

    @Override
    public boolean delete(String table, String recordId) {
        Assert.hasText(recordId, "recordId must not be empty");
        DocumentReference reference = firestore.collection(collection(table)).document(recordId);
        try {
            if (!reference.get().get().exists()) {
                return false;
            }
            reference.delete().get();
            LOGGER.debug("Deleted {}/{}", collection(table), recordId);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RecordStoreException("Interrupted while deleting from " + collection(table), ex);
        } catch (ExecutionException ex) {
            throw new RecordStoreException(causeMessage(ex, "Failed to delete %s/%s"
                .formatted(collection(table), recordId)), ex);
        }
    }

    @Override
    public int deleteByOwner(String table, DocumentOwner owner) {
        if (owner == null || owner.id() == null) {
            return 0;
        }
        try {
            List<QueryDocumentSnapshot> snapshots = queryByOwner(table, owner);
            if (snapshots.isEmpty()) {
                return 0;
            }
            WriteBatch batch = firestore.batch();
            snapshots.forEach(snapshot -> batch.delete(snapshot.getReference()));
            batch.commit().get();
            LOGGER.info("Deleted {} records from {} for owner {}", snapshots.size(), collection(table), owner.id());
            return snapshots.size();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RecordStoreException("Interrupted while deleting from " + collection(table), ex);
        } catch (ExecutionException ex) {
            throw new RecordStoreException(causeMessage(ex, "Failed to delete from " + collection(table)), ex);
        }
    }

    private List<QueryDocumentSnapshot> queryByOwner(String table, DocumentOwner owner)
        throws InterruptedException, ExecutionException {
        return firestore.collection(collection(table))
            .whereEqualTo(OWNER_FIELD, owner.id())
            .get()
            .get()
            .getDocuments();
    }

    private String collection(String table) {
        Assert.hasText(table, "table must not be empty");
        return collectionPrefix + table;
    }

    private static String causeMessage(ExecutionException ex, String fallback) {
        Throwable cause = ex.getCause();
        return cause != null && cause.getMessage() != null ? cause.getMessage() : fallback;
    }
}
