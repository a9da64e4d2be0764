package dev.pekelund.finsight.records;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.api.core.ApiFutures;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import com.google.cloud.firestore.WriteBatch;
import com.google.cloud.firestore.WriteResult;
import dev.pekelund.finsight.storage.DocumentOwner;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class FirestoreRecordStoreTest {

    private static final DocumentOwner OWNER = DocumentOwner.ofId("user-1");

    private Firestore firestore;
    private CollectionReference collection;
    private FirestoreRecordStore store;

    @BeforeEach
    void setUp() {
        firestore = mock(Firestore.class);
        collection = mock(CollectionReference.class);
        when(firestore.collection("test_employees")).thenReturn(collection);
        store = new FirestoreRecordStore(firestore, "test_");
    }

    @Test
    @SuppressWarnings("unchecked")
    void insertStampsOwnerAndCreationTime() {
        DocumentReference reference = mock(DocumentReference.class);
        when(collection.document()).thenReturn(reference);
        when(reference.getId()).thenReturn("doc-1");
        when(reference.set(anyMap())).thenReturn(ApiFutures.immediateFuture(mock(WriteResult.class)));

        String id = store.insert("employees", OWNER, Map.of("name", "John", "role", "Dev"));

        assertThat(id).isEqualTo("doc-1");
        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(reference).set(payload.capture());
        assertThat(payload.getValue())
            .containsEntry("name", "John")
            .containsEntry("role", "Dev")
            .containsEntry(RecordStore.OWNER_FIELD, "user-1");
        assertThat(payload.getValue().get(RecordStore.CREATED_AT_FIELD)).isInstanceOf(Timestamp.class);
    }

    @Test
    void insertWithoutOwnerIdNeverWrites() {
        assertThatThrownBy(() -> store.insert("employees", DocumentOwner.ofId(" "), Map.of("name", "John")))
            .isInstanceOf(RecordStoreException.class)
            .hasMessageContaining("without an owner id");
        verifyNoInteractions(collection);
    }

    @Test
    void failedWritesSurfaceTheCause() {
        DocumentReference reference = mock(DocumentReference.class);
        when(collection.document()).thenReturn(reference);
        when(reference.set(anyMap()))
            .thenReturn(ApiFutures.immediateFailedFuture(new IllegalStateException("PERMISSION_DENIED")));

        assertThatThrownBy(() -> store.insert("employees", OWNER, Map.of("name", "John")))
            .isInstanceOf(RecordStoreException.class)
            .hasMessage("PERMISSION_DENIED");
    }

    @Test
    void findByOwnerQueriesOnlyThatOwnersDocuments() {
        QueryDocumentSnapshot snapshot = mock(QueryDocumentSnapshot.class);
        when(snapshot.getId()).thenReturn("doc-1");
        when(snapshot.getData()).thenReturn(Map.of("name", "John", RecordStore.OWNER_FIELD, "user-1"));
        stubOwnerQuery(List.of(snapshot));

        List<StoredRecord> records = store.findByOwner("employees", OWNER);

        assertThat(records).singleElement().satisfies(record -> {
            assertThat(record.table()).isEqualTo("employees");
            assertThat(record.id()).isEqualTo("doc-1");
            assertThat(record.get("name")).isEqualTo("John");
        });
        verify(collection).whereEqualTo(RecordStore.OWNER_FIELD, "user-1");
    }

    @Test
    void findByOwnerWithoutOwnerSkipsTheQuery() {
        assertThat(store.findByOwner("employees", null)).isEmpty();
        verifyNoInteractions(collection);
    }

    @Test
    void findByIdReturnsEmptyForMissingDocuments() {
        DocumentReference reference = mock(DocumentReference.class);
        DocumentSnapshot snapshot = mock(DocumentSnapshot.class);
        when(collection.document("missing")).thenReturn(reference);
        when(reference.get()).thenReturn(ApiFutures.immediateFuture(snapshot));
        when(snapshot.exists()).thenReturn(false);

        assertThat(store.findById("employees", "missing")).isEmpty();
    }

    @Test
    void updateWritesChangesToTheAddressedDocument() {
        DocumentReference reference = mock(DocumentReference.class);
        when(collection.document("doc-1")).thenReturn(reference);
        when(reference.update(anyMap())).thenReturn(ApiFutures.immediateFuture(mock(WriteResult.class)));

        store.update("employees", "doc-1", Map.of("role", "Lead"));

        verify(reference).update(Map.of("role", "Lead"));
    }

    @Test
    void deleteByOwnerRemovesMatchingDocumentsInOneBatch() {
        QueryDocumentSnapshot first = mock(QueryDocumentSnapshot.class);
        QueryDocumentSnapshot second = mock(QueryDocumentSnapshot.class);
        DocumentReference firstReference = mock(DocumentReference.class);
        DocumentReference secondReference = mock(DocumentReference.class);
        when(first.getReference()).thenReturn(firstReference);
        when(second.getReference()).thenReturn(secondReference);
        stubOwnerQuery(List.of(first, second));
        WriteBatch batch = mock(WriteBatch.class);
        when(firestore.batch()).thenReturn(batch);
        when(batch.commit()).thenReturn(ApiFutures.immediateFuture(List.of()));

        int deleted = store.deleteByOwner("employees", OWNER);

        assertThat(deleted).isEqualTo(2);
        verify(batch).delete(firstReference);
        verify(batch).delete(secondReference);
        verify(batch).commit();
    }

    @Test
    void deleteByOwnerWithNoMatchesDoesNotCommit() {
        stubOwnerQuery(List.of());

        assertThat(store.deleteByOwner("employees", OWNER)).isZero();
        verify(firestore, never()).batch();
    }

    @Test
    void deleteOfMissingDocumentReportsFalse() {
        DocumentReference reference = mock(DocumentReference.class);
        DocumentSnapshot snapshot = mock(DocumentSnapshot.class);
        when(collection.document("missing")).thenReturn(reference);
        when(reference.get()).thenReturn(ApiFutures.immediateFuture(snapshot));
        when(snapshot.exists()).thenReturn(false);

        assertThat(store.delete("employees", "missing")).isFalse();
        verify(reference, never()).delete();
    }

    private void stubOwnerQuery(List<QueryDocumentSnapshot> snapshots) {
        Query query = mock(Query.class);
        QuerySnapshot result = mock(QuerySnapshot.class);
        when(collection.whereEqualTo(eq(RecordStore.OWNER_FIELD), any())).thenReturn(query);
        when(query.get()).thenReturn(ApiFutures.immediateFuture(result));
        when(result.getDocuments()).thenReturn(snapshots);
    }
}
