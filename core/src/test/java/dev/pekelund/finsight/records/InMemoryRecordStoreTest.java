package dev.pekelund.finsight.records;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.finsight.storage.DocumentOwner;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InMemoryRecordStoreTest {

    private final InMemoryRecordStore store = new InMemoryRecordStore();

    @Test
    void insertedRecordsAreScopedByOwner() {
        DocumentOwner alice = DocumentOwner.ofId("alice");
        DocumentOwner bob = DocumentOwner.ofId("bob");

        store.insert("employees", alice, Map.of("name", "John"));
        store.insert("employees", bob, Map.of("name", "Jane"));

        List<StoredRecord> records = store.findByOwner("employees", alice);
        assertThat(records).hasSize(1);
        assertThat(records.get(0).get("name")).isEqualTo("John");
        assertThat(records.get(0).get(RecordStore.OWNER_FIELD)).isEqualTo("alice");
        assertThat(records.get(0).get(RecordStore.CREATED_AT_FIELD)).isNotNull();
    }

    @Test
    void insertWithoutOwnerIdFails() {
        assertThatThrownBy(() -> store.insert("employees", new DocumentOwner(null, "Ada", null), Map.of()))
            .isInstanceOf(RecordStoreException.class)
            .hasMessageContaining("employees");
    }

    @Test
    void updateMergesChanges() {
        DocumentOwner owner = DocumentOwner.ofId("alice");
        String id = store.insert("employees", owner, Map.of("name", "John", "role", "Dev"));

        store.update("employees", id, Map.of("role", "Lead"));

        assertThat(store.findByOwner("employees", owner).get(0).fields())
            .containsEntry("name", "John")
            .containsEntry("role", "Lead");
        assertThatThrownBy(() -> store.update("employees", "missing", Map.of()))
            .isInstanceOf(RecordStoreException.class);
    }

    @Test
    void findByIdAndDeleteAddressSingleRecords() {
        DocumentOwner owner = DocumentOwner.ofId("alice");
        String id = store.insert("documents", owner, Map.of("filename", "roster.csv"));

        assertThat(store.findById("documents", id)).hasValueSatisfying(record ->
            assertThat(record.get("filename")).isEqualTo("roster.csv"));
        assertThat(store.findById("documents", "missing")).isEmpty();

        assertThat(store.delete("documents", id)).isTrue();
        assertThat(store.delete("documents", id)).isFalse();
        assertThat(store.findById("documents", id)).isEmpty();
    }

    @Test
    void deleteByOwnerRemovesOnlyThatOwnersRows() {
        store.insert("employees", DocumentOwner.ofId("alice"), Map.of("name", "John"));
        store.insert("employees", DocumentOwner.ofId("alice"), Map.of("name", "Jim"));
        store.insert("employees", DocumentOwner.ofId("bob"), Map.of("name", "Jane"));

        assertThat(store.deleteByOwner("employees", DocumentOwner.ofId("alice"))).isEqualTo(2);
        assertThat(store.size("employees")).isEqualTo(1);
        assertThat(store.deleteByOwner("employees", null)).isZero();
    }
}
