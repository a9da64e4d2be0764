package dev.pekelund.finsight.storage;

import java.util.Objects;

public record StoredDocumentReference(String bucket, String objectName, DocumentOwner owner) {

    public StoredDocumentReference {
        Objects.requireNonNull(bucket, "bucket");
        Objects.requireNonNull(objectName, "objectName");
    }

    public String path() {
        return "gs://" + bucket + "/" + objectName;
    }
}
