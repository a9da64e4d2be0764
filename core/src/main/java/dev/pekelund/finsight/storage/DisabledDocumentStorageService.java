package dev.pekelund.finsight.storage;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnMissingBean(DocumentStorageService.class)
@ConditionalOnProperty(value = "gcs.enabled", havingValue = "false", matchIfMissing = true)
public class DisabledDocumentStorageService implements DocumentStorageService {

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public StoredDocumentReference upload(String filename, byte[] content, String contentType, DocumentOwner owner) {
        throw new DocumentStorageException("Google Cloud Storage integration is disabled");
    }

    @Override
    public byte[] download(String objectName) {
        throw new DocumentStorageException("Google Cloud Storage integration is disabled");
    }

    @Override
    public void delete(String objectName) {
        throw new DocumentStorageException("Google Cloud Storage integration is disabled");
    }

    @Override
    public void deleteDocumentsForOwner(DocumentOwner owner) {
        throw new DocumentStorageException("Google Cloud Storage integration is disabled");
    }
}
