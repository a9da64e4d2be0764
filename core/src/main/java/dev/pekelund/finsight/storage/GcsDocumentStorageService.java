package dev.pekelund.finsight.storage;

import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriUtils;

public class GcsDocumentStorageService implements DocumentStorageService {

    private static final Logger LOGGER = LoggerFactory.getLogger(GcsDocumentStorageService.class);
    private static final DateTimeFormatter OBJECT_PREFIX =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS", Locale.US).withZone(ZoneOffset.UTC);
    private static final int MAX_OBJECT_FILENAME_LENGTH = 60;
    static final String CONTENT_HASH_METADATA_KEY = "content-sha256";

    private final Storage storage;
    private final GcsProperties properties;

    public GcsDocumentStorageService(Storage storage, GcsProperties properties) {
        this.storage = storage;
        this.properties = properties;
        Assert.isTrue(StringUtils.hasText(properties.getBucket()),
            "gcs.bucket must be configured when Google Cloud Storage is enabled");
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public StoredDocumentReference upload(String filename, byte[] content, String contentType, DocumentOwner owner) {
        Assert.notNull(content, "content must not be null");
        String objectName = buildObjectName(filename);

        Map<String, String> metadata = new HashMap<>(owner != null && owner.hasValues() ? owner.toMetadata() : Map.of());
        metadata.put(CONTENT_HASH_METADATA_KEY, calculateSha256Hash(content));

        BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(properties.getBucket(), objectName))
            .setContentType(contentType)
            .setMetadata(metadata)
            .build();

        try {
            storage.create(blobInfo, content);
        } catch (StorageException ex) {
            String displayName = StringUtils.hasText(filename) ? filename : objectName;
            throw new DocumentStorageException("Failed to upload file '%s'".formatted(displayName), ex);
        }
        LOGGER.info("Stored {} bytes as gs://{}/{}", content.length, properties.getBucket(), objectName);
        return new StoredDocumentReference(properties.getBucket(), objectName, owner);
    }

    @Override
    public byte[] download(String objectName) {
        Assert.hasText(objectName, "objectName must not be empty");
        try {
            Blob blob = storage.get(BlobId.of(properties.getBucket(), objectName));
            if (blob == null) {
                throw new DocumentStorageException("Object gs://%s/%s does not exist"
                    .formatted(properties.getBucket(), objectName));
            }
            return blob.getContent();
        } catch (StorageException ex) {
            throw new DocumentStorageException("Failed to download object '%s'".formatted(objectName), ex);
        }
    }

    @Override
    public void delete(String objectName) {
        Assert.hasText(objectName, "objectName must not be empty");
        try {
            boolean deleted = storage.delete(BlobId.of(properties.getBucket(), objectName));
            if (deleted) {
                LOGGER.info("Deleted gs://{}/{}", properties.getBucket(), objectName);
            } else {
                LOGGER.debug("Object gs://{}/{} was already gone", properties.getBucket(), objectName);
            }
        } catch (StorageException ex) {
            throw new DocumentStorageException("Failed to delete object '%s'".formatted(objectName), ex);
        }
    }

    @Override
    public void deleteDocumentsForOwner(DocumentOwner owner) {
        if (owner == null) {
            return;
        }

        try {
            Iterable<Blob> blobs = storage.list(properties.getBucket(),
                Storage.BlobListOption.prefix(prefix())).iterateAll();
            int deleted = 0;
            for (Blob blob : blobs) {
                if (blob.isDirectory()) {
                    continue;
                }
                DocumentOwner fileOwner = DocumentOwner.fromMetadata(blob.getMetadata());
                if (!owner.sameOwnerAs(fileOwner)) {
                    continue;
                }
                storage.delete(blob.getBlobId());
                deleted++;
            }
            LOGGER.info("Deleted {} stored documents for owner {}", deleted, owner.id());
        } catch (StorageException ex) {
            throw new DocumentStorageException("Unable to delete stored documents", ex);
        }
    }

    String buildObjectName(String originalFilename) {
        String filename = StringUtils.hasText(originalFilename) ? originalFilename : "document";
        filename = extractFilename(filename);
        filename = shortenFilename(filename, MAX_OBJECT_FILENAME_LENGTH);
        filename = UriUtils.encodePathSegment(filename, StandardCharsets.UTF_8);
        String stamp = OBJECT_PREFIX.format(Instant.now());
        String suffix = UUID.randomUUID().toString().substring(0, 6);
        return prefix() + stamp + "_" + suffix + "_" + filename;
    }

    String calculateSha256Hash(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException ex) {
            throw new DocumentStorageException("SHA-256 algorithm not available", ex);
        }
    }

    private String prefix() {
        String prefix = properties.getPrefix();
        if (!StringUtils.hasText(prefix)) {
            return "";
        }
        return prefix.endsWith("/") ? prefix : prefix + "/";
    }

    private String extractFilename(String filename) {
        try {
            Path fileName = Paths.get(filename).getFileName();
            if (fileName != null) {
                return fileName.toString();
            }
        } catch (InvalidPathException ex) {
            LOGGER.debug("Filename {} is not a valid path; splitting on separators instead", filename);
        }
        int separatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        if (separatorIndex >= 0 && separatorIndex < filename.length() - 1) {
            return filename.substring(separatorIndex + 1);
        }
        return filename;
    }

    private String shortenFilename(String filename, int maxLength) {
        if (filename.length() <= maxLength) {
            return filename;
        }

        int extensionIndex = filename.lastIndexOf('.');
        if (extensionIndex > 0 && extensionIndex < filename.length() - 1) {
            String extension = filename.substring(extensionIndex);
            int allowedBaseLength = Math.max(1, maxLength - extension.length());
            return filename.substring(0, Math.min(extensionIndex, allowedBaseLength)) + extension;
        }
        return filename.substring(0, maxLength);
    }
}
