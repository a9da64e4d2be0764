package dev.pekelund.finsight.documents.upload;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * An accepted upload. Owned by the caller for the duration of one pipeline run.
 */
public record SourceFile(String filename, byte[] content, long declaredSize, MediaKind mediaKind, String contentType) {

    public SourceFile {
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(mediaKind, "mediaKind");
    }

    public String asText() {
        return new String(content, StandardCharsets.UTF_8);
    }
}
