package dev.pekelund.finsight.documents.extraction;

import java.util.Objects;
import java.util.Optional;

/**
 * A page-image document to extract. {@code forcedSchema} skips filename classification and the generic retry.
 */
public record ExtractionRequest(byte[] content, String filename, String mediaType, ExtractionSchema forcedSchema) {

    public static final String PDF_MEDIA_TYPE = "application/pdf";

    public ExtractionRequest {
        Objects.requireNonNull(content, "content");
        mediaType = mediaType == null || mediaType.isBlank() ? PDF_MEDIA_TYPE : mediaType;
    }

    public static ExtractionRequest of(byte[] content, String filename) {
        return new ExtractionRequest(content, filename, PDF_MEDIA_TYPE, null);
    }

    public ExtractionRequest forcing(ExtractionSchema schema) {
        return new ExtractionRequest(content, filename, mediaType, schema);
    }

    public Optional<ExtractionSchema> forced() {
        return Optional.ofNullable(forcedSchema);
    }
}
