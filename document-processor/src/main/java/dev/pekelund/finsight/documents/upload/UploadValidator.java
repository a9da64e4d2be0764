package dev.pekelund.finsight.documents.upload;

import dev.pekelund.finsight.documents.upload.UploadRejectedException.RejectionReason;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import org.springframework.util.unit.DataSize;

/**
 * Rejects uploads before any pipeline stage runs.
 */
public class UploadValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(UploadValidator.class);
    private static final Map<String, MediaKind> MEDIA_KINDS = Map.of(
        "csv", MediaKind.TABULAR,
        "pdf", MediaKind.PAGE_IMAGE);

    private final DataSize maxUploadSize;
    private final Set<String> allowedExtensions;

    public UploadValidator(DataSize maxUploadSize, Set<String> allowedExtensions) {
        this.maxUploadSize = maxUploadSize != null ? maxUploadSize : DataSize.ofMegabytes(10);
        Set<String> requested = allowedExtensions == null || allowedExtensions.isEmpty()
            ? MEDIA_KINDS.keySet()
            : allowedExtensions;
        this.allowedExtensions = requested.stream()
            .map(extension -> extension.toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
            .filter(MEDIA_KINDS::containsKey)
            .collect(Collectors.toUnmodifiableSet());
    }

    public SourceFile validate(String filename, String contentType, byte[] content) {
        if (!StringUtils.hasText(filename) || content == null) {
            throw reject(RejectionReason.MISSING_FILE, "No file provided");
        }
        String extension = extensionOf(filename);
        if (extension == null || !allowedExtensions.contains(extension)) {
            throw reject(RejectionReason.UNSUPPORTED_EXTENSION,
                "Unsupported file type: only " + describeAllowed() + " files are accepted");
        }
        if (content.length == 0) {
            throw reject(RejectionReason.EMPTY_FILE, "File " + filename + " is empty");
        }
        if (content.length > maxUploadSize.toBytes()) {
            throw reject(RejectionReason.FILE_TOO_LARGE,
                "File too large: maximum size is " + maxUploadSize.toMegabytes() + " MB");
        }
        return new SourceFile(filename, content, content.length, MEDIA_KINDS.get(extension), contentType);
    }

    private UploadRejectedException reject(RejectionReason reason, String message) {
        LOGGER.warn("Rejected upload ({}): {}", reason, message);
        return new UploadRejectedException(reason, message);
    }

    private String describeAllowed() {
        return allowedExtensions.stream()
            .sorted()
            .map(extension -> extension.toUpperCase(Locale.ROOT))
            .collect(Collectors.joining(" and "));
    }

    static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return null;
        }
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
