package dev.pekelund.finsight.documents;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle of a registered upload: {@code pending} once registered, {@code processing} while a pipeline run is
 * active, then {@code completed} or {@code error}.
 */
public enum ProcessingStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    ERROR;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ProcessingStatus> fromCode(Object code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalised = code.toString().trim();
        return Arrays.stream(values())
            .filter(status -> status.name().equalsIgnoreCase(normalised))
            .findFirst();
    }
}
