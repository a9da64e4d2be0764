package dev.pekelund.finsight.documents.tabular;

import java.util.List;
import java.util.Objects;

/**
 * Canonical field a source column can be mapped onto, with the header synonyms that identify it.
 */
public record TargetField(String name, boolean required, List<String> synonyms) {

    public TargetField {
        Objects.requireNonNull(name, "name");
        synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
    }

    static TargetField required(String name, String... synonyms) {
        return new TargetField(name, true, List.of(synonyms));
    }

    static TargetField optional(String name, String... synonyms) {
        return new TargetField(name, false, List.of(synonyms));
    }
}
