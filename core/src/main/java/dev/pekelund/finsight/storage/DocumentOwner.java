package dev.pekelund.finsight.storage;

import java.util.HashMap;
import java.util.Map;

public record DocumentOwner(String id, String displayName, String email) {

    public static final String METADATA_OWNER_ID = "document.owner.id";
    public static final String METADATA_OWNER_DISPLAY_NAME = "document.owner.displayName";
    public static final String METADATA_OWNER_EMAIL = "document.owner.email";

    public DocumentOwner {
        id = normalize(id);
        displayName = normalize(displayName);
        email = normalize(email);
    }

    public static DocumentOwner ofId(String id) {
        return new DocumentOwner(id, null, null);
    }

    public boolean hasValues() {
        return id != null || displayName != null || email != null;
    }

    public Map<String, String> toMetadata() {
        Map<String, String> metadata = new HashMap<>();
        if (id != null) {
            metadata.put(METADATA_OWNER_ID, id);
        }
        if (displayName != null) {
            metadata.put(METADATA_OWNER_DISPLAY_NAME, displayName);
        }
        if (email != null) {
            metadata.put(METADATA_OWNER_EMAIL, email);
        }
        return metadata;
    }

    public static DocumentOwner fromMetadata(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }

        DocumentOwner owner = new DocumentOwner(
            metadata.get(METADATA_OWNER_ID),
            metadata.get(METADATA_OWNER_DISPLAY_NAME),
            metadata.get(METADATA_OWNER_EMAIL));
        return owner.hasValues() ? owner : null;
    }

    /**
     * Two owners match when their identifiers are equal, or, when either lacks an identifier, when their
     * e-mail addresses match ignoring case.
     */
    public boolean sameOwnerAs(DocumentOwner other) {
        if (other == null) {
            return false;
        }
        if (id != null && other.id != null) {
            return id.equals(other.id);
        }
        return email != null && email.equalsIgnoreCase(other.email);
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
