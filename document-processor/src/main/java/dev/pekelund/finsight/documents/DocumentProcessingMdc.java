package dev.pekelund.finsight.documents;

import dev.pekelund.finsight.storage.DocumentOwner;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Populates mapped diagnostic context entries so log lines emitted during one pipeline run share the same document
 * identifiers.
 */
final class DocumentProcessingMdc {

    private static final String KEY_DOCUMENT_ID = "document.id";
    private static final String KEY_FILENAME = "document.filename";
    private static final String KEY_OWNER = "document.owner";
    private static final String KEY_STAGE = "document.stage";

    private DocumentProcessingMdc() {
    }

    static Context open(String documentId, String filename, DocumentOwner owner) {
        return new Context(documentId, filename, owner);
    }

    static void setStage(String stage) {
        putIfHasText(KEY_STAGE, stage);
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String documentId, String filename, DocumentOwner owner) {
            this.previous = MDC.getCopyOfContextMap();
            putIfHasText(KEY_DOCUMENT_ID, documentId);
            putIfHasText(KEY_FILENAME, filename);
            putIfHasText(KEY_OWNER, owner != null ? owner.id() : null);
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
