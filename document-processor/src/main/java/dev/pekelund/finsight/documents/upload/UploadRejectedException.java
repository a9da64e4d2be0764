package dev.pekelund.finsight.documents.upload;

import dev.pekelund.finsight.documents.DocumentProcessingException;

public class UploadRejectedException extends DocumentProcessingException {

    public enum RejectionReason {
        MISSING_FILE,
        EMPTY_FILE,
        UNSUPPORTED_EXTENSION,
        FILE_TOO_LARGE
    }

    private final RejectionReason reason;

    public UploadRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RejectionReason getReason() {
        return reason;
    }
}
