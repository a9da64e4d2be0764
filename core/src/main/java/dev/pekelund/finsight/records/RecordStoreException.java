package dev.pekelund.finsight.records;

public class RecordStoreException extends RuntimeException {

    public RecordStoreException(String message) {
        super(message);
    }

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
