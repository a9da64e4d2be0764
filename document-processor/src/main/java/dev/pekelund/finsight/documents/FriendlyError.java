package dev.pekelund.finsight.documents;

public record FriendlyError(String message, String suggestion, boolean retryable) {
}
