package dev.pekelund.finsight.documents.summary;

public record DateRange(String start, String end) {
}
