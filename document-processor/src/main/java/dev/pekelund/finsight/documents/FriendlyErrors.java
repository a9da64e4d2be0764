package dev.pekelund.finsight.documents;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Translates technical failures into conversational messages. Patterns are matched against the lower-cased error
 * message in declaration order; the first pattern whose keywords match and whose contexts include the current one
 * wins. Without a match the context's fallback is used.
 */
public final class FriendlyErrors {

    private static final Set<ErrorContext> ANY_CONTEXT = EnumSet.allOf(ErrorContext.class);

    private static final List<ErrorPattern> PATTERNS = List.of(
        new ErrorPattern(List.of("network", "connection", "fetch failed", "offline", "econnrefused"), ANY_CONTEXT,
            new FriendlyError("We couldn't connect to our servers.",
                "Check your internet connection and try again.", true)),
        new ErrorPattern(List.of("timeout", "timed out", "too long", "exceeded", "etimedout"),
            EnumSet.of(ErrorContext.DOCUMENT_PROCESSING),
            new FriendlyError("This document is taking longer than expected to process.",
                "Try uploading a simpler file, or export your data as CSV for faster processing.", true)),
        new ErrorPattern(List.of("rate limit", "429", "too many requests"), ANY_CONTEXT,
            new FriendlyError("We're getting a lot of requests right now.",
                "Please wait a moment and try again.", true)),
        new ErrorPattern(List.of("not found", "404", "does not exist"), ANY_CONTEXT,
            new FriendlyError("We couldn't find what you're looking for.",
                "It may have been moved or deleted.", false)),
        new ErrorPattern(List.of("unsupported", "invalid file", "corrupt", "cannot read", "format"),
            EnumSet.of(ErrorContext.DOCUMENT_UPLOAD, ErrorContext.DOCUMENT_PROCESSING),
            new FriendlyError("We couldn't read this file.",
                "Try exporting it as PDF or CSV from your accounting software.", false)),
        new ErrorPattern(List.of("too large", "file size", "exceeds limit"), ANY_CONTEXT,
            new FriendlyError("This file is too large to upload.",
                "Try splitting it into smaller files or compressing it.", false)),
        new ErrorPattern(List.of("extract", "parse", "no data", "empty", "unrecognized"),
            EnumSet.of(ErrorContext.DOCUMENT_PROCESSING, ErrorContext.CSV_IMPORT),
            new FriendlyError("We couldn't find any data to import from this file.",
                "Make sure the file contains the data you expect, or try entering it manually.", false)),
        new ErrorPattern(List.of("required", "missing", "invalid", "must be"), EnumSet.of(ErrorContext.CSV_IMPORT),
            new FriendlyError("Some information is missing or incorrect.",
                "Please check the highlighted fields and try again.", true)),
        new ErrorPattern(List.of("duplicate", "already exists", "unique constraint"), ANY_CONTEXT,
            new FriendlyError("This item already exists.", "Try updating the existing one instead.", false)),
        new ErrorPattern(List.of("500", "internal server error", "server error"), ANY_CONTEXT,
            new FriendlyError("Something went wrong on our end.",
                "We're looking into it. Please try again in a moment.", true)));

    private static final Map<ErrorContext, FriendlyError> FALLBACKS = new EnumMap<>(Map.of(
        ErrorContext.DOCUMENT_UPLOAD, new FriendlyError("We had trouble uploading this file.",
            "Please try again, or try a different file.", true),
        ErrorContext.DOCUMENT_PROCESSING, new FriendlyError("We had trouble processing this document.",
            "Try uploading a CSV file for more reliable processing.", true),
        ErrorContext.CSV_IMPORT, new FriendlyError("We had trouble importing this data.",
            "Check that your CSV has the expected columns and try again.", true),
        ErrorContext.GENERAL, new FriendlyError("Something went wrong.", "Please try again.", true)));

    private FriendlyErrors() {
    }

    public static FriendlyError describe(Throwable error, ErrorContext context) {
        return describe(error != null ? error.getMessage() : null, context);
    }

    public static FriendlyError describe(String errorMessage, ErrorContext context) {
        ErrorContext resolved = context != null ? context : ErrorContext.GENERAL;
        String lowerMessage = errorMessage != null ? errorMessage.toLowerCase(Locale.ROOT) : "";
        for (ErrorPattern pattern : PATTERNS) {
            if (pattern.matches(lowerMessage, resolved)) {
                return pattern.error();
            }
        }
        return FALLBACKS.get(resolved);
    }

    private record ErrorPattern(List<String> keywords, Set<ErrorContext> contexts, FriendlyError error) {

        boolean matches(String lowerMessage, ErrorContext context) {
            return contexts.contains(context) && keywords.stream().anyMatch(lowerMessage::contains);
        }
    }
}
