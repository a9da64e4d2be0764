package dev.pekelund.finsight.documents.summary;

import java.util.List;

/**
 * Canned follow-up questions offered after a document has been summarised.
 */
public final class SuggestedQuestions {

    private SuggestedQuestions() {
    }

    public static List<String> forSummary(SmartSummary summary) {
        return forType(summary != null ? summary.documentType() : SummaryDocumentType.UNKNOWN);
    }

    public static List<String> forType(SummaryDocumentType type) {
        if (type == null) {
            return general();
        }
        return switch (type) {
            case PL -> List.of(
                "What are my biggest expense categories?",
                "How does this compare to last month?",
                "What's my profit margin?");
            case PAYROLL -> List.of(
                "What's my average employee cost?",
                "Show me payroll by department",
                "How has payroll changed over time?");
            case EXPENSE -> List.of(
                "Where am I spending the most?",
                "Are there any unusual expenses?",
                "How can I reduce costs?");
            case EMPLOYEES -> List.of(
                "What's my total payroll cost?",
                "Show me headcount by department",
                "What are my labor costs?");
            case CSV, PDF, UNKNOWN -> general();
        };
    }

    private static List<String> general() {
        return List.of(
            "What insights can you find in this data?",
            "Summarize the key points",
            "Are there any patterns I should know about?");
    }
}
