package dev.pekelund.finsight.documents.extraction;

/**
 * Builds the natural-language instructions sent to the extraction oracle.
 */
final class ExtractionInstructions {

    private static final String RULES = """
        IMPORTANT INSTRUCTIONS:
        - Extract ALL numeric values you can find
        - Use negative numbers for expenses/costs
        - If a value is not clearly present, omit it (don't guess)
        - Dates should be in YYYY-MM-DD format
        - Currency values should be plain numbers without symbols
        """;

    private static final String FORMAT = """
        Return a single JSON object with the following structure, omitting values that are not present:
        %s
        Do not add code fences or commentary; return only the JSON document.
        """;

    private ExtractionInstructions() {
    }

    static String forDocument(ExtractionSchema schema) {
        return "You are a financial document extraction expert. Analyze this PDF document and extract structured data.\n\n"
            + RULES + '\n'
            + schema.focus() + '\n'
            + FORMAT.formatted(schema.shape());
    }

    static String forText(ExtractionSchema schema, String extractedText, boolean tabular) {
        StringBuilder instruction = new StringBuilder();
        instruction.append("You are a financial document extraction expert. Analyze the following extracted text ")
            .append("from a PDF document and extract structured data.\n\n");
        instruction.append(RULES);
        instruction.append("- The text below was extracted from a PDF, so formatting may be imperfect\n");
        if (tabular) {
            instruction.append("- The text contains tables; read values along their rows and columns\n");
        }
        instruction.append("\nEXTRACTED TEXT:\n").append(extractedText).append("\n\n");
        instruction.append(schema.focus()).append('\n');
        instruction.append(FORMAT.formatted(schema.shape()));
        return instruction.toString();
    }
}
