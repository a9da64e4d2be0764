package dev.pekelund.finsight.documents.extraction;

/**
 * Embedded text layer of a PDF.
 */
public record PdfText(String text, int pageCount) {

    public PdfText {
        text = text == null ? "" : text;
    }

    public int length() {
        return text.strip().length();
    }
}
