package dev.pekelund.finsight.documents.extraction;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the embedded text layer of PDF documents with PDFBox.
 */
public class PdfTextExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfTextExtractor.class);
    private static final Pattern SPACE_RUN = Pattern.compile(" {2,}");
    private static final Pattern NUMBER = Pattern.compile("[\\d,]+\\.?\\d*");

    public PdfText extract(byte[] pdfBytes) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new PdfTextExtractionException("Cannot read text from an empty PDF document");
        }
        try (PDDocument document = PDDocument.load(new ByteArrayInputStream(pdfBytes))) {
            PDFTextStripper stripper = new PDFTextStripper();
            String text = stripper.getText(document);
            LOGGER.debug("Read {} characters of text from {} PDF page(s)", text == null ? 0 : text.length(),
                document.getNumberOfPages());
            return new PdfText(text, document.getNumberOfPages());
        } catch (IOException ex) {
            throw new PdfTextExtractionException("Failed to read PDF text: " + ex.getMessage(), ex);
        }
    }

    /**
     * Heuristic for text laid out as rows and columns. Needs at least three non-blank lines, then either more than
     * 30% of lines with column separators or more than 20% of lines carrying three or more numbers.
     */
    public boolean looksTabular(String text) {
        if (text == null) {
            return false;
        }
        String[] lines = text.lines().filter(line -> !line.isBlank()).toArray(String[]::new);
        if (lines.length < 3) {
            return false;
        }

        int separated = 0;
        int numeric = 0;
        for (String line : lines) {
            if (line.indexOf('\t') >= 0 || count(line, ',') > 2 || matches(SPACE_RUN, line) > 2) {
                separated++;
            }
            if (matches(NUMBER, line) >= 3) {
                numeric++;
            }
        }
        if (separated > lines.length * 0.3) {
            return true;
        }
        return numeric > lines.length * 0.2;
    }

    private static int count(String line, char character) {
        int total = 0;
        for (int index = 0; index < line.length(); index++) {
            if (line.charAt(index) == character) {
                total++;
            }
        }
        return total;
    }

    private static int matches(Pattern pattern, String line) {
        Matcher matcher = pattern.matcher(line);
        int total = 0;
        while (matcher.find()) {
            total++;
        }
        return total;
    }
}
