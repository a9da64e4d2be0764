package dev.pekelund.finsight.documents.tabular;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads CSV uploads into a {@link TabularParseResult}. The first record is the header row; values are kept as
 * trimmed raw strings and short rows are padded with empty values.
 */
public class TabularParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(TabularParser.class);
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setTrim(true)
        .setIgnoreEmptyLines(true)
        .setAllowMissingColumnNames(true)
        .build();

    public TabularParseResult parse(byte[] content) {
        if (content == null || content.length == 0) {
            throw new TabularParseException("The file is empty");
        }
        return parse(new String(content, StandardCharsets.UTF_8));
    }

    public TabularParseResult parse(String text) {
        if (text == null || text.isBlank()) {
            throw new TabularParseException("The file is empty");
        }
        String source = text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text;

        try (CSVParser parser = csvFormat.parse(new StringReader(source))) {
            List<String> headers = validateHeaders(parser.getHeaderNames());
            List<Map<String, String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                rows.add(toRow(headers, record));
            }
            LOGGER.info("Parsed CSV with {} columns and {} rows", headers.size(), rows.size());
            return TabularParseResult.of(headers, rows);
        } catch (IOException ex) {
            throw new TabularParseException("Failed to read CSV content", ex);
        } catch (UncheckedIOException | IllegalArgumentException | IllegalStateException ex) {
            throw new TabularParseException("The file is not valid CSV: " + ex.getMessage(), ex);
        }
    }

    private List<String> validateHeaders(List<String> headerNames) {
        if (headerNames == null || headerNames.isEmpty()) {
            throw new TabularParseException("The file has no header row");
        }
        Set<String> seen = new HashSet<>();
        List<String> headers = new ArrayList<>(headerNames.size());
        for (int index = 0; index < headerNames.size(); index++) {
            String header = headerNames.get(index) == null ? "" : headerNames.get(index).trim();
            if (header.isEmpty()) {
                throw new TabularParseException("Column %d has an empty header".formatted(index + 1));
            }
            if (!seen.add(header)) {
                throw new TabularParseException("Duplicate column header '%s'".formatted(header));
            }
            headers.add(header);
        }
        return headers;
    }

    private Map<String, String> toRow(List<String> headers, CSVRecord record) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int index = 0; index < headers.size(); index++) {
            String value = index < record.size() ? record.get(index) : "";
            row.put(headers.get(index), value == null ? "" : value.trim());
        }
        return row;
    }
}
