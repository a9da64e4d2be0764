package dev.pekelund.finsight.documents.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.util.StringUtils;

/**
 * Reads raw oracle responses into typed {@link ExtractionPayload}s.
 */
public class ExtractionPayloadReader {

    private static final Set<String> GENERIC_FIELDS = Set.of("documentType", "rawContent", "tables", "numbers");
    private static final TypeReference<Map<String, Object>> ATTRIBUTE_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ExtractionPayloadReader(ObjectMapper objectMapper) {
        SimpleModule amounts = new SimpleModule("lenient-amounts");
        amounts.addDeserializer(BigDecimal.class, new LenientAmountDeserializer());
        this.objectMapper = objectMapper.copy()
            .registerModule(amounts)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);
    }

    public ExtractionPayload read(ExtractionSchema schema, String response) {
        String json = sanitize(response);
        if (!StringUtils.hasText(json)) {
            throw new ExtractionSchemaException(schema, "Oracle returned an empty response");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new ExtractionSchemaException(schema,
                "Failed to parse extraction response as JSON: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new ExtractionSchemaException(schema, "Extraction response is not a JSON object");
        }

        List<String> missing = new ArrayList<>();
        for (String section : schema.requiredSections()) {
            JsonNode node = root.get(section);
            if (node == null || node.isNull()) {
                missing.add(section);
            }
        }
        if (!missing.isEmpty()) {
            throw new ExtractionSchemaException(schema,
                "Extraction response for " + schema.label() + " is missing required sections: " + missing);
        }

        try {
            return switch (schema) {
                case FINANCIAL_STATEMENT -> objectMapper.treeToValue(root, ExtractionPayload.FinancialStatement.class);
                case PAYROLL -> objectMapper.treeToValue(root, ExtractionPayload.Payroll.class);
                case EXPENSE -> objectMapper.treeToValue(root, ExtractionPayload.Expense.class);
                case GENERIC -> readGeneric((ObjectNode) root);
            };
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new ExtractionSchemaException(schema,
                "Extraction response does not match the " + schema.label() + " format: " + ex.getMessage(), ex);
        }
    }

    private ExtractionPayload.Generic readGeneric(ObjectNode root) throws JsonProcessingException {
        ExtractionPayload.Generic declared = objectMapper.treeToValue(root, ExtractionPayload.Generic.class);
        Map<String, Object> attributes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!GENERIC_FIELDS.contains(field.getKey()) && !field.getValue().isNull()) {
                Map<String, Object> single = objectMapper.convertValue(
                    Map.of(field.getKey(), field.getValue()), ATTRIBUTE_TYPE);
                attributes.putAll(single);
            }
        }
        return new ExtractionPayload.Generic(declared.documentType(), declared.rawContent(), declared.tables(),
            declared.numbers(), Collections.unmodifiableMap(attributes));
    }

    /**
     * Strips markdown code fences and any prose around the outermost JSON object.
     */
    static String sanitize(String response) {
        if (response == null) {
            return null;
        }
        String cleaned = response.strip();
        if (cleaned.startsWith("```")) {
            int firstNewline = cleaned.indexOf('\n');
            cleaned = firstNewline < 0 ? cleaned.substring(3) : cleaned.substring(firstNewline + 1);
            int closingFence = cleaned.lastIndexOf("```");
            if (closingFence >= 0) {
                cleaned = cleaned.substring(0, closingFence);
            }
        }
        cleaned = cleaned.replace("`", "").strip();
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start >= 0 && end > start) {
            cleaned = cleaned.substring(start, end + 1);
        }
        return cleaned;
    }
}
