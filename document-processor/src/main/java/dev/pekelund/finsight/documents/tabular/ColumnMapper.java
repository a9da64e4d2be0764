package dev.pekelund.finsight.documents.tabular;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps source headers onto the canonical fields of a {@link TabularDocumentType}.
 *
 * <p>Headers are visited in order; each takes the unclaimed field with the highest match weight (ties go to the
 * field declared first) and claims it. Headers without any match map to {@link TabularDocumentType#IGNORE} and do
 * not count towards the overall confidence.
 */
public class ColumnMapper {

    private static final Logger LOGGER = LoggerFactory.getLogger(ColumnMapper.class);
    private static final Pattern SEPARATORS = Pattern.compile("[_\\s-]+");

    private final MappingWeights weights;

    public ColumnMapper(MappingWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights");
    }

    public AutoMappingResult map(List<String> headers, TabularDocumentType type) {
        Objects.requireNonNull(type, "type");
        List<String> sourceHeaders = headers == null ? List.of() : headers;

        Map<String, String> assignments = new LinkedHashMap<>();
        Map<String, Double> confidences = new LinkedHashMap<>();
        Set<String> claimed = new HashSet<>();
        List<String> warnings = new ArrayList<>();

        for (String header : sourceHeaders) {
            TargetField bestField = null;
            double bestScore = 0.0;
            for (TargetField field : type.targetFields()) {
                if (claimed.contains(field.name())) {
                    continue;
                }
                double score = score(header, field);
                if (score > bestScore) {
                    bestField = field;
                    bestScore = score;
                }
            }

            if (bestField == null) {
                assignments.put(header, TabularDocumentType.IGNORE);
                continue;
            }
            assignments.put(header, bestField.name());
            confidences.put(header, bestScore);
            claimed.add(bestField.name());
            if (bestField.required() && bestScore < weights.synonym()) {
                warnings.add("\"%s\" → %s (low confidence)".formatted(header, bestField.name()));
            }
        }

        List<String> requiredFields = type.requiredFields();
        int requiredMapped = 0;
        double requiredConfidenceSum = 0.0;
        for (Map.Entry<String, String> entry : assignments.entrySet()) {
            if (requiredFields.contains(entry.getValue())) {
                requiredMapped++;
                requiredConfidenceSum += confidences.get(entry.getKey());
            }
        }

        double requiredComponent = requiredFields.isEmpty()
            ? 1.0
            : ((double) requiredMapped / requiredFields.size()) * (requiredConfidenceSum / Math.max(requiredMapped, 1));
        double overallComponent = confidences.isEmpty()
            ? 0.0
            : confidences.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double confidence = round(requiredComponent * weights.requiredShare()
            + overallComponent * (1.0 - weights.requiredShare()));

        boolean allRequired = requiredMapped == requiredFields.size();
        boolean autoApply = confidence >= weights.autoApplyThreshold() && allRequired;

        LOGGER.info("Mapped {} of {} columns for {} with confidence {} (required {}/{}, auto-apply {})",
            confidences.size(), sourceHeaders.size(), type, confidence, requiredMapped, requiredFields.size(),
            autoApply);
        return new AutoMappingResult(new ColumnMapping(assignments), confidences, confidence, requiredMapped,
            requiredFields.size(), autoApply, warnings);
    }

    double score(String header, TargetField field) {
        if (header == null) {
            return 0.0;
        }
        String normalisedHeader = normalise(header);
        if (normalisedHeader.isEmpty()) {
            return 0.0;
        }
        if (normalisedHeader.equals(normalise(field.name()))) {
            return weights.exact();
        }
        for (String synonym : field.synonyms()) {
            if (normalisedHeader.equals(normalise(synonym))) {
                return weights.synonym();
            }
        }
        for (String synonym : field.synonyms()) {
            String normalisedSynonym = normalise(synonym);
            if (normalisedHeader.contains(normalisedSynonym) || normalisedSynonym.contains(normalisedHeader)) {
                return weights.partial();
            }
        }
        return 0.0;
    }

    static String normalise(String value) {
        return SEPARATORS.matcher(value.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
