package dev.pekelund.finsight.documents.tabular;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores a header row against the fingerprint of every known {@link TabularDocumentType}.
 *
 * <p>A type's score is the number of headers that hit one of its general patterns (each pattern counts once) plus
 * {@link DetectionWeights#uniquePatternWeight()} for every header that hits one of its unique patterns. Confidence
 * is {@code min(score / (headers + 2), 1)} rounded to two decimals.
 */
public class TypeDetector {

    private static final Logger LOGGER = LoggerFactory.getLogger(TypeDetector.class);

    private final DetectionWeights weights;

    public TypeDetector(DetectionWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights");
    }

    public DetectedType detect(List<String> headers) {
        if (headers == null || headers.isEmpty()) {
            return DetectedType.unknown();
        }

        List<String> normalised = headers.stream()
            .map(header -> header == null ? "" : header.trim().toLowerCase(Locale.ROOT))
            .toList();

        List<Score> scores = new ArrayList<>();
        for (TabularDocumentType type : TabularDocumentType.values()) {
            if (type != TabularDocumentType.UNKNOWN) {
                scores.add(score(type, headers, normalised));
            }
        }
        // Stable sort keeps declaration order for equal scores.
        scores.sort(Comparator.comparingInt(Score::value).reversed());

        Score best = scores.get(0);
        Score runnerUp = scores.size() > 1 ? scores.get(1) : null;
        if (best.value() < weights.minimumScore()
            || (runnerUp != null && best.value() - runnerUp.value() < weights.minimumLead())) {
            LOGGER.debug("No document type detected for headers {} (best {} with score {})", headers, best.type(),
                best.value());
            return DetectedType.unknown();
        }

        double ratio = Math.min((double) best.value() / (headers.size() + 2), 1.0);
        double confidence = BigDecimal.valueOf(ratio).setScale(2, RoundingMode.HALF_UP).doubleValue();
        LOGGER.info("Detected {} with score {} and confidence {}", best.type(), best.value(), confidence);
        return new DetectedType(best.type(), confidence, best.matched());
    }

    private Score score(TabularDocumentType type, List<String> originalHeaders, List<String> headers) {
        Set<String> usedPatterns = new HashSet<>();
        List<String> matched = new ArrayList<>();
        int uniqueMatches = 0;

        for (int index = 0; index < headers.size(); index++) {
            String header = headers.get(index);
            for (Pattern pattern : type.detectionPatterns()) {
                if (!usedPatterns.contains(pattern.pattern()) && pattern.matcher(header).find()) {
                    usedPatterns.add(pattern.pattern());
                    matched.add(originalHeaders.get(index));
                    break;
                }
            }
            for (Pattern pattern : type.uniquePatterns()) {
                if (pattern.matcher(header).find()) {
                    uniqueMatches++;
                    break;
                }
            }
        }
        return new Score(type, matched.size() + uniqueMatches * weights.uniquePatternWeight(), matched);
    }

    private record Score(TabularDocumentType type, int value, List<String> matched) {
    }
}
