package dev.pekelund.finsight.documents.tabular;

/**
 * Match weights and gate threshold for {@link ColumnMapper}.
 *
 * @param exact weight of a header equal to the field name once normalised
 * @param synonym weight of a header equal to one of the field's synonyms
 * @param partial weight of a header containing a synonym or contained in one
 * @param requiredShare share of the overall confidence driven by required fields, the rest coming from all mapped
 *     columns
 * @param autoApplyThreshold minimum confidence for a mapping to be applied without confirmation
 */
public record MappingWeights(double exact, double synonym, double partial, double requiredShare,
    double autoApplyThreshold) {

    public MappingWeights {
        if (!(exact >= synonym && synonym >= partial && partial > 0.0)) {
            throw new IllegalArgumentException("Mapping weights must satisfy exact >= synonym >= partial > 0");
        }
        if (exact > 1.0 || requiredShare < 0.0 || requiredShare > 1.0) {
            throw new IllegalArgumentException("Mapping weights and required share must be within [0, 1]");
        }
    }

    public static MappingWeights defaults() {
        return new MappingWeights(1.0, 0.85, 0.7, 0.7, 0.80);
    }
}
