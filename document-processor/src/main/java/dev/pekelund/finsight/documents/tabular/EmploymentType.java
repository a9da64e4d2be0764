package dev.pekelund.finsight.documents.tabular;

import java.util.Locale;

public enum EmploymentType {

    FULL_TIME("full-time"),
    PART_TIME("part-time"),
    CONTRACTOR("contractor");

    private final String code;

    EmploymentType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Interprets free text such as {@code "Part Time"}, {@code "PT"} or {@code "1099 contract"}; anything
     * unrecognised, including blank input, is full-time.
     */
    public static EmploymentType fromText(String value) {
        if (value == null) {
            return FULL_TIME;
        }
        String letters = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
        if (letters.contains("part") || letters.equals("pt")) {
            return PART_TIME;
        }
        if (letters.contains("contract")) {
            return CONTRACTOR;
        }
        return FULL_TIME;
    }
}
