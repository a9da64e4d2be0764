package dev.pekelund.finsight.documents.support;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort parsing and US-style formatting of monetary amounts found in spreadsheets and oracle output.
 */
public final class Amounts {

    private static final Pattern IGNORED_CHARACTERS = Pattern.compile("[$,\\s]");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    // Bounds keep formatting and aggregation cheap; "1e999999999" is not a spreadsheet amount.
    private static final int MAX_INTEGER_DIGITS = 30;
    private static final int MAX_SCALE = 100;

    private Amounts() {
    }

    /**
     * Parses numbers and numeric strings such as {@code "$1,234.50"}, {@code "-12"} or {@code "(300)"}. Trailing
     * text after a leading number is ignored, so {@code "12 hours"} yields 12.
     *
     * @return the parsed amount, or empty when the value carries no leading number or its magnitude is out of range
     */
    public static Optional<BigDecimal> parse(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof BigDecimal decimal) {
            return bounded(decimal);
        }
        if (value instanceof Number number) {
            double asDouble = number.doubleValue();
            if (Double.isNaN(asDouble) || Double.isInfinite(asDouble)) {
                return Optional.empty();
            }
            return bounded(new BigDecimal(number.toString()));
        }
        if (!(value instanceof CharSequence text)) {
            return Optional.empty();
        }

        String cleaned = IGNORED_CHARACTERS.matcher(text).replaceAll("");
        boolean parenthesised = cleaned.length() > 2 && cleaned.startsWith("(") && cleaned.endsWith(")");
        if (parenthesised) {
            cleaned = cleaned.substring(1, cleaned.length() - 1);
        }
        Matcher matcher = LEADING_NUMBER.matcher(cleaned);
        if (!matcher.find()) {
            return Optional.empty();
        }
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(matcher.group());
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
        return bounded(parenthesised ? parsed.negate() : parsed);
    }

    private static Optional<BigDecimal> bounded(BigDecimal amount) {
        if (amount.scale() > MAX_SCALE || amount.precision() - amount.scale() > MAX_INTEGER_DIGITS) {
            return Optional.empty();
        }
        return Optional.of(amount);
    }

    public static double parseOrZero(Object value) {
        return parse(value).map(BigDecimal::doubleValue).orElse(0.0);
    }

    /**
     * Formats {@code amount} as whole US dollars, e.g. {@code $12,345} or {@code -$300}.
     */
    public static String formatCurrency(BigDecimal amount) {
        BigDecimal rounded = amount.setScale(0, RoundingMode.HALF_UP);
        String digits = grouping().format(rounded.abs());
        return (rounded.signum() < 0 ? "-$" : "$") + digits;
    }

    public static String formatNumber(long value) {
        return grouping().format(value);
    }

    private static DecimalFormat grouping() {
        return new DecimalFormat("#,##0", DecimalFormatSymbols.getInstance(Locale.US));
    }
}
