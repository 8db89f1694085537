package com.invoice.memory.rules;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text helpers shared by the default correction rules.
 */
public final class DocumentText {

    private static final Pattern GERMAN_DATE = Pattern.compile("(\\d{2})\\.(\\d{2})\\.(\\d{4})");

    private DocumentText() {
    }

    /**
     * Case-insensitive check for any of the given keywords.
     */
    public static boolean containsAny(String text, String... keywords) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Finds the first {@code DD.MM.YYYY} token and rewrites it as {@code YYYY-MM-DD}.
     */
    public static Optional<String> firstDate(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = GERMAN_DATE.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(m.group(3) + "-" + m.group(2) + "-" + m.group(1));
    }

    /**
     * {@code round(gross - net, 2)}, half-up.
     */
    public static BigDecimal taxFromTotals(BigDecimal grossTotal, BigDecimal netTotal) {
        return grossTotal.subtract(netTotal).setScale(2, RoundingMode.HALF_UP);
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
