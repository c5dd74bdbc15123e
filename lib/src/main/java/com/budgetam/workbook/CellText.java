package com.budgetam.workbook;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Text rules shared by every workbook grammar: marker normalization and the lenient numeric
 * conversions applied to figure columns.
 */
public final class CellText {

    private static final String LABEL_PUNCTUATION = ":.՝։-—–_";

    private CellText() {}

    /** Trims, lower-cases and removes all whitespace. */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String lower = text.trim().toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length());
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (!Character.isWhitespace(c) && !Character.isSpaceChar(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /** {@link #normalize(String)} followed by removal of the punctuation that trails labels. */
    public static String normalizeLabel(String text) {
        String normalized = normalize(text);
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char c = normalized.charAt(i);
            if (LABEL_PUNCTUATION.indexOf(c) < 0) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Parses a plain decimal number (optional sign, digits, optional fraction and exponent).
     *
     * @throws NumberFormatException if the text is blank or not a decimal number
     */
    public static BigDecimal parseDecimal(String text) {
        if (text == null) {
            throw new NumberFormatException("null");
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new NumberFormatException("Empty decimal");
        }
        return new BigDecimal(trimmed);
    }

    /** Decimal syntax only; {@code NaN} and {@code Infinity} spellings are not numbers here. */
    public static boolean isNumeric(String text) {
        try {
            parseDecimal(text);
            return true;
        } catch (NumberFormatException ex) {
            return false;
        }
    }

    /** Figure value of the cell; non-numeric content such as {@code "-"} counts as zero. */
    public static double parseAmount(String text) {
        return isNumeric(text) ? parseDecimal(text).doubleValue() : 0.0;
    }

    /** Converts a percentage cell ({@code 71.2} or {@code 71.2%}) to a fraction ({@code 0.712}). */
    public static double parseFraction(String text) {
        String stripped = text == null ? "" : text.trim().replace("%", "");
        if (!isNumeric(stripped)) {
            return 0.0;
        }
        return parseDecimal(stripped).movePointLeft(2).doubleValue();
    }

    /**
     * Integer code of a numeric cell, truncating any fraction ({@code "12.0"} is 12).
     *
     * @throws NumberFormatException if the cell is not numeric or does not fit an int
     */
    public static int parseCode(String text) {
        BigDecimal value = parseDecimal(text);
        try {
            return value.setScale(0, RoundingMode.DOWN).intValueExact();
        } catch (ArithmeticException ex) {
            throw new NumberFormatException("Code out of range: " + text);
        }
    }
}
