package com.commissionaudit.common.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for amount parsing and rounding.
 *
 * Amounts are parsed and accumulated at full precision.
 * Rounding to cents happens only when values are presented.
 */
public final class AmountUtils {

    private static final Pattern LEADING_NUMERIC_PATTERN =
            Pattern.compile("[-+]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][-+]?\\d+)?");
    private static final Pattern STRICT_NUMERIC_PATTERN = Pattern.compile("-?(?:\\d+(?:\\.\\d*)?|\\.\\d+)");

    private AmountUtils() {
        // Utility class - no instantiation
    }

    /**
     * Parse amount from a spreadsheet cell value.
     *
     * Handles:
     * - Thousands separators and currency symbols ("$1,234.50")
     * - Whitespace, including non-breaking spaces, and percent signs
     * - Trailing text after the number ("50 units")
     *
     * The number must start the cleaned value: "(1,250.00)", "PO 2024" and
     * "USD 50.00" all parse to ZERO.
     *
     * @param value Value to parse
     * @return BigDecimal amount or ZERO if parsing fails
     */
    public static BigDecimal parseAmount(Object value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }

        if (value instanceof Number number) {
            return fromNumber(number);
        }

        String stringValue = stripDecorations(value.toString()).replace("%", "");

        Matcher matcher = LEADING_NUMERIC_PATTERN.matcher(stringValue);
        if (!matcher.lookingAt()) {
            return BigDecimal.ZERO;
        }

        try {
            return new BigDecimal(matcher.group());
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    /**
     * Parse a cell that must hold nothing but a number (currency, separators and
     * percent signs allowed). Used where a stray number inside a label must not count.
     *
     * @return parsed amount, or null when the cell is not a plain number
     */
    public static BigDecimal parseStrict(Object value) {
        if (value == null || value instanceof Boolean) {
            return null;
        }

        if (value instanceof Number number) {
            double asDouble = number.doubleValue();
            if (Double.isNaN(asDouble) || Double.isInfinite(asDouble)) {
                return null;
            }
            return fromNumber(number);
        }

        String stringValue = stripDecorations(value.toString()).replace("%", "");
        if (!STRICT_NUMERIC_PATTERN.matcher(stringValue).matches()) {
            return null;
        }
        return new BigDecimal(stringValue);
    }

    /**
     * Round amount to 2 decimal places for presentation.
     */
    public static BigDecimal round(BigDecimal amount) {
        if (amount == null) {
            return null;
        }
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Check if amount is positive (greater than zero).
     */
    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.compareTo(BigDecimal.ZERO) > 0;
    }

    private static BigDecimal fromNumber(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Integer || number instanceof Long || number instanceof Short) {
            return BigDecimal.valueOf(number.longValue());
        }
        double asDouble = number.doubleValue();
        if (Double.isNaN(asDouble) || Double.isInfinite(asDouble)) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(asDouble);
    }

    private static String stripDecorations(String raw) {
        return raw
                // Remove various whitespace characters
                .replaceAll("[\\s\\u00A0\\u202F\\u2009]+", "")
                .replace("$", "")
                .replace(",", "")
                .trim();
    }
}
