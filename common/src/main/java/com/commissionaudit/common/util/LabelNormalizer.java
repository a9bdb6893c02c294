package com.commissionaudit.common.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes header and label text so that spreadsheets with different
 * capitalization, spacing and punctuation compare equal.
 *
 * "Ship To State", "ship_to_state" and "SHIPTOSTATE" all normalize to "shiptostate".
 */
public final class LabelNormalizer {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    private LabelNormalizer() {
        // Utility class - no instantiation
    }

    /**
     * Lower-case the text and strip every non-alphanumeric character.
     */
    public static String normalize(Object text) {
        if (text == null) {
            return "";
        }
        return NON_ALPHANUMERIC.matcher(text.toString().toLowerCase(Locale.ROOT)).replaceAll("");
    }

    /**
     * Check whether the normalized text contains the normalized pattern.
     */
    public static boolean containsLabel(Object text, String pattern) {
        String normalizedPattern = normalize(pattern);
        if (normalizedPattern.isEmpty()) {
            return false;
        }
        return normalize(text).contains(normalizedPattern);
    }

    /**
     * Check if a cell value carries no content.
     */
    public static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }
}
