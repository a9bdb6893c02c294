package com.commissionaudit.reconciliation.model;

import com.commissionaudit.common.util.LabelNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Column lookup for a detail sheet, built once from its header row.
 *
 * Keeps the literal header -> column index map and a normalized index so
 * aliases can be matched regardless of case, spacing and punctuation.
 */
public final class HeaderMap {

    private final Map<String, Integer> columnsByHeader;
    private final Map<String, List<Integer>> columnsByNormalizedHeader;

    private HeaderMap(Map<String, Integer> columnsByHeader, Map<String, List<Integer>> columnsByNormalizedHeader) {
        this.columnsByHeader = columnsByHeader;
        this.columnsByNormalizedHeader = columnsByNormalizedHeader;
    }

    public static HeaderMap of(List<?> headerRow) {
        Map<String, Integer> literal = new LinkedHashMap<>();
        Map<String, List<Integer>> normalized = new LinkedHashMap<>();

        for (int col = 0; col < headerRow.size(); col++) {
            Object header = headerRow.get(col);
            if (LabelNormalizer.isBlank(header)) continue;

            literal.putIfAbsent(header.toString(), col);
            String key = LabelNormalizer.normalize(header);
            if (!key.isEmpty()) {
                normalized.computeIfAbsent(key, k -> new ArrayList<>()).add(col);
            }
        }

        normalized.replaceAll((key, cols) -> List.copyOf(cols));
        return new HeaderMap(Collections.unmodifiableMap(literal), Collections.unmodifiableMap(normalized));
    }

    /**
     * Literal header string -> column index (first occurrence).
     */
    public Map<String, Integer> asMap() {
        return columnsByHeader;
    }

    /**
     * Columns whose normalized header equals the normalized alias, left to right.
     */
    public List<Integer> columnsFor(String alias) {
        return columnsByNormalizedHeader.getOrDefault(LabelNormalizer.normalize(alias), List.of());
    }

    public boolean isEmpty() {
        return columnsByHeader.isEmpty();
    }
}
