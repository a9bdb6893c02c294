package com.commissionaudit.reconciliation.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A decoded sheet: rows of raw cell values (String, Double, Boolean, LocalDate or null).
 * Rows may be ragged; reads outside a row return null.
 */
public final class TabularGrid {

    private final String name;
    private final List<List<Object>> rows;

    private TabularGrid(String name, List<List<Object>> rows) {
        this.name = name;
        this.rows = rows;
    }

    public static TabularGrid of(String name, List<? extends List<?>> rows) {
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<?> row : rows) {
            copy.add(row == null
                    ? List.of()
                    : Collections.unmodifiableList(new ArrayList<Object>(row)));
        }
        return new TabularGrid(name, Collections.unmodifiableList(copy));
    }

    public String getName() {
        return name;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount(int rowIndex) {
        return rowIndex >= 0 && rowIndex < rows.size() ? rows.get(rowIndex).size() : 0;
    }

    public Object cell(int rowIndex, int colIndex) {
        if (rowIndex < 0 || rowIndex >= rows.size() || colIndex < 0) {
            return null;
        }
        List<Object> row = rows.get(rowIndex);
        return colIndex < row.size() ? row.get(colIndex) : null;
    }

    public List<Object> headerRow() {
        return rows.isEmpty() ? List.of() : rows.get(0);
    }

    public List<List<Object>> dataRows() {
        return rows.size() <= 1 ? List.of() : rows.subList(1, rows.size());
    }
}
