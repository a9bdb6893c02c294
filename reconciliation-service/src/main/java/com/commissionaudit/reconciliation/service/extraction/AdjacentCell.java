package com.commissionaudit.reconciliation.service.extraction;

/**
 * Where a summary value may sit relative to its label.
 */
public enum AdjacentCell {

    RIGHT(0, 1),
    TWO_RIGHT(0, 2),
    DOWN(1, 0),
    DIAGONAL_DOWN_RIGHT(1, 1),
    LEFT(0, -1);

    private final int rowOffset;
    private final int colOffset;

    AdjacentCell(int rowOffset, int colOffset) {
        this.rowOffset = rowOffset;
        this.colOffset = colOffset;
    }

    public int row(int labelRow) {
        return labelRow + rowOffset;
    }

    public int col(int labelCol) {
        return labelCol + colOffset;
    }
}
