package com.commissionaudit.reconciliation.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A figure read from the summary sheet, with where it came from.
 */
@Value
@Builder
public class ReportedValue {

    private static final ReportedValue NOT_FOUND = ReportedValue.builder().build();

    BigDecimal value;
    boolean found;
    boolean heuristic;
    String cellReference;
    String labelReference;

    public static ReportedValue notFound() {
        return NOT_FOUND;
    }

    public static ReportedValue labelled(BigDecimal value, String cellReference, String labelReference) {
        return ReportedValue.builder()
                .value(value)
                .found(true)
                .cellReference(cellReference)
                .labelReference(labelReference)
                .build();
    }

    public static ReportedValue heuristic(BigDecimal value, String cellReference) {
        return ReportedValue.builder()
                .value(value)
                .heuristic(true)
                .cellReference(cellReference)
                .build();
    }

    /**
     * True when a number is available, label-confirmed or guessed.
     */
    public boolean isPresent() {
        return value != null && (found || heuristic);
    }
}
