package com.commissionaudit.reconciliation.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class DiscrepancyEntry {

    String region;
    BigDecimal recomputedTotal;
    BigDecimal reportedTotal;       // null when the payer reported nothing usable
    String reportedSource;          // A1 cell reference
    boolean heuristic;
    BigDecimal delta;
    Classification classification;

    public boolean isFlagged() {
        return classification != Classification.ALIGNED;
    }
}
