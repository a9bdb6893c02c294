package com.commissionaudit.reconciliation.model;

import java.math.BigDecimal;

public enum Classification {

    UNDERPAID,
    OVERPAID,
    ALIGNED;

    /** Absolute tolerance in currency units; fixed, not configurable. */
    public static final BigDecimal TOLERANCE = new BigDecimal("0.01");

    /**
     * Classify delta = recomputed - reported. Exactly 0.01 either way is still aligned.
     */
    public static Classification of(BigDecimal delta) {
        if (delta.compareTo(TOLERANCE) > 0) {
            return UNDERPAID;
        }
        if (delta.compareTo(TOLERANCE.negate()) < 0) {
            return OVERPAID;
        }
        return ALIGNED;
    }
}
