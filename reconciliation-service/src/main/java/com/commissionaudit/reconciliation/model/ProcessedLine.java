package com.commissionaudit.reconciliation.model;

import com.commissionaudit.reconciliation.policy.CommissionTier;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A transaction with the commission recomputed under its region's tier.
 */
@Value
@Builder
public class ProcessedLine {

    Transaction transaction;
    CommissionTier tier;
    BigDecimal appliedRate;
    BigDecimal recomputedCommission;

    /**
     * Positive when the payer under-reported this line.
     */
    public BigDecimal getLineDelta() {
        return recomputedCommission.subtract(transaction.getReportedCommission());
    }
}
