package com.commissionaudit.reconciliation.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One commissionable detail row. Immutable once extracted.
 */
@Value
@Builder
public class Transaction {

    int sourceRow;              // 1-based spreadsheet row
    String region;

    @Builder.Default
    String invoiceId = "";

    @Builder.Default
    String itemCode = "";

    @Builder.Default
    String customerId = "";

    BigDecimal salesAmount;
    ProductClass productClass;

    @Builder.Default
    BigDecimal reportedCommission = BigDecimal.ZERO;

    // True when any commission column in the row carried a value
    boolean reportedCommissionPresent;

    @Builder.Default
    BigDecimal reportedRepeatCommission = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal reportedNewCommission = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal reportedIncentiveCommission = BigDecimal.ZERO;

    BigDecimal incentiveRateOverride;   // nullable, already a fraction
}
