package com.commissionaudit.reconciliation.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A detail line whose own reported commission disagrees with the recomputation.
 */
@Value
@Builder
public class LineDiscrepancy {

    String region;
    int sourceRow;
    String invoiceId;
    String customerId;
    ProductClass productClass;
    BigDecimal salesAmount;
    String tierName;
    BigDecimal appliedRate;
    BigDecimal recomputed;
    BigDecimal reported;
    BigDecimal delta;
    Classification classification;
}
