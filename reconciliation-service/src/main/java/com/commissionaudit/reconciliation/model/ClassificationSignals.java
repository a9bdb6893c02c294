package com.commissionaudit.reconciliation.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Raw product-class evidence read from one detail row.
 */
@Value
@Builder
public class ClassificationSignals {

    boolean incentiveFlag;
    boolean newProductFlag;

    @Builder.Default
    BigDecimal incentiveCommission = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal newCommission = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal newProductSales = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal repeatCommission = BigDecimal.ZERO;
}
