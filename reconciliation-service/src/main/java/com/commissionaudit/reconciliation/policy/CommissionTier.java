package com.commissionaudit.reconciliation.policy;

import com.commissionaudit.reconciliation.model.ProductClass;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One row of the tier table. Rates are fractions (0.02 = 2%).
 */
@Value
@Builder
public class CommissionTier {

    String name;
    BigDecimal min;
    BigDecimal max;         // null = unbounded
    BigDecimal repeatRate;
    BigDecimal newRate;
    BigDecimal incentiveRate;

    @Builder.Default
    BigDecimal bonus = BigDecimal.ZERO;

    public boolean isUnbounded() {
        return max == null;
    }

    public boolean contains(BigDecimal totalSales) {
        return totalSales.compareTo(min) >= 0 && (max == null || totalSales.compareTo(max) <= 0);
    }

    public BigDecimal rateFor(ProductClass productClass) {
        return switch (productClass) {
            case INCENTIVE -> incentiveRate;
            case NEW -> newRate;
            case REPEAT -> repeatRate;
        };
    }
}
