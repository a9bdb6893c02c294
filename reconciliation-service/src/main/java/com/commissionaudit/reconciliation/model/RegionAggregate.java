package com.commissionaudit.reconciliation.model;

import com.commissionaudit.reconciliation.policy.CommissionTier;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * All processed lines of one region, with the tier chosen from the region's total sales.
 * totalSales always equals the sum of the lines' sales amounts.
 */
@Value
@Builder
public class RegionAggregate {

    String region;
    BigDecimal totalSales;
    CommissionTier tier;
    List<ProcessedLine> lines;
    BigDecimal recomputedCommission;
    BigDecimal bonus;
    BigDecimal totalWithBonus;
    BigDecimal reportedCommission;
    Map<ProductClass, BigDecimal> commissionByClass;

    public int getTransactionCount() {
        return lines.size();
    }

    public BigDecimal commissionFor(ProductClass productClass) {
        return commissionByClass.getOrDefault(productClass, BigDecimal.ZERO);
    }
}
