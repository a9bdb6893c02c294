package com.commissionaudit.reconciliation.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Final audit outcome for one workbook. Amounts are unrounded.
 */
@Value
@Builder(toBuilder = true)
public class ReconciliationResult {

    List<RegionAggregate> regions;
    GrandTotals grand;
    List<DiscrepancyEntry> discrepancies;
    DiscrepancyEntry overall;
    List<LineDiscrepancy> lineDiscrepancies;
    ReportedTotals reportedTotals;
    PerRegionReported perRegionReported;
    ReconciliationTotals totals;

    int detailRows;
    int transactionCount;
    int skippedRows;

    @Value
    @Builder
    public static class GrandTotals {
        BigDecimal totalSales;
        BigDecimal recomputedCommission;
        BigDecimal bonus;
        BigDecimal totalWithBonus;
        BigDecimal reportedLineCommission;
    }

    @Value
    @Builder
    public static class ReconciliationTotals {
        BigDecimal totalRecomputed;
        BigDecimal totalReported;
        BigDecimal totalOwed;
        int impactedRegions;
    }
}
