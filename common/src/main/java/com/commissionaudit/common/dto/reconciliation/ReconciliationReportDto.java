package com.commissionaudit.common.dto.reconciliation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a workbook reconciliation.
 * All amounts are rounded to cents; the engine itself works at full precision.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationReportDto {

    private String requestId;
    private String fileName;
    private String detailSheet;
    private String summarySheet;
    private String message;

    // Counts
    private int detailRows;
    private int transactionCount;
    private int skippedRows;
    private int regionCount;
    private int impactedRegions;

    // Grand totals (recomputed)
    private BigDecimal totalSales;
    private BigDecimal recomputedCommission;
    private BigDecimal bonus;
    private BigDecimal totalWithBonus;
    private BigDecimal reportedLineCommission;

    // Reconciliation totals
    private BigDecimal totalReported;
    private BigDecimal totalOwed;

    private DiscrepancyDto overall;
    private List<RegionReportDto> regions;
    private List<DiscrepancyDto> discrepancies;
    private List<LineDiscrepancyDto> lineDiscrepancies;
    private Map<String, ReportedValueDto> reportedTotals;
    private Map<String, ReportedValueDto> reportedByRegion;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RegionReportDto {
        private String region;
        private String tier;
        private int transactionCount;
        private BigDecimal totalSales;
        private BigDecimal repeatCommission;
        private BigDecimal newCommission;
        private BigDecimal incentiveCommission;
        private BigDecimal recomputedCommission;
        private BigDecimal bonus;
        private BigDecimal totalWithBonus;
        private BigDecimal reportedLineCommission;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DiscrepancyDto {
        private String region;
        private BigDecimal recomputedTotal;
        private BigDecimal reportedTotal;   // null when nothing was reported
        private String reportedSource;      // cell reference of the reported figure
        private boolean heuristic;          // reported figure was guessed, not label-confirmed
        private BigDecimal delta;
        private String classification;      // UNDERPAID, OVERPAID, ALIGNED
        private boolean flagged;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LineDiscrepancyDto {
        private int rowIndex;
        private String region;
        private String invoiceId;
        private String customerId;
        private String productClass;
        private String tier;
        private BigDecimal salesAmount;
        private BigDecimal appliedRate;
        private BigDecimal recomputed;
        private BigDecimal reported;
        private BigDecimal delta;
        private String classification;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReportedValueDto {
        private BigDecimal value;
        private boolean found;
        private boolean heuristic;
        private String cellReference;
        private String labelReference;
    }
}
