package com.commissionaudit.common.dto.reconciliation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Response DTO for reconciling several workbooks in one upload.
 * Carries each workbook's report plus recomputed totals combined per region.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchReconciliationDto {

    private String requestId;
    private int fileCount;
    private String message;

    private List<ReconciliationReportDto> files;
    private List<CombinedRegionDto> combinedRegions;

    private BigDecimal totalWithBonus;
    private BigDecimal totalOwed;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CombinedRegionDto {
        private String region;
        private int fileCount;
        private BigDecimal totalSales;
        private BigDecimal recomputedCommission;
        private BigDecimal bonus;
        private BigDecimal totalWithBonus;
    }
}
