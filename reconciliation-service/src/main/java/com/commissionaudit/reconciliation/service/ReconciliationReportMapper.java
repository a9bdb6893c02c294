package com.commissionaudit.reconciliation.service;

import com.commissionaudit.common.dto.reconciliation.BatchReconciliationDto.CombinedRegionDto;
import com.commissionaudit.common.dto.reconciliation.CommissionTierDto;
import com.commissionaudit.common.dto.reconciliation.ReconciliationReportDto;
import com.commissionaudit.common.dto.reconciliation.ReconciliationReportDto.DiscrepancyDto;
import com.commissionaudit.common.dto.reconciliation.ReconciliationReportDto.LineDiscrepancyDto;
import com.commissionaudit.common.dto.reconciliation.ReconciliationReportDto.RegionReportDto;
import com.commissionaudit.common.dto.reconciliation.ReconciliationReportDto.ReportedValueDto;
import com.commissionaudit.common.util.AmountUtils;
import com.commissionaudit.reconciliation.model.DiscrepancyEntry;
import com.commissionaudit.reconciliation.model.LineDiscrepancy;
import com.commissionaudit.reconciliation.model.ProductClass;
import com.commissionaudit.reconciliation.model.ReconciliationResult;
import com.commissionaudit.reconciliation.model.RegionAggregate;
import com.commissionaudit.reconciliation.model.ReportedValue;
import com.commissionaudit.reconciliation.model.WorkbookGrids;
import com.commissionaudit.reconciliation.policy.CommissionPolicy;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps engine results to response DTOs. The only place amounts are rounded.
 */
@Component
public class ReconciliationReportMapper {

    static final String HEURISTIC_TOTAL_KEY = "heuristicTotal";

    public ReconciliationReportDto toReport(WorkbookGrids grids, ReconciliationResult result) {
        ReconciliationResult.GrandTotals grand = result.getGrand();
        ReconciliationResult.ReconciliationTotals totals = result.getTotals();

        return ReconciliationReportDto.builder()
                .fileName(grids.getFileName())
                .detailSheet(grids.getDetail().getName())
                .summarySheet(grids.getSummary().getName())
                .message(summaryMessage(result))
                .detailRows(result.getDetailRows())
                .transactionCount(result.getTransactionCount())
                .skippedRows(result.getSkippedRows())
                .regionCount(result.getRegions().size())
                .impactedRegions(totals.getImpactedRegions())
                .totalSales(AmountUtils.round(grand.getTotalSales()))
                .recomputedCommission(AmountUtils.round(grand.getRecomputedCommission()))
                .bonus(AmountUtils.round(grand.getBonus()))
                .totalWithBonus(AmountUtils.round(grand.getTotalWithBonus()))
                .reportedLineCommission(AmountUtils.round(grand.getReportedLineCommission()))
                .totalReported(AmountUtils.round(totals.getTotalReported()))
                .totalOwed(AmountUtils.round(totals.getTotalOwed()))
                .overall(toDiscrepancy(result.getOverall()))
                .regions(result.getRegions().stream().map(this::toRegion).toList())
                .discrepancies(result.getDiscrepancies().stream().map(this::toDiscrepancy).toList())
                .lineDiscrepancies(result.getLineDiscrepancies().stream().map(this::toLine).toList())
                .reportedTotals(reportedTotals(result))
                .reportedByRegion(reportedByRegion(result))
                .build();
    }

    /**
     * Recomputed totals per region summed across several workbooks, sorted by region.
     */
    public List<CombinedRegionDto> combineRegions(List<ReconciliationResult> results) {
        Map<String, CombinedRegionDto> combined = new TreeMap<>();
        for (ReconciliationResult result : results) {
            for (RegionAggregate aggregate : result.getRegions()) {
                CombinedRegionDto dto = combined.computeIfAbsent(aggregate.getRegion(), region ->
                        CombinedRegionDto.builder()
                                .region(region)
                                .totalSales(BigDecimal.ZERO)
                                .recomputedCommission(BigDecimal.ZERO)
                                .bonus(BigDecimal.ZERO)
                                .totalWithBonus(BigDecimal.ZERO)
                                .build());
                dto.setFileCount(dto.getFileCount() + 1);
                dto.setTotalSales(dto.getTotalSales().add(aggregate.getTotalSales()));
                dto.setRecomputedCommission(dto.getRecomputedCommission().add(aggregate.getRecomputedCommission()));
                dto.setBonus(dto.getBonus().add(aggregate.getBonus()));
                dto.setTotalWithBonus(dto.getTotalWithBonus().add(aggregate.getTotalWithBonus()));
            }
        }

        combined.values().forEach(dto -> {
            dto.setTotalSales(AmountUtils.round(dto.getTotalSales()));
            dto.setRecomputedCommission(AmountUtils.round(dto.getRecomputedCommission()));
            dto.setBonus(AmountUtils.round(dto.getBonus()));
            dto.setTotalWithBonus(AmountUtils.round(dto.getTotalWithBonus()));
        });
        return List.copyOf(combined.values());
    }

    public List<CommissionTierDto> toTierDtos(CommissionPolicy policy) {
        return policy.getTiers().stream()
                .map(tier -> CommissionTierDto.builder()
                        .name(tier.getName())
                        .min(tier.getMin())
                        .max(tier.getMax())
                        .repeatRate(tier.getRepeatRate())
                        .newRate(tier.getNewRate())
                        .incentiveRate(policy.getIncentiveRateOverride() != null
                                ? policy.getIncentiveRateOverride()
                                : tier.getIncentiveRate())
                        .bonus(tier.getBonus())
                        .build())
                .toList();
    }

    private String summaryMessage(ReconciliationResult result) {
        int impacted = result.getTotals().getImpactedRegions();
        if (result.getRegions().isEmpty()) {
            return "No commissionable transactions found";
        }
        if (impacted == 0) {
            return String.format("All %d regions aligned with reported commission", result.getRegions().size());
        }
        return String.format("%d of %d regions differ from reported commission; total owed %s",
                impacted, result.getRegions().size(), AmountUtils.round(result.getTotals().getTotalOwed()));
    }

    private RegionReportDto toRegion(RegionAggregate aggregate) {
        return RegionReportDto.builder()
                .region(aggregate.getRegion())
                .tier(aggregate.getTier().getName())
                .transactionCount(aggregate.getTransactionCount())
                .totalSales(AmountUtils.round(aggregate.getTotalSales()))
                .repeatCommission(AmountUtils.round(aggregate.commissionFor(ProductClass.REPEAT)))
                .newCommission(AmountUtils.round(aggregate.commissionFor(ProductClass.NEW)))
                .incentiveCommission(AmountUtils.round(aggregate.commissionFor(ProductClass.INCENTIVE)))
                .recomputedCommission(AmountUtils.round(aggregate.getRecomputedCommission()))
                .bonus(AmountUtils.round(aggregate.getBonus()))
                .totalWithBonus(AmountUtils.round(aggregate.getTotalWithBonus()))
                .reportedLineCommission(AmountUtils.round(aggregate.getReportedCommission()))
                .build();
    }

    private DiscrepancyDto toDiscrepancy(DiscrepancyEntry entry) {
        return DiscrepancyDto.builder()
                .region(entry.getRegion())
                .recomputedTotal(AmountUtils.round(entry.getRecomputedTotal()))
                .reportedTotal(AmountUtils.round(entry.getReportedTotal()))
                .reportedSource(entry.getReportedSource())
                .heuristic(entry.isHeuristic())
                .delta(AmountUtils.round(entry.getDelta()))
                .classification(entry.getClassification().name())
                .flagged(entry.isFlagged())
                .build();
    }

    private LineDiscrepancyDto toLine(LineDiscrepancy line) {
        return LineDiscrepancyDto.builder()
                .rowIndex(line.getSourceRow())
                .region(line.getRegion())
                .invoiceId(line.getInvoiceId())
                .customerId(line.getCustomerId())
                .productClass(line.getProductClass().name())
                .tier(line.getTierName())
                .salesAmount(AmountUtils.round(line.getSalesAmount()))
                .appliedRate(line.getAppliedRate())
                .recomputed(AmountUtils.round(line.getRecomputed()))
                .reported(AmountUtils.round(line.getReported()))
                .delta(AmountUtils.round(line.getDelta()))
                .classification(line.getClassification().name())
                .build();
    }

    private Map<String, ReportedValueDto> reportedTotals(ReconciliationResult result) {
        Map<String, ReportedValueDto> map = new LinkedHashMap<>();
        result.getReportedTotals().asMap()
                .forEach((field, value) -> map.put(field.getKey(), toReportedValue(value)));

        ReportedValue heuristic = result.getReportedTotals().getHeuristicTotal();
        if (heuristic.isPresent()) {
            map.put(HEURISTIC_TOTAL_KEY, toReportedValue(heuristic));
        }
        return map;
    }

    private Map<String, ReportedValueDto> reportedByRegion(ReconciliationResult result) {
        Map<String, ReportedValueDto> map = new LinkedHashMap<>();
        result.getPerRegionReported().asMap()
                .forEach((region, value) -> map.put(region, toReportedValue(value)));
        return map;
    }

    private ReportedValueDto toReportedValue(ReportedValue value) {
        return ReportedValueDto.builder()
                .value(AmountUtils.round(value.getValue()))
                .found(value.isFound())
                .heuristic(value.isHeuristic())
                .cellReference(value.getCellReference())
                .labelReference(value.getLabelReference())
                .build();
    }
}
