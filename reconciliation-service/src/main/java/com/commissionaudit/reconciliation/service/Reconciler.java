package com.commissionaudit.reconciliation.service;

import com.commissionaudit.reconciliation.model.Classification;
import com.commissionaudit.reconciliation.model.DiscrepancyEntry;
import com.commissionaudit.reconciliation.model.LineDiscrepancy;
import com.commissionaudit.reconciliation.model.PerRegionReported;
import com.commissionaudit.reconciliation.model.ProcessedLine;
import com.commissionaudit.reconciliation.model.ReconciliationResult;
import com.commissionaudit.reconciliation.model.ReconciliationResult.GrandTotals;
import com.commissionaudit.reconciliation.model.ReconciliationResult.ReconciliationTotals;
import com.commissionaudit.reconciliation.model.RegionAggregate;
import com.commissionaudit.reconciliation.model.ReportedTotals;
import com.commissionaudit.reconciliation.model.ReportedValue;
import com.commissionaudit.reconciliation.model.Transaction;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Compares recomputed totals with what the payer reported.
 *
 * A region is compared with its own row of the summary region table when there
 * is one. Without it, a workbook-level total can only be attributed when the
 * workbook covers a single region; otherwise the region counts as unreported.
 */
@Component
public class Reconciler {

    public static final String OVERALL_REGION = "ALL";

    public ReconciliationResult reconcile(List<RegionAggregate> aggregates,
                                          ReportedTotals reportedTotals,
                                          PerRegionReported perRegionReported) {
        Optional<ReportedValue> workbookTotal = reportedTotals.effectiveTotalCommission();

        List<DiscrepancyEntry> discrepancies = new ArrayList<>(aggregates.size());
        BigDecimal totalRecomputed = BigDecimal.ZERO;
        BigDecimal totalReported = BigDecimal.ZERO;
        int impacted = 0;

        for (RegionAggregate aggregate : aggregates) {
            ReportedValue reported = perRegionReported.get(aggregate.getRegion())
                    .or(() -> aggregates.size() == 1 ? workbookTotal : Optional.empty())
                    .orElse(null);

            DiscrepancyEntry entry = compare(aggregate.getRegion(), aggregate.getTotalWithBonus(), reported);
            discrepancies.add(entry);

            totalRecomputed = totalRecomputed.add(aggregate.getTotalWithBonus());
            if (entry.getReportedTotal() != null) {
                totalReported = totalReported.add(entry.getReportedTotal());
            }
            if (entry.isFlagged()) {
                impacted++;
            }
        }

        GrandTotals grand = grandTotals(aggregates);

        return ReconciliationResult.builder()
                .regions(aggregates)
                .grand(grand)
                .discrepancies(Collections.unmodifiableList(discrepancies))
                .overall(compare(OVERALL_REGION, grand.getTotalWithBonus(),
                        overallReported(reportedTotals, perRegionReported).orElse(null)))
                .lineDiscrepancies(lineDiscrepancies(aggregates))
                .reportedTotals(reportedTotals)
                .perRegionReported(perRegionReported)
                .totals(ReconciliationTotals.builder()
                        .totalRecomputed(totalRecomputed)
                        .totalReported(totalReported)
                        .totalOwed(totalRecomputed.subtract(totalReported))
                        .impactedRegions(impacted)
                        .build())
                .build();
    }

    DiscrepancyEntry compare(String region, BigDecimal recomputed, ReportedValue reported) {
        BigDecimal reportedTotal = reported != null && reported.isPresent() ? reported.getValue() : null;
        BigDecimal delta = reportedTotal != null ? recomputed.subtract(reportedTotal) : recomputed;

        return DiscrepancyEntry.builder()
                .region(region)
                .recomputedTotal(recomputed)
                .reportedTotal(reportedTotal)
                .reportedSource(reportedTotal != null ? reported.getCellReference() : null)
                .heuristic(reportedTotal != null && reported.isHeuristic())
                .delta(delta)
                .classification(Classification.of(delta))
                .build();
    }

    /**
     * Workbook-wide reported figure: the region table's grand total, else the sum of
     * its rows, else the labelled (or guessed) workbook total.
     */
    private Optional<ReportedValue> overallReported(ReportedTotals reportedTotals, PerRegionReported perRegion) {
        if (perRegion.getGrandTotal().isPresent()) {
            return Optional.of(perRegion.getGrandTotal());
        }
        if (!perRegion.isEmpty()) {
            BigDecimal sum = perRegion.asMap().values().stream()
                    .map(ReportedValue::getValue)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            return Optional.of(ReportedValue.builder().value(sum).found(true).build());
        }
        return reportedTotals.effectiveTotalCommission();
    }

    private GrandTotals grandTotals(List<RegionAggregate> aggregates) {
        BigDecimal sales = BigDecimal.ZERO;
        BigDecimal commission = BigDecimal.ZERO;
        BigDecimal bonus = BigDecimal.ZERO;
        BigDecimal withBonus = BigDecimal.ZERO;
        BigDecimal reported = BigDecimal.ZERO;

        for (RegionAggregate aggregate : aggregates) {
            sales = sales.add(aggregate.getTotalSales());
            commission = commission.add(aggregate.getRecomputedCommission());
            bonus = bonus.add(aggregate.getBonus());
            withBonus = withBonus.add(aggregate.getTotalWithBonus());
            reported = reported.add(aggregate.getReportedCommission());
        }

        return GrandTotals.builder()
                .totalSales(sales)
                .recomputedCommission(commission)
                .bonus(bonus)
                .totalWithBonus(withBonus)
                .reportedLineCommission(reported)
                .build();
    }

    private List<LineDiscrepancy> lineDiscrepancies(List<RegionAggregate> aggregates) {
        List<LineDiscrepancy> result = new ArrayList<>();
        for (RegionAggregate aggregate : aggregates) {
            for (ProcessedLine line : aggregate.getLines()) {
                Transaction transaction = line.getTransaction();
                if (!transaction.isReportedCommissionPresent()) continue;

                BigDecimal delta = line.getLineDelta();
                Classification classification = Classification.of(delta);
                if (classification == Classification.ALIGNED) continue;

                result.add(LineDiscrepancy.builder()
                        .region(aggregate.getRegion())
                        .sourceRow(transaction.getSourceRow())
                        .invoiceId(transaction.getInvoiceId())
                        .customerId(transaction.getCustomerId())
                        .productClass(transaction.getProductClass())
                        .salesAmount(transaction.getSalesAmount())
                        .tierName(line.getTier().getName())
                        .appliedRate(line.getAppliedRate())
                        .recomputed(line.getRecomputedCommission())
                        .reported(transaction.getReportedCommission())
                        .delta(delta)
                        .classification(classification)
                        .build());
            }
        }
        return Collections.unmodifiableList(result);
    }
}
