package com.commissionaudit.reconciliation.service;

import com.commissionaudit.reconciliation.model.Classification;
import com.commissionaudit.reconciliation.model.DiscrepancyEntry;
import com.commissionaudit.reconciliation.model.LineDiscrepancy;
import com.commissionaudit.reconciliation.model.PerRegionReported;
import com.commissionaudit.reconciliation.model.ProductClass;
import com.commissionaudit.reconciliation.model.ReconciliationResult;
import com.commissionaudit.reconciliation.model.RegionAggregate;
import com.commissionaudit.reconciliation.model.ReportedField;
import com.commissionaudit.reconciliation.model.ReportedTotals;
import com.commissionaudit.reconciliation.model.ReportedValue;
import com.commissionaudit.reconciliation.model.Transaction;
import com.commissionaudit.reconciliation.policy.CommissionPolicy;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReconcilerTest {

    private final Reconciler reconciler = new Reconciler();
    private final StateAggregator aggregator = new StateAggregator(new TransactionProcessor());
    private final CommissionPolicy policy = CommissionPolicy.defaultPolicy();

    @Test
    void reconcile_ShouldFlagUnderpaidSingleRegion() {
        List<RegionAggregate> aggregates = aggregator.aggregate(List.of(
                repeat("TX", "5000"), repeat("TX", "3000"), repeat("TX", "2000")), policy);

        ReconciliationResult result = reconciler.reconcile(aggregates,
                reported(ReportedField.FINAL_COMMISSION, "150"), PerRegionReported.empty());

        DiscrepancyEntry tx = result.getDiscrepancies().get(0);
        assertEquals("TX", tx.getRegion());
        assertEquals(0, new BigDecimal("200").compareTo(tx.getRecomputedTotal()));
        assertEquals(0, new BigDecimal("150").compareTo(tx.getReportedTotal()));
        assertEquals(0, new BigDecimal("50").compareTo(tx.getDelta()));
        assertEquals(Classification.UNDERPAID, tx.getClassification());
        assertEquals("B1", tx.getReportedSource());

        assertEquals(0, new BigDecimal("50").compareTo(result.getTotals().getTotalOwed()));
        assertEquals(1, result.getTotals().getImpactedRegions());
        assertEquals(0, new BigDecimal("50").compareTo(result.getOverall().getDelta()));
    }

    @Test
    void reconcile_ShouldTreatOneCentAsAligned() {
        List<RegionAggregate> aggregates = aggregator.aggregate(List.of(repeat("TX", "10000")), policy);

        DiscrepancyEntry withinTolerance = reconciler.reconcile(aggregates,
                reported(ReportedField.FINAL_COMMISSION, "199.99"), PerRegionReported.empty())
                .getDiscrepancies().get(0);
        DiscrepancyEntry beyondTolerance = reconciler.reconcile(aggregates,
                reported(ReportedField.FINAL_COMMISSION, "199.989"), PerRegionReported.empty())
                .getDiscrepancies().get(0);
        DiscrepancyEntry overpaid = reconciler.reconcile(aggregates,
                reported(ReportedField.FINAL_COMMISSION, "200.011"), PerRegionReported.empty())
                .getDiscrepancies().get(0);

        assertEquals(Classification.ALIGNED, withinTolerance.getClassification());
        assertFalse(withinTolerance.isFlagged());
        assertEquals(Classification.UNDERPAID, beyondTolerance.getClassification());
        assertEquals(Classification.OVERPAID, overpaid.getClassification());
    }

    @Test
    void reconcile_ShouldNotAttributeWorkbookTotalToSeveralRegions() {
        List<RegionAggregate> aggregates = aggregator.aggregate(List.of(
                repeat("TX", "1000"), repeat("CA", "2000")), policy);

        ReconciliationResult result = reconciler.reconcile(aggregates,
                reported(ReportedField.FINAL_COMMISSION, "60"), PerRegionReported.empty());

        for (DiscrepancyEntry entry : result.getDiscrepancies()) {
            assertNull(entry.getReportedTotal());
            assertEquals(0, entry.getRecomputedTotal().compareTo(entry.getDelta()));
            assertEquals(Classification.UNDERPAID, entry.getClassification());
        }
        assertEquals(0, BigDecimal.ZERO.compareTo(result.getTotals().getTotalReported()));
        assertEquals(0, new BigDecimal("60").compareTo(result.getTotals().getTotalOwed()));

        // The workbook total still feeds the overall comparison
        assertEquals(Classification.ALIGNED, result.getOverall().getClassification());
        assertEquals(Reconciler.OVERALL_REGION, result.getOverall().getRegion());
    }

    @Test
    void reconcile_ShouldUsePerRegionFigures() {
        List<RegionAggregate> aggregates = aggregator.aggregate(List.of(
                repeat("TX", "1000"), repeat("CA", "2000")), policy);
        PerRegionReported perRegion = new PerRegionReported(Map.of(
                "tx", ReportedValue.labelled(new BigDecimal("20"), "C3", "C2"),
                "CA", ReportedValue.labelled(new BigDecimal("30"), "C4", "C2")), null);

        ReconciliationResult result = reconciler.reconcile(aggregates, ReportedTotals.empty(), perRegion);

        DiscrepancyEntry tx = result.getDiscrepancies().get(0);
        DiscrepancyEntry ca = result.getDiscrepancies().get(1);
        assertEquals(Classification.ALIGNED, tx.getClassification());
        assertEquals(Classification.UNDERPAID, ca.getClassification());
        assertEquals(0, new BigDecimal("10").compareTo(ca.getDelta()));
        assertEquals(0, new BigDecimal("50").compareTo(result.getTotals().getTotalReported()));
        assertEquals(0, new BigDecimal("10").compareTo(result.getTotals().getTotalOwed()));
        assertEquals(1, result.getTotals().getImpactedRegions());
        // No grand total row: overall compares against the sum of the table
        assertEquals(0, new BigDecimal("50").compareTo(result.getOverall().getReportedTotal()));
    }

    @Test
    void reconcile_ShouldTreatEverythingAsUnderpaidWhenNothingReported() {
        List<RegionAggregate> aggregates = aggregator.aggregate(List.of(repeat("NV", "500")), policy);

        ReconciliationResult result = reconciler.reconcile(aggregates, ReportedTotals.empty(), PerRegionReported.empty());

        DiscrepancyEntry nv = result.getDiscrepancies().get(0);
        assertNull(nv.getReportedTotal());
        assertEquals(0, new BigDecimal("10").compareTo(nv.getDelta()));
        assertEquals(Classification.UNDERPAID, nv.getClassification());
        assertNull(result.getOverall().getReportedTotal());
    }

    @Test
    void reconcile_ShouldMarkHeuristicComparison() {
        List<RegionAggregate> aggregates = aggregator.aggregate(List.of(repeat("NV", "10000")), policy);
        ReportedTotals guessed = new ReportedTotals(Map.of(), ReportedValue.heuristic(new BigDecimal("200"), "D9"));

        DiscrepancyEntry nv = reconciler.reconcile(aggregates, guessed, PerRegionReported.empty())
                .getDiscrepancies().get(0);

        assertTrue(nv.isHeuristic());
        assertEquals(Classification.ALIGNED, nv.getClassification());
        assertEquals("D9", nv.getReportedSource());
    }

    @Test
    void reconcile_ShouldListLineDiscrepancies() {
        Transaction underReported = Transaction.builder()
                .sourceRow(7)
                .region("TX")
                .invoiceId("INV-7")
                .salesAmount(new BigDecimal("1000"))
                .productClass(ProductClass.REPEAT)
                .reportedCommission(new BigDecimal("15"))
                .reportedCommissionPresent(true)
                .build();
        Transaction matching = Transaction.builder()
                .sourceRow(8)
                .region("TX")
                .salesAmount(new BigDecimal("500"))
                .productClass(ProductClass.REPEAT)
                .reportedCommission(new BigDecimal("10"))
                .reportedCommissionPresent(true)
                .build();
        Transaction unreported = repeat("TX", "800");

        List<RegionAggregate> aggregates = aggregator.aggregate(List.of(underReported, matching, unreported), policy);
        List<LineDiscrepancy> lines = reconciler.reconcile(aggregates, ReportedTotals.empty(), PerRegionReported.empty())
                .getLineDiscrepancies();

        assertEquals(1, lines.size());
        LineDiscrepancy line = lines.get(0);
        assertEquals(7, line.getSourceRow());
        assertEquals("INV-7", line.getInvoiceId());
        assertEquals("Tier 1", line.getTierName());
        assertEquals(0, new BigDecimal("5").compareTo(line.getDelta()));
        assertEquals(Classification.UNDERPAID, line.getClassification());
    }

    @Test
    void reconcile_ShouldHandleNoRegions() {
        ReconciliationResult result = reconciler.reconcile(List.of(), ReportedTotals.empty(), PerRegionReported.empty());

        assertTrue(result.getDiscrepancies().isEmpty());
        assertEquals(0, BigDecimal.ZERO.compareTo(result.getGrand().getTotalWithBonus()));
        assertEquals(Classification.ALIGNED, result.getOverall().getClassification());
    }

    private static Transaction repeat(String region, String sales) {
        return Transaction.builder()
                .region(region)
                .salesAmount(new BigDecimal(sales))
                .productClass(ProductClass.REPEAT)
                .build();
    }

    private static ReportedTotals reported(ReportedField field, String value) {
        return new ReportedTotals(
                Map.of(field, ReportedValue.labelled(new BigDecimal(value), "B1", "A1")), null);
    }
}
