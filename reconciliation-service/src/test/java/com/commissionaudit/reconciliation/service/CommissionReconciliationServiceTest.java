package com.commissionaudit.reconciliation.service;

import com.commissionaudit.reconciliation.TestWorkbooks;
import com.commissionaudit.reconciliation.config.SummaryExtractionProperties;
import com.commissionaudit.reconciliation.model.Classification;
import com.commissionaudit.reconciliation.model.DiscrepancyEntry;
import com.commissionaudit.reconciliation.model.ReconciliationResult;
import com.commissionaudit.reconciliation.model.TabularGrid;
import com.commissionaudit.reconciliation.model.WorkbookGrids;
import com.commissionaudit.reconciliation.policy.CommissionPolicy;
import com.commissionaudit.reconciliation.service.extraction.FieldExtractor;
import com.commissionaudit.reconciliation.service.extraction.SummaryExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommissionReconciliationServiceTest {

    private CommissionReconciliationService service;

    @BeforeEach
    void setUp() {
        service = new CommissionReconciliationService(
                new FieldExtractor(),
                new StateAggregator(new TransactionProcessor()),
                new SummaryExtractor(new SummaryExtractionProperties()),
                new Reconciler(),
                CommissionPolicy.defaultPolicy());
    }

    @Test
    void reconcile_ShouldFindTexasUnderpaidByFifty() {
        ReconciliationResult result = service.reconcile(grids(
                TestWorkbooks.texasDetail(),
                List.of(List.of("FINAL COMMISSION", 150.0))));

        assertEquals(1, result.getRegions().size());
        assertEquals(3, result.getTransactionCount());
        assertEquals(0, result.getSkippedRows());

        DiscrepancyEntry tx = result.getDiscrepancies().get(0);
        assertEquals(0, new BigDecimal("200").compareTo(tx.getRecomputedTotal()));
        assertEquals(0, new BigDecimal("50").compareTo(tx.getDelta()));
        assertEquals(Classification.UNDERPAID, tx.getClassification());
        assertEquals(0, new BigDecimal("50").compareTo(result.getTotals().getTotalOwed()));

        // Each line reported 1% of its sales, which is what Tier 2 pays
        assertTrue(result.getLineDiscrepancies().isEmpty());
    }

    @Test
    void reconcile_ShouldCountSkippedRowsButIgnoreEmptyOnes() {
        List<List<Object>> detail = new ArrayList<>(TestWorkbooks.texasDetail());
        detail.add(Arrays.asList("INV-4", null, 900.0, 9.0));      // no region
        detail.add(Arrays.asList("INV-5", "TX", 0.0, 0.0));        // no sales
        detail.add(Arrays.asList(null, null, null, null));         // empty

        ReconciliationResult result = service.reconcile(grids(detail, List.of(List.of("FINAL COMMISSION", 200.0))));

        assertEquals(6, result.getDetailRows());
        assertEquals(3, result.getTransactionCount());
        assertEquals(2, result.getSkippedRows());
        assertEquals(Classification.ALIGNED, result.getDiscrepancies().get(0).getClassification());
    }

    @Test
    void reconcile_ShouldBeDeterministic() {
        WorkbookGrids grids = grids(
                List.of(
                        List.of("State", "Revenue", "New Product Commission"),
                        List.of("TX", 12000.0, 100.0),
                        List.of("CA", 800.0, 0.0),
                        List.of("TX", 41000.5, 0.0)),
                List.of(
                        List.of("State", "Final Commission"),
                        List.of("TX", 900.0),
                        List.of("CA", 16.0)));

        ReconciliationResult first = service.reconcile(grids);
        ReconciliationResult second = service.reconcile(grids);

        assertEquals(first, second);
        assertEquals(List.of("TX", "CA"), first.getRegions().stream().map(r -> r.getRegion()).toList());
    }

    @Test
    void reconcile_ShouldTreatEveryRegionAsUnderpaidWhenSummaryIsEmpty() {
        ReconciliationResult result = service.reconcile(grids(
                List.of(
                        List.of("State", "Revenue"),
                        List.of("TX", 1000.0),
                        List.of("CA", 2000.0)),
                List.of(List.of("Thank you for your business"))));

        for (DiscrepancyEntry entry : result.getDiscrepancies()) {
            assertNull(entry.getReportedTotal());
            assertEquals(0, entry.getRecomputedTotal().compareTo(entry.getDelta()));
            assertEquals(Classification.UNDERPAID, entry.getClassification());
        }
        assertEquals(2, result.getTotals().getImpactedRegions());
        assertEquals(0, new BigDecimal("60").compareTo(result.getTotals().getTotalOwed()));
    }

    @Test
    void reconcile_ShouldHandleDetailWithoutTransactions() {
        ReconciliationResult result = service.reconcile(grids(
                List.of(List.of("State", "Revenue")),
                List.of(List.of("Final Commission", 150.0))));

        assertTrue(result.getRegions().isEmpty());
        assertTrue(result.getDiscrepancies().isEmpty());
        assertEquals(Classification.OVERPAID, result.getOverall().getClassification());
    }

    private static WorkbookGrids grids(List<List<Object>> detail, List<List<Object>> summary) {
        return WorkbookGrids.builder()
                .fileName("test.xlsx")
                .detail(TabularGrid.of("Detail", detail))
                .summary(TabularGrid.of("Summary", summary))
                .build();
    }
}
