package com.commissionaudit.reconciliation.service.extraction;

import com.commissionaudit.reconciliation.config.SummaryExtractionProperties;
import com.commissionaudit.reconciliation.model.PerRegionReported;
import com.commissionaudit.reconciliation.model.ReportedField;
import com.commissionaudit.reconciliation.model.ReportedTotals;
import com.commissionaudit.reconciliation.model.ReportedValue;
import com.commissionaudit.reconciliation.model.TabularGrid;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SummaryExtractorTest {

    private final SummaryExtractor extractor = new SummaryExtractor(new SummaryExtractionProperties());

    @Test
    void extract_ShouldReadValueRightOfLabel() {
        ReportedTotals totals = extractor.extract(grid(
                List.of("Commission Summary"),
                List.of("FINAL COMMISSION", 150.0)));

        ReportedValue finalCommission = totals.getFinalCommission();
        assertTrue(finalCommission.isFound());
        assertFalse(finalCommission.isHeuristic());
        assertEquals(0, new BigDecimal("150").compareTo(finalCommission.getValue()));
        assertEquals("B2", finalCommission.getCellReference());
        assertEquals("A2", finalCommission.getLabelReference());
    }

    @Test
    void extract_ShouldFollowAdjacentSearchOrder() {
        // right is text, two-right holds the number
        ReportedTotals twoRight = extractor.extract(grid(List.of("Amount Due Salesperson", "USD", "$812.40")));
        assertEquals("C1", twoRight.getAmountDueToPayee().getCellReference());

        // nothing on the row, value below
        ReportedTotals down = extractor.extract(grid(
                List.of("Repeat Product Commission"),
                List.of(95.5)));
        assertEquals("A2", down.getRepeatCommission().getCellReference());

        // only diagonal
        ReportedTotals diagonal = extractor.extract(grid(
                Arrays.asList("New Product Commission", null, null),
                Arrays.asList(null, 40.0, null)));
        assertEquals("B2", diagonal.getNewCommission().getCellReference());

        // only left
        ReportedTotals left = extractor.extract(grid(List.of(60.0, "Incentive Product Commission")));
        assertEquals("A1", left.getIncentiveCommission().getCellReference());
    }

    @Test
    void extract_ShouldSkipZeroAndTextNeighbours() {
        ReportedTotals totals = extractor.extract(grid(
                List.of("Final Commission", 0.0, "see note"),
                List.of(275.0)));

        assertEquals(0, new BigDecimal("275").compareTo(totals.getFinalCommission().getValue()));
    }

    @Test
    void extract_ShouldKeepFirstOccurrence() {
        ReportedTotals totals = extractor.extract(grid(
                List.of("Final Commission", 100.0),
                List.of("Final Commission", 999.0)));

        assertEquals(0, new BigDecimal("100").compareTo(totals.getFinalCommission().getValue()));
    }

    @Test
    void extract_ShouldNotConfuseSpecificLabelsWithFinalCommission() {
        ReportedTotals totals = extractor.extract(grid(
                List.of("Sum of Total Commission", 420.0),
                List.of("Incentive Commission Total", 35.0),
                List.of("Added State Commisison", 100.0),
                List.of("Total Revenue", 18000.0)));

        assertFalse(totals.getFinalCommission().isFound());
        assertEquals(0, new BigDecimal("420").compareTo(totals.getSumOfCommission().getValue()));
        assertEquals(0, new BigDecimal("35").compareTo(totals.getIncentiveCommission().getValue()));
        assertEquals(0, new BigDecimal("100").compareTo(totals.getStateBonus().getValue()));
        assertEquals(0, new BigDecimal("18000").compareTo(totals.getTotalRevenue().getValue()));
    }

    @Test
    void effectiveTotal_ShouldPreferFinalOverSumOverAmountDue() {
        ReportedTotals totals = extractor.extract(grid(
                List.of("Amount Due", 300.0),
                List.of("Sum of Commission", 310.0),
                List.of("Final Commission", 320.0)));

        assertEquals(0, new BigDecimal("320").compareTo(totals.effectiveTotalCommission().orElseThrow().getValue()));

        ReportedTotals withoutFinal = extractor.extract(grid(
                List.of("Amount Due", 300.0),
                List.of("Sum of Commission", 310.0)));

        assertEquals(0, new BigDecimal("310").compareTo(withoutFinal.effectiveTotalCommission().orElseThrow().getValue()));
    }

    @Test
    void extract_ShouldGuessLargestPlausibleNumberWhenNoTotalLabel() {
        ReportedTotals totals = extractor.extract(grid(
                List.of("Repeat Product Commission", 9000.0),
                List.of("Notes", 50.0),
                List.of("Q3", 2500.0),
                List.of("YTD", 12000.0)));

        assertFalse(totals.hasLabelledTotal());
        ReportedValue guess = totals.getHeuristicTotal();
        assertTrue(guess.isHeuristic());
        assertFalse(guess.isFound());
        // 9000 is claimed by its label, 12000 is outside the window
        assertEquals(0, new BigDecimal("2500").compareTo(guess.getValue()));
        assertEquals("B3", guess.getCellReference());
        assertSame(guess, totals.effectiveTotalCommission().orElseThrow());
    }

    @Test
    void extract_ShouldRespectConfiguredHeuristicWindow() {
        SummaryExtractor wide = new SummaryExtractor(
                new SummaryExtractionProperties(new BigDecimal("100"), new BigDecimal("20000")));

        ReportedTotals totals = wide.extract(grid(List.of("YTD", 12000.0)));

        assertEquals(0, new BigDecimal("12000").compareTo(totals.getHeuristicTotal().getValue()));
    }

    @Test
    void extract_ShouldNotGuessWhenTotalIsLabelled() {
        ReportedTotals totals = extractor.extract(grid(
                List.of("Final Commission", 150.0),
                List.of("Other", 5000.0)));

        assertFalse(totals.getHeuristicTotal().isPresent());
    }

    @Test
    void extract_ShouldReturnNothingForEmptySheet() {
        ReportedTotals totals = extractor.extract(grid(List.of("Nothing to see"), List.of(12.0)));

        assertTrue(totals.asMap().isEmpty());
        assertTrue(totals.effectiveTotalCommission().isEmpty());
    }

    @Test
    void extractPerRegion_ShouldReadRegionTable() {
        PerRegionReported perRegion = extractor.extractPerRegion(grid(
                List.of("Commission by State"),
                List.of("State", "Total Sales", "Final Commission"),
                List.of("TX", 10000.0, 200.0),
                List.of("ca", 2500.0, "$75.50"),
                List.of("Grand Total", 12500.0, 275.5),
                List.of("Footer", 1.0, 1.0)));

        assertEquals(2, perRegion.asMap().size());
        assertEquals(0, new BigDecimal("200").compareTo(perRegion.get("tx").orElseThrow().getValue()));
        assertEquals(0, new BigDecimal("75.50").compareTo(perRegion.get("CA").orElseThrow().getValue()));
        assertEquals("C3", perRegion.get("TX").orElseThrow().getCellReference());
        assertEquals("C2", perRegion.get("TX").orElseThrow().getLabelReference());
        assertEquals(0, new BigDecimal("275.5").compareTo(perRegion.getGrandTotal().getValue()));
    }

    @Test
    void extractPerRegion_ShouldStopAtBlankRegion() {
        PerRegionReported perRegion = extractor.extractPerRegion(grid(
                List.of("Row Labels", "Sum of Total Commission"),
                List.of("NV", 12.0),
                Arrays.asList(null, null),
                List.of("AZ", 13.0)));

        assertTrue(perRegion.get("NV").isPresent());
        assertTrue(perRegion.get("AZ").isEmpty());
        assertFalse(perRegion.getGrandTotal().isPresent());
    }

    @Test
    void extractPerRegion_ShouldBeEmptyWithoutTable() {
        assertTrue(extractor.extractPerRegion(grid(List.of("Final Commission", 150.0))).isEmpty());
    }

    private static TabularGrid grid(List<?>... rows) {
        return TabularGrid.of("Summary", Arrays.asList(rows));
    }
}
