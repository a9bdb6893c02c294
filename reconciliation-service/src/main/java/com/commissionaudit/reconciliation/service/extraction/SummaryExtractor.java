package com.commissionaudit.reconciliation.service.extraction;

import com.commissionaudit.common.util.AmountUtils;
import com.commissionaudit.common.util.LabelNormalizer;
import com.commissionaudit.reconciliation.config.SummaryExtractionProperties;
import com.commissionaudit.reconciliation.model.PerRegionReported;
import com.commissionaudit.reconciliation.model.ReportedField;
import com.commissionaudit.reconciliation.model.ReportedTotals;
import com.commissionaudit.reconciliation.model.ReportedValue;
import com.commissionaudit.reconciliation.model.TabularGrid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.util.CellReference;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads what the payer claims on the free-form summary sheet.
 *
 * Labels are found anywhere on the sheet by {@link SummaryLabelRule}; the value
 * is the first positive number next to the label. When no total-commission label
 * is found at all, the largest number inside the configured window is taken as
 * a flagged guess.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SummaryExtractor {

    private static final List<String> REGION_HEADERS = List.of(
            "state", "ship to state", "shiptostate", "region", "st", "row labels");

    // Priority order when a region table has several total-like columns
    private static final List<String> REGION_TOTAL_HEADERS = List.of(
            "final commission", "total with bonus", "amount due", "amount due salesperson",
            "total", "commission total", "total commission", "sum of total commission",
            "sum of final commission", "paid", "amount");

    private final SummaryExtractionProperties properties;

    public ReportedTotals extract(TabularGrid grid) {
        if (grid == null) {
            return ReportedTotals.empty();
        }

        List<SummaryLabelRule> rules = SummaryLabelRule.defaultRules();
        Map<ReportedField, ReportedValue> found = new EnumMap<>(ReportedField.class);
        Set<Long> claimed = new HashSet<>();

        for (int r = 0; r < grid.rowCount(); r++) {
            for (int c = 0; c < grid.columnCount(r); c++) {
                Object cell = grid.cell(r, c);
                if (!(cell instanceof String) || LabelNormalizer.isBlank(cell)) continue;

                for (SummaryLabelRule rule : rules) {
                    if (!rule.matches(cell)) continue;

                    claimed.add(position(r, c));
                    if (!found.containsKey(rule.getField())) {
                        ReportedValue value = locateValue(grid, r, c, rule, claimed);
                        if (value != null) {
                            found.put(rule.getField(), value);
                            log.debug("Summary {} = {} at {} (label {})", rule.getField(),
                                    value.getValue(), value.getCellReference(), value.getLabelReference());
                        }
                    }
                    break;
                }
            }
        }

        ReportedTotals labelled = new ReportedTotals(found, null);
        if (labelled.hasLabelledTotal()) {
            return labelled;
        }

        ReportedValue heuristic = guessTotal(grid, claimed);
        if (heuristic == null) {
            return labelled;
        }
        log.info("No labelled commission total on sheet '{}'; using {} at {} as a guess",
                grid.getName(), heuristic.getValue(), heuristic.getCellReference());
        return new ReportedTotals(found, heuristic);
    }

    /**
     * Region table on the summary sheet: a header row naming a region column and a
     * total column, then one row per region until a blank or "Grand Total" row.
     * Only the first such table is read.
     */
    public PerRegionReported extractPerRegion(TabularGrid grid) {
        if (grid == null) {
            return PerRegionReported.empty();
        }

        for (int r = 0; r < grid.rowCount(); r++) {
            int regionCol = findHeader(grid, r, REGION_HEADERS, -1);
            if (regionCol < 0) continue;

            int totalCol = -1;
            for (String alias : REGION_TOTAL_HEADERS) {
                totalCol = findHeader(grid, r, List.of(alias), regionCol);
                if (totalCol >= 0) break;
            }
            if (totalCol < 0) continue;

            return readRegionTable(grid, r, regionCol, totalCol);
        }
        return PerRegionReported.empty();
    }

    private PerRegionReported readRegionTable(TabularGrid grid, int headerRow, int regionCol, int totalCol) {
        String labelReference = reference(headerRow, totalCol);
        Map<String, ReportedValue> byRegion = new LinkedHashMap<>();
        ReportedValue grandTotal = null;

        for (int r = headerRow + 1; r < grid.rowCount(); r++) {
            Object regionCell = grid.cell(r, regionCol);
            if (LabelNormalizer.isBlank(regionCell)) break;

            BigDecimal value = AmountUtils.parseStrict(grid.cell(r, totalCol));
            String regionKey = LabelNormalizer.normalize(regionCell);
            if (regionKey.contains("grandtotal") || regionKey.equals("total")) {
                if (value != null) {
                    grandTotal = ReportedValue.labelled(value, reference(r, totalCol), labelReference);
                }
                break;
            }
            if (value != null) {
                byRegion.putIfAbsent(regionCell.toString().trim(),
                        ReportedValue.labelled(value, reference(r, totalCol), labelReference));
            }
        }

        log.debug("Summary region table at {}: {} regions, grand total {}",
                labelReference, byRegion.size(), grandTotal != null ? grandTotal.getValue() : "none");
        return new PerRegionReported(byRegion, grandTotal);
    }

    private ReportedValue locateValue(TabularGrid grid, int labelRow, int labelCol,
                                      SummaryLabelRule rule, Set<Long> claimed) {
        for (AdjacentCell adjacent : rule.getSearchOrder()) {
            int r = adjacent.row(labelRow);
            int c = adjacent.col(labelCol);
            BigDecimal value = AmountUtils.parseStrict(grid.cell(r, c));
            if (AmountUtils.isPositive(value)) {
                claimed.add(position(r, c));
                return ReportedValue.labelled(value, reference(r, c), reference(labelRow, labelCol));
            }
        }
        return null;
    }

    private ReportedValue guessTotal(TabularGrid grid, Set<Long> claimed) {
        BigDecimal min = properties.getHeuristicMin();
        BigDecimal max = properties.getHeuristicMax();
        BigDecimal best = null;
        String bestReference = null;

        for (int r = 0; r < grid.rowCount(); r++) {
            for (int c = 0; c < grid.columnCount(r); c++) {
                if (claimed.contains(position(r, c))) continue;

                BigDecimal value = AmountUtils.parseStrict(grid.cell(r, c));
                if (value == null || value.compareTo(min) < 0 || value.compareTo(max) > 0) continue;

                if (best == null || value.compareTo(best) > 0) {
                    best = value;
                    bestReference = reference(r, c);
                }
            }
        }
        return best == null ? null : ReportedValue.heuristic(best, bestReference);
    }

    private static int findHeader(TabularGrid grid, int row, List<String> aliases, int excludeCol) {
        for (int c = 0; c < grid.columnCount(row); c++) {
            if (c == excludeCol) continue;
            String normalized = LabelNormalizer.normalize(grid.cell(row, c));
            if (normalized.isEmpty()) continue;
            for (String alias : aliases) {
                if (normalized.equals(LabelNormalizer.normalize(alias))) {
                    return c;
                }
            }
        }
        return -1;
    }

    private static long position(int row, int col) {
        return ((long) row << 32) | (col & 0xffffffffL);
    }

    private static String reference(int row, int col) {
        return new CellReference(row, col).formatAsString();
    }
}
