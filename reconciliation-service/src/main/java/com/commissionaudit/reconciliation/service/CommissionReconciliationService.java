package com.commissionaudit.reconciliation.service;

import com.commissionaudit.common.util.LabelNormalizer;
import com.commissionaudit.reconciliation.model.HeaderMap;
import com.commissionaudit.reconciliation.model.PerRegionReported;
import com.commissionaudit.reconciliation.model.ReconciliationResult;
import com.commissionaudit.reconciliation.model.RegionAggregate;
import com.commissionaudit.reconciliation.model.ReportedTotals;
import com.commissionaudit.reconciliation.model.TabularGrid;
import com.commissionaudit.reconciliation.model.Transaction;
import com.commissionaudit.reconciliation.model.WorkbookGrids;
import com.commissionaudit.reconciliation.policy.CommissionPolicy;
import com.commissionaudit.reconciliation.service.extraction.FieldExtractor;
import com.commissionaudit.reconciliation.service.extraction.SummaryExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the audit pipeline on an already-decoded workbook:
 * extract transactions, aggregate by region, read the summary, reconcile.
 *
 * Works on in-memory grids only; file handling lives in
 * {@link WorkbookReconciliationService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommissionReconciliationService {

    private final FieldExtractor fieldExtractor;
    private final StateAggregator stateAggregator;
    private final SummaryExtractor summaryExtractor;
    private final Reconciler reconciler;
    private final CommissionPolicy commissionPolicy;

    public ReconciliationResult reconcile(WorkbookGrids grids) {
        TabularGrid detail = grids.getDetail();
        HeaderMap headerMap = HeaderMap.of(detail.headerRow());
        if (headerMap.isEmpty()) {
            log.warn("Detail sheet '{}' has no header row", detail.getName());
        } else {
            log.debug("Detail sheet '{}' columns: {}", detail.getName(), headerMap.asMap());
        }

        List<List<Object>> dataRows = detail.dataRows();
        List<Transaction> transactions = new ArrayList<>(dataRows.size());
        int skipped = 0;

        for (int i = 0; i < dataRows.size(); i++) {
            List<Object> row = dataRows.get(i);
            if (isEmptyRow(row)) continue;

            // +2: 1-based, after the header row
            Transaction transaction = fieldExtractor.extract(row, headerMap, i + 2);
            if (transaction == null) {
                skipped++;
                log.debug("Skipping detail row {}: no region or no positive sales", i + 2);
                continue;
            }
            transactions.add(transaction);
        }

        log.info("Detail sheet '{}': {} data rows, {} transactions, {} skipped",
                detail.getName(), dataRows.size(), transactions.size(), skipped);

        List<RegionAggregate> aggregates = stateAggregator.aggregate(transactions, commissionPolicy);
        ReportedTotals reportedTotals = summaryExtractor.extract(grids.getSummary());
        PerRegionReported perRegion = summaryExtractor.extractPerRegion(grids.getSummary());

        ReconciliationResult result = reconciler.reconcile(aggregates, reportedTotals, perRegion)
                .toBuilder()
                .detailRows(dataRows.size())
                .transactionCount(transactions.size())
                .skippedRows(skipped)
                .build();

        log.info("Reconciled {} regions: recomputed={} reported={} owed={} impacted={}",
                aggregates.size(),
                result.getTotals().getTotalRecomputed(),
                result.getTotals().getTotalReported(),
                result.getTotals().getTotalOwed(),
                result.getTotals().getImpactedRegions());

        return result;
    }

    private static boolean isEmptyRow(List<Object> row) {
        for (Object cell : row) {
            if (!LabelNormalizer.isBlank(cell)) {
                return false;
            }
        }
        return true;
    }
}
