package com.commissionaudit.reconciliation.service;

import com.commissionaudit.reconciliation.model.ProcessedLine;
import com.commissionaudit.reconciliation.model.ProductClass;
import com.commissionaudit.reconciliation.model.RegionAggregate;
import com.commissionaudit.reconciliation.model.Transaction;
import com.commissionaudit.reconciliation.policy.CommissionPolicy;
import com.commissionaudit.reconciliation.policy.CommissionTier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups transactions by region and recomputes each region's commission.
 *
 * The tier depends on the region's total sales, so rates can only be applied
 * once every row has been grouped: pass 1 groups and sums, pass 2 resolves the
 * tier and processes the lines. Regions keep the order of first appearance.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StateAggregator {

    private final TransactionProcessor transactionProcessor;

    public List<RegionAggregate> aggregate(List<Transaction> transactions, CommissionPolicy policy) {
        // Pass 1: group and sum
        Map<String, List<Transaction>> byRegion = new LinkedHashMap<>();
        Map<String, BigDecimal> salesByRegion = new LinkedHashMap<>();
        for (Transaction transaction : transactions) {
            byRegion.computeIfAbsent(transaction.getRegion(), k -> new ArrayList<>()).add(transaction);
            salesByRegion.merge(transaction.getRegion(), transaction.getSalesAmount(), BigDecimal::add);
        }

        // Pass 2: tier per region, then lines
        List<RegionAggregate> aggregates = new ArrayList<>(byRegion.size());
        for (Map.Entry<String, List<Transaction>> entry : byRegion.entrySet()) {
            String region = entry.getKey();
            BigDecimal totalSales = salesByRegion.get(region);
            CommissionTier tier = policy.tierFor(totalSales);

            List<ProcessedLine> lines = new ArrayList<>(entry.getValue().size());
            BigDecimal commission = BigDecimal.ZERO;
            BigDecimal reported = BigDecimal.ZERO;
            Map<ProductClass, BigDecimal> byClass = new EnumMap<>(ProductClass.class);

            for (Transaction transaction : entry.getValue()) {
                ProcessedLine line = transactionProcessor.process(transaction, tier, policy);
                lines.add(line);
                commission = commission.add(line.getRecomputedCommission());
                reported = reported.add(transaction.getReportedCommission());
                byClass.merge(transaction.getProductClass(), line.getRecomputedCommission(), BigDecimal::add);
            }

            BigDecimal bonus = tier.getBonus();
            log.debug("Region {}: sales={} tier={} commission={} bonus={}",
                    region, totalSales, tier.getName(), commission, bonus);

            aggregates.add(RegionAggregate.builder()
                    .region(region)
                    .totalSales(totalSales)
                    .tier(tier)
                    .lines(Collections.unmodifiableList(lines))
                    .recomputedCommission(commission)
                    .bonus(bonus)
                    .totalWithBonus(commission.add(bonus))
                    .reportedCommission(reported)
                    .commissionByClass(Collections.unmodifiableMap(byClass))
                    .build());
        }

        return Collections.unmodifiableList(aggregates);
    }
}
