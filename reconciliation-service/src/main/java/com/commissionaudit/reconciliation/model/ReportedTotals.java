package com.commissionaudit.reconciliation.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Workbook-level figures found on the summary sheet. Absent fields are normal.
 */
public final class ReportedTotals {

    private final Map<ReportedField, ReportedValue> values;
    private final ReportedValue heuristicTotal;

    public ReportedTotals(Map<ReportedField, ReportedValue> values, ReportedValue heuristicTotal) {
        EnumMap<ReportedField, ReportedValue> copy = new EnumMap<>(ReportedField.class);
        copy.putAll(values);
        this.values = Collections.unmodifiableMap(copy);
        this.heuristicTotal = heuristicTotal == null ? ReportedValue.notFound() : heuristicTotal;
    }

    public static ReportedTotals empty() {
        return new ReportedTotals(Map.of(), null);
    }

    public ReportedValue get(ReportedField field) {
        return values.getOrDefault(field, ReportedValue.notFound());
    }

    public Map<ReportedField, ReportedValue> asMap() {
        return values;
    }

    public ReportedValue getHeuristicTotal() {
        return heuristicTotal;
    }

    public ReportedValue getAmountDueToPayee() {
        return get(ReportedField.AMOUNT_DUE_TO_PAYEE);
    }

    public ReportedValue getFinalCommission() {
        return get(ReportedField.FINAL_COMMISSION);
    }

    public ReportedValue getSumOfCommission() {
        return get(ReportedField.SUM_OF_COMMISSION);
    }

    public ReportedValue getRepeatCommission() {
        return get(ReportedField.REPEAT_COMMISSION);
    }

    public ReportedValue getNewCommission() {
        return get(ReportedField.NEW_COMMISSION);
    }

    public ReportedValue getIncentiveCommission() {
        return get(ReportedField.INCENTIVE_COMMISSION);
    }

    public ReportedValue getStateBonus() {
        return get(ReportedField.STATE_BONUS);
    }

    public ReportedValue getTotalRevenue() {
        return get(ReportedField.TOTAL_REVENUE);
    }

    /**
     * Strongest total-commission signal found by label, else the heuristic guess.
     */
    public Optional<ReportedValue> effectiveTotalCommission() {
        Optional<ReportedValue> labelled = values.entrySet().stream()
                .filter(e -> e.getKey().isTotalSignal() && e.getValue().isFound())
                .min(Comparator.comparingInt(e -> e.getKey().getTotalSignalRank()))
                .map(Map.Entry::getValue);
        if (labelled.isPresent()) {
            return labelled;
        }
        return heuristicTotal.isPresent() ? Optional.of(heuristicTotal) : Optional.empty();
    }

    public boolean hasLabelledTotal() {
        return values.entrySet().stream()
                .anyMatch(e -> e.getKey().isTotalSignal() && e.getValue().isFound());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReportedTotals other)) return false;
        return values.equals(other.values) && heuristicTotal.equals(other.heuristicTotal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values, heuristicTotal);
    }
}
