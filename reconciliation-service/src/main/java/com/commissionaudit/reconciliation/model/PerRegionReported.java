package com.commissionaudit.reconciliation.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Region -> reported total, read from a region table on the summary sheet.
 * Lookups ignore case and surrounding whitespace.
 */
public final class PerRegionReported {

    private static final PerRegionReported EMPTY = new PerRegionReported(Map.of(), null);

    private final Map<String, ReportedValue> byRegion;
    private final ReportedValue grandTotal;

    public PerRegionReported(Map<String, ReportedValue> byRegion, ReportedValue grandTotal) {
        Map<String, ReportedValue> copy = new LinkedHashMap<>();
        byRegion.forEach((region, value) -> copy.putIfAbsent(key(region), value));
        this.byRegion = Collections.unmodifiableMap(copy);
        this.grandTotal = grandTotal == null ? ReportedValue.notFound() : grandTotal;
    }

    public static PerRegionReported empty() {
        return EMPTY;
    }

    public Optional<ReportedValue> get(String region) {
        if (region == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byRegion.get(key(region)));
    }

    public Map<String, ReportedValue> asMap() {
        return byRegion;
    }

    /**
     * The table's "Grand Total" row, when it had one.
     */
    public ReportedValue getGrandTotal() {
        return grandTotal;
    }

    public boolean isEmpty() {
        return byRegion.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PerRegionReported other)) return false;
        return byRegion.equals(other.byRegion) && grandTotal.equals(other.grandTotal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(byRegion, grandTotal);
    }

    private static String key(String region) {
        return region.trim().toUpperCase(Locale.ROOT);
    }
}
