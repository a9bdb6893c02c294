package com.commissionaudit.reconciliation.policy;

import com.commissionaudit.common.exception.PolicyConfigurationException;
import com.commissionaudit.reconciliation.model.ProductClass;
import com.commissionaudit.reconciliation.model.Transaction;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * Immutable tier table plus rate rules.
 *
 * Tiers are ordered by min, start at 0, are contiguous at cent precision
 * (next min = previous max + 0.01) and the last one is unbounded, so every
 * non-negative total resolves to exactly one tier.
 */
public final class CommissionPolicy {

    private static final BigDecimal CENT = new BigDecimal("0.01");
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final List<CommissionTier> tiers;
    private final BigDecimal incentiveRateOverride;

    public CommissionPolicy(List<CommissionTier> tiers, BigDecimal incentiveRateOverride) {
        validate(tiers);
        this.tiers = List.copyOf(tiers);
        this.incentiveRateOverride = normalizeRate(incentiveRateOverride);
    }

    public CommissionPolicy(List<CommissionTier> tiers) {
        this(tiers, null);
    }

    /**
     * Standard three-tier schedule.
     */
    public static CommissionPolicy defaultPolicy() {
        return new CommissionPolicy(List.of(
                CommissionTier.builder()
                        .name("Tier 1")
                        .min(BigDecimal.ZERO)
                        .max(new BigDecimal("9999.99"))
                        .repeatRate(new BigDecimal("0.02"))
                        .newRate(new BigDecimal("0.03"))
                        .incentiveRate(new BigDecimal("0.03"))
                        .bonus(BigDecimal.ZERO)
                        .build(),
                CommissionTier.builder()
                        .name("Tier 2")
                        .min(new BigDecimal("10000.00"))
                        .max(new BigDecimal("49999.99"))
                        .repeatRate(new BigDecimal("0.01"))
                        .newRate(new BigDecimal("0.02"))
                        .incentiveRate(new BigDecimal("0.03"))
                        .bonus(new BigDecimal("100"))
                        .build(),
                CommissionTier.builder()
                        .name("Tier 3")
                        .min(new BigDecimal("50000.00"))
                        .repeatRate(new BigDecimal("0.005"))
                        .newRate(new BigDecimal("0.015"))
                        .incentiveRate(new BigDecimal("0.03"))
                        .bonus(new BigDecimal("300"))
                        .build()));
    }

    public List<CommissionTier> getTiers() {
        return tiers;
    }

    public BigDecimal getIncentiveRateOverride() {
        return incentiveRateOverride;
    }

    /**
     * Tier for a region's total sales. Totals between a tier's max and the next
     * tier's min (sub-cent) fall into the next tier.
     */
    public CommissionTier tierFor(BigDecimal totalSales) {
        if (totalSales == null || totalSales.signum() < 0) {
            throw new IllegalArgumentException("Total sales must be non-negative: " + totalSales);
        }
        for (CommissionTier tier : tiers) {
            if (tier.isUnbounded() || totalSales.compareTo(tier.getMax()) <= 0) {
                return tier;
            }
        }
        // unreachable: last tier is unbounded
        throw new IllegalStateException("No tier for total " + totalSales);
    }

    public BigDecimal rateFor(CommissionTier tier, ProductClass productClass) {
        if (productClass == ProductClass.INCENTIVE && incentiveRateOverride != null) {
            return incentiveRateOverride;
        }
        return tier.rateFor(productClass);
    }

    /**
     * Rate for a concrete transaction; a per-row incentive override beats the policy one.
     */
    public BigDecimal rateFor(CommissionTier tier, Transaction transaction) {
        if (transaction.getProductClass() == ProductClass.INCENTIVE
                && transaction.getIncentiveRateOverride() != null) {
            return transaction.getIncentiveRateOverride();
        }
        return rateFor(tier, transaction.getProductClass());
    }

    /**
     * Rates above 1 are percentages (3 -> 0.03).
     */
    public static BigDecimal normalizeRate(BigDecimal rate) {
        if (rate == null) {
            return null;
        }
        return rate.compareTo(BigDecimal.ONE) > 0 ? rate.divide(HUNDRED, MathContext.DECIMAL64) : rate;
    }

    private static void validate(List<CommissionTier> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            throw new PolicyConfigurationException("at least one tier is required");
        }

        CommissionTier first = tiers.get(0);
        if (first.getMin() == null || first.getMin().signum() != 0) {
            throw new PolicyConfigurationException("first tier must start at 0, got " + first.getMin());
        }

        for (int i = 0; i < tiers.size(); i++) {
            CommissionTier tier = tiers.get(i);
            String name = tier.getName() != null ? tier.getName() : "tier #" + (i + 1);
            boolean last = i == tiers.size() - 1;

            if (tier.getMin() == null) {
                throw new PolicyConfigurationException(name + " has no min");
            }
            if (tier.isUnbounded() && !last) {
                throw new PolicyConfigurationException(name + " is unbounded but is not the last tier");
            }
            if (!tier.isUnbounded() && last) {
                throw new PolicyConfigurationException("last tier " + name + " must be unbounded");
            }
            if (!tier.isUnbounded() && tier.getMin().compareTo(tier.getMax()) > 0) {
                throw new PolicyConfigurationException(name + " has min above max");
            }
            requireRate(name, "repeat rate", tier.getRepeatRate());
            requireRate(name, "new rate", tier.getNewRate());
            requireRate(name, "incentive rate", tier.getIncentiveRate());
            if (tier.getBonus() == null || tier.getBonus().signum() < 0) {
                throw new PolicyConfigurationException(name + " bonus must be non-negative");
            }

            if (!last) {
                BigDecimal expectedNextMin = tier.getMax().add(CENT);
                BigDecimal nextMin = tiers.get(i + 1).getMin();
                if (nextMin == null || nextMin.compareTo(expectedNextMin) != 0) {
                    throw new PolicyConfigurationException(String.format(
                            "tiers must be contiguous: %s ends at %s so the next tier must start at %s, got %s",
                            name, tier.getMax(), expectedNextMin, nextMin));
                }
            }
        }
    }

    private static void requireRate(String tierName, String label, BigDecimal rate) {
        if (rate == null || rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) > 0) {
            throw new PolicyConfigurationException(
                    tierName + " " + label + " must be a fraction between 0 and 1, got " + rate);
        }
    }
}
