package com.commissionaudit.reconciliation.model;

import com.commissionaudit.common.util.AmountUtils;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Product class of a transaction, ranked by precedence (1 = highest).
 *
 * A detail row often carries several non-zero commission columns because the payer
 * double-reports; classification walks the classes in precedence order and takes
 * the first one whose signal is present. Rows with no signal are REPEAT.
 */
public enum ProductClass {

    INCENTIVE(1) {
        @Override
        public boolean matches(ClassificationSignals signals) {
            return signals.isIncentiveFlag() || AmountUtils.isPositive(signals.getIncentiveCommission());
        }
    },

    NEW(2) {
        @Override
        public boolean matches(ClassificationSignals signals) {
            return signals.isNewProductFlag()
                    || AmountUtils.isPositive(signals.getNewCommission())
                    || AmountUtils.isPositive(signals.getNewProductSales());
        }
    },

    REPEAT(3) {
        @Override
        public boolean matches(ClassificationSignals signals) {
            return AmountUtils.isPositive(signals.getRepeatCommission());
        }
    };

    public static final ProductClass DEFAULT = REPEAT;

    private static final List<ProductClass> BY_PRECEDENCE = Arrays.stream(values())
            .sorted(Comparator.comparingInt(ProductClass::getPrecedence))
            .toList();

    private final int precedence;

    ProductClass(int precedence) {
        this.precedence = precedence;
    }

    public int getPrecedence() {
        return precedence;
    }

    public abstract boolean matches(ClassificationSignals signals);

    /**
     * Pick the highest-precedence class whose signal is present.
     */
    public static ProductClass classify(ClassificationSignals signals) {
        for (ProductClass productClass : BY_PRECEDENCE) {
            if (productClass.matches(signals)) {
                return productClass;
            }
        }
        return DEFAULT;
    }
}
